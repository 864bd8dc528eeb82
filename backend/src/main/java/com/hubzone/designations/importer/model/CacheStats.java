package com.hubzone.designations.importer.model;

public record CacheStats(
    long entryCount,
    long expiredCount,
    long totalBytes
) {
}
