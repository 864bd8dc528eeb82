package com.hubzone.designations.importer.model;

import java.time.Instant;

public record CacheEntry(
    String cacheKey,
    DatasetSource source,
    String stateFips,
    String sourceUrl,
    String localPath,
    Instant downloadedAt,
    Instant expiresAt,
    String checksum,
    long byteSize
) {
    public boolean isExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }
}
