package com.hubzone.designations.importer.source;

public record FeedProblem(String geoid, String message) {
}
