package com.hubzone.designations.importer.model;

import java.time.Instant;

public record ImportIssue(
    String code,
    String message,
    String geoid,
    IssueSeverity severity,
    Instant timestamp
) {
    public static ImportIssue warning(String code, String message, String geoid, Instant at) {
        return new ImportIssue(code, message, geoid, IssueSeverity.WARNING, at);
    }

    public static ImportIssue error(String code, String message, String geoid, Instant at) {
        return new ImportIssue(code, message, geoid, IssueSeverity.ERROR, at);
    }

    public static ImportIssue fatal(String code, String message, String geoid, Instant at) {
        return new ImportIssue(code, message, geoid, IssueSeverity.FATAL, at);
    }
}
