package com.hubzone.designations.importer.model;

import java.time.Instant;
import java.util.List;

public record ImportExecution(
    long id,
    TriggerType triggerType,
    String triggeredBy,
    ImportExecutionStatus status,
    ImportOptions options,
    ImportStatistics statistics,
    List<ImportIssue> errors,
    List<ImportIssue> warnings,
    int retryCount,
    boolean cancelRequested,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    Instant lastHeartbeatAt
) {
}
