package com.hubzone.designations.importer.model;

import java.time.Instant;
import java.util.List;

public record ImportCompletionNotice(
    long executionId,
    TriggerType triggerType,
    ImportExecutionStatus status,
    boolean dryRun,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    ImportStatistics statistics,
    String errorMessage,
    List<String> recipients
) {
    public ImportCompletionNotice {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
}
