package com.hubzone.designations.importer.model;

import java.time.LocalDate;
import java.util.List;

public record ImportRunResult(
    long executionId,
    ImportExecutionStatus status,
    LocalDate runDate,
    boolean dryRun,
    ImportStatistics statistics,
    Changeset changeset,
    List<AffectedBusinessChange> affectedBusinesses,
    List<ImportIssue> errors,
    List<ImportIssue> warnings,
    int notificationsHandedOff
) {
}
