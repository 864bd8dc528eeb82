package com.hubzone.designations.importer.model;

import java.time.Instant;

public record ImportProgressEvent(
    long executionId,
    ImportStage stage,
    String stateFips,
    String message,
    Instant occurredAt
) {
}
