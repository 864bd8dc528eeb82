package com.hubzone.designations.importer.model;

import java.time.Instant;

public record SchedulerStatus(
    boolean running,
    String zone,
    Instant nextFireTime,
    Instant lastFireTime,
    String lastOutcome,
    Long lastExecutionId
) {
}
