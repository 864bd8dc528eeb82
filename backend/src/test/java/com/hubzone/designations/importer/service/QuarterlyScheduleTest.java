package com.hubzone.designations.importer.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class QuarterlyScheduleTest {

    @Test
    void nextFireTimeIsTheFollowingQuarterStart() {
        Instant next = QuarterlySchedule.nextFireTime(Instant.parse("2024-02-15T10:00:00Z"), ZoneOffset.UTC);
        assertThat(next).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
    }

    @Test
    void exactQuarterStartFiresAtTheNextOne() {
        Instant next = QuarterlySchedule.nextFireTime(Instant.parse("2024-07-01T00:00:00Z"), ZoneOffset.UTC);
        assertThat(next).isEqualTo(Instant.parse("2024-10-01T00:00:00Z"));
    }

    @Test
    void lastQuarterRollsOverToJanuary() {
        Instant next = QuarterlySchedule.nextFireTime(Instant.parse("2024-11-30T23:59:59Z"), ZoneOffset.UTC);
        assertThat(next).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void quarterStartFollowsConfiguredZone() {
        Instant next = QuarterlySchedule.nextFireTime(
            Instant.parse("2024-03-31T12:00:00Z"), ZoneId.of("America/New_York"));
        assertThat(next).isEqualTo(Instant.parse("2024-04-01T04:00:00Z"));
    }
}
