package com.hubzone.designations.importer.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public final class QuarterlySchedule {
    private static final int[] QUARTER_START_MONTHS = {1, 4, 7, 10};

    private QuarterlySchedule() {
    }

    public static Instant nextFireTime(Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        int year = local.getYear();
        for (int attempt = 0; attempt < 2; attempt++) {
            for (int month : QUARTER_START_MONTHS) {
                ZonedDateTime candidate = LocalDate.of(year + attempt, month, 1).atStartOfDay(zone);
                if (candidate.toInstant().isAfter(now)) {
                    return candidate.toInstant();
                }
            }
        }
        throw new IllegalStateException("No quarter start found after " + now);
    }
}
