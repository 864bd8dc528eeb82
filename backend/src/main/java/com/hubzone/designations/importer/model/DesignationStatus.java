package com.hubzone.designations.importer.model;

import java.util.Locale;

public enum DesignationStatus {
    ACTIVE,
    EXPIRED,
    PENDING,
    REDESIGNATED;

    public static DesignationStatus fromFeedValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        try {
            return DesignationStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ACTIVE;
        }
    }
}
