package com.hubzone.designations.importer.model;

import java.time.LocalDate;

public record EligibleDesignation(
    DesignationType type,
    LocalDate designationDate,
    LocalDate expirationDate,
    String sourceDataset
) {
    public boolean hasExpiration() {
        return expirationDate != null;
    }
}
