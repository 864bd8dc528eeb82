package com.hubzone.designations.importer.model;

import java.time.LocalDate;

public record Designation(
    String geoid,
    String stateFips,
    String countyFips,
    DesignationType type,
    DesignationStatus status,
    LocalDate designationDate,
    LocalDate expirationDate,
    LocalDate gracePeriodEndDate,
    String sourceDataset
) {
    public boolean isActive() {
        return status == DesignationStatus.ACTIVE;
    }

    public Designation expire(LocalDate runDate) {
        return new Designation(
            geoid,
            stateFips,
            countyFips,
            type,
            DesignationStatus.EXPIRED,
            designationDate,
            runDate,
            gracePeriodEndDate,
            sourceDataset
        );
    }

    public Designation redesignate(LocalDate graceEnd) {
        return new Designation(
            geoid,
            stateFips,
            countyFips,
            type,
            DesignationStatus.REDESIGNATED,
            designationDate,
            expirationDate,
            graceEnd,
            sourceDataset
        );
    }
}
