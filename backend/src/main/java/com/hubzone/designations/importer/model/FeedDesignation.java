package com.hubzone.designations.importer.model;

import java.time.LocalDate;

public record FeedDesignation(
    String geoid,
    String stateFips,
    String countyFips,
    DesignationType type,
    DesignationStatus status,
    LocalDate designationDate,
    LocalDate expirationDate
) {
}
