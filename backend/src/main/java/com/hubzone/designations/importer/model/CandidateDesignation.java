package com.hubzone.designations.importer.model;

import java.util.List;

public record CandidateDesignation(
    String geoid,
    String stateFips,
    String countyFips,
    List<EligibleDesignation> eligibilities,
    QualificationResult qualification,
    GeographicUnit unit
) {
    public CandidateDesignation {
        eligibilities = eligibilities == null ? List.of() : List.copyOf(eligibilities);
    }
}
