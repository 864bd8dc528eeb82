package com.hubzone.designations.importer.source;

import com.hubzone.designations.importer.model.CandidateDesignation;
import com.hubzone.designations.importer.model.GeographicUnit;
import com.hubzone.designations.importer.model.ImportIssue;

import java.util.List;
import java.util.Map;
import java.util.Set;

// skippedGeoids could not be evaluated and stay out of the reconciliation scope.
public record StateCandidates(
    String stateFips,
    List<CandidateDesignation> candidates,
    Map<String, GeographicUnit> unitsByGeoid,
    Set<String> skippedGeoids,
    List<ImportIssue> issues,
    int totalUnits
) {
    public StateCandidates {
        candidates = List.copyOf(candidates);
        unitsByGeoid = Map.copyOf(unitsByGeoid);
        skippedGeoids = Set.copyOf(skippedGeoids);
        issues = List.copyOf(issues);
    }
}
