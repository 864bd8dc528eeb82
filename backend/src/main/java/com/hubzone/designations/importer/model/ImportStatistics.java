package com.hubzone.designations.importer.model;

public record ImportStatistics(
    int totalUnits,
    int newDesignations,
    int updatedDesignations,
    int unchangedDesignations,
    int expiredDesignations,
    int redesignatedAreas,
    int reconciliationConflicts,
    long totalActiveHubzones,
    int statesProcessed,
    int statesSkipped,
    int unitsSkipped,
    int affectedBusinesses
) {
    public static ImportStatistics empty() {
        return new ImportStatistics(0, 0, 0, 0, 0, 0, 0, 0L, 0, 0, 0, 0);
    }
}
