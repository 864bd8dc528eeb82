package com.hubzone.designations.importer.model;

import java.math.BigDecimal;

public record EconomicProfile(
    String geoid,
    String stateFips,
    String countyFips,
    int vintageYear,
    Long totalPopulation,
    Long povertyUniverse,
    Long populationBelowPoverty,
    BigDecimal medianHouseholdIncome,
    BigDecimal medianFamilyIncome,
    BigDecimal areaMedianIncome
) {
    public EconomicProfile withAreaMedianIncome(BigDecimal value) {
        return new EconomicProfile(
            geoid,
            stateFips,
            countyFips,
            vintageYear,
            totalPopulation,
            povertyUniverse,
            populationBelowPoverty,
            medianHouseholdIncome,
            medianFamilyIncome,
            value
        );
    }
}
