package com.hubzone.designations.importer.model;

import java.math.BigDecimal;

public record QualificationResult(
    String geoid,
    boolean qualifiesByPoverty,
    boolean qualifiesByIncome,
    boolean qualified,
    BigDecimal povertyRate,
    BigDecimal incomeRatio,
    BigDecimal povertyRateThreshold,
    BigDecimal incomeRatioThreshold,
    QualificationReason reason
) {
}
