package com.hubzone.designations.importer.evaluation;

import com.hubzone.designations.importer.error.EvaluationDataMissingException;
import com.hubzone.designations.importer.model.EconomicProfile;
import com.hubzone.designations.importer.model.QualificationReason;
import com.hubzone.designations.importer.model.QualificationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Applies the qualified census tract tests to an economic profile.
 * <ul>
 *   <li>poverty: at least 25% of the poverty universe below the poverty line</li>
 *   <li>income: median family income at most 80% of the area median income</li>
 * </ul>
 * Both comparisons are inclusive and done in exact decimal arithmetic, so a rate of exactly 25.0% or a
 * ratio of exactly 0.80 qualifies. The rates carried on the result are rounded for display only.
 */
@Component
public class QualificationEvaluator {
    public static final BigDecimal POVERTY_RATE_THRESHOLD = new BigDecimal("25.0");
    public static final BigDecimal INCOME_RATIO_THRESHOLD = new BigDecimal("0.80");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public QualificationResult evaluate(EconomicProfile profile) {
        String geoid = profile.geoid();
        Long universe = povertyUniverse(profile);
        Long below = profile.populationBelowPoverty();
        boolean povertyKnown = universe != null && universe > 0 && below != null;

        BigDecimal income = profile.medianFamilyIncome() != null
            ? profile.medianFamilyIncome()
            : profile.medianHouseholdIncome();
        BigDecimal ami = profile.areaMedianIncome();
        boolean incomeKnown = income != null && ami != null && ami.signum() > 0;

        if (!povertyKnown && !incomeKnown) {
            throw new EvaluationDataMissingException(
                geoid,
                "No usable poverty universe or income data for " + geoid
            );
        }

        boolean byPoverty = false;
        BigDecimal povertyRate = null;
        if (povertyKnown) {
            BigDecimal belowTimesHundred = BigDecimal.valueOf(below).multiply(HUNDRED);
            BigDecimal thresholdTimesUniverse = POVERTY_RATE_THRESHOLD.multiply(BigDecimal.valueOf(universe));
            byPoverty = belowTimesHundred.compareTo(thresholdTimesUniverse) >= 0;
            povertyRate = belowTimesHundred.divide(BigDecimal.valueOf(universe), 4, RoundingMode.HALF_UP);
        }

        boolean byIncome = false;
        BigDecimal incomeRatio = null;
        if (incomeKnown) {
            byIncome = income.compareTo(INCOME_RATIO_THRESHOLD.multiply(ami)) <= 0;
            incomeRatio = income.divide(ami, 6, RoundingMode.HALF_UP);
        }

        return new QualificationResult(
            geoid,
            byPoverty,
            byIncome,
            byPoverty || byIncome,
            povertyRate,
            incomeRatio,
            POVERTY_RATE_THRESHOLD,
            INCOME_RATIO_THRESHOLD,
            reason(byPoverty, byIncome)
        );
    }

    private static Long povertyUniverse(EconomicProfile profile) {
        Long universe = profile.povertyUniverse();
        if (universe != null && universe > 0) {
            return universe;
        }
        return profile.totalPopulation();
    }

    private static QualificationReason reason(boolean byPoverty, boolean byIncome) {
        if (byPoverty && byIncome) {
            return QualificationReason.BOTH;
        }
        if (byPoverty) {
            return QualificationReason.POVERTY;
        }
        return byIncome ? QualificationReason.INCOME : QualificationReason.NONE;
    }
}
