package com.hubzone.designations.importer.source;

import com.hubzone.designations.importer.error.EvaluationDataMissingException;
import com.hubzone.designations.importer.evaluation.QualificationEvaluator;
import com.hubzone.designations.importer.model.CandidateDesignation;
import com.hubzone.designations.importer.model.DatasetSource;
import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.EconomicProfile;
import com.hubzone.designations.importer.model.EligibleDesignation;
import com.hubzone.designations.importer.model.FeedDesignation;
import com.hubzone.designations.importer.model.GeographicUnit;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.model.QualificationResult;
import com.hubzone.designations.importer.model.UnitType;
import com.hubzone.designations.importer.reconcile.TieBreakPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Component
public class CandidateAssembler {
    private static final Logger log = LoggerFactory.getLogger(CandidateAssembler.class);

    private final QualificationEvaluator evaluator;
    private final Clock clock;

    public CandidateAssembler(QualificationEvaluator evaluator, Clock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    public StateCandidates assemble(
        String stateFips,
        List<GeographicUnit> units,
        List<EconomicProfile> profiles,
        List<FeedDesignation> feedRows,
        LocalDate runDate,
        int vintageYear
    ) {
        Map<String, GeographicUnit> unitsByGeoid = new LinkedHashMap<>();
        for (GeographicUnit unit : units) {
            unitsByGeoid.put(unit.geoid(), unit);
        }
        Map<String, EconomicProfile> profilesByGeoid = new HashMap<>();
        if (profiles != null) {
            for (EconomicProfile profile : profiles) {
                profilesByGeoid.put(profile.geoid(), profile);
            }
        }
        Map<String, List<EligibleDesignation>> feedEligibilities = feedEligibilities(feedRows, runDate);

        Set<String> geoids = new TreeSet<>(unitsByGeoid.keySet());
        geoids.addAll(feedEligibilities.keySet());

        List<CandidateDesignation> candidates = new ArrayList<>();
        Set<String> skipped = new LinkedHashSet<>();
        List<ImportIssue> issues = new ArrayList<>();
        String computedSource = DatasetSource.ECONOMIC_PROFILES.id() + ":" + vintageYear;

        for (String geoid : geoids) {
            List<EligibleDesignation> eligibilities = new ArrayList<>(feedEligibilities.getOrDefault(geoid, List.of()));
            QualificationResult qualification = null;

            if (profiles != null && UnitType.forGeoid(geoid) == UnitType.TRACT && unitsByGeoid.containsKey(geoid)) {
                try {
                    EconomicProfile profile = profilesByGeoid.get(geoid);
                    if (profile == null) {
                        throw new EvaluationDataMissingException(geoid, "No economic profile for " + geoid);
                    }
                    qualification = evaluator.evaluate(profile);
                    if (qualification.qualified()) {
                        eligibilities.add(new EligibleDesignation(
                            DesignationType.QUALIFIED_CENSUS_TRACT,
                            runDate,
                            null,
                            computedSource
                        ));
                    }
                } catch (EvaluationDataMissingException e) {
                    issues.add(ImportIssue.warning(e.code(), e.getMessage(), geoid, clock.instant()));
                    if (eligibilities.isEmpty()) {
                        skipped.add(geoid);
                        continue;
                    }
                }
            }

            if (eligibilities.isEmpty()) {
                continue;
            }
            GeographicUnit unit = unitsByGeoid.get(geoid);
            candidates.add(new CandidateDesignation(
                geoid,
                unit != null ? unit.stateFips() : stateFips,
                unit != null ? unit.countyFips() : countyOf(geoid),
                TieBreakPolicy.distinctByType(eligibilities),
                qualification,
                unit
            ));
        }

        log.debug(
            "State {}: {} units, {} candidates, {} skipped",
            stateFips,
            geoids.size(),
            candidates.size(),
            skipped.size()
        );
        return new StateCandidates(stateFips, candidates, unitsByGeoid, skipped, issues, geoids.size());
    }

    private static Map<String, List<EligibleDesignation>> feedEligibilities(List<FeedDesignation> rows, LocalDate runDate) {
        Map<String, List<EligibleDesignation>> byGeoid = new HashMap<>();
        if (rows == null) {
            return byGeoid;
        }
        for (FeedDesignation row : rows) {
            if (row.status() != DesignationStatus.ACTIVE) {
                continue;
            }
            if (row.expirationDate() != null && row.expirationDate().isBefore(runDate)) {
                continue;
            }
            byGeoid.computeIfAbsent(row.geoid(), key -> new ArrayList<>()).add(new EligibleDesignation(
                row.type(),
                row.designationDate(),
                row.expirationDate(),
                DatasetSource.DESIGNATIONS.id()
            ));
        }
        return byGeoid;
    }

    private static String countyOf(String geoid) {
        return geoid.length() >= 5 ? geoid.substring(0, 5) : null;
    }
}
