package com.hubzone.designations.importer.source;

import com.hubzone.designations.importer.evaluation.QualificationEvaluator;
import com.hubzone.designations.importer.model.CandidateDesignation;
import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.EconomicProfile;
import com.hubzone.designations.importer.model.EligibleDesignation;
import com.hubzone.designations.importer.model.FeedDesignation;
import com.hubzone.designations.importer.model.GeographicUnit;
import com.hubzone.designations.importer.model.UnitType;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateAssemblerTest {
    private static final LocalDate RUN_DATE = LocalDate.of(2024, 1, 1);

    private final GeometryFactory factory = new GeometryFactory();
    private final CandidateAssembler assembler = new CandidateAssembler(
        new QualificationEvaluator(),
        Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC)
    );

    @Test
    void qualifyingTractBecomesComputedCandidate() {
        StateCandidates result = assembler.assemble(
            "11",
            List.of(unit("11001000100"), unit("11001000200")),
            List.of(profile("11001000100", 1000L, 400L), profile("11001000200", 1000L, 50L)),
            List.of(),
            RUN_DATE,
            2022
        );

        assertThat(result.totalUnits()).isEqualTo(2);
        assertThat(result.candidates()).extracting(CandidateDesignation::geoid).containsExactly("11001000100");
        CandidateDesignation candidate = result.candidates().get(0);
        EligibleDesignation eligibility = candidate.eligibilities().get(0);
        assertThat(eligibility.type()).isEqualTo(DesignationType.QUALIFIED_CENSUS_TRACT);
        assertThat(eligibility.designationDate()).isEqualTo(RUN_DATE);
        assertThat(eligibility.sourceDataset()).isEqualTo("census_acs:2022");
        assertThat(candidate.qualification().qualified()).isTrue();
        assertThat(result.skippedGeoids()).isEmpty();
    }

    @Test
    void tractWithoutProfileIsSkippedWithWarning() {
        StateCandidates result = assembler.assemble(
            "11", List.of(unit("11001000100")), List.of(), List.of(), RUN_DATE, 2022);

        assertThat(result.candidates()).isEmpty();
        assertThat(result.skippedGeoids()).containsExactly("11001000100");
        assertThat(result.issues()).hasSize(1);
        assertThat(result.issues().get(0).code()).isEqualTo(ImportErrorCodes.EVALUATION_DATA_MISSING);
    }

    @Test
    void feedDesignationKeepsTractWithoutProfile() {
        FeedDesignation row = feedRow("11001000100", DesignationType.INDIAN_LANDS, DesignationStatus.ACTIVE, null);

        StateCandidates result = assembler.assemble(
            "11", List.of(unit("11001000100")), List.of(), List.of(row), RUN_DATE, 2022);

        assertThat(result.skippedGeoids()).isEmpty();
        assertThat(result.issues()).hasSize(1);
        assertThat(result.candidates()).hasSize(1);
        assertThat(result.candidates().get(0).eligibilities())
            .extracting(EligibleDesignation::type)
            .containsExactly(DesignationType.INDIAN_LANDS);
    }

    @Test
    void inactiveOrExpiredFeedRowsAreIgnored() {
        List<FeedDesignation> rows = List.of(
            feedRow("11001", DesignationType.BASE_CLOSURE_AREA, DesignationStatus.ACTIVE, RUN_DATE.minusDays(1)),
            feedRow("11003", DesignationType.GOVERNOR_DESIGNATED, DesignationStatus.EXPIRED, null),
            feedRow("11005", DesignationType.QUALIFIED_NON_METRO_COUNTY, DesignationStatus.ACTIVE, RUN_DATE)
        );

        StateCandidates result = assembler.assemble("11", List.of(), null, rows, RUN_DATE, 2022);

        assertThat(result.candidates()).extracting(CandidateDesignation::geoid).containsExactly("11005");
        assertThat(result.candidates().get(0).countyFips()).isEqualTo("11005");
        assertThat(result.candidates().get(0).eligibilities().get(0).sourceDataset()).isEqualTo("sba_designations");
    }

    @Test
    void withoutEconomicSourceTractsAreNotEvaluated() {
        StateCandidates result = assembler.assemble(
            "11", List.of(unit("11001000100")), null, List.of(), RUN_DATE, 2022);

        assertThat(result.candidates()).isEmpty();
        assertThat(result.skippedGeoids()).isEmpty();
        assertThat(result.issues()).isEmpty();
    }

    private GeographicUnit unit(String geoid) {
        Polygon box = factory.createPolygon(new Coordinate[] {
            new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(1, 1), new Coordinate(0, 1), new Coordinate(0, 0)
        });
        return new GeographicUnit(geoid, UnitType.TRACT, "11", "11001", "Tract", 1L, 0L, box.getInteriorPoint(), box);
    }

    private static EconomicProfile profile(String geoid, long universe, long below) {
        return new EconomicProfile(geoid, "11", "11001", 2022, universe, universe, below,
            null, new BigDecimal("70000"), new BigDecimal("70000"));
    }

    private static FeedDesignation feedRow(String geoid, DesignationType type, DesignationStatus status, LocalDate expiration) {
        return new FeedDesignation(geoid, "11", geoid.substring(0, 5), type, status, LocalDate.of(2019, 1, 1), expiration);
    }
}
