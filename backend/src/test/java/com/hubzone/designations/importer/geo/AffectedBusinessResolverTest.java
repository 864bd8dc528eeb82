package com.hubzone.designations.importer.geo;

import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.BusinessChangeType;
import com.hubzone.designations.importer.model.BusinessLocation;
import com.hubzone.designations.importer.model.ChangeKind;
import com.hubzone.designations.importer.model.Changeset;
import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationChange;
import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.HubzoneMembership;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AffectedBusinessResolverTest {
    private static final LocalDate RUN_DATE = LocalDate.of(2024, 1, 1);
    private static final String WEST = "11001000100";
    private static final String EAST = "11001000200";

    private final GeometryFactory factory = new GeometryFactory(new PrecisionModel(), 4326);
    private final AffectedBusinessResolver resolver =
        new AffectedBusinessResolver(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));

    // WEST covers x in [-78, -77], EAST covers x in [-77, -76]; both y in [38, 39]
    private final Map<String, Geometry> geometries = Map.of(
        WEST, box(-78, -77),
        EAST, box(-77, -76)
    );

    @Test
    void businessInsideNewTractGainsStatus() {
        Changeset changeset = changeset(List.of(created(WEST)), List.of(), List.of(), List.of());
        BusinessLocation business = business("B-1", -77.5, 38.5, false);

        BusinessResolution resolution = resolver.resolve(changeset, List.of(business), geometries);

        assertThat(resolution.changes()).hasSize(1);
        AffectedBusinessChange change = resolution.changes().get(0);
        assertThat(change.changeType()).isEqualTo(BusinessChangeType.GAINED_HUBZONE);
        assertThat(change.previousStatus()).isEqualTo(HubzoneMembership.NOT_IN_HUBZONE);
        assertThat(change.newStatus()).isEqualTo(HubzoneMembership.IN_HUBZONE);
        assertThat(change.geoid()).isEqualTo(WEST);
        assertThat(change.notificationSent()).isFalse();
    }

    @Test
    void businessAlreadyInHubzoneIsNotReportedAsGained() {
        Changeset changeset = changeset(List.of(created(WEST)), List.of(), List.of(), List.of());

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-1", -77.5, 38.5, true)), geometries);

        assertThat(resolution.changes()).isEmpty();
    }

    @Test
    void businessInsideExpiredUnitLosesStatus() {
        Changeset changeset = changeset(List.of(), List.of(expired(WEST)), List.of(), List.of());

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-2", -77.5, 38.5, true)), geometries);

        assertThat(resolution.changes()).hasSize(1);
        assertThat(resolution.changes().get(0).changeType()).isEqualTo(BusinessChangeType.LOST_HUBZONE);
        assertThat(resolution.changes().get(0).newStatus()).isEqualTo(HubzoneMembership.NOT_IN_HUBZONE);
    }

    @Test
    void businessInsideRedesignatedUnitKeepsStatusUntilGraceEnds() {
        Changeset changeset = changeset(List.of(), List.of(), List.of(redesignated(WEST)), List.of());

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-3", -77.5, 38.5, true)), geometries);

        AffectedBusinessChange change = resolution.changes().get(0);
        assertThat(change.changeType()).isEqualTo(BusinessChangeType.HUBZONE_REDESIGNATED);
        assertThat(change.newStatus()).isEqualTo(HubzoneMembership.IN_HUBZONE);
        assertThat(change.gracePeriodEndDate()).isEqualTo(RUN_DATE.plusMonths(36));
    }

    @Test
    void businessOnSharedBoundaryKeepsStatusWhenNeighbourStaysActive() {
        Changeset changeset = changeset(List.of(), List.of(expired(WEST)), List.of(), List.of(EAST));

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-4", -77.0, 38.5, true)), geometries);

        assertThat(resolution.changes()).isEmpty();
    }

    @Test
    void businessOnBoundaryOfLostUnitCountsAsInside() {
        Changeset changeset = changeset(List.of(), List.of(expired(WEST)), List.of(), List.of());

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-5", -78.0, 38.0, true)), geometries);

        assertThat(resolution.changes()).extracting(AffectedBusinessChange::changeType)
            .containsExactly(BusinessChangeType.LOST_HUBZONE);
    }

    @Test
    void businessOutsideChangedUnitsIsUntouched() {
        Changeset changeset = changeset(List.of(created(WEST)), List.of(), List.of(), List.of());

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-6", -70.0, 40.0, false)), geometries);

        assertThat(resolution.changes()).isEmpty();
        assertThat(resolution.warnings()).isEmpty();
    }

    @Test
    void missingCoordinatesAndBoundariesBecomeWarnings() {
        Changeset changeset = changeset(List.of(created(WEST), created("11001000900")), List.of(), List.of(), List.of());
        BusinessLocation noCoordinates = new BusinessLocation("B-7", "Nowhere LLC", "11", null, null, false);
        BusinessLocation inside = business("B-8", -77.5, 38.5, false);

        BusinessResolution resolution = resolver.resolve(changeset, List.of(noCoordinates, inside), geometries);

        assertThat(resolution.changes()).extracting(AffectedBusinessChange::businessId).containsExactly("B-8");
        assertThat(resolution.warnings()).hasSize(2);
        assertThat(resolution.warnings()).allSatisfy(issue ->
            assertThat(issue.code()).isEqualTo(ImportErrorCodes.GEOSPATIAL_RESOLUTION_ERROR));
        assertThat(resolution.warnings().get(0).geoid()).isEqualTo("11001000900");
        assertThat(resolution.warnings().get(1).message()).contains("B-7");
    }

    @Test
    void changesetWithoutMembershipChangesSkipsResolution() {
        Changeset changeset = changeset(List.of(), List.of(), List.of(), List.of(WEST));

        BusinessResolution resolution = resolver.resolve(
            changeset, List.of(business("B-9", -77.5, 38.5, false)), geometries);

        assertThat(resolution.changes()).isEmpty();
    }

    private Geometry box(double minX, double maxX) {
        return factory.createPolygon(new Coordinate[] {
            new Coordinate(minX, 38),
            new Coordinate(maxX, 38),
            new Coordinate(maxX, 39),
            new Coordinate(minX, 39),
            new Coordinate(minX, 38)
        });
    }

    private static Changeset changeset(
        List<DesignationChange> created,
        List<DesignationChange> expired,
        List<DesignationChange> redesignated,
        List<String> unchanged
    ) {
        return new Changeset(created, List.of(), expired, redesignated, unchanged, List.of());
    }

    private static DesignationChange created(String geoid) {
        return new DesignationChange(ChangeKind.NEW, geoid, null, active(geoid), null);
    }

    private static DesignationChange expired(String geoid) {
        Designation previous = active(geoid);
        return new DesignationChange(ChangeKind.EXPIRED, geoid, previous, previous.expire(RUN_DATE), null);
    }

    private static DesignationChange redesignated(String geoid) {
        Designation previous = active(geoid);
        return new DesignationChange(ChangeKind.REDESIGNATED, geoid, previous, previous.redesignate(RUN_DATE.plusMonths(36)), null);
    }

    private static Designation active(String geoid) {
        return new Designation(geoid, "11", "11001", DesignationType.QUALIFIED_CENSUS_TRACT,
            DesignationStatus.ACTIVE, LocalDate.of(2020, 1, 1), null, null, "census_acs:2022");
    }

    private static BusinessLocation business(String id, double longitude, double latitude, boolean inHubzone) {
        return new BusinessLocation(id, id + " Inc", "11", latitude, longitude, inHubzone);
    }
}
