package com.hubzone.designations.importer.geo;

import com.hubzone.designations.importer.error.GeospatialResolutionException;
import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.BusinessChangeType;
import com.hubzone.designations.importer.model.BusinessLocation;
import com.hubzone.designations.importer.model.Changeset;
import com.hubzone.designations.importer.model.DesignationChange;
import com.hubzone.designations.importer.model.HubzoneMembership;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.util.ImportErrorCodes;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Works out which businesses gain, lose or enter the grace period of HUBZone status because of a changeset.
 * <p>
 * Only new, expired and redesignated units can change a business; updated units keep covering the same
 * area. Candidate units are found through an STR-tree over their envelopes and then confirmed with
 * {@code covers}, so a point on a boundary counts as inside. Each business gets at most one change.
 */
@Component
public class AffectedBusinessResolver {
    private static final Logger log = LoggerFactory.getLogger(AffectedBusinessResolver.class);

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);
    private final Clock clock;

    public AffectedBusinessResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param changeset  the reconciliation result for the businesses' scope
     * @param businesses businesses with their last known HUBZone status
     * @param geometries boundaries by GEOID; must cover the changed units and the units active after the run
     */
    public BusinessResolution resolve(
        Changeset changeset,
        List<BusinessLocation> businesses,
        Map<String, Geometry> geometries
    ) {
        if (changeset.created().isEmpty() && changeset.expired().isEmpty() && changeset.redesignated().isEmpty()) {
            return BusinessResolution.empty();
        }
        List<ImportIssue> warnings = new ArrayList<>();
        STRtree index = new STRtree();
        Set<String> activeAfter = changeset.activeAfterGeoids();

        for (DesignationChange change : changeset.created()) {
            insert(index, change.geoid(), UnitRole.GAINED, null, geometries, warnings);
        }
        for (DesignationChange change : changeset.expired()) {
            insert(index, change.geoid(), UnitRole.LOST, null, geometries, warnings);
        }
        for (DesignationChange change : changeset.redesignated()) {
            insert(index, change.geoid(), UnitRole.REDESIGNATED, change.next().gracePeriodEndDate(), geometries, warnings);
        }
        for (String geoid : activeAfter) {
            Geometry geometry = geometries.get(geoid);
            if (geometry != null && !geometry.isEmpty()) {
                index.insert(geometry.getEnvelopeInternal(), new IndexedUnit(geoid, UnitRole.STILL_ACTIVE, null, PreparedGeometryFactory.prepare(geometry)));
            }
        }
        index.build();

        List<AffectedBusinessChange> changes = new ArrayList<>();
        List<BusinessLocation> ordered = new ArrayList<>(businesses);
        ordered.sort(Comparator.comparing(BusinessLocation::businessId));
        for (BusinessLocation business : ordered) {
            if (!business.hasCoordinates()) {
                GeospatialResolutionException problem = new GeospatialResolutionException(
                    business.businessId(),
                    "Business " + business.businessId() + " has no usable coordinates"
                );
                warnings.add(ImportIssue.warning(problem.code(), problem.getMessage(), null, clock.instant()));
                continue;
            }
            AffectedBusinessChange change = classify(business, index, activeAfter);
            if (change != null) {
                changes.add(change);
            }
        }
        log.debug("Resolved {} affected businesses out of {}", changes.size(), businesses.size());
        return new BusinessResolution(changes, warnings);
    }

    private AffectedBusinessChange classify(BusinessLocation business, STRtree index, Set<String> activeAfter) {
        Point point = geometryFactory.createPoint(new Coordinate(business.longitude(), business.latitude()));
        List<IndexedUnit> covering = new ArrayList<>();
        for (Object hit : index.query(point.getEnvelopeInternal())) {
            IndexedUnit unit = (IndexedUnit) hit;
            if (unit.geometry().covers(point)) {
                covering.add(unit);
            }
        }
        if (covering.isEmpty()) {
            return null;
        }
        covering.sort(Comparator.comparing(IndexedUnit::geoid));

        if (!business.inHubzone()) {
            return covering.stream()
                .filter(unit -> unit.role() == UnitRole.GAINED)
                .findFirst()
                .map(unit -> change(business, HubzoneMembership.IN_HUBZONE, BusinessChangeType.GAINED_HUBZONE, unit))
                .orElse(null);
        }

        boolean stillCovered = covering.stream().anyMatch(unit -> activeAfter.contains(unit.geoid()));
        if (stillCovered) {
            return null;
        }
        IndexedUnit redesignated = covering.stream()
            .filter(unit -> unit.role() == UnitRole.REDESIGNATED)
            .findFirst()
            .orElse(null);
        if (redesignated != null) {
            return change(business, HubzoneMembership.IN_HUBZONE, BusinessChangeType.HUBZONE_REDESIGNATED, redesignated);
        }
        return covering.stream()
            .filter(unit -> unit.role() == UnitRole.LOST)
            .findFirst()
            .map(unit -> change(business, HubzoneMembership.NOT_IN_HUBZONE, BusinessChangeType.LOST_HUBZONE, unit))
            .orElse(null);
    }

    private static AffectedBusinessChange change(
        BusinessLocation business,
        HubzoneMembership newStatus,
        BusinessChangeType type,
        IndexedUnit unit
    ) {
        return new AffectedBusinessChange(
            business.businessId(),
            business.businessName(),
            HubzoneMembership.of(business.inHubzone()),
            newStatus,
            type,
            unit.geoid(),
            unit.gracePeriodEndDate(),
            false
        );
    }

    private void insert(
        STRtree index,
        String geoid,
        UnitRole role,
        LocalDate gracePeriodEndDate,
        Map<String, Geometry> geometries,
        List<ImportIssue> warnings
    ) {
        Geometry geometry = geometries.get(geoid);
        if (geometry == null || geometry.isEmpty()) {
            log.warn("No boundary for changed unit {}; affected businesses cannot be resolved for it", geoid);
            warnings.add(ImportIssue.warning(
                ImportErrorCodes.GEOSPATIAL_RESOLUTION_ERROR,
                "No boundary available for unit " + geoid,
                geoid,
                clock.instant()
            ));
            return;
        }
        index.insert(geometry.getEnvelopeInternal(), new IndexedUnit(geoid, role, gracePeriodEndDate, PreparedGeometryFactory.prepare(geometry)));
    }

    private enum UnitRole {
        GAINED,
        LOST,
        REDESIGNATED,
        STILL_ACTIVE
    }

    private record IndexedUnit(String geoid, UnitRole role, LocalDate gracePeriodEndDate, PreparedGeometry geometry) {
    }
}
