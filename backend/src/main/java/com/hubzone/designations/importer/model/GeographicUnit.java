package com.hubzone.designations.importer.model;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;

public record GeographicUnit(
    String geoid,
    UnitType unitType,
    String stateFips,
    String countyFips,
    String name,
    long landArea,
    long waterArea,
    Point centroid,
    Geometry boundary
) {
}
