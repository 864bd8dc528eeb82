package com.hubzone.designations.importer.model;

public enum UnitType {
    TRACT,
    COUNTY;

    public static UnitType forGeoid(String geoid) {
        return geoid != null && geoid.length() == 5 ? COUNTY : TRACT;
    }
}
