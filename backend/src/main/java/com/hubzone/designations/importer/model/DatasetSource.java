package com.hubzone.designations.importer.model;

public enum DatasetSource {
    BOUNDARIES("boundaries"),
    DESIGNATIONS("sba_designations"),
    ECONOMIC_PROFILES("census_acs");

    private final String id;

    DatasetSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
