package com.hubzone.designations.importer.model;

public enum BusinessChangeType {
    GAINED_HUBZONE("gained_hubzone"),
    LOST_HUBZONE("lost_hubzone"),
    HUBZONE_REDESIGNATED("hubzone_redesignated");

    private final String code;

    BusinessChangeType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
