package com.hubzone.designations.importer.model;

public enum DatasetFormat {
    GEOJSON,
    CSV,
    JSON_TABLE
}
