package com.hubzone.designations.importer.model;

public enum IssueSeverity {
    WARNING,
    ERROR,
    FATAL
}
