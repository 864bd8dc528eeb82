package com.hubzone.designations.importer.model;

public enum QualificationReason {
    POVERTY,
    INCOME,
    BOTH,
    NONE
}
