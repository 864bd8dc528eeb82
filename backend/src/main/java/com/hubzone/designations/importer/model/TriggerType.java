package com.hubzone.designations.importer.model;

public enum TriggerType {
    SCHEDULED,
    MANUAL
}
