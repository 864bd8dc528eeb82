package com.hubzone.designations.importer.model;

public enum ChangeKind {
    NEW,
    UPDATED,
    EXPIRED,
    REDESIGNATED
}
