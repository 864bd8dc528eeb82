package com.hubzone.designations.importer.model;

public enum ImportStage {
    ACQUIRE,
    EVALUATE,
    RECONCILE,
    RESOLVE,
    COMMIT,
    NOTIFY,
    FINISHED
}
