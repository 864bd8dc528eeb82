package com.hubzone.designations.importer.reconcile;

public enum TieBreakRuleKind {
    NO_EXPIRATION_FIRST,
    INCUMBENT_TYPE_FIRST,
    LATEST_EXPIRATION_FIRST,
    TYPE_PRECEDENCE
}
