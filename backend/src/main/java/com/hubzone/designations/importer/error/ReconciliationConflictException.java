package com.hubzone.designations.importer.error;

import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.util.ImportErrorCodes;

import java.util.List;

public class ReconciliationConflictException extends ImportException {
    private final List<DesignationType> candidates;

    public ReconciliationConflictException(String geoid, List<DesignationType> candidates) {
        super("Unresolvable designation types for " + geoid + ": " + candidates, geoid, null);
        this.candidates = List.copyOf(candidates);
    }

    @Override
    public String code() {
        return ImportErrorCodes.RECONCILIATION_CONFLICT;
    }

    public List<DesignationType> candidates() {
        return candidates;
    }
}
