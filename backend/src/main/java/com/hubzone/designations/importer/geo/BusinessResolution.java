package com.hubzone.designations.importer.geo;

import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.ImportIssue;

import java.util.List;

public record BusinessResolution(List<AffectedBusinessChange> changes, List<ImportIssue> warnings) {
    public BusinessResolution {
        changes = List.copyOf(changes);
        warnings = List.copyOf(warnings);
    }

    public static BusinessResolution empty() {
        return new BusinessResolution(List.of(), List.of());
    }
}
