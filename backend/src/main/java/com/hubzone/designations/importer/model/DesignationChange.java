package com.hubzone.designations.importer.model;

public record DesignationChange(
    ChangeKind kind,
    String geoid,
    Designation previous,
    Designation next,
    QualificationResult qualification
) {
}
