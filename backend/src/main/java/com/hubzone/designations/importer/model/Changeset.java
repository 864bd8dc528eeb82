package com.hubzone.designations.importer.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record Changeset(
    List<DesignationChange> created,
    List<DesignationChange> updated,
    List<DesignationChange> expired,
    List<DesignationChange> redesignated,
    List<String> unchangedGeoids,
    List<ImportIssue> conflicts
) {
    public Changeset {
        created = created == null ? List.of() : List.copyOf(created);
        updated = updated == null ? List.of() : List.copyOf(updated);
        expired = expired == null ? List.of() : List.copyOf(expired);
        redesignated = redesignated == null ? List.of() : List.copyOf(redesignated);
        unchangedGeoids = unchangedGeoids == null ? List.of() : List.copyOf(unchangedGeoids);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static Changeset empty() {
        return new Changeset(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public Changeset merge(Changeset other) {
        if (other == null) {
            return this;
        }
        return new Changeset(
            concat(created, other.created),
            concat(updated, other.updated),
            concat(expired, other.expired),
            concat(redesignated, other.redesignated),
            concat(unchangedGeoids, other.unchangedGeoids),
            concat(conflicts, other.conflicts)
        );
    }

    public int changeCount() {
        return created.size() + updated.size() + expired.size() + redesignated.size();
    }

    public List<DesignationChange> allChanges() {
        List<DesignationChange> all = new ArrayList<>(changeCount());
        all.addAll(created);
        all.addAll(updated);
        all.addAll(expired);
        all.addAll(redesignated);
        return all;
    }

    // Conflicted units keep what they had, so they count as covering.
    public Set<String> activeAfterGeoids() {
        Set<String> active = new LinkedHashSet<>(unchangedGeoids);
        created.forEach(change -> active.add(change.geoid()));
        updated.forEach(change -> active.add(change.geoid()));
        conflicts.stream()
            .map(ImportIssue::geoid)
            .filter(geoid -> geoid != null)
            .forEach(active::add);
        return active;
    }

    public int activeDelta() {
        long lostActive = expired.stream()
            .filter(change -> change.previous() != null && change.previous().isActive())
            .count();
        return created.size() - (int) lostActive - redesignated.size();
    }

    private static <T> List<T> concat(List<T> left, List<T> right) {
        List<T> merged = new ArrayList<>(left.size() + right.size());
        merged.addAll(left);
        merged.addAll(right);
        return merged;
    }
}
