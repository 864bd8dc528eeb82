package com.hubzone.designations.importer.model;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

public record ImportOptions(
    boolean dryRun,
    boolean skipNotifications,
    List<String> states
) {
    public ImportOptions {
        states = normalizeStates(states);
    }

    public static ImportOptions defaults() {
        return new ImportOptions(false, false, List.of());
    }

    public boolean isScoped() {
        return !states.isEmpty();
    }

    private static List<String> normalizeStates(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        TreeSet<String> normalized = new TreeSet<>();
        raw.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .map(value -> value.length() == 1 ? "0" + value : value)
            .forEach(normalized::add);
        return List.copyOf(normalized);
    }
}
