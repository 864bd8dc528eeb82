package com.hubzone.designations.importer.model;

import java.util.Locale;
import java.util.Map;

public enum DesignationType {
    QUALIFIED_CENSUS_TRACT("qualified_census_tract"),
    QUALIFIED_NON_METRO_COUNTY("qualified_non_metro_county"),
    INDIAN_LANDS("indian_lands"),
    BASE_CLOSURE_AREA("base_closure_area"),
    GOVERNOR_DESIGNATED("governor_designated"),
    REDESIGNATED("redesignated");

    private static final Map<String, DesignationType> FEED_ALIASES = Map.ofEntries(
        Map.entry("qct", QUALIFIED_CENSUS_TRACT),
        Map.entry("qualified_census_tract", QUALIFIED_CENSUS_TRACT),
        Map.entry("qnmc", QUALIFIED_NON_METRO_COUNTY),
        Map.entry("qualified_non_metro_county", QUALIFIED_NON_METRO_COUNTY),
        Map.entry("indian_lands", INDIAN_LANDS),
        Map.entry("base_closure", BASE_CLOSURE_AREA),
        Map.entry("base_closure_area", BASE_CLOSURE_AREA),
        Map.entry("governor_designated", GOVERNOR_DESIGNATED),
        Map.entry("redesignated", REDESIGNATED)
    );

    private final String code;

    DesignationType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static DesignationType fromFeedValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return FEED_ALIASES.get(raw.trim().toLowerCase(Locale.ROOT));
    }
}
