package com.hubzone.designations.importer.model;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public record StateFips(String fips, String name, String abbreviation) {

    public static final List<StateFips> ALL = List.of(
        new StateFips("01", "Alabama", "AL"),
        new StateFips("02", "Alaska", "AK"),
        new StateFips("04", "Arizona", "AZ"),
        new StateFips("05", "Arkansas", "AR"),
        new StateFips("06", "California", "CA"),
        new StateFips("08", "Colorado", "CO"),
        new StateFips("09", "Connecticut", "CT"),
        new StateFips("10", "Delaware", "DE"),
        new StateFips("11", "District of Columbia", "DC"),
        new StateFips("12", "Florida", "FL"),
        new StateFips("13", "Georgia", "GA"),
        new StateFips("15", "Hawaii", "HI"),
        new StateFips("16", "Idaho", "ID"),
        new StateFips("17", "Illinois", "IL"),
        new StateFips("18", "Indiana", "IN"),
        new StateFips("19", "Iowa", "IA"),
        new StateFips("20", "Kansas", "KS"),
        new StateFips("21", "Kentucky", "KY"),
        new StateFips("22", "Louisiana", "LA"),
        new StateFips("23", "Maine", "ME"),
        new StateFips("24", "Maryland", "MD"),
        new StateFips("25", "Massachusetts", "MA"),
        new StateFips("26", "Michigan", "MI"),
        new StateFips("27", "Minnesota", "MN"),
        new StateFips("28", "Mississippi", "MS"),
        new StateFips("29", "Missouri", "MO"),
        new StateFips("30", "Montana", "MT"),
        new StateFips("31", "Nebraska", "NE"),
        new StateFips("32", "Nevada", "NV"),
        new StateFips("33", "New Hampshire", "NH"),
        new StateFips("34", "New Jersey", "NJ"),
        new StateFips("35", "New Mexico", "NM"),
        new StateFips("36", "New York", "NY"),
        new StateFips("37", "North Carolina", "NC"),
        new StateFips("38", "North Dakota", "ND"),
        new StateFips("39", "Ohio", "OH"),
        new StateFips("40", "Oklahoma", "OK"),
        new StateFips("41", "Oregon", "OR"),
        new StateFips("42", "Pennsylvania", "PA"),
        new StateFips("44", "Rhode Island", "RI"),
        new StateFips("45", "South Carolina", "SC"),
        new StateFips("46", "South Dakota", "SD"),
        new StateFips("47", "Tennessee", "TN"),
        new StateFips("48", "Texas", "TX"),
        new StateFips("49", "Utah", "UT"),
        new StateFips("50", "Vermont", "VT"),
        new StateFips("51", "Virginia", "VA"),
        new StateFips("53", "Washington", "WA"),
        new StateFips("54", "West Virginia", "WV"),
        new StateFips("55", "Wisconsin", "WI"),
        new StateFips("56", "Wyoming", "WY"),
        new StateFips("72", "Puerto Rico", "PR"),
        new StateFips("78", "Virgin Islands", "VI"),
        new StateFips("66", "Guam", "GU"),
        new StateFips("69", "Northern Mariana Islands", "MP"),
        new StateFips("60", "American Samoa", "AS")
    );

    private static final Map<String, StateFips> BY_FIPS = ALL.stream()
        .collect(Collectors.toUnmodifiableMap(StateFips::fips, Function.identity()));

    public static boolean isKnown(String fips) {
        return fips != null && BY_FIPS.containsKey(fips);
    }

    public static List<String> allCodes() {
        return ALL.stream()
            .map(StateFips::fips)
            .sorted(Comparator.naturalOrder())
            .toList();
    }
}
