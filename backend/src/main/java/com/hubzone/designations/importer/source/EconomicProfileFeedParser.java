package com.hubzone.designations.importer.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubzone.designations.importer.model.EconomicProfile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Without an AMI column, a tract's AMI is the median family income of its county's tracts.
@Component
public class EconomicProfileFeedParser {
    static final String TOTAL_POPULATION = "B01001_001E";
    static final String POVERTY_UNIVERSE = "B17001_001E";
    static final String BELOW_POVERTY = "B17001_002E";
    static final String MEDIAN_HOUSEHOLD_INCOME = "B19013_001E";
    static final String MEDIAN_FAMILY_INCOME = "B19113_001E";
    static final String AREA_MEDIAN_INCOME = "AMI";

    private final ObjectMapper objectMapper;

    public EconomicProfileFeedParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FeedParseResult<EconomicProfile> parse(Path path, int vintageYear) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(objectMapper.readTree(in), vintageYear);
        }
    }

    FeedParseResult<EconomicProfile> parse(JsonNode table, int vintageYear) {
        List<FeedProblem> problems = new ArrayList<>();
        if (!table.isArray() || table.size() == 0) {
            problems.add(new FeedProblem(null, "economic profile table is empty"));
            return new FeedParseResult<>(List.of(), problems);
        }
        Map<String, Integer> columns = new HashMap<>();
        JsonNode header = table.get(0);
        for (int i = 0; i < header.size(); i++) {
            columns.put(header.get(i).asText(), i);
        }
        if (!columns.containsKey("state") || !columns.containsKey("county")) {
            problems.add(new FeedProblem(null, "economic profile table has no state/county columns"));
            return new FeedParseResult<>(List.of(), problems);
        }

        List<EconomicProfile> profiles = new ArrayList<>();
        for (int rowIndex = 1; rowIndex < table.size(); rowIndex++) {
            JsonNode row = table.get(rowIndex);
            String state = cell(row, columns.get("state"));
            String county = cell(row, columns.get("county"));
            String tract = cell(row, columns.get("tract"));
            if (state == null || county == null) {
                problems.add(new FeedProblem(null, "row " + rowIndex + ": missing state or county"));
                continue;
            }
            String countyFips = state + county;
            String geoid = tract == null ? countyFips : countyFips + tract;
            profiles.add(new EconomicProfile(
                geoid,
                state,
                countyFips,
                vintageYear,
                count(row, columns.get(TOTAL_POPULATION)),
                count(row, columns.get(POVERTY_UNIVERSE)),
                count(row, columns.get(BELOW_POVERTY)),
                amount(row, columns.get(MEDIAN_HOUSEHOLD_INCOME)),
                amount(row, columns.get(MEDIAN_FAMILY_INCOME)),
                amount(row, columns.get(AREA_MEDIAN_INCOME))
            ));
        }
        return new FeedParseResult<>(withCountyMedians(profiles), problems);
    }

    private static List<EconomicProfile> withCountyMedians(List<EconomicProfile> profiles) {
        Map<String, List<BigDecimal>> incomesByCounty = new LinkedHashMap<>();
        for (EconomicProfile profile : profiles) {
            BigDecimal income = familyIncome(profile);
            if (income != null) {
                incomesByCounty.computeIfAbsent(profile.countyFips(), key -> new ArrayList<>()).add(income);
            }
        }
        Map<String, BigDecimal> medians = new HashMap<>();
        incomesByCounty.forEach((county, incomes) -> medians.put(county, upperMedian(incomes)));

        List<EconomicProfile> result = new ArrayList<>(profiles.size());
        for (EconomicProfile profile : profiles) {
            if (profile.areaMedianIncome() != null) {
                result.add(profile);
            } else {
                result.add(profile.withAreaMedianIncome(medians.get(profile.countyFips())));
            }
        }
        return result;
    }

    static BigDecimal familyIncome(EconomicProfile profile) {
        return profile.medianFamilyIncome() != null ? profile.medianFamilyIncome() : profile.medianHouseholdIncome();
    }

    static BigDecimal upperMedian(List<BigDecimal> values) {
        List<BigDecimal> sorted = new ArrayList<>(values);
        sorted.sort(null);
        return sorted.get(sorted.size() / 2);
    }

    private static String cell(JsonNode row, Integer index) {
        if (index == null || index >= row.size()) {
            return null;
        }
        JsonNode value = row.get(index);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Long count(JsonNode row, Integer index) {
        BigDecimal value = amount(row, index);
        return value == null ? null : value.longValue();
    }

    private static BigDecimal amount(JsonNode row, Integer index) {
        String text = cell(row, index);
        if (text == null) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(text);
            return value.signum() < 0 ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
