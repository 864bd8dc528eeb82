package com.hubzone.designations.importer.source;

import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.model.FeedDesignation;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DesignationFeedParser {
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setIgnoreEmptyLines(true)
        .setIgnoreSurroundingSpaces(true)
        .setTrim(true)
        .setAllowMissingColumnNames(true)
        .build();

    public FeedParseResult<FeedDesignation> parse(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    FeedParseResult<FeedDesignation> parse(Reader reader) throws IOException {
        List<FeedDesignation> rows = new ArrayList<>();
        List<FeedProblem> problems = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                String geoid = value(record, "geoid");
                if (geoid == null) {
                    problems.add(new FeedProblem(null, "line " + record.getRecordNumber() + ": missing geoid"));
                    continue;
                }
                DesignationType type = DesignationType.fromFeedValue(value(record, "type"));
                if (type == null) {
                    problems.add(new FeedProblem(geoid, "unknown designation type '" + value(record, "type") + "'"));
                    continue;
                }
                LocalDate designationDate;
                LocalDate expirationDate;
                try {
                    designationDate = parseDate(value(record, "designation_date"));
                    expirationDate = parseDate(value(record, "expiration_date"));
                } catch (DateTimeParseException e) {
                    problems.add(new FeedProblem(geoid, "unreadable date: " + e.getParsedString()));
                    continue;
                }
                if (designationDate == null) {
                    problems.add(new FeedProblem(geoid, "missing designation_date"));
                    continue;
                }
                String stateFips = normalizeState(value(record, "state"), geoid);
                rows.add(new FeedDesignation(
                    geoid,
                    stateFips,
                    normalizeCounty(value(record, "county"), stateFips, geoid),
                    type,
                    DesignationStatus.fromFeedValue(value(record, "status")),
                    designationDate,
                    expirationDate
                ));
            }
        }
        return new FeedParseResult<>(rows, problems);
    }

    // Ties keep the row read first.
    public static List<FeedDesignation> mergeByGeoid(List<FeedDesignation> rows) {
        Map<String, FeedDesignation> byGeoid = new LinkedHashMap<>();
        for (FeedDesignation row : rows) {
            byGeoid.merge(row.geoid(), row, (kept, candidate) ->
                candidate.designationDate().isAfter(kept.designationDate()) ? candidate : kept);
        }
        return new ArrayList<>(byGeoid.values());
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return null;
        }
        String value = record.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }

    static LocalDate parseDate(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.length() > 10 && raw.charAt(4) == '-' ? raw.substring(0, 10) : raw;
        if (text.indexOf('/') > 0) {
            return LocalDate.parse(text, US_DATE);
        }
        return LocalDate.parse(text);
    }

    private static String normalizeState(String raw, String geoid) {
        if (raw != null && raw.chars().allMatch(Character::isDigit)) {
            return raw.length() == 1 ? "0" + raw : raw;
        }
        return geoid.length() >= 2 ? geoid.substring(0, 2) : raw;
    }

    private static String normalizeCounty(String raw, String stateFips, String geoid) {
        if (raw != null && raw.chars().allMatch(Character::isDigit)) {
            if (raw.length() == 5) {
                return raw;
            }
            if (raw.length() <= 3 && stateFips != null) {
                return stateFips + "0".repeat(3 - raw.length()) + raw;
            }
        }
        return geoid.length() >= 5 ? geoid.substring(0, 5) : null;
    }
}
