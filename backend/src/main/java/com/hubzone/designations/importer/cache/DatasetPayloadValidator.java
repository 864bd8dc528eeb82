package com.hubzone.designations.importer.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubzone.designations.importer.http.PayloadValidator;
import com.hubzone.designations.importer.model.DatasetFormat;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

@Component
public class DatasetPayloadValidator {
    private final ObjectMapper objectMapper;

    public DatasetPayloadValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PayloadValidator forFormat(DatasetFormat format) {
        return body -> {
            if (body == null || body.length == 0) {
                return "empty body";
            }
            return switch (format) {
                case GEOJSON -> validateGeoJson(body);
                case JSON_TABLE -> validateJsonTable(body);
                case CSV -> validateCsv(body);
            };
        };
    }

    private String validateGeoJson(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            return "invalid JSON: " + e.getMessage();
        }
        if (root == null || !root.isObject()) {
            return "not a JSON object";
        }
        if (!root.path("features").isArray()) {
            return "GeoJSON payload has no features array";
        }
        return null;
    }

    private String validateJsonTable(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            return "invalid JSON: " + e.getMessage();
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            return "not a JSON table";
        }
        if (!root.get(0).isArray()) {
            return "JSON table has no header row";
        }
        return null;
    }

    private String validateCsv(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        CSVFormat format = CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).build();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                return "CSV payload has no header";
            }
            CSVRecord header = records.next();
            if (header.size() < 2) {
                return "CSV header has fewer than two columns";
            }
            return null;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            return "CSV payload unreadable: " + e.getMessage();
        }
    }
}
