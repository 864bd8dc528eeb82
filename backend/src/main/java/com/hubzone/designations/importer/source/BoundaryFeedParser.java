package com.hubzone.designations.importer.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubzone.designations.importer.model.GeographicUnit;
import com.hubzone.designations.importer.model.UnitType;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class BoundaryFeedParser {
    private static final int WGS84_SRID = 4326;

    private final ObjectMapper objectMapper;
    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    public BoundaryFeedParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FeedParseResult<GeographicUnit> parse(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(objectMapper.readTree(in));
        }
    }

    FeedParseResult<GeographicUnit> parse(JsonNode root) {
        List<GeographicUnit> units = new ArrayList<>();
        List<FeedProblem> problems = new ArrayList<>();
        GeoJsonReader reader = new GeoJsonReader(geometryFactory);
        for (JsonNode feature : root.path("features")) {
            JsonNode props = feature.path("properties");
            String geoid = text(props, "GEOID", "GEOID20", "geoid");
            if (geoid == null) {
                problems.add(new FeedProblem(null, "boundary feature without GEOID"));
                continue;
            }
            JsonNode geometryNode = feature.get("geometry");
            if (geometryNode == null || geometryNode.isNull()) {
                problems.add(new FeedProblem(geoid, "boundary feature without geometry"));
                continue;
            }
            Geometry boundary;
            try {
                boundary = reader.read(geometryNode.toString());
            } catch (ParseException | RuntimeException e) {
                problems.add(new FeedProblem(geoid, "unreadable boundary geometry: " + e.getMessage()));
                continue;
            }
            if (boundary.isEmpty() || !(boundary instanceof Polygonal)) {
                problems.add(new FeedProblem(geoid, "boundary is not a polygon or multi-polygon"));
                continue;
            }
            if (!boundary.isValid()) {
                boundary = boundary.buffer(0);
            }

            String stateFips = text(props, "STATEFP", "STATE");
            if (stateFips == null && geoid.length() >= 2) {
                stateFips = geoid.substring(0, 2);
            }
            String countyFips = geoid.length() >= 5 ? geoid.substring(0, 5) : null;
            units.add(new GeographicUnit(
                geoid,
                UnitType.forGeoid(geoid),
                stateFips,
                countyFips,
                text(props, "NAMELSAD", "NAME", "BASENAME"),
                number(props, "ALAND", "AREALAND"),
                number(props, "AWATER", "AREAWATER"),
                centroid(props, boundary),
                boundary
            ));
        }
        return new FeedParseResult<>(units, problems);
    }

    private Point centroid(JsonNode props, Geometry boundary) {
        String lat = text(props, "INTPTLAT", "CENTLAT");
        String lon = text(props, "INTPTLON", "CENTLON");
        if (lat != null && lon != null) {
            try {
                return geometryFactory.createPoint(new Coordinate(Double.parseDouble(lon), Double.parseDouble(lat)));
            } catch (NumberFormatException ignored) {
                // fall through to the computed centroid
            }
        }
        return boundary.getInteriorPoint();
    }

    private static String text(JsonNode props, String... names) {
        for (String name : names) {
            JsonNode value = props.get(name);
            if (value != null && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static long number(JsonNode props, String... names) {
        String text = text(props, names);
        if (text == null) {
            return 0L;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
