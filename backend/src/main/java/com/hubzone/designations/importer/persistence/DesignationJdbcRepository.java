package com.hubzone.designations.importer.persistence;

import com.hubzone.designations.importer.model.Designation;
import com.hubzone.designations.importer.model.DesignationStatus;
import com.hubzone.designations.importer.model.DesignationType;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class DesignationJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(DesignationJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    private final RowMapper<Designation> rowMapper = (rs, rowNum) -> new Designation(
        rs.getString("geoid"),
        rs.getString("state_fips"),
        rs.getString("county_fips"),
        DesignationType.valueOf(rs.getString("designation_type")),
        DesignationStatus.valueOf(rs.getString("status")),
        toLocalDate(rs.getDate("designation_date")),
        toLocalDate(rs.getDate("expiration_date")),
        toLocalDate(rs.getDate("grace_period_end_date")),
        rs.getString("source_dataset")
    );

    public DesignationJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Designation> findCurrentByState(String stateFips) {
        return jdbc.query(
            """
                SELECT geoid, state_fips, county_fips, designation_type, status,
                       designation_date, expiration_date, grace_period_end_date, source_dataset
                FROM hubzone_designations
                WHERE state_fips = :stateFips
                  AND status IN ('ACTIVE', 'REDESIGNATED')
                ORDER BY geoid
                """,
            new MapSqlParameterSource("stateFips", stateFips),
            rowMapper
        );
    }

    public Designation findByGeoid(String geoid) {
        List<Designation> rows = jdbc.query(
            """
                SELECT geoid, state_fips, county_fips, designation_type, status,
                       designation_date, expiration_date, grace_period_end_date, source_dataset
                FROM hubzone_designations
                WHERE geoid = :geoid
                """,
            new MapSqlParameterSource("geoid", geoid),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<Designation> findAll() {
        return jdbc.query(
            """
                SELECT geoid, state_fips, county_fips, designation_type, status,
                       designation_date, expiration_date, grace_period_end_date, source_dataset
                FROM hubzone_designations
                ORDER BY geoid
                """,
            rowMapper
        );
    }

    public long countActive() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM hubzone_designations WHERE status = 'ACTIVE'",
            new MapSqlParameterSource(),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Map<String, Geometry> findGeometries(Collection<String> geoids) {
        Map<String, Geometry> geometries = new LinkedHashMap<>();
        if (geoids == null || geoids.isEmpty()) {
            return geometries;
        }
        GeoJsonReader reader = new GeoJsonReader();
        jdbc.query(
            """
                SELECT geoid, geometry_geojson
                FROM hubzone_designations
                WHERE geoid IN (:geoids)
                  AND geometry_geojson IS NOT NULL
                """,
            new MapSqlParameterSource("geoids", geoids),
            (RowCallbackHandler) rs -> {
                String geoid = rs.getString("geoid");
                try {
                    geometries.put(geoid, reader.read(rs.getString("geometry_geojson")));
                } catch (ParseException e) {
                    log.warn("Stored boundary for {} is not valid GeoJSON; ignoring it", geoid, e);
                }
            }
        );
        return geometries;
    }

    // A null geometry keeps the stored boundary.
    public void upsert(Designation designation, Geometry geometry, long importExecutionId) {
        String geometryJson = null;
        Envelope envelope = null;
        if (geometry != null && !geometry.isEmpty()) {
            GeoJsonWriter writer = new GeoJsonWriter();
            writer.setEncodeCRS(false);
            geometryJson = writer.write(geometry);
            envelope = geometry.getEnvelopeInternal();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("geoid", designation.geoid())
            .addValue("stateFips", designation.stateFips())
            .addValue("countyFips", designation.countyFips())
            .addValue("designationType", designation.type().name())
            .addValue("status", designation.status().name())
            .addValue("designationDate", toDate(designation.designationDate()))
            .addValue("expirationDate", toDate(designation.expirationDate()))
            .addValue("gracePeriodEndDate", toDate(designation.gracePeriodEndDate()))
            .addValue("sourceDataset", designation.sourceDataset())
            .addValue("geometryJson", geometryJson)
            .addValue("minLon", envelope == null ? null : envelope.getMinX())
            .addValue("minLat", envelope == null ? null : envelope.getMinY())
            .addValue("maxLon", envelope == null ? null : envelope.getMaxX())
            .addValue("maxLat", envelope == null ? null : envelope.getMaxY())
            .addValue("executionId", importExecutionId);

        int updated = jdbc.update(
            """
                UPDATE hubzone_designations
                SET state_fips = :stateFips,
                    county_fips = :countyFips,
                    designation_type = :designationType,
                    status = :status,
                    designation_date = :designationDate,
                    expiration_date = :expirationDate,
                    grace_period_end_date = :gracePeriodEndDate,
                    source_dataset = :sourceDataset,
                    geometry_geojson = COALESCE(:geometryJson, geometry_geojson),
                    min_lon = COALESCE(:minLon, min_lon),
                    min_lat = COALESCE(:minLat, min_lat),
                    max_lon = COALESCE(:maxLon, max_lon),
                    max_lat = COALESCE(:maxLat, max_lat),
                    last_import_execution_id = :executionId,
                    updated_at = CURRENT_TIMESTAMP
                WHERE geoid = :geoid
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO hubzone_designations (
                    geoid, state_fips, county_fips, designation_type, status,
                    designation_date, expiration_date, grace_period_end_date, source_dataset,
                    geometry_geojson, min_lon, min_lat, max_lon, max_lat,
                    last_import_execution_id, updated_at
                )
                VALUES (
                    :geoid, :stateFips, :countyFips, :designationType, :status,
                    :designationDate, :expirationDate, :gracePeriodEndDate, :sourceDataset,
                    :geometryJson, :minLon, :minLat, :maxLon, :maxLat,
                    :executionId, CURRENT_TIMESTAMP
                )
                """,
            params
        );
    }

    private Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    private LocalDate toLocalDate(Date value) {
        return value == null ? null : value.toLocalDate();
    }
}
