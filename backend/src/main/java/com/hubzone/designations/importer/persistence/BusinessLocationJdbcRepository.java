package com.hubzone.designations.importer.persistence;

import com.hubzone.designations.importer.model.BusinessLocation;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class BusinessLocationJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final SqlDialect dialect;

    private final RowMapper<BusinessLocation> rowMapper = (rs, rowNum) -> new BusinessLocation(
        rs.getString("business_id"),
        rs.getString("business_name"),
        rs.getString("state_fips"),
        nullableDouble(rs, "latitude"),
        nullableDouble(rs, "longitude"),
        rs.getBoolean("hubzone_status")
    );

    public BusinessLocationJdbcRepository(NamedParameterJdbcTemplate jdbc, SqlDialect dialect) {
        this.jdbc = jdbc;
        this.dialect = dialect;
    }

    public List<BusinessLocation> findByState(String stateFips) {
        return jdbc.query(
            """
                SELECT business_id, business_name, state_fips, latitude, longitude, hubzone_status
                FROM business_locations
                WHERE state_fips = :stateFips
                ORDER BY business_id
                """,
            new MapSqlParameterSource("stateFips", stateFips),
            rowMapper
        );
    }

    public BusinessLocation findById(String businessId) {
        List<BusinessLocation> rows = jdbc.query(
            """
                SELECT business_id, business_name, state_fips, latitude, longitude, hubzone_status
                FROM business_locations
                WHERE business_id = :businessId
                """,
            new MapSqlParameterSource("businessId", businessId),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void upsert(BusinessLocation location) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("businessId", location.businessId())
            .addValue("businessName", location.businessName())
            .addValue("stateFips", location.stateFips())
            .addValue("latitude", location.latitude())
            .addValue("longitude", location.longitude())
            .addValue("hubzoneStatus", location.inHubzone());
        if (dialect.isPostgres()) {
            jdbc.update(
                """
                    INSERT INTO business_locations (
                        business_id, business_name, state_fips, latitude, longitude, hubzone_status
                    )
                    VALUES (
                        :businessId, :businessName, :stateFips, :latitude, :longitude, :hubzoneStatus
                    )
                    ON CONFLICT (business_id)
                    DO UPDATE SET
                        business_name = EXCLUDED.business_name,
                        state_fips = EXCLUDED.state_fips,
                        latitude = EXCLUDED.latitude,
                        longitude = EXCLUDED.longitude,
                        hubzone_status = EXCLUDED.hubzone_status
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO business_locations (
                    business_id, business_name, state_fips, latitude, longitude, hubzone_status
                )
                KEY(business_id)
                VALUES (
                    :businessId, :businessName, :stateFips, :latitude, :longitude, :hubzoneStatus
                )
                """,
            params
        );
    }

    public int updateHubzoneStatus(String businessId, boolean inHubzone, String geoid, Instant at) {
        return jdbc.update(
            """
                UPDATE business_locations
                SET hubzone_status = :inHubzone,
                    hubzone_geoid = :geoid,
                    hubzone_status_updated_at = :at
                WHERE business_id = :businessId
                """,
            new MapSqlParameterSource()
                .addValue("businessId", businessId)
                .addValue("inHubzone", inHubzone)
                .addValue("geoid", geoid)
                .addValue("at", toTimestamp(at))
        );
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
