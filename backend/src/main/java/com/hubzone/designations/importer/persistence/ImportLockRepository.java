package com.hubzone.designations.importer.persistence;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Compare-and-swap access to the single {@code import_execution_lock} row that guards import runs
 * across every instance sharing the database.
 */
@Repository
public class ImportLockRepository {
    public static final String LOCK_NAME = "designation-import";

    private final NamedParameterJdbcTemplate jdbc;

    public ImportLockRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Long currentHolder() {
        List<Long> rows = jdbc.query(
            "SELECT holder_execution_id FROM import_execution_lock WHERE lock_name = :name",
            new MapSqlParameterSource("name", LOCK_NAME),
            (rs, rowNum) -> {
                long value = rs.getLong("holder_execution_id");
                return rs.wasNull() ? null : value;
            }
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Claims the lease when it is free or has lapsed. Returns false when another holder owns a live lease.
     */
    public boolean tryClaim(String instanceId, Instant now, Instant leaseUntil) {
        int updated = jdbc.update(
            """
                UPDATE import_execution_lock
                SET holder_execution_id = NULL,
                    holder_instance = :instanceId,
                    acquired_at = :now,
                    lease_expires_at = :leaseUntil
                WHERE lock_name = :name
                  AND (holder_instance IS NULL OR lease_expires_at IS NULL OR lease_expires_at < :now)
                """,
            new MapSqlParameterSource()
                .addValue("name", LOCK_NAME)
                .addValue("instanceId", instanceId)
                .addValue("now", toTimestamp(now))
                .addValue("leaseUntil", toTimestamp(leaseUntil))
        );
        return updated == 1;
    }

    public void assignHolder(String instanceId, long executionId) {
        jdbc.update(
            """
                UPDATE import_execution_lock
                SET holder_execution_id = :executionId
                WHERE lock_name = :name
                  AND holder_instance = :instanceId
                """,
            new MapSqlParameterSource()
                .addValue("name", LOCK_NAME)
                .addValue("instanceId", instanceId)
                .addValue("executionId", executionId)
        );
    }

    /**
     * Locks the lease row for the rest of the surrounding transaction and reports whether the given
     * execution still holds it.
     */
    public boolean lockIfHeldBy(long executionId) {
        List<Long> rows = jdbc.query(
            "SELECT holder_execution_id FROM import_execution_lock WHERE lock_name = :name FOR UPDATE",
            new MapSqlParameterSource("name", LOCK_NAME),
            (rs, rowNum) -> {
                long value = rs.getLong("holder_execution_id");
                return rs.wasNull() ? null : value;
            }
        );
        return !rows.isEmpty() && rows.get(0) != null && rows.get(0) == executionId;
    }

    public boolean extendLease(long executionId, Instant leaseUntil) {
        int updated = jdbc.update(
            """
                UPDATE import_execution_lock
                SET lease_expires_at = :leaseUntil
                WHERE lock_name = :name
                  AND holder_execution_id = :executionId
                """,
            new MapSqlParameterSource()
                .addValue("name", LOCK_NAME)
                .addValue("executionId", executionId)
                .addValue("leaseUntil", toTimestamp(leaseUntil))
        );
        return updated == 1;
    }

    public boolean release(long executionId) {
        int updated = jdbc.update(
            """
                UPDATE import_execution_lock
                SET holder_execution_id = NULL,
                    holder_instance = NULL,
                    acquired_at = NULL,
                    lease_expires_at = NULL
                WHERE lock_name = :name
                  AND holder_execution_id = :executionId
                """,
            new MapSqlParameterSource()
                .addValue("name", LOCK_NAME)
                .addValue("executionId", executionId)
        );
        return updated == 1;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
