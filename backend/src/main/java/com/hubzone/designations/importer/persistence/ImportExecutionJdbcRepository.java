package com.hubzone.designations.importer.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubzone.designations.importer.model.ImportExecution;
import com.hubzone.designations.importer.model.ImportExecutionStatus;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.model.ImportOptions;
import com.hubzone.designations.importer.model.ImportStatistics;
import com.hubzone.designations.importer.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class ImportExecutionJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ImportExecutionJdbcRepository.class);
    private static final TypeReference<List<ImportIssue>> ISSUE_LIST = new TypeReference<>() {};
    private static final String SELECT_COLUMNS = """
        SELECT id, trigger_type, triggered_by, status, options_json, statistics_json,
               errors_json, warnings_json, retry_count, cancel_requested,
               created_at, started_at, finished_at, last_heartbeat_at
        FROM import_executions
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    private final RowMapper<ImportExecution> rowMapper = (rs, rowNum) -> new ImportExecution(
        rs.getLong("id"),
        TriggerType.valueOf(rs.getString("trigger_type")),
        rs.getString("triggered_by"),
        ImportExecutionStatus.valueOf(rs.getString("status")),
        readJson(rs.getString("options_json"), ImportOptions.class, ImportOptions.defaults()),
        readJson(rs.getString("statistics_json"), ImportStatistics.class, ImportStatistics.empty()),
        readIssues(rs.getString("errors_json")),
        readIssues(rs.getString("warnings_json")),
        rs.getInt("retry_count"),
        rs.getBoolean("cancel_requested"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        toInstant(rs.getTimestamp("last_heartbeat_at"))
    );

    public ImportExecutionJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertPending(TriggerType triggerType, String triggeredBy, ImportOptions options, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("triggerType", triggerType.name())
            .addValue("triggeredBy", triggeredBy)
            .addValue("status", ImportExecutionStatus.PENDING.name())
            .addValue("optionsJson", writeJson(options))
            .addValue("createdAt", toTimestamp(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO import_executions (
                    trigger_type, triggered_by, status, options_json, created_at
                )
                VALUES (
                    :triggerType, :triggeredBy, :status, :optionsJson, :createdAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public void markRunning(long executionId, Instant startedAt) {
        jdbc.update(
            """
                UPDATE import_executions
                SET status = 'RUNNING',
                    started_at = COALESCE(started_at, :startedAt),
                    last_heartbeat_at = :startedAt
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", executionId)
                .addValue("startedAt", toTimestamp(startedAt))
        );
    }

    public void updateHeartbeat(long executionId, Instant at) {
        jdbc.update(
            "UPDATE import_executions SET last_heartbeat_at = :at WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", executionId)
                .addValue("at", toTimestamp(at))
        );
    }

    public void updateRetryCount(long executionId, int retryCount) {
        jdbc.update(
            "UPDATE import_executions SET retry_count = :retryCount WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", executionId)
                .addValue("retryCount", retryCount)
        );
    }

    public void updateIssues(long executionId, List<ImportIssue> errors, List<ImportIssue> warnings) {
        jdbc.update(
            """
                UPDATE import_executions
                SET errors_json = :errorsJson,
                    warnings_json = :warningsJson
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", executionId)
                .addValue("errorsJson", writeJson(errors))
                .addValue("warningsJson", writeJson(warnings))
        );
    }

    // Rows already in a terminal status are left untouched.
    public boolean complete(
        long executionId,
        ImportExecutionStatus status,
        Instant finishedAt,
        ImportStatistics statistics,
        List<ImportIssue> errors,
        List<ImportIssue> warnings,
        Object result
    ) {
        int updated = jdbc.update(
            """
                UPDATE import_executions
                SET status = :status,
                    finished_at = :finishedAt,
                    statistics_json = :statisticsJson,
                    errors_json = :errorsJson,
                    warnings_json = :warningsJson,
                    result_json = COALESCE(:resultJson, result_json)
                WHERE id = :id
                  AND status IN ('PENDING', 'RUNNING')
                """,
            new MapSqlParameterSource()
                .addValue("id", executionId)
                .addValue("status", status.name())
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("statisticsJson", writeJson(statistics))
                .addValue("errorsJson", writeJson(errors))
                .addValue("warningsJson", writeJson(warnings))
                .addValue("resultJson", result == null ? null : writeJson(result))
        );
        return updated == 1;
    }

    public boolean requestCancel(long executionId) {
        int updated = jdbc.update(
            """
                UPDATE import_executions
                SET cancel_requested = TRUE
                WHERE id = :id
                  AND status IN ('PENDING', 'RUNNING')
                """,
            new MapSqlParameterSource("id", executionId)
        );
        return updated > 0;
    }

    public boolean isCancelRequested(long executionId) {
        List<Boolean> rows = jdbc.query(
            "SELECT cancel_requested FROM import_executions WHERE id = :id",
            new MapSqlParameterSource("id", executionId),
            (rs, rowNum) -> rs.getBoolean("cancel_requested")
        );
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0));
    }

    public ImportExecution findById(long executionId) {
        List<ImportExecution> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource("id", executionId),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public String findResultJson(long executionId) {
        List<String> rows = jdbc.query(
            "SELECT result_json FROM import_executions WHERE id = :id",
            new MapSqlParameterSource("id", executionId),
            (rs, rowNum) -> rs.getString("result_json")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ImportExecution> findRecent(int limit) {
        return jdbc.query(
            SELECT_COLUMNS + " ORDER BY id DESC LIMIT :limit",
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            rowMapper
        );
    }

    public List<ImportExecution> findUnfinished() {
        return jdbc.query(
            SELECT_COLUMNS + " WHERE status IN ('PENDING', 'RUNNING') ORDER BY id",
            rowMapper
        );
    }

    public long countAll() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM import_executions",
            new MapSqlParameterSource(),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.warn("Failed to serialize {} for import execution record", value.getClass().getSimpleName(), e);
            return null;
        }
    }

    private <T> T readJson(String json, Class<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.warn("Failed to parse stored {} JSON", type.getSimpleName(), e);
            return fallback;
        }
    }

    private List<ImportIssue> readIssues(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, ISSUE_LIST);
        } catch (Exception e) {
            log.warn("Failed to parse stored import issues JSON", e);
            return List.of();
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
