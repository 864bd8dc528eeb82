package com.hubzone.designations.importer.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.ImportCompletionNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.util.List;

@Component
public class OutboxNotificationGateway implements NotificationGateway {
    private static final Logger log = LoggerFactory.getLogger(OutboxNotificationGateway.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public OutboxNotificationGateway(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public void handOff(long executionId, List<AffectedBusinessChange> changes) {
        if (changes == null || changes.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = changes.stream()
            .map(change -> new MapSqlParameterSource()
                .addValue("executionId", executionId)
                .addValue("businessId", change.businessId())
                .addValue("changeType", change.changeType().code())
                .addValue("geoid", change.geoid())
                .addValue("graceEnd", change.gracePeriodEndDate() == null ? null : Date.valueOf(change.gracePeriodEndDate())))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO hubzone_change_notifications (
                    import_execution_id, business_id, change_type, geoid, grace_period_end_date, status
                )
                VALUES (
                    :executionId, :businessId, :changeType, :geoid, :graceEnd, 'PENDING'
                )
                """,
            batch
        );
        log.info("Queued {} HUBZone change notifications for import {}", changes.size(), executionId);
    }

    @Override
    public void notifyCompletion(ImportCompletionNotice notice) {
        String content;
        try {
            content = objectMapper.writeValueAsString(notice);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize completion notice for import " + notice.executionId(), e);
        }
        jdbc.update(
            """
                INSERT INTO import_completion_notices (
                    import_execution_id, status, recipients, duration_ms, content_json
                )
                VALUES (
                    :executionId, :status, :recipients, :durationMs, :content
                )
                """,
            new MapSqlParameterSource()
                .addValue("executionId", notice.executionId())
                .addValue("status", notice.status().name())
                .addValue("recipients", String.join(",", notice.recipients()))
                .addValue("durationMs", notice.durationMs())
                .addValue("content", content)
        );
        log.info("Queued completion notice for import {} ({}) to {}", notice.executionId(), notice.status(), notice.recipients());
    }
}
