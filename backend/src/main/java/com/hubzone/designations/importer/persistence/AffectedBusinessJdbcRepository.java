package com.hubzone.designations.importer.persistence;

import com.hubzone.designations.importer.model.AffectedBusinessChange;
import com.hubzone.designations.importer.model.BusinessChangeType;
import com.hubzone.designations.importer.model.HubzoneMembership;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.util.List;

@Repository
public class AffectedBusinessJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public AffectedBusinessJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insertAll(long executionId, List<AffectedBusinessChange> changes) {
        if (changes == null || changes.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = changes.stream()
            .map(change -> new MapSqlParameterSource()
                .addValue("executionId", executionId)
                .addValue("businessId", change.businessId())
                .addValue("previousStatus", change.previousStatus().name())
                .addValue("newStatus", change.newStatus().name())
                .addValue("changeType", change.changeType().name())
                .addValue("geoid", change.geoid())
                .addValue("graceEnd", change.gracePeriodEndDate() == null ? null : Date.valueOf(change.gracePeriodEndDate()))
                .addValue("notificationSent", change.notificationSent()))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO affected_business_changes (
                    import_execution_id, business_id, previous_status, new_status,
                    change_type, geoid, grace_period_end_date, notification_sent
                )
                VALUES (
                    :executionId, :businessId, :previousStatus, :newStatus,
                    :changeType, :geoid, :graceEnd, :notificationSent
                )
                """,
            batch
        );
    }

    public int markNotificationSent(long executionId) {
        return jdbc.update(
            """
                UPDATE affected_business_changes
                SET notification_sent = TRUE
                WHERE import_execution_id = :executionId
                """,
            new MapSqlParameterSource("executionId", executionId)
        );
    }

    public List<AffectedBusinessChange> findByExecution(long executionId) {
        return jdbc.query(
            """
                SELECT c.business_id, b.business_name, c.previous_status, c.new_status,
                       c.change_type, c.geoid, c.grace_period_end_date, c.notification_sent
                FROM affected_business_changes c
                LEFT JOIN business_locations b ON b.business_id = c.business_id
                WHERE c.import_execution_id = :executionId
                ORDER BY c.id
                """,
            new MapSqlParameterSource("executionId", executionId),
            (rs, rowNum) -> {
                Date graceEnd = rs.getDate("grace_period_end_date");
                return new AffectedBusinessChange(
                    rs.getString("business_id"),
                    rs.getString("business_name"),
                    HubzoneMembership.valueOf(rs.getString("previous_status")),
                    HubzoneMembership.valueOf(rs.getString("new_status")),
                    BusinessChangeType.valueOf(rs.getString("change_type")),
                    rs.getString("geoid"),
                    graceEnd == null ? null : graceEnd.toLocalDate(),
                    rs.getBoolean("notification_sent")
                );
            }
        );
    }
}
