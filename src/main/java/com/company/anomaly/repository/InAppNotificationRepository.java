package com.company.anomaly.repository;

import com.company.anomaly.domain.AppNotification;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class InAppNotificationRepository {

    private final JdbcTemplate jdbcTemplate;

    public AppNotification save(AppNotification notification) {
        String sql = """
            INSERT INTO anomaly_notifications (
                id, anomaly_id, template_id, anomaly_type, severity, title, message, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                notification.getId().toString(),
                notification.getAnomalyId().toString(),
                notification.getTemplateId(),
                notification.getAnomalyType(),
                notification.getSeverity(),
                notification.getTitle(),
                notification.getMessage(),
                OffsetDateTime.ofInstant(notification.getCreatedAt(), ZoneOffset.UTC)
        );
        return notification;
    }

    public List<AppNotification> findRecent(int limit) {
        String sql = """
            SELECT id, anomaly_id, template_id, anomaly_type, severity, title, message, created_at
            FROM anomaly_notifications
            ORDER BY created_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new AppNotificationRowMapper(), limit);
    }

    private static class AppNotificationRowMapper implements RowMapper<AppNotification> {
        @Override
        public AppNotification mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AppNotification.builder()
                    .id(UUID.fromString(rs.getString("id")))
                    .anomalyId(UUID.fromString(rs.getString("anomaly_id")))
                    .templateId(rs.getString("template_id"))
                    .anomalyType(rs.getString("anomaly_type"))
                    .severity(rs.getString("severity"))
                    .title(rs.getString("title"))
                    .message(rs.getString("message"))
                    .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
                    .build();
        }
    }
}
