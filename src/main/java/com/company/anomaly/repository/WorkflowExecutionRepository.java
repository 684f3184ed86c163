package com.company.anomaly.repository;

import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.ExecutionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to execution history. The table belongs to the execution subsystem.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class WorkflowExecutionRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Most recent completed executions of a template, newest first.
     */
    public List<WorkflowExecution> findRecentByTemplate(String templateId, int limit) {
        String sql = """
            SELECT execution_id, template_id, duration_ms, outcome, completed_at
            FROM workflow_executions
            WHERE template_id = ?
            AND completed_at IS NOT NULL
            ORDER BY completed_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new WorkflowExecutionRowMapper(), templateId, limit);
    }

    public Optional<WorkflowExecution> findById(String executionId) {
        String sql = """
            SELECT execution_id, template_id, duration_ms, outcome, completed_at
            FROM workflow_executions
            WHERE execution_id = ?
            """;

        List<WorkflowExecution> results = jdbcTemplate.query(sql, new WorkflowExecutionRowMapper(), executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Templates that had at least one completion since the given instant.
     */
    public List<String> findTemplateIdsCompletedSince(Instant since) {
        String sql = """
            SELECT DISTINCT template_id
            FROM workflow_executions
            WHERE completed_at >= ?
            ORDER BY template_id
            """;

        return jdbcTemplate.queryForList(sql, String.class, OffsetDateTime.ofInstant(since, ZoneOffset.UTC));
    }

    private static class WorkflowExecutionRowMapper implements RowMapper<WorkflowExecution> {
        @Override
        public WorkflowExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            OffsetDateTime completedAt = rs.getObject("completed_at", OffsetDateTime.class);
            return WorkflowExecution.builder()
                    .executionId(rs.getString("execution_id"))
                    .templateId(rs.getString("template_id"))
                    .durationMs(rs.getObject("duration_ms", Long.class))
                    .outcome(ExecutionOutcome.fromString(rs.getString("outcome")))
                    .completedAt(completedAt != null ? completedAt.toInstant() : null)
                    .build();
        }
    }
}
