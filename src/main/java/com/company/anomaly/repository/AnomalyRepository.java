package com.company.anomaly.repository;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.AnomalyQuery;
import com.company.anomaly.domain.DailyAnomalyCount;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Insert-only anomaly store: rows are never updated or deleted.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class AnomalyRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> METRICS_MAP = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
            SELECT id, template_id, anomaly_type, severity, description, metrics,
                   affected_entities, investigation_steps, detected_at
            FROM anomalies
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Anomaly save(Anomaly anomaly) {
        String sql = """
            INSERT INTO anomalies (
                id, template_id, anomaly_type, severity, description, metrics,
                affected_entities, investigation_steps, detected_at, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                anomaly.getId().toString(),
                anomaly.getTemplateId(),
                anomaly.getType().getCode(),
                anomaly.getSeverity().getCode(),
                anomaly.getDescription(),
                writeJson(metricsToMap(anomaly.getMetrics())),
                writeJson(anomaly.getAffectedEntities()),
                writeJson(anomaly.getInvestigationSteps()),
                toOffset(anomaly.getDetectedAt()),
                toOffset(clock.instant())
        );

        log.debug("Stored anomaly {} ({}, {}) for template {}",
                anomaly.getId(), anomaly.getType().getCode(), anomaly.getSeverity().getCode(), anomaly.getTemplateId());
        return anomaly;
    }

    public Optional<Anomaly> findById(UUID id) {
        String sql = SELECT_COLUMNS + "WHERE id = ?";
        List<Anomaly> results = jdbcTemplate.query(sql, new AnomalyRowMapper(), id.toString());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Paged lookup, newest first.
     */
    public List<Anomaly> find(AnomalyQuery query) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(whereClause(query, args));
        sql.append(" ORDER BY detected_at DESC, id LIMIT ? OFFSET ?");
        args.add(query.getSize());
        args.add(query.getOffset());

        return jdbcTemplate.query(sql.toString(), new AnomalyRowMapper(), args.toArray());
    }

    public long count(AnomalyQuery query) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM anomalies " + whereClause(query, args);
        Long count = jdbcTemplate.queryForObject(sql, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    public List<Anomaly> findByDateRange(Instant start, Instant end) {
        String sql = SELECT_COLUMNS + """
            WHERE detected_at >= ? AND detected_at <= ?
            ORDER BY detected_at DESC
            """;
        return jdbcTemplate.query(sql, new AnomalyRowMapper(), toOffset(start), toOffset(end));
    }

    public List<Anomaly> findByType(AnomalyType type, Instant start, Instant end) {
        String sql = SELECT_COLUMNS + """
            WHERE anomaly_type = ? AND detected_at >= ? AND detected_at <= ?
            ORDER BY detected_at DESC
            """;
        return jdbcTemplate.query(sql, new AnomalyRowMapper(), type.getCode(), toOffset(start), toOffset(end));
    }

    public List<Anomaly> findBySeverity(AnomalySeverity severity, Instant start, Instant end) {
        String sql = SELECT_COLUMNS + """
            WHERE severity = ? AND detected_at >= ? AND detected_at <= ?
            ORDER BY detected_at DESC
            """;
        return jdbcTemplate.query(sql, new AnomalyRowMapper(), severity.getCode(), toOffset(start), toOffset(end));
    }

    /**
     * Anomaly counts per UTC calendar day, oldest day first.
     */
    public List<DailyAnomalyCount> countByDate(Instant start, Instant end) {
        String sql = """
            SELECT CAST(detected_at AT TIME ZONE 'UTC' AS DATE) AS detection_date, COUNT(*) AS anomaly_count
            FROM anomalies
            WHERE detected_at >= ? AND detected_at <= ?
            GROUP BY CAST(detected_at AT TIME ZONE 'UTC' AS DATE)
            ORDER BY detection_date ASC
            """;

        return jdbcTemplate.query(sql,
                (rs, rowNum) -> new DailyAnomalyCount(
                        rs.getObject("detection_date", LocalDate.class),
                        rs.getLong("anomaly_count")),
                toOffset(start), toOffset(end));
    }

    /**
     * Count per severity; severities without anomalies are reported as zero.
     */
    public Map<AnomalySeverity, Long> severityDistribution(Instant start, Instant end) {
        String sql = """
            SELECT severity, COUNT(*) AS anomaly_count
            FROM anomalies
            WHERE detected_at >= ? AND detected_at <= ?
            GROUP BY severity
            """;

        Map<AnomalySeverity, Long> distribution = new EnumMap<>(AnomalySeverity.class);
        for (AnomalySeverity severity : AnomalySeverity.values()) {
            distribution.put(severity, 0L);
        }
        jdbcTemplate.query(sql, (RowCallbackHandler) rs ->
                distribution.put(AnomalySeverity.fromCode(rs.getString("severity")), rs.getLong("anomaly_count")),
                toOffset(start), toOffset(end));
        return distribution;
    }

    private String whereClause(AnomalyQuery query, List<Object> args) {
        if (query.getStart() == null || query.getEnd() == null) {
            throw new InvalidDataAccessApiUsageException("Anomaly queries require a date range");
        }
        StringBuilder where = new StringBuilder("WHERE detected_at >= ? AND detected_at <= ?");
        args.add(toOffset(query.getStart()));
        args.add(toOffset(query.getEnd()));

        if (query.getType() != null) {
            where.append(" AND anomaly_type = ?");
            args.add(query.getType().getCode());
        }
        if (query.getSeverity() != null) {
            where.append(" AND severity = ?");
            args.add(query.getSeverity().getCode());
        }
        if (query.getTemplateId() != null) {
            where.append(" AND template_id = ?");
            args.add(query.getTemplateId());
        }
        return where.toString();
    }

    private Map<String, Double> metricsToMap(AnomalyMetrics metrics) {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("current_value", metrics.getCurrentValue());
        map.put("baseline_value", metrics.getBaselineValue());
        map.put("deviation", metrics.getDeviation());
        map.put("z_score", metrics.getZScore());
        map.put("confidence", metrics.getConfidence());
        return map;
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Cannot serialize anomaly column", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Corrupt JSON column in anomalies table", e);
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private class AnomalyRowMapper implements RowMapper<Anomaly> {
        @Override
        public Anomaly mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Double> metrics = readJson(rs.getString("metrics"), METRICS_MAP);
            return Anomaly.builder()
                    .id(UUID.fromString(rs.getString("id")))
                    .templateId(rs.getString("template_id"))
                    .type(AnomalyType.fromCode(rs.getString("anomaly_type")))
                    .severity(AnomalySeverity.fromCode(rs.getString("severity")))
                    .description(rs.getString("description"))
                    .metrics(AnomalyMetrics.builder()
                            .currentValue(metrics.getOrDefault("current_value", 0.0))
                            .baselineValue(metrics.getOrDefault("baseline_value", 0.0))
                            .deviation(metrics.getOrDefault("deviation", 0.0))
                            .zScore(metrics.getOrDefault("z_score", 0.0))
                            .confidence(metrics.getOrDefault("confidence", 0.0))
                            .build())
                    .affectedEntities(readJson(rs.getString("affected_entities"), STRING_LIST))
                    .investigationSteps(readJson(rs.getString("investigation_steps"), STRING_LIST))
                    .detectedAt(rs.getObject("detected_at", OffsetDateTime.class).toInstant())
                    .build();
        }
    }
}
