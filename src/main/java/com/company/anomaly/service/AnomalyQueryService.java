package com.company.anomaly.service;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyQuery;
import com.company.anomaly.domain.DailyAnomalyCount;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.company.anomaly.dto.response.AnomalyPageResponse;
import com.company.anomaly.dto.response.AnomalyResponse;
import com.company.anomaly.dto.response.AnomalyTrendsResponse;
import com.company.anomaly.dto.response.DailyCountResponse;
import com.company.anomaly.exception.AnomalyNotFoundException;
import com.company.anomaly.exception.InvalidAnomalyQueryException;
import com.company.anomaly.repository.AnomalyRepository;
import com.company.anomaly.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyQueryService {

    static final int DEFAULT_TREND_DAYS = 30;
    static final int MAX_PAGE_SIZE = 500;

    private final AnomalyRepository anomalyRepository;
    private final Clock clock;

    public AnomalyPageResponse listAnomalies(String start, String end, String type, String severity,
                                             String templateId, int page, int size) {
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            throw new InvalidAnomalyQueryException("Both start and end are required");
        }
        if (page < 0) {
            throw new InvalidAnomalyQueryException("page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new InvalidAnomalyQueryException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if ((long) page * size > Integer.MAX_VALUE) {
            throw new InvalidAnomalyQueryException("page " + page + " is out of range for size " + size);
        }

        Instant from = parseTime("start", start, false);
        Instant to = parseTime("end", end, true);
        validateRange(from, to);

        AnomalyQuery query = AnomalyQuery.builder()
                .start(from)
                .end(to)
                .type(type != null && !type.isBlank() ? parseType(type) : null)
                .severity(severity != null && !severity.isBlank() ? parseSeverity(severity) : null)
                .templateId(templateId != null && !templateId.isBlank() ? templateId : null)
                .page(page)
                .size(size)
                .build();

        List<Anomaly> anomalies = anomalyRepository.find(query);
        long total = anomalyRepository.count(query);

        return AnomalyPageResponse.builder()
                .anomalies(anomalies.stream().map(AnomalyResponse::from).toList())
                .page(page)
                .size(size)
                .totalElements(total)
                .totalPages((int) ((total + size - 1) / size))
                .build();
    }

    /**
     * Anomalies never change once stored, so the detail view is cached for a long time.
     */
    @Cacheable(value = "anomalyDetail", key = "#id")
    public AnomalyResponse getAnomaly(String id) {
        UUID anomalyId;
        try {
            anomalyId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new InvalidAnomalyQueryException("Invalid anomaly id: " + id, e);
        }
        return anomalyRepository.findById(anomalyId)
                .map(AnomalyResponse::from)
                .orElseThrow(() -> new AnomalyNotFoundException(id));
    }

    /**
     * Daily counts and severity split. Without bounds the last 30 days are used.
     */
    @Cacheable(value = "anomalyTrends", key = "(#start ?: 'default') + ':' + (#end ?: 'now')")
    public AnomalyTrendsResponse getTrends(String start, String end) {
        Instant to = end != null && !end.isBlank() ? parseTime("end", end, true) : clock.instant();
        Instant from = start != null && !start.isBlank()
                ? parseTime("start", start, false)
                : to.minus(Duration.ofDays(DEFAULT_TREND_DAYS));
        validateRange(from, to);

        List<DailyAnomalyCount> daily = anomalyRepository.countByDate(from, to);
        Map<AnomalySeverity, Long> distribution = anomalyRepository.severityDistribution(from, to);

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        distribution.forEach((severity, count) -> bySeverity.put(severity.getCode(), count));

        return AnomalyTrendsResponse.builder()
                .start(from)
                .end(to)
                .dailyCounts(daily.stream()
                        .map(d -> new DailyCountResponse(d.getDate(), d.getCount()))
                        .collect(Collectors.toList()))
                .severityDistribution(bySeverity)
                .total(daily.stream().mapToLong(DailyAnomalyCount::getCount).sum())
                .build();
    }

    private Instant parseTime(String name, String value, boolean endOfDay) {
        try {
            return TimeUtils.parseInstantOrDate(value.trim(), endOfDay);
        } catch (DateTimeParseException e) {
            throw new InvalidAnomalyQueryException(
                    "Invalid " + name + " '" + value + "': expected ISO-8601 instant or date", e);
        }
    }

    private void validateRange(Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new InvalidAnomalyQueryException("start must not be after end");
        }
    }

    private AnomalyType parseType(String type) {
        try {
            return AnomalyType.fromCode(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidAnomalyQueryException(e.getMessage(), e);
        }
    }

    private AnomalySeverity parseSeverity(String severity) {
        try {
            return AnomalySeverity.fromCode(severity);
        } catch (IllegalArgumentException e) {
            throw new InvalidAnomalyQueryException(e.getMessage(), e);
        }
    }
}
