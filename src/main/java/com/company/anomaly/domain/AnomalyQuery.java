package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter for anomaly lookups. The date range is mandatory, the rest narrows it down.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyQuery {
    Instant start;
    Instant end;
    AnomalyType type;
    AnomalySeverity severity;
    String templateId;
    @Builder.Default
    int page = 0;
    @Builder.Default
    int size = 50;

    public long getOffset() {
        return (long) page * size;
    }
}
