package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of a template baseline handed to the detection rules.
 */
@Value
@Builder
public class BaselineSnapshot {
    String templateId;
    MovingStatistic.Snapshot failureRate;
    MovingStatistic.Snapshot executionTime;
    MovingStatistic.Snapshot successRate;

    /** True when history could not be fetched; the baseline is empty and must not be trusted. */
    boolean historyUnavailable;

    public int getSampleCount() {
        return executionTime.getSampleCount();
    }

    public static BaselineSnapshot unavailable(String templateId) {
        MovingStatistic.Snapshot empty = new MovingStatistic.Snapshot(0.0, 0.0, 0);
        return BaselineSnapshot.builder()
                .templateId(templateId)
                .failureRate(empty)
                .executionTime(empty)
                .successRate(empty)
                .historyUnavailable(true)
                .build();
    }
}
