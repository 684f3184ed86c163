package com.company.anomaly.domain.enums;

import java.util.Locale;

public enum AnomalyType {
    SPIKE_IN_FAILURES("spike_in_failures", "Spike in Failures"),
    PERFORMANCE_DEGRADATION("performance_degradation", "Performance Degradation"),
    UNUSUAL_EXECUTION_TIME("unusual_execution_time", "Unusual Execution Time"),
    PATTERN_DEVIATION("pattern_deviation", "Pattern Deviation"),
    RESOURCE_EXHAUSTION("resource_exhaustion", "Resource Exhaustion"),
    CONSECUTIVE_FAILURES("consecutive_failures", "Consecutive Failures");

    private final String code;
    private final String displayName;

    AnomalyType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a stored or user-supplied code. Enum names are accepted as well
     * so {@code PERFORMANCE_DEGRADATION} and {@code performance_degradation} both work.
     */
    public static AnomalyType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Anomaly type must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AnomalyType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + code);
    }
}
