package com.company.anomaly.domain.enums;

import java.util.Locale;

public enum AnomalySeverity {
    INFO(1, "info", "Informational - no action required"),
    WARNING(2, "warning", "Warning - requires attention"),
    CRITICAL(3, "critical", "Critical - immediate action required");

    public static final double DEFAULT_WARNING_Z_SCORE = 2.0;
    public static final double DEFAULT_CRITICAL_Z_SCORE = 3.0;

    private final int level;
    private final String code;
    private final String description;

    AnomalySeverity(int level, String code, String description) {
        this.level = level;
        this.code = code;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(AnomalySeverity other) {
        return this.level > other.level;
    }

    public boolean isAtLeast(AnomalySeverity other) {
        return this.level >= other.level;
    }

    public static AnomalySeverity max(AnomalySeverity a, AnomalySeverity b) {
        return a.isHigherThan(b) ? a : b;
    }

    public static AnomalySeverity fromZScore(double zScore) {
        return fromZScore(zScore, DEFAULT_WARNING_Z_SCORE, DEFAULT_CRITICAL_Z_SCORE);
    }

    /**
     * Maps the magnitude of a z-score onto a severity. The sign is ignored.
     */
    public static AnomalySeverity fromZScore(double zScore, double warningThreshold, double criticalThreshold) {
        double magnitude = Math.abs(zScore);
        if (magnitude >= criticalThreshold) {
            return CRITICAL;
        }
        if (magnitude >= warningThreshold) {
            return WARNING;
        }
        return INFO;
    }

    public static AnomalySeverity fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AnomalySeverity severity : values()) {
            if (severity.code.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + code);
    }
}
