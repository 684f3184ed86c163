package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnomalyMetrics {

    private static final double FULL_CONFIDENCE_Z_SCORE = 3.0;

    double currentValue;
    double baselineValue;
    double deviation;
    double zScore;
    double confidence;

    public static AnomalyMetrics of(double currentValue, double baselineValue, double zScore) {
        return AnomalyMetrics.builder()
                .currentValue(currentValue)
                .baselineValue(baselineValue)
                .deviation(currentValue - baselineValue)
                .zScore(zScore)
                .confidence(confidenceFor(zScore))
                .build();
    }

    /**
     * min(|z| / 3, 1): grows with the magnitude of the z-score and saturates at 1.
     */
    public static double confidenceFor(double zScore) {
        if (Double.isNaN(zScore)) {
            return 0.0;
        }
        return Math.min(Math.abs(zScore) / FULL_CONFIDENCE_Z_SCORE, 1.0);
    }
}
