package com.company.anomaly.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyMetricsTest {

    @Test
    void confidence_growsWithZScoreAndSaturatesAtOne() {
        assertThat(AnomalyMetrics.confidenceFor(0.0)).isZero();
        assertThat(AnomalyMetrics.confidenceFor(1.5)).isCloseTo(0.5, within(1e-9));
        assertThat(AnomalyMetrics.confidenceFor(-2.4)).isCloseTo(0.8, within(1e-9));
        assertThat(AnomalyMetrics.confidenceFor(3.0)).isEqualTo(1.0);
        assertThat(AnomalyMetrics.confidenceFor(12.0)).isEqualTo(1.0);

        double previous = 0.0;
        for (double z = 0.0; z <= 6.0; z += 0.25) {
            double confidence = AnomalyMetrics.confidenceFor(z);
            assertThat(confidence).isBetween(0.0, 1.0).isGreaterThanOrEqualTo(previous);
            previous = confidence;
        }
    }

    @Test
    void of_derivesDeviationAndConfidence() {
        AnomalyMetrics metrics = AnomalyMetrics.of(135.0, 100.0, 3.5);

        assertThat(metrics.getDeviation()).isEqualTo(35.0);
        assertThat(metrics.getZScore()).isEqualTo(3.5);
        assertThat(metrics.getConfidence()).isEqualTo(1.0);
    }
}
