package com.company.anomaly.detection.rules;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.MovingStatistic;
import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.company.anomaly.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Two-sided z-score check on execution time.
 * Fires alongside {@link PerformanceDegradationRule} for slow outliers.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class UnusualExecutionTimeRule implements AnomalyRule {

    private final AnomalyDetectionProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.UNUSUAL_EXECUTION_TIME;
    }

    @Override
    public Optional<Anomaly> evaluate(WorkflowExecution execution, BaselineSnapshot baseline, Instant detectedAt) {
        MovingStatistic.Snapshot executionTime = baseline.getExecutionTime();
        double duration = execution.getDurationMs();

        OptionalDouble z = executionTime.zScore(duration);
        if (z.isEmpty()) {
            return Optional.empty();
        }

        AnomalyDetectionProperties.Detection detection = properties.getDetection();
        double zScore = z.getAsDouble();
        if (Math.abs(zScore) <= detection.getUnusualExecutionZScore()) {
            return Optional.empty();
        }

        AnomalySeverity severity = AnomalySeverity.fromZScore(zScore,
                detection.getWarningZScore(), detection.getCriticalZScore());

        return Optional.of(Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId(execution.getTemplateId())
                .type(type())
                .severity(severity)
                .description(String.format(Locale.ROOT, "Unusual execution time detected: %s (z-score: %.2f)",
                        TimeUtils.formatSeconds(duration), zScore))
                .metrics(AnomalyMetrics.of(duration, executionTime.getMean(), zScore))
                .affectedEntity(execution.getExecutionId())
                .affectedEntity(execution.getTemplateId())
                .investigationStep("Verify execution was completed correctly")
                .investigationStep("Check for data anomalies")
                .investigationStep("Review workflow notes for unusual circumstances")
                .detectedAt(detectedAt)
                .build());
    }
}
