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
import java.util.Optional;
import java.util.UUID;

/**
 * Flags executions slower than mean + 2 sigma of the template's execution time.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class PerformanceDegradationRule implements AnomalyRule {

    private final AnomalyDetectionProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.PERFORMANCE_DEGRADATION;
    }

    @Override
    public Optional<Anomaly> evaluate(WorkflowExecution execution, BaselineSnapshot baseline, Instant detectedAt) {
        MovingStatistic.Snapshot executionTime = baseline.getExecutionTime();
        if (!executionTime.hasSpread()) {
            return Optional.empty();
        }

        AnomalyDetectionProperties.Detection detection = properties.getDetection();
        double duration = execution.getDurationMs();
        double threshold = executionTime.getMean() + detection.getPerformanceDegradationSigma() * executionTime.getStdDev();
        if (duration <= threshold) {
            return Optional.empty();
        }

        double zScore = (duration - executionTime.getMean()) / executionTime.getStdDev();
        AnomalySeverity severity = zScore > detection.getCriticalZScore()
                ? AnomalySeverity.CRITICAL
                : AnomalySeverity.WARNING;

        return Optional.of(Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId(execution.getTemplateId())
                .type(type())
                .severity(severity)
                .description(String.format("Workflow execution time (%s) is significantly above baseline (%s ± %s)",
                        TimeUtils.formatSeconds(duration),
                        TimeUtils.formatSeconds(executionTime.getMean()),
                        TimeUtils.formatSeconds(executionTime.getStdDev())))
                .metrics(AnomalyMetrics.of(duration, executionTime.getMean(), zScore))
                .affectedEntity(execution.getExecutionId())
                .affectedEntity(execution.getTemplateId())
                .investigationStep("Review workflow step completion times")
                .investigationStep("Check for external API delays")
                .investigationStep("Investigate system resource usage")
                .detectedAt(detectedAt)
                .build());
    }
}
