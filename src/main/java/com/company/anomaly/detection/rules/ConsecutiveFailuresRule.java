package com.company.anomaly.detection.rules;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.MovingStatistic;
import com.company.anomaly.domain.OutcomeWindow;
import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Component
@Order(20)
@RequiredArgsConstructor
public class ConsecutiveFailuresRule implements BatchAnomalyRule {

    private static final double ALL_FAILED = 100.0;

    private final AnomalyDetectionProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.CONSECUTIVE_FAILURES;
    }

    @Override
    public Optional<Anomaly> evaluate(OutcomeWindow window, Instant detectedAt) {
        AnomalyDetectionProperties.Batch batch = properties.getBatch();
        int streak = window.leadingFailureStreak();
        if (streak < batch.getConsecutiveFailureThreshold()) {
            return Optional.empty();
        }

        int windowSize = properties.getBaseline().getWindowSize();
        List<WorkflowExecution> failures = window.newest(streak);
        MovingStatistic reference = OutcomeWindow.failureRateStatistic(window.after(streak, windowSize), windowSize);
        double zScore = reference.zScore(ALL_FAILED).orElse(0.0);

        AnomalyDetectionProperties.Detection detection = properties.getDetection();
        AnomalySeverity severity = AnomalySeverity.max(AnomalySeverity.WARNING,
                AnomalySeverity.fromZScore(zScore, detection.getWarningZScore(), detection.getCriticalZScore()));
        if (streak >= batch.getConsecutiveFailureCriticalThreshold()) {
            severity = AnomalySeverity.CRITICAL;
        }

        WorkflowExecution latest = failures.get(0);
        Anomaly.AnomalyBuilder builder = Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId(window.getTemplateId())
                .type(type())
                .severity(severity)
                .description(String.format(Locale.ROOT,
                        "%d consecutive failed executions (latest: %s, baseline failure rate %.1f%%)",
                        streak, latest.getOutcome(), reference.getMean()))
                .metrics(AnomalyMetrics.of(ALL_FAILED, reference.getMean(), zScore))
                .investigationStep("Inspect the most recent failure for a common root cause")
                .investigationStep("Check workflow configuration and credentials")
                .investigationStep("Consider pausing scheduled runs until resolved")
                .detectedAt(detectedAt);

        failures.forEach(execution -> builder.affectedEntity(execution.getExecutionId()));
        builder.affectedEntity(window.getTemplateId());

        return Optional.of(builder.build());
    }
}
