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
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares the failure rate of the newest executions with the older reference window.
 * The z-score uses the standard error of the recent window's mean.
 */
@Component
@Order(10)
@Slf4j
@RequiredArgsConstructor
public class SpikeInFailuresRule implements BatchAnomalyRule {

    private final AnomalyDetectionProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.SPIKE_IN_FAILURES;
    }

    @Override
    public Optional<Anomaly> evaluate(OutcomeWindow window, Instant detectedAt) {
        AnomalyDetectionProperties.Batch batch = properties.getBatch();
        int recentSize = batch.getSpikeWindow();
        int windowSize = properties.getBaseline().getWindowSize();

        List<WorkflowExecution> recent = window.newest(recentSize);
        List<WorkflowExecution> reference = window.after(recentSize, windowSize);
        if (recent.size() < recentSize || reference.size() < properties.getDetection().getMinSamples()) {
            return Optional.empty();
        }

        MovingStatistic referenceRate = OutcomeWindow.failureRateStatistic(reference, windowSize);
        if (!referenceRate.snapshot().hasSpread()) {
            log.debug("Reference failure rate for template {} has no spread, spike z-score undefined",
                    window.getTemplateId());
            return Optional.empty();
        }

        double recentRate = OutcomeWindow.failureRate(recent);
        double standardError = referenceRate.getStdDev() / Math.sqrt(recent.size());
        double zScore = (recentRate - referenceRate.getMean()) / standardError;
        if (zScore <= batch.getSpikeZScore() || recentRate <= referenceRate.getMean()) {
            return Optional.empty();
        }

        AnomalyDetectionProperties.Detection detection = properties.getDetection();
        Anomaly.AnomalyBuilder builder = Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId(window.getTemplateId())
                .type(type())
                .severity(AnomalySeverity.fromZScore(zScore, detection.getWarningZScore(), detection.getCriticalZScore()))
                .description(String.format(Locale.ROOT,
                        "Failure rate spiked to %.1f%% over the last %d executions (baseline %.1f%% ± %.1f%%)",
                        recentRate, recent.size(), referenceRate.getMean(), referenceRate.getStdDev()))
                .metrics(AnomalyMetrics.of(recentRate, referenceRate.getMean(), zScore))
                .investigationStep("Review error logs of the failed executions")
                .investigationStep("Check recent changes to the workflow template")
                .investigationStep("Verify availability of external dependencies")
                .detectedAt(detectedAt);

        recent.stream()
                .filter(WorkflowExecution::isFailure)
                .forEach(execution -> builder.affectedEntity(execution.getExecutionId()));
        builder.affectedEntity(window.getTemplateId());

        return Optional.of(builder.build());
    }
}
