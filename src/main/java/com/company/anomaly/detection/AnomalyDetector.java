package com.company.anomaly.detection;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.detection.rules.AnomalyRule;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.WorkflowExecution;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered per-execution rule against a baseline snapshot. Has no side effects
 * besides metrics: the same execution and baseline always yield the same anomalies
 * (apart from their ids and detection time).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetector {

    private final List<AnomalyRule> rules;
    private final AnomalyDetectionProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public List<Anomaly> check(WorkflowExecution execution, BaselineSnapshot baseline) {
        int minSamples = properties.getDetection().getMinSamples();
        if (baseline.getSampleCount() < minSamples) {
            log.debug("Template {} has {} samples (< {}), skipping detection for {}",
                    execution.getTemplateId(), baseline.getSampleCount(), minSamples, execution.getExecutionId());
            return List.of();
        }
        if (execution.getDurationMs() == null) {
            log.warn("Execution {} has no duration, skipping detection", execution.getExecutionId());
            return List.of();
        }

        Instant detectedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<Anomaly> anomalies = new ArrayList<>();
        for (AnomalyRule rule : rules) {
            try {
                rule.evaluate(execution, baseline, detectedAt).ifPresent(anomalies::add);
            } catch (RuntimeException e) {
                log.error("Rule {} failed for execution {}", rule.type().getCode(), execution.getExecutionId(), e);
                meterRegistry.counter("anomaly.rule.errors", "type", rule.type().getCode()).increment();
            }
        }

        if (!anomalies.isEmpty()) {
            log.info("Detected {} anomalies for execution {} of template {}",
                    anomalies.size(), execution.getExecutionId(), execution.getTemplateId());
        }
        return List.copyOf(anomalies);
    }
}
