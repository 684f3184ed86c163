package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.detection.BatchAnomalyDetector;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.OutcomeWindow;
import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.pipeline.AnomalyPublisher;
import com.company.anomaly.repository.WorkflowExecutionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodically looks for failure spikes and failure streaks, which cannot be judged from
 * a single execution.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.batch.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class FailurePatternDetectionJob {

    private final WorkflowExecutionRepository executionRepository;
    private final BatchAnomalyDetector batchAnomalyDetector;
    private final AnomalyPublisher anomalyPublisher;
    private final AnomalyDetectionProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /** Newest completion seen per template at its last evaluation. */
    private final Map<String, Instant> lastEvaluated = new ConcurrentHashMap<>();

    @Scheduled(
            fixedDelayString = "${anomaly.batch.interval-ms:600000}",
            initialDelayString = "${anomaly.batch.initial-delay-ms:60000}"
    )
    public void detectFailurePatterns() {
        Instant since = clock.instant().minus(properties.getBatch().getLookback());
        List<String> templateIds = executionRepository.findTemplateIdsCompletedSince(since);
        log.info("Starting failure pattern detection for {} active templates", templateIds.size());

        int evaluated = 0;
        int anomalies = 0;
        int failures = 0;

        for (String templateId : templateIds) {
            try {
                int found = evaluateTemplate(templateId);
                if (found >= 0) {
                    evaluated++;
                    anomalies += found;
                }
            } catch (Exception e) {
                log.error("Failure pattern detection failed for template {}", templateId, e);
                failures++;
            }
        }

        meterRegistry.counter("anomaly.batch.runs").increment();
        log.info("Failure pattern detection completed: {} evaluated, {} anomalies, {} failed",
                evaluated, anomalies, failures);
    }

    /**
     * @return anomalies stored, or -1 when the template had nothing new since the last run
     */
    int evaluateTemplate(String templateId) {
        AnomalyDetectionProperties.Batch batch = properties.getBatch();
        int limit = batch.getSpikeWindow() + properties.getBaseline().getWindowSize();
        List<WorkflowExecution> recent = executionRepository.findRecentByTemplate(templateId, limit);
        OutcomeWindow window = new OutcomeWindow(templateId, recent);

        Instant newest = window.newestCompletedAt();
        if (newest == null) {
            return -1;
        }
        Instant previous = lastEvaluated.get(templateId);
        if (previous != null && !newest.isAfter(previous)) {
            log.debug("No new executions for template {} since {}", templateId, previous);
            return -1;
        }

        List<Anomaly> detected = batchAnomalyDetector.check(window);
        List<Anomaly> stored = anomalyPublisher.persist(detected);
        anomalyPublisher.dispatch(stored);
        lastEvaluated.put(templateId, newest);

        if (!stored.isEmpty()) {
            log.warn("Template {}: {} failure pattern anomalies recorded", templateId, stored.size());
        }
        return stored.size();
    }
}
