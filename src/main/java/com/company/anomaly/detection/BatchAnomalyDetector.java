package com.company.anomaly.detection;

import com.company.anomaly.detection.rules.BatchAnomalyRule;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.OutcomeWindow;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class BatchAnomalyDetector {

    private final List<BatchAnomalyRule> rules;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public List<Anomaly> check(OutcomeWindow window) {
        if (window.size() == 0) {
            return List.of();
        }

        Instant detectedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<Anomaly> anomalies = new ArrayList<>();
        for (BatchAnomalyRule rule : rules) {
            try {
                rule.evaluate(window, detectedAt).ifPresent(anomalies::add);
            } catch (RuntimeException e) {
                log.error("Batch rule {} failed for template {}", rule.type().getCode(), window.getTemplateId(), e);
                meterRegistry.counter("anomaly.rule.errors", "type", rule.type().getCode()).increment();
            }
        }
        return List.copyOf(anomalies);
    }
}
