package com.company.anomaly.detection.rules;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.OutcomeWindow;
import com.company.anomaly.domain.enums.AnomalyType;

import java.time.Instant;
import java.util.Optional;

/**
 * A check over a template's recent outcomes rather than a single execution.
 */
public interface BatchAnomalyRule {

    AnomalyType type();

    Optional<Anomaly> evaluate(OutcomeWindow window, Instant detectedAt);
}
