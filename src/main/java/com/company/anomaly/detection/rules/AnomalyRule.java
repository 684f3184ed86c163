package com.company.anomaly.detection.rules;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.AnomalyType;

import java.time.Instant;
import java.util.Optional;

/**
 * A stateless check of one execution against its template baseline.
 */
public interface AnomalyRule {

    AnomalyType type();

    Optional<Anomaly> evaluate(WorkflowExecution execution, BaselineSnapshot baseline, Instant detectedAt);
}
