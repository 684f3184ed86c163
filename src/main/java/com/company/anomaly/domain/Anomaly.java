package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A detected deviation from a template's baseline. Records are written once and never changed.
 */
@Value
@Builder
public class Anomaly {
    UUID id;
    String templateId;
    AnomalyType type;
    AnomalySeverity severity;
    String description;
    AnomalyMetrics metrics;

    /** Execution ids first, then the template id. */
    @Singular("affectedEntity")
    List<String> affectedEntities;

    @Singular("investigationStep")
    List<String> investigationSteps;

    Instant detectedAt;
}
