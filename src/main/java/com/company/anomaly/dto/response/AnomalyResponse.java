package com.company.anomaly.dto.response;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyResponse {
    private String id;
    private String templateId;
    private String type;
    private String severity;
    private String description;
    private AnomalyMetricsResponse metrics;
    private List<String> affectedEntities;
    private List<String> investigationSteps;
    private Instant detectedAt;

    public static AnomalyResponse from(Anomaly anomaly) {
        AnomalyMetrics metrics = anomaly.getMetrics();
        return AnomalyResponse.builder()
                .id(anomaly.getId().toString())
                .templateId(anomaly.getTemplateId())
                .type(anomaly.getType().getCode())
                .severity(anomaly.getSeverity().getCode())
                .description(anomaly.getDescription())
                .metrics(AnomalyMetricsResponse.builder()
                        .currentValue(metrics.getCurrentValue())
                        .baselineValue(metrics.getBaselineValue())
                        .deviation(metrics.getDeviation())
                        .zScore(metrics.getZScore())
                        .confidence(metrics.getConfidence())
                        .build())
                .affectedEntities(new ArrayList<>(anomaly.getAffectedEntities()))
                .investigationSteps(new ArrayList<>(anomaly.getInvestigationSteps()))
                .detectedAt(anomaly.getDetectedAt())
                .build();
    }
}
