package com.company.anomaly.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyMetricsResponse {
    private double currentValue;
    private double baselineValue;
    private double deviation;
    @JsonProperty("zScore")
    private double zScore;
    private double confidence;
}
