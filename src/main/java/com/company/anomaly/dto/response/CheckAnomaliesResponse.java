package com.company.anomaly.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckAnomaliesResponse {
    private String executionId;
    private List<AnomalyResponse> anomalies;
    private int total;
    private String pipelineState;
    private String skipReason;
}
