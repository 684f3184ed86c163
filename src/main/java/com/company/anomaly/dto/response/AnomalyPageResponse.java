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
public class AnomalyPageResponse {
    private List<AnomalyResponse> anomalies;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;
}
