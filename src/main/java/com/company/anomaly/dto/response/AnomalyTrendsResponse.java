package com.company.anomaly.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyTrendsResponse {
    private Instant start;
    private Instant end;
    private List<DailyCountResponse> dailyCounts;
    /** Keyed by severity code; every severity is present. */
    private Map<String, Long> severityDistribution;
    private long total;
}
