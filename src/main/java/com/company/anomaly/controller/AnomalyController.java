package com.company.anomaly.controller;

import com.company.anomaly.dto.request.CheckAnomaliesRequest;
import com.company.anomaly.dto.response.AnomalyPageResponse;
import com.company.anomaly.dto.response.AnomalyResponse;
import com.company.anomaly.dto.response.AnomalyTrendsResponse;
import com.company.anomaly.dto.response.CheckAnomaliesResponse;
import com.company.anomaly.service.AnomalyCheckService;
import com.company.anomaly.service.AnomalyQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Detect and query workflow execution anomalies")
@RequiredArgsConstructor
@Slf4j
public class AnomalyController {

    private final AnomalyQueryService queryService;
    private final AnomalyCheckService checkService;
    private final MeterRegistry meterRegistry;

    @PostMapping("/check")
    @Operation(
            summary = "Run anomaly detection for an execution",
            description = "Synchronously evaluates a stored execution against its template baseline"
    )
    public ResponseEntity<CheckAnomaliesResponse> checkAnomalies(@Valid @RequestBody CheckAnomaliesRequest request) {
        meterRegistry.counter("api.anomalies.check.requests").increment();
        return ResponseEntity.ok(checkService.checkExecution(request.getExecutionId()));
    }

    @GetMapping
    @Operation(
            summary = "List anomalies",
            description = "Date-bounded, paginated list, newest first. start and end accept ISO-8601 instants or dates"
    )
    public ResponseEntity<AnomalyPageResponse> listAnomalies(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @Parameter(description = "Anomaly type code, e.g. performance_degradation")
            @RequestParam(required = false) String type,
            @Parameter(description = "info, warning or critical")
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String templateId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        meterRegistry.counter("api.anomalies.list.requests").increment();
        return ResponseEntity.ok(queryService.listAnomalies(start, end, type, severity, templateId, page, size));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get anomaly details")
    public ResponseEntity<AnomalyResponse> getAnomaly(@PathVariable String id) {
        meterRegistry.counter("api.anomalies.detail.requests").increment();

        // stored anomalies are immutable
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS).cachePrivate())
                .body(queryService.getAnomaly(id));
    }

    @GetMapping("/trends")
    @Operation(
            summary = "Anomaly trends",
            description = "Counts per day and severity distribution; defaults to the last 30 days"
    )
    public ResponseEntity<AnomalyTrendsResponse> getTrends(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {

        meterRegistry.counter("api.anomalies.trends.requests").increment();
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.getTrends(start, end));
    }
}
