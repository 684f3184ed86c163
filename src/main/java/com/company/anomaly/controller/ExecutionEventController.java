package com.company.anomaly.controller;

import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.ExecutionOutcome;
import com.company.anomaly.dto.request.ExecutionCompletedRequest;
import com.company.anomaly.event.ExecutionCompletedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/executions")
@Tag(name = "Execution Events", description = "Completion notifications from the workflow engine")
@RequiredArgsConstructor
@Slf4j
public class ExecutionEventController {

    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    @PostMapping("/completed")
    @Operation(
            summary = "Report a completed execution",
            description = "Queues anomaly detection and returns immediately"
    )
    public ResponseEntity<Map<String, String>> executionCompleted(@Valid @RequestBody ExecutionCompletedRequest request) {
        WorkflowExecution execution = WorkflowExecution.builder()
                .executionId(request.getExecutionId())
                .templateId(request.getTemplateId())
                .durationMs(request.getDurationMs())
                .outcome(ExecutionOutcome.fromString(request.getOutcome()))
                .completedAt(request.getCompletedAt())
                .build();

        eventPublisher.publishEvent(new ExecutionCompletedEvent(execution));

        meterRegistry.counter("api.executions.completed.requests",
                "outcome", execution.getOutcome().name()
        ).increment();

        return ResponseEntity.accepted().body(Map.of(
                "executionId", execution.getExecutionId(),
                "status", "accepted"));
    }
}
