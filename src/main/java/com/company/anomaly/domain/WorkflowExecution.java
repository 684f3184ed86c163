package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.ExecutionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A completed workflow execution as reported by the execution subsystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowExecution {
    private String executionId;
    private String templateId;
    private Long durationMs;
    private ExecutionOutcome outcome;
    private Instant completedAt;

    public boolean isFailure() {
        return outcome != null && outcome.isFailure();
    }
}
