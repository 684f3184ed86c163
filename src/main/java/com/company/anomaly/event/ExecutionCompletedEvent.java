package com.company.anomaly.event;

import com.company.anomaly.domain.WorkflowExecution;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExecutionCompletedEvent {
    private final WorkflowExecution execution;
}
