package com.company.anomaly.pipeline;

import com.company.anomaly.event.ExecutionCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Entry point from the execution subsystem. Only hands off; the publisher's thread
 * returns as soon as the execution is queued.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExecutionCompletedListener {

    private final AnomalyDetectionPipeline pipeline;

    @EventListener
    public void onExecutionCompleted(ExecutionCompletedEvent event) {
        log.debug("Execution {} of template {} completed, queueing anomaly detection",
                event.getExecution().getExecutionId(), event.getExecution().getTemplateId());
        pipeline.submit(event.getExecution());
    }
}
