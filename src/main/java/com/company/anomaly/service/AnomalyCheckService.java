package com.company.anomaly.service;

import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.dto.response.AnomalyResponse;
import com.company.anomaly.dto.response.CheckAnomaliesResponse;
import com.company.anomaly.exception.ExecutionNotFoundException;
import com.company.anomaly.pipeline.AnomalyDetectionPipeline;
import com.company.anomaly.pipeline.PipelineOutcome;
import com.company.anomaly.repository.WorkflowExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * On-demand detection for one stored execution, run synchronously on the caller's thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyCheckService {

    private final WorkflowExecutionRepository executionRepository;
    private final AnomalyDetectionPipeline pipeline;

    public CheckAnomaliesResponse checkExecution(String executionId) {
        WorkflowExecution execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));

        log.info("On-demand anomaly check for execution {} of template {}",
                executionId, execution.getTemplateId());
        PipelineOutcome outcome = pipeline.run(execution);

        return CheckAnomaliesResponse.builder()
                .executionId(executionId)
                .anomalies(outcome.getAnomalies().stream().map(AnomalyResponse::from).toList())
                .total(outcome.getAnomalies().size())
                .pipelineState(outcome.getState().name())
                .skipReason(outcome.getSkipReason() != null ? outcome.getSkipReason().name() : null)
                .build();
    }
}
