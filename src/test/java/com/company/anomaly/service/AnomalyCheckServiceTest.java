package com.company.anomaly.service;

import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.dto.response.CheckAnomaliesResponse;
import com.company.anomaly.exception.ExecutionNotFoundException;
import com.company.anomaly.pipeline.AnomalyDetectionPipeline;
import com.company.anomaly.pipeline.PipelineOutcome;
import com.company.anomaly.pipeline.PipelineState;
import com.company.anomaly.pipeline.SkipReason;
import com.company.anomaly.repository.WorkflowExecutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.company.anomaly.ExecutionFixtures.success;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnomalyCheckServiceTest {

    private WorkflowExecutionRepository executionRepository;
    private AnomalyDetectionPipeline pipeline;
    private AnomalyCheckService service;

    @BeforeEach
    void setUp() {
        executionRepository = mock(WorkflowExecutionRepository.class);
        pipeline = mock(AnomalyDetectionPipeline.class);
        service = new AnomalyCheckService(executionRepository, pipeline);
    }

    @Test
    void reportsSkipReasonForColdTemplate() {
        WorkflowExecution execution = success("E1", "T1", 100);
        when(executionRepository.findById("E1")).thenReturn(Optional.of(execution));
        when(pipeline.run(execution)).thenReturn(PipelineOutcome.builder()
                .executionId("E1")
                .templateId("T1")
                .state(PipelineState.SKIPPED)
                .skipReason(SkipReason.INSUFFICIENT_HISTORY)
                .build());

        CheckAnomaliesResponse response = service.checkExecution("E1");

        assertThat(response.getTotal()).isZero();
        assertThat(response.getAnomalies()).isEmpty();
        assertThat(response.getPipelineState()).isEqualTo("SKIPPED");
        assertThat(response.getSkipReason()).isEqualTo("INSUFFICIENT_HISTORY");
    }

    @Test
    void unknownExecutionIsNotFound() {
        when(executionRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.checkExecution("nope")).isInstanceOf(ExecutionNotFoundException.class);
        verifyNoInteractions(pipeline);
    }
}
