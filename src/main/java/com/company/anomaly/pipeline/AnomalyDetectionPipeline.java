package com.company.anomaly.pipeline;

import com.company.anomaly.baseline.BaselineSource;
import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.detection.AnomalyDetector;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.WorkflowExecution;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per-execution detection: RECEIVED, BASELINE_LOADED, DETECTED, PERSISTED, DISPATCHED, DONE,
 * with SKIPPED and FAILED as the alternative terminal states. Detection and the baseline
 * update happen under the template lock; storing and alerting happen after it is released.
 */
@Service
@Slf4j
public class AnomalyDetectionPipeline {

    static final String MDC_TEMPLATE_ID = "templateId";
    static final String MDC_EXECUTION_ID = "executionId";

    private final BaselineSource baselineSource;
    private final AnomalyDetector anomalyDetector;
    private final AnomalyPublisher anomalyPublisher;
    private final AnomalyDetectionProperties properties;
    private final Executor pipelineExecutor;
    private final MeterRegistry meterRegistry;

    public AnomalyDetectionPipeline(BaselineSource baselineSource,
                                    AnomalyDetector anomalyDetector,
                                    AnomalyPublisher anomalyPublisher,
                                    AnomalyDetectionProperties properties,
                                    @Qualifier("anomalyPipelineExecutor") Executor pipelineExecutor,
                                    MeterRegistry meterRegistry) {
        this.baselineSource = baselineSource;
        this.anomalyDetector = anomalyDetector;
        this.anomalyPublisher = anomalyPublisher;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Hands the execution to the pipeline executor. The returned future always completes
     * normally; a rejected hand-off completes it with a FAILED outcome.
     */
    public CompletableFuture<PipelineOutcome> submit(WorkflowExecution execution) {
        try {
            return CompletableFuture.supplyAsync(() -> run(execution), pipelineExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Pipeline queue full, dropping execution {} of template {}",
                    execution.getExecutionId(), execution.getTemplateId());
            meterRegistry.counter("anomaly.pipeline.rejected").increment();
            return CompletableFuture.completedFuture(PipelineOutcome.builder()
                    .executionId(execution.getExecutionId())
                    .templateId(execution.getTemplateId())
                    .visited(PipelineState.RECEIVED)
                    .visited(PipelineState.FAILED)
                    .state(PipelineState.FAILED)
                    .build());
        }
    }

    public PipelineOutcome run(WorkflowExecution execution) {
        MDC.put(MDC_TEMPLATE_ID, execution.getTemplateId());
        MDC.put(MDC_EXECUTION_ID, execution.getExecutionId());
        Timer.Sample sample = Timer.start(meterRegistry);

        PipelineOutcome.PipelineOutcomeBuilder outcome = PipelineOutcome.builder()
                .executionId(execution.getExecutionId())
                .templateId(execution.getTemplateId())
                .visited(PipelineState.RECEIVED);
        PipelineState finalState = PipelineState.FAILED;

        try {
            Evaluation evaluation = baselineSource.evaluateAndUpdate(execution,
                    baseline -> evaluate(execution, baseline));
            outcome.visited(PipelineState.BASELINE_LOADED);

            if (evaluation.getSkipReason() != null) {
                finalState = PipelineState.SKIPPED;
                outcome.skipReason(evaluation.getSkipReason());
                logSkip(execution, evaluation.getSkipReason());
                return finish(outcome, finalState);
            }

            List<Anomaly> detected = evaluation.getAnomalies();
            outcome.visited(PipelineState.DETECTED).detected(detected.size());
            if (detected.isEmpty()) {
                finalState = PipelineState.DONE;
                return finish(outcome, finalState);
            }

            List<Anomaly> stored = anomalyPublisher.persist(detected);
            if (stored.isEmpty()) {
                log.error("None of the {} anomalies for execution {} could be persisted",
                        detected.size(), execution.getExecutionId());
                finalState = PipelineState.FAILED;
                return finish(outcome, finalState);
            }
            outcome.visited(PipelineState.PERSISTED).persisted(stored.size()).anomalies(stored);

            int dispatched = anomalyPublisher.dispatch(stored);
            outcome.visited(PipelineState.DISPATCHED).dispatched(dispatched);

            finalState = PipelineState.DONE;
            return finish(outcome, finalState);

        } catch (RuntimeException e) {
            log.error("Anomaly pipeline failed for execution {}", execution.getExecutionId(), e);
            finalState = PipelineState.FAILED;
            return finish(outcome, finalState);
        } finally {
            sample.stop(meterRegistry.timer("anomaly.pipeline.duration"));
            meterRegistry.counter("anomaly.pipeline.runs", "state", finalState.name()).increment();
            MDC.remove(MDC_TEMPLATE_ID);
            MDC.remove(MDC_EXECUTION_ID);
        }
    }

    private Evaluation evaluate(WorkflowExecution execution, BaselineSnapshot baseline) {
        if (baseline.isHistoryUnavailable()) {
            return new Evaluation(SkipReason.DATA_UNAVAILABLE, List.of());
        }
        if (baseline.getSampleCount() < properties.getDetection().getMinSamples()) {
            return new Evaluation(SkipReason.INSUFFICIENT_HISTORY, List.of());
        }
        return new Evaluation(null, anomalyDetector.check(execution, baseline));
    }

    private PipelineOutcome finish(PipelineOutcome.PipelineOutcomeBuilder outcome, PipelineState state) {
        return outcome.visited(state).state(state).build();
    }

    private void logSkip(WorkflowExecution execution, SkipReason reason) {
        if (reason == SkipReason.DATA_UNAVAILABLE) {
            log.warn("Skipping detection for execution {}: execution history unavailable", execution.getExecutionId());
        } else {
            log.info("Skipping detection for execution {}: not enough history for template {}",
                    execution.getExecutionId(), execution.getTemplateId());
        }
        meterRegistry.counter("anomaly.pipeline.skipped", "reason", reason.name()).increment();
    }

    @Value
    private static class Evaluation {
        SkipReason skipReason;
        List<Anomaly> anomalies;
    }
}
