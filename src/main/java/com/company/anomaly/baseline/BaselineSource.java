package com.company.anomaly.baseline;

import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.WorkflowExecution;

import java.util.function.Function;

/**
 * Supplies per-template baselines to the detection pipeline.
 */
public interface BaselineSource {

    BaselineSnapshot load(String templateId);

    /**
     * Loads the baseline, leaving the given execution out of any history replay.
     */
    BaselineSnapshot load(String templateId, String excludeExecutionId);

    void update(String templateId, WorkflowExecution execution);

    /**
     * Loads the template baseline, applies {@code evaluation} to it and then folds the
     * execution in, all under the template's lock. The evaluation sees the baseline as it
     * was before this execution.
     */
    <T> T evaluateAndUpdate(WorkflowExecution execution, Function<BaselineSnapshot, T> evaluation);
}
