package com.company.anomaly.pipeline;

import com.company.anomaly.domain.Anomaly;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineOutcome {
    String executionId;
    String templateId;
    PipelineState state;

    /** Every state the run passed through, ending with {@link #state}. */
    @Singular("visited")
    List<PipelineState> path;

    SkipReason skipReason;
    int detected;
    int persisted;
    int dispatched;

    /** Anomalies that were stored. */
    @Singular
    List<Anomaly> anomalies;
}
