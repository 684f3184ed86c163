package com.company.anomaly.pipeline;

public enum PipelineState {
    RECEIVED,
    BASELINE_LOADED,
    DETECTED,
    PERSISTED,
    DISPATCHED,
    DONE,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == SKIPPED || this == FAILED;
    }
}
