package com.company.anomaly.pipeline;

public enum SkipReason {
    /** Fewer baseline samples than the configured minimum. */
    INSUFFICIENT_HISTORY,
    /** Execution history could not be read. */
    DATA_UNAVAILABLE
}
