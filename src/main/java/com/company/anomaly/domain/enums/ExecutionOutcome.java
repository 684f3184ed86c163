package com.company.anomaly.domain.enums;

import java.util.Locale;

public enum ExecutionOutcome {
    SUCCESS,
    FAILED,
    TIMEOUT,
    CANCELLED;

    /**
     * Cancelled executions are not counted as failures.
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }

    public static ExecutionOutcome fromString(String outcome) {
        if (outcome == null || outcome.isBlank()) {
            throw new IllegalArgumentException("Execution outcome must not be blank");
        }
        try {
            return ExecutionOutcome.valueOf(outcome.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution outcome: " + outcome, e);
        }
    }
}
