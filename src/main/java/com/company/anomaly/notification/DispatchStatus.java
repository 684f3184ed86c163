package com.company.anomaly.notification;

public enum DispatchStatus {
    DISPATCHED,
    BELOW_THRESHOLD,
    RATE_LIMITED,
    /** A required channel failed; optional channel failures never produce this. */
    FAILED
}
