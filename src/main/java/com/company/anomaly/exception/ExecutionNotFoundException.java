package com.company.anomaly.exception;

public class ExecutionNotFoundException extends RuntimeException {
    public ExecutionNotFoundException(String executionId) {
        super("Workflow execution not found: " + executionId);
    }
}
