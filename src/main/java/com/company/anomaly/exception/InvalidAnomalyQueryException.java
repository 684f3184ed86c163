package com.company.anomaly.exception;

public class InvalidAnomalyQueryException extends RuntimeException {
    public InvalidAnomalyQueryException(String message) {
        super(message);
    }

    public InvalidAnomalyQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
