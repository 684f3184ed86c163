package com.company.anomaly.exception;

/**
 * A notification channel could not deliver an alert.
 */
public class AlertSendException extends RuntimeException {
    public AlertSendException(String message) {
        super(message);
    }

    public AlertSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
