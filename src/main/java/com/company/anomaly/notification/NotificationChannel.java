package com.company.anomaly.notification;

import com.company.anomaly.domain.Anomaly;

/**
 * A delivery target for anomaly alerts. Required channels decide whether a dispatch
 * counts as failed; optional ones are best effort.
 */
public interface NotificationChannel {

    String name();

    boolean isRequired();

    boolean isEnabled();

    /**
     * @throws com.company.anomaly.exception.AlertSendException when delivery fails
     */
    void send(Anomaly anomaly, AlertMessage message);
}
