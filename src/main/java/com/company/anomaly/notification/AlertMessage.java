package com.company.anomaly.notification;

import com.company.anomaly.domain.enums.AnomalySeverity;
import lombok.Value;

@Value
public class AlertMessage {
    String title;
    String body;
    AnomalySeverity severity;
}
