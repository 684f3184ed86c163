package com.company.anomaly.notification;

import com.company.anomaly.domain.enums.AnomalyType;
import lombok.Value;

@Value
public class RateLimitKey {
    String templateId;
    AnomalyType type;
}
