package com.company.anomaly.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * An in-app notification shown on the dashboard for a dispatched anomaly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppNotification {
    private UUID id;
    private UUID anomalyId;
    private String templateId;
    private String anomalyType;
    private String severity;
    private String title;
    private String message;
    private Instant createdAt;
}
