package com.company.anomaly.dto.response;

import com.company.anomaly.domain.AppNotification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {
    private String id;
    private String anomalyId;
    private String templateId;
    private String anomalyType;
    private String severity;
    private String title;
    private String message;
    private Instant createdAt;

    public static NotificationResponse from(AppNotification notification) {
        return NotificationResponse.builder()
                .id(notification.getId().toString())
                .anomalyId(notification.getAnomalyId().toString())
                .templateId(notification.getTemplateId())
                .anomalyType(notification.getAnomalyType())
                .severity(notification.getSeverity())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
