package com.company.anomaly.notification;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AppNotification;
import com.company.anomaly.exception.AlertSendException;
import com.company.anomaly.repository.InAppNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class InAppNotificationChannel implements NotificationChannel {

    static final String NAME = "in_app";

    private final InAppNotificationRepository notificationRepository;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isRequired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void send(Anomaly anomaly, AlertMessage message) {
        AppNotification notification = AppNotification.builder()
                .id(UUID.randomUUID())
                .anomalyId(anomaly.getId())
                .templateId(anomaly.getTemplateId())
                .anomalyType(anomaly.getType().getCode())
                .severity(anomaly.getSeverity().getCode())
                .title(message.getTitle())
                .message(message.getBody())
                .createdAt(clock.instant())
                .build();

        try {
            notificationRepository.save(notification);
        } catch (DataAccessException e) {
            throw new AlertSendException("Failed to store in-app notification for anomaly " + anomaly.getId(), e);
        }
        log.debug("In-app notification {} created for anomaly {}", notification.getId(), anomaly.getId());
    }
}
