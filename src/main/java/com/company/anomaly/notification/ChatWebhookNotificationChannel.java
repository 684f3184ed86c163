package com.company.anomaly.notification;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.exception.AlertSendException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts alerts to a chat incoming webhook. The payload is a plain {@code text} message,
 * which Slack, Mattermost and Teams connectors all accept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChatWebhookNotificationChannel implements NotificationChannel {

    static final String NAME = "chat";

    private final RestTemplate chatWebhookRestTemplate;
    private final AnomalyDetectionProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isRequired() {
        return false;
    }

    @Override
    public boolean isEnabled() {
        AnomalyDetectionProperties.Chat chat = properties.getAlerting().getChat();
        return chat.isEnabled() && chat.getWebhookUrl() != null && !chat.getWebhookUrl().isBlank();
    }

    @Override
    public void send(Anomaly anomaly, AlertMessage message) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> payload = Map.of("text", message.getBody());

        try {
            chatWebhookRestTemplate.postForEntity(
                    properties.getAlerting().getChat().getWebhookUrl(),
                    new HttpEntity<>(payload, headers),
                    String.class);
        } catch (RestClientException e) {
            throw new AlertSendException("Chat webhook rejected alert for anomaly " + anomaly.getId(), e);
        }
        log.info("Chat alert sent for anomaly {} ({})", anomaly.getId(), anomaly.getType().getCode());
    }
}
