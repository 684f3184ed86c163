package com.company.anomaly.notification;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.AppNotification;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.company.anomaly.exception.AlertSendException;
import com.company.anomaly.repository.InAppNotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.UUID;

import static com.company.anomaly.ExecutionFixtures.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InAppNotificationChannelTest {

    private InAppNotificationRepository repository;
    private InAppNotificationChannel channel;
    private Anomaly anomaly;

    @BeforeEach
    void setUp() {
        repository = mock(InAppNotificationRepository.class);
        channel = new InAppNotificationChannel(repository, Clock.fixed(BASE_TIME, ZoneOffset.UTC));
        anomaly = Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId("T1")
                .type(AnomalyType.CONSECUTIVE_FAILURES)
                .severity(AnomalySeverity.WARNING)
                .description("3 consecutive failures")
                .metrics(AnomalyMetrics.of(3, 0, 2.0))
                .detectedAt(BASE_TIME)
                .build();
    }

    @Test
    void storesNotificationLinkedToAnomaly() {
        channel.send(anomaly, new AlertMessage("Anomaly Detected: Consecutive Failures", "body", AnomalySeverity.WARNING));

        ArgumentCaptor<AppNotification> captor = ArgumentCaptor.forClass(AppNotification.class);
        verify(repository).save(captor.capture());
        AppNotification saved = captor.getValue();
        assertThat(saved.getAnomalyId()).isEqualTo(anomaly.getId());
        assertThat(saved.getAnomalyType()).isEqualTo("consecutive_failures");
        assertThat(saved.getSeverity()).isEqualTo("warning");
        assertThat(saved.getTitle()).isEqualTo("Anomaly Detected: Consecutive Failures");
        assertThat(saved.getCreatedAt()).isEqualTo(BASE_TIME);
    }

    @Test
    void storageFailureBecomesAlertSendException() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> channel.send(anomaly, new AlertMessage("t", "b", AnomalySeverity.WARNING)))
                .isInstanceOf(AlertSendException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void isRequiredAndAlwaysEnabled() {
        assertThat(channel.isRequired()).isTrue();
        assertThat(channel.isEnabled()).isTrue();
        assertThat(channel.name()).isEqualTo("in_app");
    }
}
