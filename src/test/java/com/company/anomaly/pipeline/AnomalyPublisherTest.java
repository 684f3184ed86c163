package com.company.anomaly.pipeline;

import com.company.anomaly.MutableClock;
import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.company.anomaly.notification.AlertDispatcher;
import com.company.anomaly.notification.AlertMessageFormatter;
import com.company.anomaly.notification.DispatchResult;
import com.company.anomaly.notification.DispatchStatus;
import com.company.anomaly.notification.NotificationChannel;
import com.company.anomaly.notification.RateLimitCounterStore;
import com.company.anomaly.repository.AnomalyRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.company.anomaly.ExecutionFixtures.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnomalyPublisherTest {

    private AnomalyRepository repository;
    private AlertDispatcher dispatcher;
    private SimpleMeterRegistry meterRegistry;
    private AnomalyPublisher publisher;

    @BeforeEach
    void setUp() {
        repository = mock(AnomalyRepository.class);
        dispatcher = mock(AlertDispatcher.class);
        meterRegistry = new SimpleMeterRegistry();
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        publisher = new AnomalyPublisher(repository, dispatcher, meterRegistry, retryRegistry);
    }

    private static Anomaly anomaly(AnomalySeverity severity) {
        return Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId("T1")
                .type(AnomalyType.UNUSUAL_EXECUTION_TIME)
                .severity(severity)
                .description("unusual")
                .metrics(AnomalyMetrics.of(60, 100, -2.5))
                .detectedAt(BASE_TIME)
                .build();
    }

    @Test
    void retriesOnceBeforeSucceeding() {
        Anomaly anomaly = anomaly(AnomalySeverity.WARNING);
        when(repository.save(anomaly))
                .thenThrow(new DataAccessResourceFailureException("blip"))
                .thenReturn(anomaly);

        List<Anomaly> stored = publisher.persist(List.of(anomaly));

        assertThat(stored).containsExactly(anomaly);
        verify(repository, times(2)).save(anomaly);
        assertThat(meterRegistry.counter("anomaly.detected",
                "type", "unusual_execution_time", "severity", "warning").count()).isEqualTo(1.0);
    }

    @Test
    void dropsAnomalyAfterRetryIsExhausted() {
        Anomaly failing = anomaly(AnomalySeverity.CRITICAL);
        Anomaly fine = anomaly(AnomalySeverity.WARNING);
        when(repository.save(failing)).thenThrow(new DataAccessResourceFailureException("down"));
        when(repository.save(fine)).thenReturn(fine);

        List<Anomaly> stored = publisher.persist(List.of(failing, fine));

        assertThat(stored).containsExactly(fine);
        verify(repository, times(2)).save(failing);
        assertThat(meterRegistry.counter("anomaly.persistence.failures").count()).isEqualTo(1.0);
    }

    @Test
    void countsOnlyDispatchedAlerts() {
        Anomaly first = anomaly(AnomalySeverity.CRITICAL);
        Anomaly second = anomaly(AnomalySeverity.INFO);
        when(dispatcher.notify(first)).thenReturn(DispatchResult.of(DispatchStatus.DISPATCHED));
        when(dispatcher.notify(second)).thenReturn(DispatchResult.of(DispatchStatus.BELOW_THRESHOLD));

        assertThat(publisher.dispatch(List.of(first, second))).isEqualTo(1);
    }

    @Test
    void rateLimitedAnomaliesAreStillPersisted() {
        MutableClock clock = new MutableClock(BASE_TIME);
        NotificationChannel inApp = mock(NotificationChannel.class);
        when(inApp.name()).thenReturn("in_app");
        when(inApp.isRequired()).thenReturn(true);
        when(inApp.isEnabled()).thenReturn(true);
        AlertDispatcher rateLimited = new AlertDispatcher(
                List.of(inApp),
                new RateLimitCounterStore(clock, 3, Duration.ofSeconds(60)),
                new AlertMessageFormatter(),
                new AnomalyDetectionProperties(),
                CircuitBreakerRegistry.ofDefaults(),
                TimeLimiterRegistry.ofDefaults(),
                Runnable::run,
                meterRegistry,
                OpenTelemetry.noop().getTracer("test"));
        AnomalyPublisher publisher = new AnomalyPublisher(repository, rateLimited, meterRegistry,
                RetryRegistry.ofDefaults());

        List<Anomaly> burst = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Anomaly anomaly = anomaly(AnomalySeverity.WARNING);
            when(repository.save(anomaly)).thenReturn(anomaly);
            burst.add(anomaly);
        }

        int dispatched = 0;
        int stored = 0;
        for (Anomaly anomaly : burst) {
            List<Anomaly> saved = publisher.persist(List.of(anomaly));
            stored += saved.size();
            dispatched += publisher.dispatch(saved);
            clock.advance(Duration.ofSeconds(2));
        }

        assertThat(stored).isEqualTo(5);
        assertThat(dispatched).isEqualTo(3);
        verify(repository, times(5)).save(any(Anomaly.class));
        verify(inApp, times(3)).send(any(), any());
    }
}
