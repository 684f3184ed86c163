package com.company.anomaly.notification;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.enums.AnomalySeverity;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Gates anomalies by severity and per-(template, type) rate, then fans out to the
 * enabled channels. Never throws: every outcome is reported through {@link DispatchResult}.
 */
@Service
@Slf4j
public class AlertDispatcher {

    private final List<NotificationChannel> channels;
    private final RateLimitCounterStore rateLimitCounterStore;
    private final AlertMessageFormatter messageFormatter;
    private final AnomalyDetectionProperties properties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final Executor channelExecutor;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    public AlertDispatcher(List<NotificationChannel> channels,
                           RateLimitCounterStore rateLimitCounterStore,
                           AlertMessageFormatter messageFormatter,
                           AnomalyDetectionProperties properties,
                           CircuitBreakerRegistry circuitBreakerRegistry,
                           TimeLimiterRegistry timeLimiterRegistry,
                           @Qualifier("notificationChannelExecutor") Executor channelExecutor,
                           MeterRegistry meterRegistry,
                           Tracer tracer) {
        this.channels = channels;
        this.rateLimitCounterStore = rateLimitCounterStore;
        this.messageFormatter = messageFormatter;
        this.properties = properties;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.channelExecutor = channelExecutor;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
    }

    public DispatchResult notify(Anomaly anomaly) {
        AnomalySeverity minSeverity = properties.getAlerting().getMinSeverity();
        if (!anomaly.getSeverity().isAtLeast(minSeverity)) {
            log.debug("Anomaly {} ({}) below alert threshold {}",
                    anomaly.getId(), anomaly.getSeverity().getCode(), minSeverity.getCode());
            meterRegistry.counter("anomaly.alerts.below_threshold").increment();
            return DispatchResult.of(DispatchStatus.BELOW_THRESHOLD);
        }

        if (!rateLimitCounterStore.tryAcquire(anomaly.getTemplateId(), anomaly.getType())) {
            log.info("Alert for anomaly {} suppressed: rate limit reached for template {} / {}",
                    anomaly.getId(), anomaly.getTemplateId(), anomaly.getType().getCode());
            meterRegistry.counter("anomaly.alerts.rate_limited",
                    "type", anomaly.getType().getCode()
            ).increment();
            return DispatchResult.of(DispatchStatus.RATE_LIMITED);
        }

        AlertMessage message = messageFormatter.format(anomaly);
        List<String> delivered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        boolean requiredFailed = false;

        Span span = tracer.spanBuilder("anomaly.alert.dispatch")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("anomaly.id", anomaly.getId().toString());
            span.setAttribute("anomaly.type", anomaly.getType().getCode());
            span.setAttribute("anomaly.severity", anomaly.getSeverity().getCode());
            span.setAttribute("template.id", anomaly.getTemplateId());

            for (NotificationChannel channel : channels) {
                if (!channel.isEnabled()) {
                    continue;
                }
                boolean sent = channel.isRequired()
                        ? sendRequired(channel, anomaly, message, span)
                        : sendOptional(channel, anomaly, message, span);
                if (sent) {
                    delivered.add(channel.name());
                    meterRegistry.counter("anomaly.alerts.sent", "channel", channel.name()).increment();
                } else {
                    failed.add(channel.name());
                    meterRegistry.counter("anomaly.alerts.failed", "channel", channel.name()).increment();
                    requiredFailed |= channel.isRequired();
                }
            }

            if (requiredFailed) {
                span.setStatus(StatusCode.ERROR, "Required channel failed");
            }
        } finally {
            span.end();
        }

        DispatchStatus status = requiredFailed ? DispatchStatus.FAILED : DispatchStatus.DISPATCHED;
        log.info("Alert for anomaly {} {}: delivered={}, failed={}", anomaly.getId(), status, delivered, failed);
        return new DispatchResult(status, List.copyOf(delivered), List.copyOf(failed));
    }

    private boolean sendRequired(NotificationChannel channel, Anomaly anomaly, AlertMessage message, Span span) {
        try {
            channel.send(anomaly, message);
            return true;
        } catch (RuntimeException e) {
            log.error("Required channel {} failed for anomaly {}", channel.name(), anomaly.getId(), e);
            span.recordException(e);
            return false;
        }
    }

    /**
     * Runs the channel on the channel executor, bounded by its time limiter and guarded by
     * its circuit breaker.
     */
    private boolean sendOptional(NotificationChannel channel, Anomaly anomaly, AlertMessage message, Span span) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(channel.name());
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(channel.name());

        Callable<Void> timed = timeLimiter.decorateFutureSupplier(() ->
                CompletableFuture.runAsync(() -> channel.send(anomaly, message), channelExecutor)
                        .thenApply(ignored -> (Void) null));
        Callable<Void> guarded = CircuitBreaker.decorateCallable(circuitBreaker, timed);

        try {
            guarded.call();
            return true;
        } catch (Exception e) {
            log.warn("Optional channel {} failed for anomaly {}: {}", channel.name(), anomaly.getId(), e.toString());
            span.recordException(e);
            return false;
        }
    }
}
