package com.company.anomaly.config;

import com.company.anomaly.baseline.BaselineTracker;
import com.company.anomaly.notification.RateLimitCounterStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final BaselineTracker baselineTracker;
    private final RateLimitCounterStore rateLimitCounterStore;

    @Bean
    public MeterBinder anomalyMetrics(
            @Qualifier("anomalyPipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor) {
        return (registry) -> {
            Gauge.builder("anomaly.baselines.cached", baselineTracker, BaselineTracker::cachedTemplateCount)
                    .description("Templates with an in-memory baseline")
                    .register(registry);

            Gauge.builder("anomaly.pipeline.queue.depth", pipelineExecutor,
                            executor -> executor.getThreadPoolExecutor().getQueue().size())
                    .description("Executions waiting for anomaly detection")
                    .register(registry);

            Gauge.builder("anomaly.alerts.rate_limit.keys", rateLimitCounterStore, RateLimitCounterStore::trackedKeyCount)
                    .description("(template, type) pairs with alerts inside the rate limit window")
                    .register(registry);

            log.info("Anomaly metrics registered");
        };
    }
}
