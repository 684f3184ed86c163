package com.company.anomaly.pipeline;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.notification.AlertDispatcher;
import com.company.anomaly.notification.DispatchResult;
import com.company.anomaly.repository.AnomalyRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores detected anomalies and hands the stored ones to the dispatcher. Shared by the
 * per-execution pipeline and the scheduled failure-pattern job.
 */
@Component
@Slf4j
public class AnomalyPublisher {

    static final String PERSISTENCE_RETRY = "anomalyPersistence";

    private final AnomalyRepository anomalyRepository;
    private final AlertDispatcher alertDispatcher;
    private final MeterRegistry meterRegistry;
    private final Retry persistenceRetry;

    public AnomalyPublisher(AnomalyRepository anomalyRepository,
                            AlertDispatcher alertDispatcher,
                            MeterRegistry meterRegistry,
                            RetryRegistry retryRegistry) {
        this.anomalyRepository = anomalyRepository;
        this.alertDispatcher = alertDispatcher;
        this.meterRegistry = meterRegistry;
        this.persistenceRetry = retryRegistry.retry(PERSISTENCE_RETRY);
    }

    /**
     * Saves each anomaly with one retry. Anomalies that still fail are dropped and left
     * out of the returned list, so they are never alerted on.
     */
    public List<Anomaly> persist(List<Anomaly> anomalies) {
        List<Anomaly> stored = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            try {
                Retry.decorateSupplier(persistenceRetry, () -> anomalyRepository.save(anomaly)).get();
                stored.add(anomaly);
                meterRegistry.counter("anomaly.detected",
                        "type", anomaly.getType().getCode(),
                        "severity", anomaly.getSeverity().getCode()
                ).increment();
            } catch (RuntimeException e) {
                log.error("Dropping anomaly {} ({}) for template {}: could not be persisted",
                        anomaly.getId(), anomaly.getType().getCode(), anomaly.getTemplateId(), e);
                meterRegistry.counter("anomaly.persistence.failures").increment();
            }
        }
        return stored;
    }

    /**
     * @return number of anomalies whose alert went out
     */
    public int dispatch(List<Anomaly> storedAnomalies) {
        int dispatched = 0;
        for (Anomaly anomaly : storedAnomalies) {
            DispatchResult result = alertDispatcher.notify(anomaly);
            if (result.isDispatched()) {
                dispatched++;
            }
        }
        return dispatched;
    }
}
