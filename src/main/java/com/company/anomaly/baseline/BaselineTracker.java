package com.company.anomaly.baseline;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.BaselineMetrics;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.repository.WorkflowExecutionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory baseline cache. A template's baseline is rebuilt from execution history the
 * first time it is needed and then kept current by {@link #update}. Nothing is persisted:
 * after a restart the next load simply replays history again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BaselineTracker implements BaselineSource {

    private final WorkflowExecutionRepository executionRepository;
    private final AnomalyDetectionProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, TemplateBaseline> baselines = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public BaselineSnapshot load(String templateId) {
        return load(templateId, null);
    }

    @Override
    public BaselineSnapshot load(String templateId, String excludeExecutionId) {
        ReentrantLock lock = lockFor(templateId);
        lock.lock();
        try {
            TemplateBaseline baseline = getOrRehydrate(templateId, excludeExecutionId);
            return baseline != null ? baseline.metrics.snapshot() : BaselineSnapshot.unavailable(templateId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * No-op for templates that were never loaded; their first load replays history,
     * which already contains this execution.
     */
    @Override
    public void update(String templateId, WorkflowExecution execution) {
        ReentrantLock lock = lockFor(templateId);
        lock.lock();
        try {
            TemplateBaseline baseline = baselines.get(templateId);
            if (baseline == null) {
                log.debug("Baseline for template {} not cached, skipping update with {}",
                        templateId, execution.getExecutionId());
                return;
            }
            baseline.absorb(execution);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T evaluateAndUpdate(WorkflowExecution execution, Function<BaselineSnapshot, T> evaluation) {
        String templateId = execution.getTemplateId();
        ReentrantLock lock = lockFor(templateId);
        lock.lock();
        try {
            TemplateBaseline baseline = getOrRehydrate(templateId, execution.getExecutionId());
            if (baseline == null) {
                return evaluation.apply(BaselineSnapshot.unavailable(templateId));
            }
            if (baseline.hasAbsorbed(execution.getExecutionId())) {
                // re-check of a processed execution: judge it against history without itself
                log.debug("Execution {} already in baseline of template {}, replaying history without it",
                        execution.getExecutionId(), templateId);
                TemplateBaseline without = replayHistory(templateId, execution.getExecutionId());
                return evaluation.apply(without != null
                        ? without.metrics.snapshot()
                        : BaselineSnapshot.unavailable(templateId));
            }
            T result = evaluation.apply(baseline.metrics.snapshot());
            baseline.absorb(execution);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void evict(String templateId) {
        if (baselines.remove(templateId) != null) {
            log.info("Evicted baseline for template {}", templateId);
        }
    }

    public int cachedTemplateCount() {
        return baselines.size();
    }

    private ReentrantLock lockFor(String templateId) {
        Objects.requireNonNull(templateId, "templateId");
        return locks.computeIfAbsent(templateId, id -> new ReentrantLock());
    }

    /**
     * Caller holds the template lock. Returns null when history could not be read; the
     * failure is not cached so the next call tries again.
     */
    private TemplateBaseline getOrRehydrate(String templateId, String excludeExecutionId) {
        TemplateBaseline cached = baselines.get(templateId);
        if (cached != null) {
            return cached;
        }
        TemplateBaseline baseline = replayHistory(templateId, excludeExecutionId);
        if (baseline != null) {
            baselines.put(templateId, baseline);
        }
        return baseline;
    }

    /**
     * Builds an uncached baseline from the most recent history, oldest first, leaving out
     * {@code excludeExecutionId}. Returns null when history could not be read.
     */
    private TemplateBaseline replayHistory(String templateId, String excludeExecutionId) {
        int windowSize = properties.getBaseline().getWindowSize();
        List<WorkflowExecution> history;
        try {
            history = executionRepository.findRecentByTemplate(templateId, windowSize + 1);
        } catch (RuntimeException e) {
            log.warn("Failed to load execution history for template {}: {}", templateId, e.getMessage());
            meterRegistry.counter("anomaly.baseline.rehydration.failures").increment();
            return null;
        }

        List<WorkflowExecution> replay = new ArrayList<>(windowSize);
        for (WorkflowExecution execution : history) {
            if (excludeExecutionId != null && excludeExecutionId.equals(execution.getExecutionId())) {
                continue;
            }
            if (replay.size() == windowSize) {
                break;
            }
            replay.add(execution);
        }
        // history is newest first, replay oldest first
        Collections.reverse(replay);

        TemplateBaseline baseline = new TemplateBaseline(templateId, windowSize);
        replay.forEach(baseline::absorb);

        meterRegistry.counter("anomaly.baseline.rehydrations").increment();
        log.debug("Rehydrated baseline for template {} from {} executions", templateId, replay.size());
        return baseline;
    }

    private static final class TemplateBaseline {
        private final BaselineMetrics metrics;
        private final Set<String> absorbedExecutionIds = new LinkedHashSet<>();
        private final int rememberedIds;

        private TemplateBaseline(String templateId, int windowSize) {
            this.metrics = new BaselineMetrics(templateId, windowSize);
            this.rememberedIds = windowSize * 2;
        }

        private boolean hasAbsorbed(String executionId) {
            return executionId != null && absorbedExecutionIds.contains(executionId);
        }

        private void absorb(WorkflowExecution execution) {
            String executionId = execution.getExecutionId();
            if (executionId != null && !absorbedExecutionIds.add(executionId)) {
                return;
            }
            metrics.observe(execution);

            if (absorbedExecutionIds.size() > rememberedIds) {
                Iterator<String> oldest = absorbedExecutionIds.iterator();
                oldest.next();
                oldest.remove();
            }
        }
    }
}
