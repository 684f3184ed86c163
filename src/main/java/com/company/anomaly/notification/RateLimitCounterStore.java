package com.company.anomaly.notification;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.domain.enums.AnomalyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window counter of sent alerts per (template, anomaly type). Each key keeps the
 * send timestamps inside the window; updates for one key are atomic.
 */
@Component
@Slf4j
public class RateLimitCounterStore {

    private final Clock clock;
    private final int maxPerWindow;
    private final Duration window;
    private final Map<RateLimitKey, Deque<Instant>> sent = new ConcurrentHashMap<>();

    @Autowired
    public RateLimitCounterStore(Clock clock, AnomalyDetectionProperties properties) {
        this(clock,
                properties.getAlerting().getRateLimit().getMaxPerWindow(),
                properties.getAlerting().getRateLimit().getWindow());
    }

    public RateLimitCounterStore(Clock clock, int maxPerWindow, Duration window) {
        if (maxPerWindow < 1) {
            throw new IllegalArgumentException("maxPerWindow must be positive: " + maxPerWindow);
        }
        this.clock = clock;
        this.maxPerWindow = maxPerWindow;
        this.window = window;
    }

    /**
     * Records a send and returns true if the key is still under its limit, otherwise
     * returns false and records nothing.
     */
    public boolean tryAcquire(String templateId, AnomalyType type) {
        boolean[] acquired = new boolean[1];
        sent.compute(new RateLimitKey(templateId, type), (key, timestamps) -> {
            Deque<Instant> current = timestamps != null ? timestamps : new ArrayDeque<>();
            Instant now = clock.instant();
            prune(current, now);
            if (current.size() < maxPerWindow) {
                current.addLast(now);
                acquired[0] = true;
            }
            return current;
        });
        return acquired[0];
    }

    public int currentCount(String templateId, AnomalyType type) {
        int[] count = new int[1];
        sent.computeIfPresent(new RateLimitKey(templateId, type), (key, timestamps) -> {
            prune(timestamps, clock.instant());
            count[0] = timestamps.size();
            return timestamps;
        });
        return count[0];
    }

    /**
     * Drops keys whose timestamps have all left the window.
     */
    @Scheduled(fixedDelayString = "${anomaly.alerting.rate-limit.purge-interval-ms:300000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = sent.size();
        for (RateLimitKey key : sent.keySet()) {
            sent.computeIfPresent(key, (k, timestamps) -> {
                prune(timestamps, now);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        int removed = before - sent.size();
        if (removed > 0) {
            log.debug("Purged {} idle rate limit keys", removed);
        }
    }

    public int trackedKeyCount() {
        return sent.size();
    }

    private void prune(Deque<Instant> timestamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
