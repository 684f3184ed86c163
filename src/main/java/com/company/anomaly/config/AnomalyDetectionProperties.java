package com.company.anomaly.config;

import com.company.anomaly.domain.enums.AnomalySeverity;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "anomaly")
@Getter
@Setter
public class AnomalyDetectionProperties {

    private Baseline baseline = new Baseline();
    private Detection detection = new Detection();
    private Batch batch = new Batch();
    private Alerting alerting = new Alerting();
    private Pipeline pipeline = new Pipeline();

    @Getter
    @Setter
    public static class Baseline {
        /** Number of most recent executions kept per statistic. */
        private int windowSize = 30;
    }

    @Getter
    @Setter
    public static class Detection {
        /** Below this many samples every statistical rule is skipped. */
        private int minSamples = 5;
        private double performanceDegradationSigma = 2.0;
        private double unusualExecutionZScore = 2.0;
        private double warningZScore = AnomalySeverity.DEFAULT_WARNING_Z_SCORE;
        private double criticalZScore = AnomalySeverity.DEFAULT_CRITICAL_Z_SCORE;
    }

    @Getter
    @Setter
    public static class Batch {
        private boolean enabled = true;
        private long intervalMs = 600_000;
        /** Templates with a completion inside this lookback are evaluated. */
        private Duration lookback = Duration.ofHours(24);
        private int spikeWindow = 10;
        private double spikeZScore = 2.0;
        private int consecutiveFailureThreshold = 3;
        private int consecutiveFailureCriticalThreshold = 5;
    }

    @Getter
    @Setter
    public static class Alerting {
        private AnomalySeverity minSeverity = AnomalySeverity.WARNING;
        private RateLimit rateLimit = new RateLimit();
        private Chat chat = new Chat();
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int maxPerWindow = 10;
        private Duration window = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Chat {
        private boolean enabled = false;
        private String webhookUrl;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(4);
    }

    @Getter
    @Setter
    public static class Pipeline {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 1000;
        private int channelPoolSize = 4;
    }
}
