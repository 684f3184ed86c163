package com.company.anomaly.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class OpenTelemetryConfig {

    private static final String INSTRUMENTATION_NAME = "workflow-anomaly-service";

    /**
     * SDK configured from the standard OTEL_* environment; falls back to the no-op
     * implementation when tracing is switched off.
     */
    @Bean
    public OpenTelemetry openTelemetry(@Value("${anomaly.tracing.enabled:true}") boolean tracingEnabled) {
        if (!tracingEnabled) {
            log.info("Tracing disabled, using no-op OpenTelemetry");
            return OpenTelemetry.noop();
        }
        return AutoConfiguredOpenTelemetrySdk.initialize().getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
