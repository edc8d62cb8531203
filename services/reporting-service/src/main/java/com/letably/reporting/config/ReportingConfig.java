package com.letably.reporting.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.letably.observability.ReportTracer;
import com.letably.reporting.export.ReportJson;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Ambient beans of the reporting service: clock, metrics registry, tracer and JSON mapper.
 *
 * <p>Each bean backs off when the hosting application provides its own, so an actuator-enabled
 * deployment keeps its Prometheus registry and an agent-instrumented one keeps its SDK.
 */
@Configuration
public class ReportingConfig {

    /** Instrumentation scope of the report spans. */
    public static final String TRACER_SCOPE = "com.letably.reporting";

    @Bean
    @ConditionalOnMissingBean
    public Clock reportingClock(ReportingProperties properties) {
        return Clock.system(ZoneId.of(properties.timeZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public ReportTracer reportTracer(OpenTelemetry openTelemetry) {
        return new ReportTracer(openTelemetry.getTracer(TRACER_SCOPE));
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper reportObjectMapper() {
        return ReportJson.objectMapper();
    }
}
