package com.motif.integration.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the Motif Integration Service.
 *
 * Provides custom metrics for pipeline runs, mining and annotation requests.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter runsSucceeded;
    private final Counter runsPartiallyFailed;
    private final Counter runsFailed;
    private final Counter miningRequestsCompleted;
    private final Counter annotationsSucceeded;
    private final Counter annotationsFailed;
    private final Counter annotationsNotReady;

    // Timers
    private final Timer runTimer;
    private final Timer miningTimer;
    private final Timer annotationTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.runsSucceeded = Counter.builder("pipeline.run.success")
                .description("Number of pipeline runs where every stage succeeded")
                .register(registry);

        this.runsPartiallyFailed = Counter.builder("pipeline.run.partial")
                .description("Number of pipeline runs where exactly one branch failed")
                .register(registry);

        this.runsFailed = Counter.builder("pipeline.run.failure")
                .description("Number of pipeline runs that produced no usable result")
                .register(registry);

        this.miningRequestsCompleted = Counter.builder("pipeline.mining.count")
                .description("Number of standalone mining requests completed")
                .register(registry);

        this.annotationsSucceeded = Counter.builder("pipeline.annotation.success")
                .description("Number of successful annotation requests")
                .register(registry);

        this.annotationsFailed = Counter.builder("pipeline.annotation.failure")
                .description("Number of failed annotation requests")
                .register(registry);

        this.annotationsNotReady = Counter.builder("pipeline.annotation.not_ready")
                .description("Number of annotation requests rejected by the readiness check")
                .register(registry);

        this.runTimer = Timer.builder("pipeline.run.duration")
                .description("Time taken for complete pipeline runs")
                .register(registry);

        this.miningTimer = Timer.builder("pipeline.mining.duration")
                .description("Time taken for standalone mining requests")
                .register(registry);

        this.annotationTimer = Timer.builder("pipeline.annotation.duration")
                .description("Time taken for annotation requests")
                .register(registry);
    }

    /**
     * Registers a gauge for in-flight work monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param valueSupplier supplier for the current value
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
                .description(description)
                .register(registry);
    }
}
