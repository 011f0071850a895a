package com.worldmaker.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for WorldMaker Core Service.
 *
 * Provides custom metrics for graph updates, dependency resolution and trace synthesis.
 * When {@code worldmaker.features.metrics-enabled} is false every {@code worldmaker.*}
 * meter is denied and becomes a no-op.
 */
@Slf4j
@Configuration
@Getter
public class MetricsConfig {

    static final String METER_PREFIX = "worldmaker.";

    private final MeterRegistry registry;

    // Counters
    private final Counter edgesAdded;
    private final Counter circularEdges;
    private final Counter tracesSynthesized;
    private final Counter tracesFailed;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    // Timers
    private final Timer synthesisTimer;
    private final Timer resolutionTimer;

    public MetricsConfig(MeterRegistry registry, WorldmakerConfig config) {
        this.registry = registry;

        if (!config.getFeatures().isMetricsEnabled()) {
            log.info("Metrics disabled, denying {}* meters", METER_PREFIX);
            registry.config().meterFilter(MeterFilter.denyNameStartsWith(METER_PREFIX));
        }

        // Initialize counters
        this.edgesAdded = Counter.builder("worldmaker.graph.edges.added")
                .description("Number of dependency edges recorded")
                .register(registry);

        this.circularEdges = Counter.builder("worldmaker.graph.edges.circular")
                .description("Number of recorded edges that closed a cycle")
                .register(registry);

        this.tracesSynthesized = Counter.builder("worldmaker.trace.synthesized")
                .description("Number of traces synthesized")
                .register(registry);

        this.tracesFailed = Counter.builder("worldmaker.trace.failed")
                .description("Number of synthesized traces ending in error")
                .register(registry);

        this.cacheHits = Counter.builder("worldmaker.resolution.cache.hits")
                .description("Dependency resolutions served from cache")
                .register(registry);

        this.cacheMisses = Counter.builder("worldmaker.resolution.cache.misses")
                .description("Dependency resolutions computed")
                .register(registry);

        // Initialize timers
        this.synthesisTimer = Timer.builder("worldmaker.trace.synthesis.duration")
                .description("Time taken to synthesize a trace")
                .register(registry);

        this.resolutionTimer = Timer.builder("worldmaker.resolution.duration")
                .description("Time taken to resolve dependencies")
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
