package com.worldmaker.core.service.api.health;

import com.worldmaker.core.service.catalog.EntityCatalog;
import com.worldmaker.core.service.config.WorldmakerConfig;
import com.worldmaker.core.service.engine.DependencyGraphAdapter;
import com.worldmaker.core.service.engine.TraceSynthesizerAdapter;
import com.worldmaker.core.service.runtime.TraceBuffer;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the dependency graph and trace stores.
 *
 * Reports store sizes for monitoring; out of service when the service is disabled.
 */
@Component
@RequiredArgsConstructor
public class DependencyGraphHealthIndicator implements HealthIndicator {

    private final DependencyGraphAdapter graph;
    private final EntityCatalog catalog;
    private final TraceBuffer traceBuffer;
    private final TraceSynthesizerAdapter synthesizer;
    private final WorldmakerConfig config;

    @Override
    public Health health() {
        var overview = graph.overview();

        Health.Builder builder = config.isEnabled()
                ? Health.up()
                : Health.outOfService();

        return builder
                .withDetail("dependencies", overview.totalDependencies())
                .withDetail("circularDependencies", overview.circularDependencies())
                .withDetail("graphEntities", overview.entityCount())
                .withDetail("catalogEntities", catalog.count())
                .withDetail("cachedResolutions", graph.cacheStats().cacheSize())
                .withDetail("bufferedTraces", traceBuffer.count())
                .withDetail("flowExecutions", synthesizer.executionCount())
                .build();
    }
}
