package com.worldmaker.core.service.engine;

import com.worldmaker.core.graph.DependencyEdge;
import com.worldmaker.core.graph.EdgeStore;
import com.worldmaker.core.graph.GraphOverview;
import com.worldmaker.core.graph.GraphQueries;
import com.worldmaker.core.graph.Severity;
import com.worldmaker.core.impact.FailureSimulation;
import com.worldmaker.core.impact.ImpactCalculator;
import com.worldmaker.core.impact.ImpactReport;
import com.worldmaker.core.resolve.CacheStats;
import com.worldmaker.core.resolve.DependencyResolution;
import com.worldmaker.core.resolve.DependencyResolver;
import com.worldmaker.core.resolve.ResolutionCache;
import com.worldmaker.core.resolve.ResolutionMode;
import com.worldmaker.core.service.config.MetricsConfig;
import com.worldmaker.core.service.config.WorldmakerConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Adapter for the dependency graph engine.
 * Serializes writers against readers and keeps the resolution cache
 * consistent with the edge store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DependencyGraphAdapter {

    private final EdgeStore edgeStore;
    private final GraphQueries graphQueries;
    private final ImpactCalculator impactCalculator;
    private final DependencyResolver resolver;
    private final ResolutionCache resolutionCache;
    private final WorldmakerConfig config;
    private final MetricsConfig metricsConfig;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "worldmaker.store.edges.count",
                "Number of dependency edges in memory",
                () -> read(edgeStore::size)
        );
        log.info("DependencyGraphAdapter initialized, resolution cache {}",
                config.getFeatures().isResolutionCacheEnabled() ? "enabled" : "disabled");
    }

    // ==================== Writes ====================

    /**
     * Records a dependency and drops cached resolutions of both endpoints.
     */
    public DependencyEdge addDependency(String sourceId, String sourceType, String targetId, String targetType,
                                        String dependencyType, Severity severity) {
        lock.writeLock().lock();
        try {
            var edge = edgeStore.addEdge(sourceId, sourceType, targetId, targetType, dependencyType, severity);
            synchronized (resolutionCache) {
                resolutionCache.invalidate(sourceId);
                resolutionCache.invalidate(targetId);
            }
            recordEdgeAdded(edge);
            return edge;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Queries ====================

    public List<DependencyEdge> circularDependencies(int limit) {
        return read(() -> graphQueries.detectCircularDependencies().stream()
                .limit(Math.max(limit, 0))
                .toList());
    }

    /**
     * Resolves through the TTL cache unless the cache feature is switched off.
     */
    public DependencyResolution resolve(String entityId, ResolutionMode mode) {
        return metricsConfig.getResolutionTimer().record(() -> read(() -> {
            if (!config.getFeatures().isResolutionCacheEnabled()) {
                metricsConfig.getCacheMisses().increment();
                return resolver.resolve(entityId, mode);
            }
            synchronized (resolutionCache) {
                long hitsBefore = resolutionCache.stats().cacheHits();
                var resolution = resolutionCache.resolve(entityId, mode);
                if (resolutionCache.stats().cacheHits() > hitsBefore) {
                    metricsConfig.getCacheHits().increment();
                } else {
                    metricsConfig.getCacheMisses().increment();
                }
                return resolution;
            }
        }));
    }

    public ImpactReport blastRadius(String entityId) {
        return read(() -> impactCalculator.calculateBlastRadius(entityId));
    }

    public FailureSimulation simulateFailure(String entityId) {
        log.info("Simulating failure of {}", entityId);
        return read(() -> impactCalculator.simulateFailure(entityId));
    }

    public GraphOverview overview() {
        return read(graphQueries::overview);
    }

    // ==================== Cache Management ====================

    public CacheStats cacheStats() {
        synchronized (resolutionCache) {
            return resolutionCache.stats();
        }
    }

    public int invalidateCache(String entityId) {
        synchronized (resolutionCache) {
            int removed = resolutionCache.invalidate(entityId);
            log.info("Invalidated {} cached resolutions for {}", removed, entityId);
            return removed;
        }
    }

    public void invalidateCache() {
        synchronized (resolutionCache) {
            resolutionCache.invalidateAll();
        }
    }

    @Scheduled(fixedDelayString = "${worldmaker.resolution.cache-eviction-interval-ms:60000}")
    public int evictExpiredResolutions() {
        synchronized (resolutionCache) {
            int evicted = resolutionCache.evictExpired();
            if (evicted > 0) {
                log.debug("Evicted {} expired resolutions", evicted);
            }
            return evicted;
        }
    }

    // --- Private helpers ---

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void recordEdgeAdded(DependencyEdge edge) {
        metricsConfig.getEdgesAdded().increment();
        if (edge.circular()) {
            metricsConfig.getCircularEdges().increment();
        }
        log.info("Dependency added: {} -> {} ({}, {})",
                edge.sourceId(), edge.targetId(), edge.dependencyType(), edge.severity().wireName());
    }
}
