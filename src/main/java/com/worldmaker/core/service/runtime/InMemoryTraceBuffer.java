package com.worldmaker.core.service.runtime;

import com.worldmaker.core.service.config.MetricsConfig;
import com.worldmaker.core.service.config.RetentionConfig;
import com.worldmaker.core.trace.Trace;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of TraceBuffer.
 *
 * Stores synthesized traces with TTL-based and capacity-based eviction.
 * Thread-safe using ConcurrentHashMap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryTraceBuffer implements TraceBuffer {

    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    private final Map<String, StoredTrace> traces = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> flowToTraces = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "worldmaker.store.traces.count",
                "Number of traces in memory",
                this::count
        );
        log.info("InMemoryTraceBuffer initialized, TTL: {} minutes, max traces: {}",
                retentionConfig.getTrace().getTtlMinutes(),
                retentionConfig.getTrace().getMaxCount());
    }

    @Override
    public void store(Trace trace) {
        traces.put(trace.traceId(), new StoredTrace(trace, clock.instant(), sequence.incrementAndGet()));
        if (trace.flowId() != null) {
            flowToTraces.computeIfAbsent(trace.flowId(), k -> ConcurrentHashMap.newKeySet()).add(trace.traceId());
        }
        log.debug("Stored trace {} for flow {}", trace.traceId(), trace.flowId());
        enforceCapacity();
    }

    @Override
    public Optional<Trace> getTrace(String traceId) {
        return Optional.ofNullable(traces.get(traceId))
                .map(StoredTrace::trace);
    }

    @Override
    public Collection<Trace> getAll() {
        return newestFirst(traces.values());
    }

    @Override
    public Collection<Trace> getTracesForFlow(String flowId) {
        Set<String> traceIds = flowToTraces.get(flowId);
        if (traceIds == null) return Collections.emptyList();

        return newestFirst(traceIds.stream()
                .map(traces::get)
                .filter(Objects::nonNull)
                .toList());
    }

    @Override
    public boolean delete(String traceId) {
        StoredTrace removed = traces.remove(traceId);
        if (removed != null) {
            // Clean up flow mapping
            String flowId = removed.trace().flowId();
            Set<String> traceIds = flowId != null ? flowToTraces.get(flowId) : null;
            if (traceIds != null) {
                traceIds.remove(traceId);
            }
            log.debug("Trace deleted: {}", traceId);
            return true;
        }
        return false;
    }

    @Override
    public int deleteTracesForFlow(String flowId) {
        Set<String> traceIds = flowToTraces.remove(flowId);
        if (traceIds == null) return 0;

        int deleted = 0;
        for (String traceId : traceIds) {
            if (traces.remove(traceId) != null) {
                deleted++;
            }
        }
        log.info("Deleted {} traces for flow: {}", deleted, flowId);
        return deleted;
    }

    @Override
    public int count() {
        return traces.size();
    }

    @Override
    @Scheduled(fixedDelayString = "${worldmaker.retention.trace.eviction-interval-ms:60000}")
    public int evictExpired() {
        long ttlMinutes = retentionConfig.getTrace().getTtlMinutes();
        if (ttlMinutes <= 0) return 0;

        Instant cutoff = clock.instant().minus(Duration.ofMinutes(ttlMinutes));
        List<String> toEvict = new ArrayList<>();

        for (Map.Entry<String, StoredTrace> entry : traces.entrySet()) {
            if (entry.getValue().storedAt().isBefore(cutoff)) {
                toEvict.add(entry.getKey());
            }
        }

        for (String traceId : toEvict) {
            delete(traceId);
        }

        if (!toEvict.isEmpty()) {
            log.info("Evicted {} expired traces", toEvict.size());
        }
        return toEvict.size();
    }

    // --- Private helpers ---

    private void enforceCapacity() {
        int maxCount = retentionConfig.getTrace().getMaxCount();
        if (maxCount <= 0 || traces.size() <= maxCount) return;

        var oldest = traces.values().stream()
                .sorted(Comparator.comparingLong(StoredTrace::sequence))
                .limit(traces.size() - (long) maxCount)
                .toList();
        oldest.forEach(stored -> delete(stored.trace().traceId()));
        log.info("Trace buffer at capacity ({}), evicted {} oldest traces", maxCount, oldest.size());
    }

    private static List<Trace> newestFirst(Collection<StoredTrace> stored) {
        return stored.stream()
                .sorted(Comparator.comparingLong(StoredTrace::sequence).reversed())
                .map(StoredTrace::trace)
                .toList();
    }

    private record StoredTrace(Trace trace, Instant storedAt, long sequence) {}
}
