package com.worldmaker.core.resolve;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * TTL memoisation in front of a {@link DependencyResolver}, keyed by
 * {@code "{id}:{mode}"} and invalidated explicitly by entity id.
 *
 * Single-threaded: concurrent callers must synchronise externally.
 */
@Slf4j
public class ResolutionCache {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private final DependencyResolver resolver;
    private final Duration ttl;
    private final Clock clock;

    private final Map<String, CachedResolution> entries = new HashMap<>();
    private long resolutionCount;
    private long cacheHits;

    public ResolutionCache(DependencyResolver resolver) {
        this(resolver, DEFAULT_TTL, Clock.systemUTC());
    }

    public ResolutionCache(DependencyResolver resolver, Duration ttl, Clock clock) {
        this.resolver = resolver;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached resolution when younger than the TTL, otherwise
     * resolves and stores a fresh one.
     */
    public DependencyResolution resolve(String entityId, ResolutionMode mode) {
        String key = cacheKey(entityId, mode);
        var cached = lookup(key);
        if (cached != null) {
            cacheHits++;
            return cached;
        }

        resolutionCount++;
        var resolution = resolver.resolve(entityId, mode);
        entries.put(key, new CachedResolution(clock.instant(), resolution));
        return resolution;
    }

    /**
     * Drops every cached resolution of {@code entityId}.
     *
     * @return number of entries removed
     */
    public int invalidate(String entityId) {
        String prefix = entityId + ":";
        List<String> keys = entries.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList();
        keys.forEach(entries::remove);

        log.debug("Cache invalidated for {} ({} entries)", entityId, keys.size());
        return keys.size();
    }

    public void invalidateAll() {
        entries.clear();
        log.info("Dependency resolution cache fully invalidated");
    }

    /**
     * Removes every entry older than the TTL.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        List<String> expired = entries.entrySet().stream()
                .filter(entry -> !entry.getValue().isFresh(now, ttl))
                .map(Map.Entry::getKey)
                .toList();
        expired.forEach(entries::remove);
        return expired.size();
    }

    public CacheStats stats() {
        long lookups = Math.max(resolutionCount + cacheHits, 1);
        return new CacheStats(
                resolutionCount,
                cacheHits,
                entries.size(),
                (double) cacheHits / lookups
        );
    }

    private DependencyResolution lookup(String key) {
        var entry = entries.get(key);
        if (entry == null) return null;

        if (entry.isFresh(clock.instant(), ttl)) {
            return entry.value();
        }
        entries.remove(key);
        return null;
    }

    static String cacheKey(String entityId, ResolutionMode mode) {
        return entityId + ":" + mode.wireName();
    }

    private record CachedResolution(Instant storedAt, DependencyResolution value) {

        boolean isFresh(Instant now, Duration ttl) {
            return Duration.between(storedAt, now).compareTo(ttl) < 0;
        }
    }
}
