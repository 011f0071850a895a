package com.worldmaker.core.resolve;

/**
 * Counters exposed by {@link ResolutionCache}.
 *
 * @param hitRate {@code cacheHits / max(totalResolutions + cacheHits, 1)}
 */
public record CacheStats(
        long totalResolutions,
        long cacheHits,
        int cacheSize,
        double hitRate
) {}
