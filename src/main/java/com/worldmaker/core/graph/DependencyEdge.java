package com.worldmaker.core.graph;

import java.time.Instant;

/**
 * A directed dependency: {@code source} depends on {@code target}.
 *
 * The circular flag is decided once, when the edge is inserted, and is never
 * re-evaluated afterwards.
 */
public record DependencyEdge(
        String id,
        String sourceId,
        String sourceType,
        String targetId,
        String targetType,
        String dependencyType,
        Severity severity,
        boolean circular,
        Instant createdAt
) {}
