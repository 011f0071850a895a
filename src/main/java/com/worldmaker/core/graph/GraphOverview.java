package com.worldmaker.core.graph;

/**
 * Aggregate counters for the dependency graph.
 */
public record GraphOverview(
        int totalDependencies,
        int circularDependencies,
        int entityCount
) {}
