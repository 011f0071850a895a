package com.worldmaker.core.graph;

/**
 * An edge reached during a transitive walk, tagged with the hop count at which
 * its source was processed plus one.
 */
public record TransitiveDependency(DependencyEdge edge, int hopsFromSource) {}
