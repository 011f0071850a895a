package com.worldmaker.core.resolve;

import com.worldmaker.core.graph.GraphQueries;
import com.worldmaker.core.graph.TransitiveDependency;
import com.worldmaker.core.impact.ImpactCalculator;
import com.worldmaker.core.resolve.DependencyResolution.Statistics;

import java.util.List;

/**
 * Computes a {@link DependencyResolution} straight from the graph, no caching.
 */
public class DependencyResolver {

    private final GraphQueries graphQueries;
    private final ImpactCalculator impactCalculator;

    public DependencyResolver(GraphQueries graphQueries, ImpactCalculator impactCalculator) {
        this.graphQueries = graphQueries;
        this.impactCalculator = impactCalculator;
    }

    public DependencyResolution resolve(String entityId, ResolutionMode mode) {
        var dependsOn = graphQueries.getDependenciesOf(entityId);
        var dependedOnBy = graphQueries.getDependentsOf(entityId);

        List<TransitiveDependency> transitive = mode == ResolutionMode.DIRECT
                ? null
                : graphQueries.getTransitiveDependencies(entityId);
        var blastRadius = mode == ResolutionMode.BLAST_RADIUS
                ? graphQueries.calculateBlastRadius(entityId)
                : null;
        var impact = mode == ResolutionMode.FULL
                ? impactCalculator.calculateBlastRadius(entityId)
                : null;

        int transitiveCount = transitive != null ? transitive.size() : 0;
        var statistics = new Statistics(
                dependsOn.size(),
                dependedOnBy.size(),
                transitiveCount,
                dependsOn.size() + dependedOnBy.size() + transitiveCount
        );

        return new DependencyResolution(
                entityId,
                mode,
                dependsOn,
                dependedOnBy,
                transitive,
                blastRadius,
                impact,
                statistics
        );
    }
}
