package com.worldmaker.core.resolve;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.worldmaker.core.graph.BlastRadiusResult;
import com.worldmaker.core.graph.DependencyEdge;
import com.worldmaker.core.graph.TransitiveDependency;
import com.worldmaker.core.impact.ImpactReport;

import java.util.List;

/**
 * Resolved neighbourhood of an entity.
 *
 * Only the sections the {@link ResolutionMode} asks for are populated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependencyResolution(
        String entityId,
        ResolutionMode depth,
        List<DependencyEdge> dependsOn,
        List<DependencyEdge> dependedOnBy,
        List<TransitiveDependency> transitiveDependencies,
        BlastRadiusResult blastRadius,
        ImpactReport impact,
        Statistics statistics
) {

    public record Statistics(
            int directDependencyCount,
            int directDependentCount,
            int transitiveCount,
            int totalCount
    ) {}
}
