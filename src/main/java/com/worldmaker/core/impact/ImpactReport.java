package com.worldmaker.core.impact;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.worldmaker.core.graph.BlastRadiusResult.AffectedEntity;
import com.worldmaker.core.graph.EntityRef;

import java.util.List;

/**
 * Blast radius of an entity enriched with its surroundings and advice.
 */
public record ImpactReport(
        String entityId,
        EntityRef root,
        int blastRadius,
        int maxDepth,
        List<AffectedEntity> affected,
        EntityContext context,
        List<String> recommendations
) {

    /**
     * Where the entity sits: its owning platform and its direct neighbourhood.
     *
     * @param platform owning platform, absent when the entity records none
     * @param upstreamDependents number of edges pointing at the entity
     * @param downstreamDependencies number of edges leaving the entity
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EntityContext(
            EntityRef entity,
            EntityRef platform,
            int upstreamDependents,
            int downstreamDependencies
    ) {}
}
