package com.worldmaker.core.graph;

import java.util.List;

/**
 * Everything that transitively depends on {@code root}.
 *
 * @param root the failing entity
 * @param blastRadius number of affected entities
 * @param affected each affected entity once, at its shortest distance
 * @param maxDepth largest {@code hopsAway} in {@code affected}, 0 when empty
 */
public record BlastRadiusResult(
        EntityRef root,
        int blastRadius,
        List<AffectedEntity> affected,
        int maxDepth
) {

    /**
     * An entity hit by a failure of the root.
     *
     * @param severity severity of the edge through which it was first reached
     */
    public record AffectedEntity(
            String id,
            String type,
            String name,
            Severity severity,
            int hopsAway
    ) {}
}
