package com.worldmaker.core.impact;

import com.worldmaker.core.graph.BlastRadiusResult.AffectedEntity;
import com.worldmaker.core.graph.Severity;

import java.util.List;
import java.util.Map;

/**
 * Outcome of taking an entity down.
 *
 * @param totalImpact affected entities within the cascade depth reached
 *                    through a high or critical edge
 * @param severity classification of {@code totalImpact}
 * @param impactBySeverity affected counts keyed by edge severity wire name
 * @param impactByDepth affected names keyed by hop distance, ascending
 */
public record FailureSimulation(
        String entityId,
        String entityName,
        int blastRadius,
        int maxCascadeDepth,
        int totalImpact,
        Severity severity,
        List<AffectedEntity> affected,
        Map<String, Integer> impactBySeverity,
        Map<Integer, List<String>> impactByDepth
) {}
