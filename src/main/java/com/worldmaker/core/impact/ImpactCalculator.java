package com.worldmaker.core.impact;

import com.worldmaker.core.graph.BlastRadiusResult;
import com.worldmaker.core.graph.BlastRadiusResult.AffectedEntity;
import com.worldmaker.core.graph.EntityLookup;
import com.worldmaker.core.graph.EntityRef;
import com.worldmaker.core.graph.GraphQueries;
import com.worldmaker.core.graph.Severity;
import com.worldmaker.core.impact.ImpactReport.EntityContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns blast radii into severity classifications and operator advice.
 *
 * Thresholds are fixed literals.
 */
@Slf4j
public class ImpactCalculator {

    static final String PLATFORM_TYPE = "platform";
    static final String PLATFORM_FIELD = "platform_id";
    static final int CASCADE_MAX_DEPTH = 10;

    static final String CIRCUIT_BREAKER_ADVICE = "CRITICAL: High blast radius. Consider adding circuit breakers.";
    static final String FALLBACK_ADVICE = "Add fallback/degraded-mode capabilities for downstream consumers.";
    static final String SPLIT_SERVICE_ADVICE = "Many upstream dependents. Consider splitting into smaller services.";
    static final String BULKHEAD_ADVICE = "Multiple critical dependencies. Implement bulkhead patterns.";
    static final String NO_CONCERNS_ADVICE = "No immediate concerns. Continue monitoring.";

    private final GraphQueries graphQueries;
    private final EntityLookup entityLookup;

    public ImpactCalculator(GraphQueries graphQueries, EntityLookup entityLookup) {
        this.graphQueries = graphQueries;
        this.entityLookup = entityLookup;
    }

    // ==================== Blast Radius ====================

    public ImpactReport calculateBlastRadius(String id) {
        var blast = graphQueries.calculateBlastRadius(id);
        var context = buildContext(blast.root());
        var recommendations = recommend(blast.blastRadius(), context);

        log.debug("Impact for {}: radius={}, recommendations={}", id, blast.blastRadius(), recommendations.size());
        return new ImpactReport(
                id,
                blast.root(),
                blast.blastRadius(),
                blast.maxDepth(),
                blast.affected(),
                context,
                recommendations
        );
    }

    private EntityContext buildContext(EntityRef root) {
        var platform = entityLookup.get(root.type(), root.id())
                .flatMap(entity -> entity.stringField(PLATFORM_FIELD))
                .map(platformId -> entityLookup.resolve(PLATFORM_TYPE, platformId))
                .orElse(null);

        return new EntityContext(
                root,
                platform,
                graphQueries.getDependentsOf(root.id()).size(),
                graphQueries.getDependenciesOf(root.id()).size()
        );
    }

    static List<String> recommend(int blastRadius, EntityContext context) {
        List<String> recommendations = new ArrayList<>();
        if (blastRadius > 10) {
            recommendations.add(CIRCUIT_BREAKER_ADVICE);
        }
        if (blastRadius > 5) {
            recommendations.add(FALLBACK_ADVICE);
        }
        if (context.upstreamDependents() > 5) {
            recommendations.add(SPLIT_SERVICE_ADVICE);
        }
        if (context.downstreamDependencies() > 3) {
            recommendations.add(BULKHEAD_ADVICE);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(NO_CONCERNS_ADVICE);
        }
        return List.copyOf(recommendations);
    }

    // ==================== Failure Simulation ====================

    public FailureSimulation simulateFailure(String id) {
        var blast = graphQueries.calculateBlastRadius(id);
        int totalImpact = countSeriousImpact(blast);
        var severity = classifySeverity(totalImpact);

        log.info("Simulated failure of {}: total impact {} -> {}", id, totalImpact, severity.wireName());
        return new FailureSimulation(
                id,
                blast.root().name(),
                blast.blastRadius(),
                blast.maxDepth(),
                totalImpact,
                severity,
                blast.affected(),
                countBySeverity(blast.affected()),
                groupByDepth(blast.affected())
        );
    }

    static Severity classifySeverity(int totalImpact) {
        if (totalImpact >= 10) return Severity.CRITICAL;
        if (totalImpact >= 5) return Severity.HIGH;
        if (totalImpact >= 2) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private int countSeriousImpact(BlastRadiusResult blast) {
        return (int) blast.affected().stream()
                .filter(a -> a.hopsAway() <= CASCADE_MAX_DEPTH)
                .filter(a -> a.severity().isAtLeast(Severity.HIGH))
                .count();
    }

    private Map<String, Integer> countBySeverity(List<AffectedEntity> affected) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Severity severity : List.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW)) {
            counts.put(severity.wireName(), 0);
        }
        affected.forEach(a -> counts.merge(a.severity().wireName(), 1, Integer::sum));
        return counts;
    }

    private Map<Integer, List<String>> groupByDepth(List<AffectedEntity> affected) {
        Map<Integer, List<String>> byDepth = new TreeMap<>();
        affected.forEach(a -> byDepth.computeIfAbsent(a.hopsAway(), k -> new ArrayList<>()).add(a.name()));
        return byDepth;
    }
}
