package com.worldmaker.core.graph;

import com.worldmaker.core.graph.BlastRadiusResult.AffectedEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-side traversals over an {@link EdgeStore}.
 *
 * Unknown ids are not errors: every query answers with an empty result.
 */
@Slf4j
public class GraphQueries {

    public static final int DEFAULT_TRANSITIVE_DEPTH = 10;

    private final EdgeStore edgeStore;
    private final EntityLookup entityLookup;

    public GraphQueries(EdgeStore edgeStore, EntityLookup entityLookup) {
        this.edgeStore = edgeStore;
        this.entityLookup = entityLookup;
    }

    public List<DependencyEdge> getDependenciesOf(String id) {
        return edgeStore.getDependenciesOf(id);
    }

    public List<DependencyEdge> getDependentsOf(String id) {
        return edgeStore.getDependentsOf(id);
    }

    public List<TransitiveDependency> getTransitiveDependencies(String sourceId) {
        return getTransitiveDependencies(sourceId, DEFAULT_TRANSITIVE_DEPTH);
    }

    /**
     * Forward breadth-first walk from {@code sourceId}.
     *
     * A node is marked visited when it is dequeued, so a target reached through
     * several paths before its own turn is reported once per path.
     */
    public List<TransitiveDependency> getTransitiveDependencies(String sourceId, int maxDepth) {
        Set<String> visited = new HashSet<>();
        Deque<Hop> queue = new ArrayDeque<>();
        List<TransitiveDependency> result = new ArrayList<>();
        queue.add(new Hop(sourceId, 0));

        while (!queue.isEmpty()) {
            Hop current = queue.poll();
            if (visited.contains(current.entityId()) || current.depth() > maxDepth) {
                continue;
            }
            visited.add(current.entityId());

            for (DependencyEdge edge : edgeStore.getDependenciesOf(current.entityId())) {
                result.add(new TransitiveDependency(edge, current.depth() + 1));
                if (!visited.contains(edge.targetId())) {
                    queue.add(current.next(edge.targetId()));
                }
            }
        }

        log.debug("Transitive dependencies of {}: {} edges (maxDepth={})", sourceId, result.size(), maxDepth);
        return result;
    }

    /**
     * Reverse breadth-first walk: who breaks if {@code id} fails.
     */
    public BlastRadiusResult calculateBlastRadius(String id) {
        Set<String> visited = new HashSet<>();
        Set<String> discovered = new HashSet<>();
        Deque<Hop> queue = new ArrayDeque<>();
        List<AffectedEntity> affected = new ArrayList<>();
        discovered.add(id);
        queue.add(new Hop(id, 0));

        while (!queue.isEmpty()) {
            Hop current = queue.poll();
            if (visited.contains(current.entityId())) {
                continue;
            }
            visited.add(current.entityId());

            for (DependencyEdge edge : edgeStore.getDependentsOf(current.entityId())) {
                String source = edge.sourceId();
                if (visited.contains(source) || !discovered.add(source)) {
                    continue;
                }
                var ref = entityLookup.resolve(edge.sourceType(), source);
                affected.add(new AffectedEntity(
                        source,
                        edge.sourceType(),
                        ref.name(),
                        edge.severity(),
                        current.depth() + 1
                ));
                queue.add(current.next(source));
            }
        }

        int maxDepth = affected.stream()
                .mapToInt(AffectedEntity::hopsAway)
                .max()
                .orElse(0);

        log.debug("Blast radius of {}: {} affected, max depth {}", id, affected.size(), maxDepth);
        return new BlastRadiusResult(rootRef(id), affected.size(), List.copyOf(affected), maxDepth);
    }

    /**
     * Edges flagged circular at insertion time.
     */
    public List<DependencyEdge> detectCircularDependencies() {
        return edgeStore.allEdges().stream()
                .filter(DependencyEdge::circular)
                .toList();
    }

    public GraphOverview overview() {
        return new GraphOverview(
                edgeStore.size(),
                detectCircularDependencies().size(),
                edgeStore.entityIds().size()
        );
    }

    /**
     * Resolves the root's type from the edges that mention it.
     */
    EntityRef rootRef(String id) {
        String type = edgeStore.getDependentsOf(id).stream()
                .map(DependencyEdge::targetType)
                .findFirst()
                .or(() -> edgeStore.getDependenciesOf(id).stream()
                        .map(DependencyEdge::sourceType)
                        .findFirst())
                .orElse(EdgeStore.DEFAULT_ENTITY_TYPE);
        return entityLookup.resolve(type, id);
    }
}
