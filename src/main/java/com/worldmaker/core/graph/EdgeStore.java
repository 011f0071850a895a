package com.worldmaker.core.graph;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only store of dependency edges with forward and reverse adjacency
 * indices keyed by entity id.
 *
 * Not safe for concurrent mutation: callers serialise writes, reads may run
 * concurrently with each other.
 */
@Slf4j
public class EdgeStore {

    public static final String DEFAULT_ENTITY_TYPE = "service";
    public static final String DEFAULT_DEPENDENCY_TYPE = "runtime";

    static final int CYCLE_CHECK_MAX_DEPTH = 20;

    private final Clock clock;

    private final List<DependencyEdge> edges = new ArrayList<>();
    private final Map<String, List<Integer>> forwardIndex = new HashMap<>();
    private final Map<String, List<Integer>> reverseIndex = new HashMap<>();

    public EdgeStore() {
        this(Clock.systemUTC());
    }

    public EdgeStore(Clock clock) {
        this.clock = clock;
    }

    // ==================== Mutation ====================

    /**
     * Appends a dependency edge and indexes it.
     *
     * The new edge is flagged circular when {@code targetId} already reaches
     * {@code sourceId}. Edges inserted earlier are left untouched even if this
     * edge closes a loop through them.
     *
     * @return the stored edge
     * @throws IllegalArgumentException if either id is blank
     */
    public DependencyEdge addEdge(String sourceId, String sourceType,
                                  String targetId, String targetType,
                                  String dependencyType, Severity severity) {
        requireId(sourceId, "sourceId");
        requireId(targetId, "targetId");

        boolean circular = hasPath(targetId, sourceId, CYCLE_CHECK_MAX_DEPTH);
        var edge = new DependencyEdge(
                UUID.randomUUID().toString(),
                sourceId,
                orDefault(sourceType, DEFAULT_ENTITY_TYPE),
                targetId,
                orDefault(targetType, DEFAULT_ENTITY_TYPE),
                orDefault(dependencyType, DEFAULT_DEPENDENCY_TYPE),
                severity != null ? severity : Severity.MEDIUM,
                circular,
                clock.instant()
        );

        int index = edges.size();
        edges.add(edge);
        forwardIndex.computeIfAbsent(sourceId, k -> new ArrayList<>()).add(index);
        reverseIndex.computeIfAbsent(targetId, k -> new ArrayList<>()).add(index);

        if (circular) {
            log.warn("Circular dependency closed by edge {} ({} -> {})", edge.id(), sourceId, targetId);
        } else {
            log.debug("Edge added: {} -> {} ({})", sourceId, targetId, edge.dependencyType());
        }
        return edge;
    }

    /**
     * Drops every edge and index entry.
     */
    public void clear() {
        int removed = edges.size();
        edges.clear();
        forwardIndex.clear();
        reverseIndex.clear();
        log.info("Edge store cleared ({} edges removed)", removed);
    }

    // ==================== Lookups ====================

    /**
     * Edges whose source is {@code sourceId}, in insertion order.
     */
    public List<DependencyEdge> getDependenciesOf(String sourceId) {
        return resolve(forwardIndex.get(sourceId));
    }

    /**
     * Edges whose target is {@code targetId}, in insertion order.
     */
    public List<DependencyEdge> getDependentsOf(String targetId) {
        return resolve(reverseIndex.get(targetId));
    }

    public Optional<DependencyEdge> findById(String edgeId) {
        return edges.stream()
                .filter(edge -> edge.id().equals(edgeId))
                .findFirst();
    }

    public List<DependencyEdge> allEdges() {
        return Collections.unmodifiableList(new ArrayList<>(edges));
    }

    public Set<String> entityIds() {
        var ids = new HashSet<>(forwardIndex.keySet());
        ids.addAll(reverseIndex.keySet());
        return ids;
    }

    public int size() {
        return edges.size();
    }

    // ==================== Reachability ====================

    /**
     * Bounded breadth-first search over the forward index.
     */
    boolean hasPath(String fromId, String toId, int maxDepth) {
        Set<String> visited = new HashSet<>();
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(fromId, 0));

        while (!queue.isEmpty()) {
            Hop current = queue.poll();
            if (current.entityId().equals(toId)) {
                return true;
            }
            if (visited.contains(current.entityId()) || current.depth() > maxDepth) {
                continue;
            }
            visited.add(current.entityId());

            for (DependencyEdge edge : getDependenciesOf(current.entityId())) {
                queue.add(current.next(edge.targetId()));
            }
        }
        return false;
    }

    // ==================== Helpers ====================

    private List<DependencyEdge> resolve(List<Integer> indices) {
        if (indices == null) return List.of();

        return indices.stream()
                .map(edges::get)
                .toList();
    }

    private static void requireId(String id, String field) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
