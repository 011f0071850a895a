package com.worldmaker.core.graph;

/**
 * Queue element for the breadth-first traversals: an entity and its distance
 * from the traversal root.
 */
record Hop(String entityId, int depth) {

    Hop next(String nextEntityId) {
        return new Hop(nextEntityId, depth + 1);
    }
}
