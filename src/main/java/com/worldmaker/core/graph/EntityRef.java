package com.worldmaker.core.graph;

/**
 * Lightweight reference to an entity, with its display name resolved.
 */
public record EntityRef(String id, String type, String name) {

    public static final String UNKNOWN_NAME = "unknown";

    public static EntityRef unnamed(String id, String type) {
        return new EntityRef(id, type, UNKNOWN_NAME);
    }
}
