package com.worldmaker.core.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link EntityLookup} for tests.
 */
public class TestEntities implements EntityLookup {

    private final Map<String, EntityRecord> entities = new HashMap<>();

    public TestEntities add(String type, String id, String name) {
        return add(type, id, name, Map.of());
    }

    public TestEntities add(String type, String id, String name, Map<String, Object> fields) {
        entities.put(type + ":" + id, new EntityRecord(type, id, name, fields));
        return this;
    }

    @Override
    public Optional<EntityRecord> get(String type, String id) {
        return Optional.ofNullable(entities.get(type + ":" + id));
    }
}
