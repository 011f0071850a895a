package com.worldmaker.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A typed entity known to an external catalog.
 *
 * Fields are free-form; callers read them through {@link #field(String)} and
 * {@link #stringField(String)} rather than casting the map themselves.
 */
public record EntityRecord(
        String type,
        String id,
        String name,
        Map<String, Object> fields
) {

    public EntityRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<Object> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<String> stringField(String key) {
        return field(key).map(String::valueOf);
    }

    public EntityRef toRef() {
        return new EntityRef(id, type, name);
    }
}
