package com.worldmaker.core.graph;

import java.util.Optional;

/**
 * Read access to the entities behind graph ids.
 *
 * A missing entity is a normal answer: the graph only ever uses the lookup to
 * decorate results with names.
 */
@FunctionalInterface
public interface EntityLookup {

    /**
     * Finds an entity by type and id.
     *
     * @param type the entity type, e.g. {@code service} or {@code platform}
     * @param id the entity id
     * @return the entity if known
     */
    Optional<EntityRecord> get(String type, String id);

    /**
     * Resolves a display name, falling back to {@link EntityRef#UNKNOWN_NAME}.
     */
    default EntityRef resolve(String type, String id) {
        return get(type, id)
                .map(entity -> new EntityRef(id, type, entity.name() != null ? entity.name() : EntityRef.UNKNOWN_NAME))
                .orElseGet(() -> EntityRef.unnamed(id, type));
    }

    static EntityLookup empty() {
        return (type, id) -> Optional.empty();
    }
}
