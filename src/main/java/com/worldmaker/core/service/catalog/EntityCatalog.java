package com.worldmaker.core.service.catalog;

import com.worldmaker.core.graph.EntityLookup;
import com.worldmaker.core.graph.EntityRecord;
import com.worldmaker.core.trace.FlowDefinition;
import com.worldmaker.core.trace.FlowSource;
import com.worldmaker.core.trace.FlowStep;

import java.util.List;

/**
 * Interface for the entity catalog.
 *
 * Holds the services, platforms and flows the engines refer to by id, and
 * serves them to the graph engine as an {@link EntityLookup} and to the
 * trace engine as a {@link FlowSource}.
 */
public interface EntityCatalog extends EntityLookup, FlowSource {

    String SERVICE_TYPE = "service";
    String PLATFORM_TYPE = "platform";
    String FLOW_TYPE = "flow";

    /**
     * Stores an entity, replacing any entity with the same type and id.
     *
     * @param entity the entity to store
     * @return the stored entity
     */
    EntityRecord register(EntityRecord entity);

    /**
     * Stores a flow as a {@code flow} entity together with its steps.
     *
     * @param flow the flow definition
     * @param steps the flow's steps, replacing any previous ones
     */
    void registerFlow(FlowDefinition flow, List<FlowStep> steps);

    /**
     * Lists entities of one type in registration order.
     *
     * @param type the entity type
     * @return the entities, empty if none
     */
    List<EntityRecord> findByType(String type);

    /**
     * Gets the count of stored entities across all types.
     *
     * @return number of entities
     */
    int count();
}
