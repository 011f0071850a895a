package com.worldmaker.core.service.catalog;

import com.worldmaker.core.graph.EntityRecord;
import com.worldmaker.core.service.config.MetricsConfig;
import com.worldmaker.core.trace.FlowDefinition;
import com.worldmaker.core.trace.FlowStep;
import com.worldmaker.core.trace.ServiceDescriptor;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of EntityCatalog.
 *
 * Entities are kept per type in registration order.
 * Thread-safe using ConcurrentHashMap and synchronized per-type maps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryEntityCatalog implements EntityCatalog {

    static final String FLOW_TYPE_FIELD = "flow_type";
    static final String SERVICE_TYPE_FIELD = "service_type";
    static final String API_VERSION_FIELD = "api_version";
    static final String METADATA_FIELD = "metadata";

    private final MetricsConfig metricsConfig;

    private final Map<String, Map<String, EntityRecord>> entitiesByType = new ConcurrentHashMap<>();
    private final Map<String, List<FlowStep>> stepsByFlow = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "worldmaker.store.entities.count",
                "Number of entities in the catalog",
                this::count
        );
        log.info("InMemoryEntityCatalog initialized");
    }

    // ==================== Entities ====================

    @Override
    public EntityRecord register(EntityRecord entity) {
        var byId = entitiesByType.computeIfAbsent(entity.type(),
                type -> Collections.synchronizedMap(new LinkedHashMap<>()));
        byId.put(entity.id(), entity);
        log.debug("Registered {} entity: {}", entity.type(), entity.id());
        return entity;
    }

    @Override
    public Optional<EntityRecord> get(String type, String id) {
        var byId = entitiesByType.get(type);
        if (byId == null || id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<EntityRecord> findByType(String type) {
        var byId = entitiesByType.get(type);
        if (byId == null) return List.of();
        synchronized (byId) {
            return List.copyOf(byId.values());
        }
    }

    @Override
    public int count() {
        return entitiesByType.values().stream()
                .mapToInt(Map::size)
                .sum();
    }

    // ==================== Flows ====================

    @Override
    public void registerFlow(FlowDefinition flow, List<FlowStep> steps) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FLOW_TYPE_FIELD, flow.flowType());
        register(new EntityRecord(FLOW_TYPE, flow.id(), flow.name(), fields));
        stepsByFlow.put(flow.id(), List.copyOf(steps));
        log.info("Registered flow {} ({}) with {} steps", flow.id(), flow.name(), steps.size());
    }

    @Override
    public Optional<FlowDefinition> findFlow(String flowId) {
        return get(FLOW_TYPE, flowId).map(InMemoryEntityCatalog::toFlow);
    }

    @Override
    public List<FlowStep> findSteps(String flowId) {
        return stepsByFlow.getOrDefault(flowId, List.of());
    }

    @Override
    public Optional<ServiceDescriptor> findService(String serviceId) {
        return get(SERVICE_TYPE, serviceId).map(InMemoryEntityCatalog::toService);
    }

    @Override
    public List<FlowDefinition> findAllFlows() {
        List<FlowDefinition> flows = new ArrayList<>();
        for (EntityRecord entity : findByType(FLOW_TYPE)) {
            flows.add(toFlow(entity));
        }
        return flows;
    }

    // --- Private helpers ---

    private static FlowDefinition toFlow(EntityRecord entity) {
        return new FlowDefinition(entity.id(), entity.name(), entity.stringField(FLOW_TYPE_FIELD).orElse(null));
    }

    @SuppressWarnings("unchecked")
    private static ServiceDescriptor toService(EntityRecord entity) {
        Map<String, Object> metadata = entity.field(METADATA_FIELD)
                .filter(Map.class::isInstance)
                .map(value -> (Map<String, Object>) value)
                .orElse(Map.of());

        return new ServiceDescriptor(
                entity.id(),
                entity.name(),
                entity.stringField(SERVICE_TYPE_FIELD).orElse(null),
                entity.stringField(API_VERSION_FIELD).orElse(null),
                metadata
        );
    }
}
