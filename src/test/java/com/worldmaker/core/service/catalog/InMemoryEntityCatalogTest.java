package com.worldmaker.core.service.catalog;

import com.worldmaker.core.graph.EntityRecord;
import com.worldmaker.core.graph.EntityRef;
import com.worldmaker.core.service.config.MetricsConfig;
import com.worldmaker.core.service.config.WorldmakerConfig;
import com.worldmaker.core.trace.FlowDefinition;
import com.worldmaker.core.trace.FlowStep;
import com.worldmaker.core.trace.ServiceDescriptor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEntityCatalogTest {

    private InMemoryEntityCatalog catalog;

    @BeforeEach
    void setUp() {
        var config = new WorldmakerConfig();
        config.getFeatures().setMetricsEnabled(false);
        catalog = new InMemoryEntityCatalog(new MetricsConfig(new SimpleMeterRegistry(), config));
    }

    @Test
    @DisplayName("Entities are looked up by type and id")
    void registerAndGet() {
        catalog.register(new EntityRecord("service", "orders", "OrderService", null));

        assertThat(catalog.get("service", "orders")).map(EntityRecord::name).contains("OrderService");
        assertThat(catalog.get("platform", "orders")).isEmpty();
        assertThat(catalog.resolve("service", "missing")).isEqualTo(new EntityRef("missing", "service", "unknown"));
        assertThat(catalog.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Re-registering replaces the entity")
    void registerReplaces() {
        catalog.register(new EntityRecord("service", "orders", "Orders v1", null));
        catalog.register(new EntityRecord("service", "orders", "Orders v2", null));

        assertThat(catalog.findByType("service")).extracting(EntityRecord::name).containsExactly("Orders v2");
    }

    @Test
    @DisplayName("Service entities map onto service descriptors")
    void findService() {
        catalog.register(new EntityRecord("service", "payments", "PaymentService", Map.of(
                "service_type", "grpc",
                "api_version", "v4",
                "metadata", Map.of("language", "go"))));

        assertThat(catalog.findService("payments")).contains(new ServiceDescriptor(
                "payments", "PaymentService", "grpc", "v4", Map.of("language", "go")));
        assertThat(catalog.findService("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Flows are stored as flow entities with their steps")
    void registerFlow() {
        var flow = new FlowDefinition("checkout", "Checkout", "purchase");
        var steps = List.of(new FlowStep(1, "web", "orders"));

        catalog.registerFlow(flow, steps);

        assertThat(catalog.findFlow("checkout")).contains(flow);
        assertThat(catalog.findSteps("checkout")).isEqualTo(steps);
        assertThat(catalog.findSteps("unknown")).isEmpty();
        assertThat(catalog.findAllFlows()).containsExactly(flow);
        assertThat(catalog.get("flow", "checkout")).map(EntityRecord::name).contains("Checkout");
    }
}
