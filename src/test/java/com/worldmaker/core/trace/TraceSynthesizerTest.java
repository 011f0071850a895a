package com.worldmaker.core.trace;

import com.worldmaker.core.EngineException;
import com.worldmaker.core.trace.format.JaegerSpan;
import com.worldmaker.core.trace.format.OtelSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceSynthesizerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(START, ZoneOffset.UTC);

    private static final FlowDefinition CHECKOUT = new FlowDefinition("checkout", "Checkout", "purchase");

    private static final List<FlowStep> STEPS = List.of(
            new FlowStep(1, "web", "orders"),
            new FlowStep(2, "orders", "payments", "grpc"),
            new FlowStep(3, "payments", "ledger", "event_driven"));

    private static final Map<String, ServiceDescriptor> SERVICES = Map.of(
            "web", new ServiceDescriptor("web", "WebFrontend", "rest", "v2", Map.of("language", "typescript")),
            "orders", new ServiceDescriptor("orders", "OrderService", "rest", "v1", null),
            "payments", new ServiceDescriptor("payments", "PaymentService", "grpc", null, null),
            "ledger", new ServiceDescriptor("ledger", "LedgerService", "event_driven", "v3", null));

    private static TraceSynthesizer synthesizer(long seed) {
        return new TraceSynthesizer(new Random(seed), CLOCK);
    }

    private static Trace run(TraceSynthesizer synthesizer, boolean injectFailure, Integer failureStep) {
        return synthesizer.execute(CHECKOUT, STEPS, SERVICES, "staging", injectFailure, failureStep);
    }

    // ==================== Structure ====================

    @Nested
    class SuccessfulExecution {

        private final Trace trace = run(synthesizer(42), false, null);

        @Test
        @DisplayName("One root plus a client and server span per hop")
        void spanCount() {
            assertThat(trace.spanCount()).isEqualTo(7);
            assertThat(trace.spans()).hasSize(7);
            assertThat(trace.spansJaeger()).hasSize(7);
            assertThat(trace.status()).isEqualTo(StatusCode.OK);
            assertThat(trace.error()).isNull();
            assertThat(trace.failed()).isFalse();
        }

        @Test
        @DisplayName("Ids are lower-case hex of the expected width")
        void idFormats() {
            assertThat(trace.traceId()).matches("[0-9a-f]{32}");
            assertThat(trace.executionId()).matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
            assertThat(trace.spans()).allSatisfy(span -> {
                assertThat(span.traceId()).isEqualTo(trace.traceId());
                assertThat(span.spanId()).matches("[0-9a-f]{16}");
            });
            assertThat(trace.spans()).extracting(OtelSpan::spanId).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Root span describes the flow and spans the whole execution")
        void rootSpan() {
            var root = trace.spans().get(0);

            assertThat(root.parentSpanId()).isEmpty();
            assertThat(root.operationName()).isEqualTo("FLOW Checkout");
            assertThat(root.serviceName()).isEqualTo("worldmaker-flow-engine");
            assertThat(root.kind()).isEqualTo("SPAN_KIND_INTERNAL");
            assertThat(root.status().code()).isEqualTo("STATUS_CODE_OK");
            assertThat(root.attributes())
                    .containsEntry("flow.id", "checkout")
                    .containsEntry("flow.type", "purchase")
                    .containsEntry("flow.steps_total", 3)
                    .containsEntry("flow.steps_completed", 3)
                    .containsEntry("execution.id", trace.executionId())
                    .containsEntry("execution.environment", "staging");
            assertThat(root.startTimeUnixNano()).isEqualTo(START.getEpochSecond() * 1_000_000_000L);
            assertThat(trace.spans()).allSatisfy(span ->
                    assertThat(span.endTimeUnixNano()).isLessThanOrEqualTo(root.endTimeUnixNano()));
            assertThat(trace.startTime()).isEqualTo(START);
        }

        @Test
        @DisplayName("Every server span nests inside its client span")
        void clientServerPairs() {
            var root = trace.spans().get(0);
            Map<String, OtelSpan> byId = trace.spans().stream()
                    .collect(Collectors.toMap(OtelSpan::spanId, Function.identity()));

            var clients = trace.spans().stream().filter(s -> s.kind().equals("SPAN_KIND_CLIENT")).toList();
            var servers = trace.spans().stream().filter(s -> s.kind().equals("SPAN_KIND_SERVER")).toList();
            assertThat(clients).hasSize(3);
            assertThat(servers).hasSize(3);

            assertThat(clients).allSatisfy(client -> assertThat(client.parentSpanId()).isEqualTo(root.spanId()));
            assertThat(servers).allSatisfy(server -> {
                var client = byId.get(server.parentSpanId());
                assertThat(client.kind()).isEqualTo("SPAN_KIND_CLIENT");
                assertThat(server.operationName()).isEqualTo(client.operationName());
                assertThat(server.startTimeUnixNano()).isGreaterThanOrEqualTo(client.startTimeUnixNano());
                assertThat(server.endTimeUnixNano()).isLessThanOrEqualTo(client.endTimeUnixNano());
                assertThat(server.durationMs()).isGreaterThanOrEqualTo(1.0);
            });
        }

        @Test
        @DisplayName("Hops run sequentially with a gap between them")
        void hopsAreSequential() {
            var clients = trace.spans().stream().filter(s -> s.kind().equals("SPAN_KIND_CLIENT")).toList();
            for (int i = 1; i < clients.size(); i++) {
                assertThat(clients.get(i).startTimeUnixNano()).isGreaterThan(clients.get(i - 1).endTimeUnixNano());
            }
            assertThat(clients.get(0).startTimeUnixNano()).isEqualTo(trace.spans().get(0).startTimeUnixNano());
        }

        @Test
        @DisplayName("Attributes follow the hop protocol")
        void protocolAttributes() {
            var clients = trace.spans().stream().filter(s -> s.kind().equals("SPAN_KIND_CLIENT")).toList();

            assertThat(clients.get(0).serviceName()).isEqualTo("WebFrontend");
            assertThat(clients.get(0).attributes())
                    .containsEntry("peer.service", "OrderService")
                    .containsEntry("net.peer.name", "orderservice.internal")
                    .containsEntry("net.peer.port", 8080)
                    .containsEntry("http.status_code", 200)
                    .containsEntry("http.url", "http://orderservice.internal:8080/api/process");
            assertThat(clients.get(0).operationName()).matches("(POST|GET|PUT) /api/order/\\w+");

            assertThat(clients.get(1).attributes())
                    .containsEntry("rpc.system", "grpc")
                    .containsEntry("rpc.service", "PaymentServiceService")
                    .containsEntry("rpc.grpc.status_code", 0)
                    .containsEntry("net.peer.port", 50051);
            assertThat(clients.get(1).operationName()).startsWith("payment.PaymentService/");

            assertThat(clients.get(2).attributes())
                    .containsEntry("messaging.system", "kafka")
                    .containsEntry("messaging.destination", "ledgerservice.events")
                    .containsEntry("messaging.operation", "publish");
        }

        @Test
        @DisplayName("Resources carry service identity and runtime")
        void resources() {
            var firstClient = trace.spans().get(1);
            assertThat(firstClient.resource().attributes())
                    .containsEntry("service.name", "WebFrontend")
                    .containsEntry("service.version", "v2")
                    .containsEntry("service.namespace", "worldmaker")
                    .containsEntry("deployment.environment", "staging")
                    .containsEntry("process.runtime.name", "typescript")
                    .containsEntry("telemetry.sdk.name", "worldmaker-synthetic");
            assertThat((String) firstClient.resource().attributes().get("host.name")).matches("webfrontend-0[1-5]");

            var paymentServer = trace.spans().get(4);
            assertThat(paymentServer.resource().attributes())
                    .containsEntry("service.version", "v1")
                    .containsEntry("process.runtime.name", "java");
        }

        @Test
        @DisplayName("Healthy server spans log receive and processed events")
        void serverEvents() {
            var server = trace.spans().get(2);
            assertThat(server.events()).extracting(OtelSpan.Event::name)
                    .containsExactly("request.received", "request.processed");
            assertThat(server.events().get(1).attributes()).containsEntry("status", "ok");
        }
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("Failing the first hop truncates the trace to three spans")
    void failure_firstStep() {
        var trace = run(synthesizer(7), true, 0);

        assertThat(trace.spanCount()).isEqualTo(3);
        assertThat(trace.status()).isEqualTo(StatusCode.ERROR);
        assertThat(trace.error().step()).isZero();
        assertThat(trace.error().fromService()).isEqualTo("WebFrontend");
        assertThat(trace.error().toService()).isEqualTo("OrderService");
        assertThat(trace.spans().get(0).status().code()).isEqualTo("STATUS_CODE_ERROR");
        assertThat(trace.spans().get(0).attributes()).containsEntry("flow.steps_completed", 1);
    }

    @Test
    @DisplayName("Failing hop carries error status, message and exception event")
    void failure_middleStep() {
        var trace = run(synthesizer(7), true, 1);

        assertThat(trace.spanCount()).isEqualTo(5);
        var client = trace.spans().get(3);
        var server = trace.spans().get(4);

        assertThat(client.status().code()).isEqualTo("STATUS_CODE_ERROR");
        assertThat(client.status().message()).isEqualTo("Error calling PaymentService");
        assertThat(client.attributes()).containsEntry("rpc.grpc.status_code", 14);
        assertThat(server.status().code()).isEqualTo("STATUS_CODE_ERROR");
        assertThat(server.status().message()).contains("PaymentService");
        assertThat(trace.error().error()).isEqualTo(server.status().message());
        assertThat(server.events()).extracting(OtelSpan.Event::name)
                .containsExactly("request.received", "exception");
        assertThat(server.events().get(1).attributes())
                .containsKeys("exception.type", "exception.message", "exception.stacktrace");
    }

    @Test
    @DisplayName("Failure step outside the flow means no hop fails")
    void failure_outOfRange() {
        var trace = run(synthesizer(7), true, 5);

        assertThat(trace.status()).isEqualTo(StatusCode.OK);
        assertThat(trace.spanCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("Random failure injection always fails exactly one hop")
    void failure_randomStep() {
        var trace = run(synthesizer(99), true, null);

        assertThat(trace.failed()).isTrue();
        assertThat(trace.spanCount()).isEqualTo(1 + 2 * (trace.error().step() + 1));
    }

    // ==================== Determinism & Input Handling ====================

    @Test
    @DisplayName("Same seed, inputs and clock give identical traces")
    void deterministic() {
        assertThat(run(synthesizer(42), true, 2)).isEqualTo(run(synthesizer(42), true, 2));
        assertThat(run(synthesizer(42), false, null).traceId())
                .isNotEqualTo(run(synthesizer(43), false, null).traceId());
    }

    @Test
    @DisplayName("Steps execute by step number regardless of input order")
    void stepsSortedByNumber() {
        var reversed = new ArrayList<>(STEPS);
        Collections.reverse(reversed);

        var trace = synthesizer(42).execute(CHECKOUT, reversed, SERVICES, "prod", false, null);

        assertThat(trace.spans().get(1).attributes()).containsEntry("flow.step_number", 1);
        assertThat(trace.spans().get(1).serviceName()).isEqualTo("WebFrontend");
    }

    @Test
    @DisplayName("Unknown services get positional placeholder names")
    void placeholderNames() {
        var trace = synthesizer(1).execute(CHECKOUT, List.of(new FlowStep(1, "x", "y")), Map.of(), "prod", false, null);

        assertThat(trace.spans().get(1).serviceName()).isEqualTo("service-0");
        assertThat(trace.spans().get(2).serviceName()).isEqualTo("service-1");
        assertThat(trace.spans().get(1).attributes()).containsKey("http.method");
    }

    @Test
    @DisplayName("Hops without service ids fall back to placeholders when no directory is given")
    void missingServiceIds() {
        var steps = List.of(new FlowStep(1, null, "b"), new FlowStep(2, "b", null));

        var trace = synthesizer(1).execute(CHECKOUT, steps, null, "prod", false, null);

        assertThat(trace.spanCount()).isEqualTo(5);
        assertThat(trace.failed()).isFalse();
        assertThat(trace.spans().get(1).serviceName()).isEqualTo("service-0");
        assertThat(trace.spans().get(4).serviceName()).isEqualTo("service-2");
    }

    @Test
    @DisplayName("A flow without steps is rejected")
    void emptySteps() {
        var synthesizer = synthesizer(1);

        assertThatThrownBy(() -> synthesizer.execute(CHECKOUT, List.of(), SERVICES, "prod", false, null))
                .isInstanceOf(EngineException.class)
                .extracting(e -> ((EngineException) e).getErrorCode())
                .isEqualTo(EngineException.INVALID_INPUT);
        assertThat(synthesizer.executionCount()).isZero();
    }

    @Test
    @DisplayName("Jaeger shape mirrors the OTel spans")
    void jaegerShape() {
        var trace = run(synthesizer(42), false, null);
        var root = trace.spansJaeger().get(0);
        var client = trace.spansJaeger().get(1);

        assertThat(root.parentSpanId()).isEqualTo("0000000000000000");
        assertThat(root.references()).isEmpty();
        assertThat(client.references()).containsExactly(
                new JaegerSpan.Reference("CHILD_OF", trace.traceId(), root.spanId()));
        assertThat(client.startTime()).isEqualTo(trace.spans().get(1).startTimeUnixNano() / 1_000);
        assertThat(client.process().serviceName()).isEqualTo("WebFrontend");
    }

    // ==================== Flow Source ====================

    @Test
    @DisplayName("Lookup-based execution needs a flow source")
    void executeById_unconfigured() {
        assertThatThrownBy(() -> synthesizer(1).executeById("checkout", "prod", false, null))
                .isInstanceOf(EngineException.class)
                .hasMessage("Flow source not configured");
    }

    @Test
    @DisplayName("Unknown flow id is reported as not found")
    void executeById_unknownFlow() {
        var synthesizer = new TraceSynthesizer(new Random(1), CLOCK, new StubFlowSource());

        assertThatThrownBy(() -> synthesizer.executeById("nope", "prod", false, null))
                .isInstanceOf(EngineException.class)
                .extracting(e -> ((EngineException) e).getErrorCode())
                .isEqualTo(EngineException.FLOW_NOT_FOUND);
    }

    @Test
    @DisplayName("Execute all skips flows that cannot run")
    void executeAll_skipsBrokenFlows() {
        var synthesizer = new TraceSynthesizer(new Random(1), CLOCK, new StubFlowSource());

        var traces = synthesizer.executeAll("prod");

        assertThat(traces).extracting(Trace::flowId).containsExactly("checkout");
        assertThat(traces.get(0).spans().get(1).serviceName()).isEqualTo("WebFrontend");
        assertThat(synthesizer.executionCount()).isEqualTo(1);
    }

    private static class StubFlowSource implements FlowSource {

        private static final FlowDefinition EMPTY = new FlowDefinition("empty", "Empty", null);
        private static final FlowDefinition BROKEN = new FlowDefinition("broken", "Broken", null);

        @Override
        public Optional<FlowDefinition> findFlow(String flowId) {
            return findAllFlows().stream().filter(flow -> flow.id().equals(flowId)).findFirst();
        }

        @Override
        public List<FlowStep> findSteps(String flowId) {
            if (flowId.equals(BROKEN.id())) {
                throw new IllegalStateException("Steps unavailable for " + flowId);
            }
            return flowId.equals(CHECKOUT.id()) ? STEPS : List.of();
        }

        @Override
        public Optional<ServiceDescriptor> findService(String serviceId) {
            return Optional.ofNullable(SERVICES.get(serviceId));
        }

        @Override
        public List<FlowDefinition> findAllFlows() {
            return List.of(EMPTY, BROKEN, CHECKOUT);
        }
    }
}
