package com.worldmaker.core.trace;

import com.worldmaker.core.EngineException;
import com.worldmaker.core.trace.format.SpanFormatter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Synthesizes a distributed trace for one execution of a flow.
 *
 * Each hop yields a CLIENT span on the caller and a SERVER span on the callee,
 * both under a single INTERNAL root span. Execution stops at the first failing
 * hop. Every id, latency and choice is drawn from the injected {@link Random};
 * the injected {@link Clock} is read exactly once per execution, so identical
 * seeds, inputs and clocks give identical traces.
 *
 * Not thread-safe.
 */
@Slf4j
public class TraceSynthesizer {

    static final String ENGINE_SERVICE_NAME = "worldmaker-flow-engine";
    static final String ENGINE_VERSION = "0.1.0";
    static final String SERVICE_NAMESPACE = "worldmaker";
    static final String DEFAULT_SERVICE_TYPE = "rest";
    static final double LATENCY_SPIKE_PROBABILITY = 0.05;

    private static final List<String> CLIENT_METHODS = List.of("POST", "GET", "PUT");
    private static final List<Integer> CLIENT_ERROR_STATUSES = List.of(500, 502, 503, 504);
    private static final List<Integer> SERVER_ERROR_STATUSES = List.of(500, 502, 503);
    private static final List<String> EXCEPTION_TYPES = List.of(
            "ConnectionRefusedError",
            "TimeoutError",
            "ServiceUnavailableError",
            "CircuitBreakerOpenError");

    private final Random random;
    private final Clock clock;
    private final FlowSource flowSource;

    private int executionCount;

    public TraceSynthesizer(Random random, Clock clock) {
        this(random, clock, null);
    }

    /**
     * @param flowSource store used by the lookup-based entry points; may be null
     */
    public TraceSynthesizer(Random random, Clock clock, FlowSource flowSource) {
        this.random = random;
        this.clock = clock;
        this.flowSource = flowSource;
    }

    // ==================== Entry Points ====================

    /**
     * Executes {@code steps} in step-number order and returns the trace.
     *
     * @param services directory keyed by service id; missing entries get placeholder names
     * @param injectFailure whether one hop should fail
     * @param failureStep zero-based hop to fail; random when null
     * @throws EngineException with {@link EngineException#INVALID_INPUT} if there are no steps
     */
    public Trace execute(FlowDefinition flow, List<FlowStep> steps, Map<String, ServiceDescriptor> services,
                         String environment, boolean injectFailure, Integer failureStep) {
        if (flow == null) {
            throw EngineException.invalidInput("Flow is required", null);
        }
        if (steps == null || steps.isEmpty()) {
            throw EngineException.invalidInput("Flow " + flow.id() + " has no steps", flow.id());
        }
        executionCount++;

        var ordered = steps.stream()
                .sorted(Comparator.comparingInt(FlowStep::stepNumber))
                .toList();
        var directory = services != null ? services : Map.<String, ServiceDescriptor>of();

        String traceId = randomHex(2);
        String executionId = new UUID(random.nextLong(), random.nextLong()).toString();
        Instant baseTime = clock.instant();

        Integer failAt = null;
        if (injectFailure) {
            failAt = failureStep != null ? failureStep : random.nextInt(ordered.size());
            if (failAt < 0 || failAt >= ordered.size()) {
                log.warn("Failure step {} outside flow {} ({} steps), no hop will fail",
                        failAt, flow.id(), ordered.size());
            }
        }
        String rootSpanId = randomHex(1);

        List<Span> hopSpans = new ArrayList<>();
        TraceError error = null;
        Instant cursor = baseTime;

        for (int i = 0; i < ordered.size(); i++) {
            var hop = new Hop(i, ordered.get(i), directory, failAt != null && failAt == i);
            var client = clientSpan(traceId, rootSpanId, hop, cursor, environment);
            var server = serverSpan(traceId, client, hop, environment);
            hopSpans.add(client);
            hopSpans.add(server);

            if (hop.fails()) {
                error = new TraceError(i, hop.fromName(), hop.toName(), server.getStatusMessage());
                break;
            }
            cursor = client.getEndTime().plusNanos(toNanos(uniform(0.1, 2.0)));
        }

        Instant endTime = hopSpans.stream()
                .map(Span::getEndTime)
                .max(Comparator.naturalOrder())
                .orElse(baseTime);
        var status = error != null ? StatusCode.ERROR : StatusCode.OK;
        var root = rootSpan(traceId, rootSpanId, executionId, flow, ordered.size(), hopSpans.size() / 2,
                baseTime, endTime, status, environment);

        List<Span> allSpans = new ArrayList<>();
        allSpans.add(root);
        allSpans.addAll(hopSpans);

        var trace = new Trace(
                traceId,
                executionId,
                flow.id(),
                flow.name(),
                environment,
                baseTime,
                endTime,
                Math.round(root.getDurationNanos() / 10_000.0) / 100.0,
                status,
                allSpans.size(),
                error,
                allSpans.stream().map(SpanFormatter::toOtel).toList(),
                allSpans.stream().map(SpanFormatter::toJaeger).toList()
        );

        log.info("Synthesized trace {} for flow {} ({} spans, {})",
                traceId, flow.id(), trace.spanCount(), status.wireName());
        return trace;
    }

    /**
     * Looks the flow, its steps and its services up in the configured
     * {@link FlowSource} and executes it.
     *
     * @throws EngineException {@link EngineException#UNCONFIGURED} without a flow source,
     *                         {@link EngineException#FLOW_NOT_FOUND} for unknown flows
     */
    public Trace executeById(String flowId, String environment, boolean injectFailure, Integer failureStep) {
        var source = requireFlowSource();
        var flow = source.findFlow(flowId)
                .orElseThrow(() -> EngineException.flowNotFound(flowId));
        var steps = source.findSteps(flowId);
        return execute(flow, steps, lookupServices(source, steps), environment, injectFailure, failureStep);
    }

    /**
     * Executes every known flow once. Flows that cannot be executed are
     * logged and skipped.
     */
    public List<Trace> executeAll(String environment) {
        var source = requireFlowSource();
        List<Trace> traces = new ArrayList<>();
        for (FlowDefinition flow : source.findAllFlows()) {
            try {
                traces.add(executeById(flow.id(), environment, false, null));
            } catch (RuntimeException e) {
                log.warn("Skipping flow {}: {}", flow.name(), e.getMessage());
            }
        }
        return traces;
    }

    public int executionCount() {
        return executionCount;
    }

    // ==================== Span Construction ====================

    private Span clientSpan(String traceId, String rootSpanId, Hop hop, Instant start, String environment) {
        double latencyMs = simulateLatency(hop.type(), hop.fails());
        long latencyNanos = toNanos(latencyMs);
        String spanId = randomHex(1);
        String operation = operationName(hop.toName(), hop.type());

        return Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .parentSpanId(rootSpanId)
                .operationName(operation)
                .serviceName(hop.fromName())
                .serviceType(hop.typeName())
                .kind(SpanKind.CLIENT)
                .startTime(start)
                .endTime(start.plusNanos(latencyNanos))
                .durationNanos(latencyNanos)
                .statusCode(hop.fails() ? StatusCode.ERROR : StatusCode.OK)
                .statusMessage(hop.fails() ? "Error calling " + hop.toName() : "")
                .attributes(clientAttributes(hop))
                .resource(resource(hop.fromName(), hop.from(), environment))
                .build();
    }

    /**
     * The server span starts one network delay after the client and stops one
     * delay before it, never shorter than 1ms and never outside the client span.
     */
    private Span serverSpan(String traceId, Span client, Hop hop, String environment) {
        String spanId = randomHex(1);
        double latencyMs = client.getDurationNanos() / 1_000_000.0;
        double networkDelayMs = Math.min(uniform(0.5, 5.0), Math.max((latencyMs - 1.0) / 2.0, 0.0));
        double processingMs = Math.max(latencyMs - networkDelayMs * 2, 1.0);

        Instant start = client.getStartTime().plusNanos(toNanos(networkDelayMs));
        long durationNanos = toNanos(processingMs);
        String statusMessage = hop.fails() ? errorMessage(hop.toName()) : "";

        return Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .parentSpanId(client.getSpanId())
                .operationName(client.getOperationName())
                .serviceName(hop.toName())
                .serviceType(hop.typeName())
                .kind(SpanKind.SERVER)
                .startTime(start)
                .endTime(start.plusNanos(durationNanos))
                .durationNanos(durationNanos)
                .statusCode(hop.fails() ? StatusCode.ERROR : StatusCode.OK)
                .statusMessage(statusMessage)
                .attributes(serverAttributes(hop))
                .events(serverEvents(hop, start))
                .resource(resource(hop.toName(), hop.to(), environment))
                .build();
    }

    private Span rootSpan(String traceId, String rootSpanId, String executionId, FlowDefinition flow,
                          int stepsTotal, int stepsCompleted, Instant start, Instant end,
                          StatusCode status, String environment) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("flow.id", nullToEmpty(flow.id()));
        attributes.put("flow.name", nullToEmpty(flow.name()));
        attributes.put("flow.type", nullToEmpty(flow.flowType()));
        attributes.put("flow.steps_total", stepsTotal);
        attributes.put("flow.steps_completed", stepsCompleted);
        attributes.put("execution.id", executionId);
        attributes.put("execution.environment", environment);

        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("service.name", ENGINE_SERVICE_NAME);
        resource.put("service.version", ENGINE_VERSION);
        resource.put("deployment.environment", environment);

        return Span.builder()
                .traceId(traceId)
                .spanId(rootSpanId)
                .operationName("FLOW " + (flow.name() != null ? flow.name() : "unknown"))
                .serviceName(ENGINE_SERVICE_NAME)
                .serviceType("internal")
                .kind(SpanKind.INTERNAL)
                .startTime(start)
                .endTime(end)
                .durationNanos(Duration.between(start, end).toNanos())
                .statusCode(status)
                .attributes(Collections.unmodifiableMap(attributes))
                .resource(Collections.unmodifiableMap(resource))
                .build();
    }

    // ==================== Attributes ====================

    private Map<String, Object> clientAttributes(Hop hop) {
        String peer = hop.toName();
        String host = peer.toLowerCase(Locale.ROOT).replace(' ', '-');

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("peer.service", peer);
        attributes.put("net.peer.name", host + ".internal");
        attributes.put("net.peer.port", hop.type().peerPort());
        attributes.put("flow.step_number", hop.step().stepNumber());

        switch (hop.type()) {
            case REST -> {
                attributes.put("http.method", choice(CLIENT_METHODS));
                attributes.put("http.status_code", hop.fails() ? choice(CLIENT_ERROR_STATUSES) : 200);
                attributes.put("http.url", "http://" + peer.toLowerCase(Locale.ROOT) + ".internal:8080/api/process");
            }
            case GRPC -> {
                attributes.put("rpc.system", "grpc");
                attributes.put("rpc.service", peer + "Service");
                attributes.put("rpc.method", "Process");
                attributes.put("rpc.grpc.status_code", hop.fails() ? 14 : 0);
            }
            case EVENT_DRIVEN -> {
                attributes.put("messaging.system", "kafka");
                attributes.put("messaging.destination", peer.toLowerCase(Locale.ROOT) + ".events");
                attributes.put("messaging.operation", "publish");
            }
            default -> {
            }
        }
        return Collections.unmodifiableMap(attributes);
    }

    private Map<String, Object> serverAttributes(Hop hop) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("flow.step_number", hop.step().stepNumber());

        switch (hop.type()) {
            case REST -> {
                attributes.put("http.method", "POST");
                attributes.put("http.status_code", hop.fails() ? choice(SERVER_ERROR_STATUSES) : 200);
                attributes.put("http.route", "/api/process");
                attributes.put("http.scheme", "http");
            }
            case GRPC -> {
                attributes.put("rpc.system", "grpc");
                attributes.put("rpc.grpc.status_code", hop.fails() ? 14 : 0);
            }
            default -> {
            }
        }
        return Collections.unmodifiableMap(attributes);
    }

    private List<SpanEvent> serverEvents(Hop hop, Instant start) {
        String service = hop.toName();
        List<SpanEvent> events = new ArrayList<>();
        events.add(new SpanEvent("request.received", start.plusNanos(toNanos(0.1)),
                Map.of("service.name", service)));

        if (hop.fails()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            Instant at = start.plusNanos(toNanos(uniform(5, 50)));
            attributes.put("exception.type", choice(EXCEPTION_TYPES));
            attributes.put("exception.message", "Failed to process request in " + service);
            attributes.put("exception.stacktrace", "  at " + service.toLowerCase(Locale.ROOT)
                    + ".RequestHandler.handle(RequestHandler.java:42)");
            events.add(new SpanEvent("exception", at, Collections.unmodifiableMap(attributes)));
        } else {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("service.name", service);
            attributes.put("status", "ok");
            events.add(new SpanEvent("request.processed", start.plusNanos(toNanos(uniform(2, 20))),
                    Collections.unmodifiableMap(attributes)));
        }
        return events;
    }

    private Map<String, Object> resource(String serviceName, ServiceDescriptor service, String environment) {
        String apiVersion = service != null && service.apiVersion() != null ? service.apiVersion() : "v1";
        Object runtime = service != null ? service.metadata().getOrDefault("language", "java") : "java";

        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("service.name", serviceName);
        resource.put("service.version", apiVersion);
        resource.put("service.namespace", SERVICE_NAMESPACE);
        resource.put("deployment.environment", environment);
        resource.put("host.name", String.format("%s-%02d",
                serviceName.toLowerCase(Locale.ROOT).replace(' ', '-'), randomInt(1, 5)));
        resource.put("os.type", "linux");
        resource.put("process.runtime.name", String.valueOf(runtime));
        resource.put("telemetry.sdk.name", "worldmaker-synthetic");
        resource.put("telemetry.sdk.version", ENGINE_VERSION);
        return Collections.unmodifiableMap(resource);
    }

    // ==================== Simulation ====================

    /**
     * Latency in milliseconds, rounded to two decimals.
     */
    double simulateLatency(ServiceType type, boolean failing) {
        double latency = uniform(type.minLatencyMs(), type.maxLatencyMs());
        if (failing) {
            latency *= uniform(2, 10);
        }
        if (random.nextDouble() < LATENCY_SPIKE_PROBABILITY) {
            latency *= uniform(3, 8);
        }
        return Math.round(latency * 100) / 100.0;
    }

    private String operationName(String serviceName, ServiceType type) {
        String pattern = choice(type.operationPatterns());
        String clean = serviceName.toLowerCase(Locale.ROOT)
                .replace("service", "")
                .replace("-", "")
                .strip();
        String service = clean.isEmpty() ? "default" : clean;
        String capitalized = Character.toUpperCase(service.charAt(0)) + service.substring(1);

        return pattern.replace("{service}", service)
                .replace("{Service}", capitalized);
    }

    private String errorMessage(String serviceName) {
        return choice(List.of(
                "Connection refused: " + serviceName + ":8080",
                "Timeout after 30000ms calling " + serviceName,
                "HTTP 503 Service Unavailable from " + serviceName,
                "Circuit breaker OPEN for " + serviceName,
                "HTTP 500 Internal Server Error from " + serviceName,
                "gRPC UNAVAILABLE: " + serviceName + " not responding",
                "Connection pool exhausted for " + serviceName
        ));
    }

    // ==================== Randomness ====================

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    private int randomInt(int lowInclusive, int highInclusive) {
        return lowInclusive + random.nextInt(highInclusive - lowInclusive + 1);
    }

    private <T> T choice(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    private String randomHex(int longs) {
        var builder = new StringBuilder(longs * 16);
        for (int i = 0; i < longs; i++) {
            builder.append(String.format("%016x", random.nextLong()));
        }
        return builder.toString();
    }

    // ==================== Helpers ====================

    private FlowSource requireFlowSource() {
        if (flowSource == null) {
            throw EngineException.unconfigured("Flow source");
        }
        return flowSource;
    }

    private static Map<String, ServiceDescriptor> lookupServices(FlowSource source, List<FlowStep> steps) {
        Map<String, ServiceDescriptor> services = new LinkedHashMap<>();
        for (FlowStep step : steps) {
            for (String serviceId : List.of(nullToEmpty(step.fromServiceId()), nullToEmpty(step.toServiceId()))) {
                if (!serviceId.isEmpty() && !services.containsKey(serviceId)) {
                    source.findService(serviceId).ifPresent(service -> services.put(serviceId, service));
                }
            }
        }
        return services;
    }

    private static long toNanos(double millis) {
        return (long) (millis * 1_000_000);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * A flow step with its endpoints resolved against the service directory.
     */
    private record Hop(int index, FlowStep step, ServiceDescriptor from, ServiceDescriptor to,
                       String fromName, String toName, String typeName, boolean fails) {

        Hop(int index, FlowStep step, Map<String, ServiceDescriptor> directory, boolean fails) {
            this(index, step,
                    lookup(directory, step.fromServiceId()),
                    lookup(directory, step.toServiceId()),
                    nameOf(lookup(directory, step.fromServiceId()), "service-" + index),
                    nameOf(lookup(directory, step.toServiceId()), "service-" + (index + 1)),
                    typeOf(step, lookup(directory, step.toServiceId())),
                    fails);
        }

        // Immutable maps reject null keys, so a hop without an id skips the lookup.
        private static ServiceDescriptor lookup(Map<String, ServiceDescriptor> directory, String serviceId) {
            return serviceId != null ? directory.get(serviceId) : null;
        }

        ServiceType type() {
            return ServiceType.fromWire(typeName);
        }

        private static String nameOf(ServiceDescriptor service, String fallback) {
            return service != null && service.name() != null ? service.name() : fallback;
        }

        private static String typeOf(FlowStep step, ServiceDescriptor target) {
            if (step.serviceType() != null) return step.serviceType();
            if (target != null && target.serviceType() != null) return target.serviceType();
            return DEFAULT_SERVICE_TYPE;
        }
    }
}
