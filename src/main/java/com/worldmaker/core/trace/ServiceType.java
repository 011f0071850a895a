package com.worldmaker.core.trace;

import java.util.Arrays;
import java.util.List;

/**
 * Protocol families a hop can use, with their latency envelope in
 * milliseconds and the operation names they produce.
 */
public enum ServiceType {
    REST("rest", 5, 150, 8080, Patterns.HTTP),
    GRPC("grpc", 1, 50, 50051, List.of(
            "{service}.{Service}Service/Process",
            "{service}.{Service}Service/Get",
            "{service}.{Service}Service/Update",
            "{service}.{Service}Service/Validate")),
    EVENT_DRIVEN("event_driven", 10, 500, 9092, List.of(
            "PUBLISH {service}.event.processed",
            "CONSUME {service}.event.received",
            "PUBLISH {service}.event.completed")),
    GRAPHQL("graphql", 10, 200, 9092, List.of(
            "QUERY {service}.query",
            "MUTATION {service}.mutate")),
    BATCH("batch", 100, 5000, 9092, List.of(
            "BATCH {service}.process_batch",
            "BATCH {service}.aggregate")),
    OTHER("default", 5, 100, 9092, Patterns.HTTP);

    private final String wireName;
    private final double minLatencyMs;
    private final double maxLatencyMs;
    private final int peerPort;
    private final List<String> operationPatterns;

    ServiceType(String wireName, double minLatencyMs, double maxLatencyMs,
                int peerPort, List<String> operationPatterns) {
        this.wireName = wireName;
        this.minLatencyMs = minLatencyMs;
        this.maxLatencyMs = maxLatencyMs;
        this.peerPort = peerPort;
        this.operationPatterns = operationPatterns;
    }

    /**
     * Maps a directory value to a type; anything unrecognised is {@link #OTHER}.
     */
    public static ServiceType fromWire(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(value))
                .findFirst()
                .orElse(OTHER);
    }

    public String wireName() {
        return wireName;
    }

    public double minLatencyMs() {
        return minLatencyMs;
    }

    public double maxLatencyMs() {
        return maxLatencyMs;
    }

    public int peerPort() {
        return peerPort;
    }

    public List<String> operationPatterns() {
        return operationPatterns;
    }

    private static final class Patterns {
        static final List<String> HTTP = List.of(
                "POST /api/{service}/process",
                "GET /api/{service}/status",
                "PUT /api/{service}/update",
                "POST /api/{service}/validate",
                "GET /api/{service}/health");
    }
}
