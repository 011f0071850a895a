package com.worldmaker.core.trace.format;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Jaeger JSON shape of a span. Times and durations are in microseconds.
 *
 * @param parentSpanId sixteen zeros for a root span
 */
public record JaegerSpan(
        @JsonProperty("traceID") String traceId,
        @JsonProperty("spanID") String spanId,
        @JsonProperty("parentSpanID") String parentSpanId,
        String operationName,
        List<Reference> references,
        long startTime,
        long duration,
        List<Tag> tags,
        List<Log> logs,
        Process process
) {

    public record Reference(
            String refType,
            @JsonProperty("traceID") String traceId,
            @JsonProperty("spanID") String spanId
    ) {}

    /**
     * @param type one of {@code bool}, {@code int64}, {@code float64}, {@code string}
     */
    public record Tag(String key, String type, Object value) {}

    public record Log(long timestamp, List<Tag> fields) {}

    public record Process(String serviceName, List<Tag> tags) {}
}
