package com.worldmaker.core.trace;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single timed unit of work in a synthesized trace.
 */
@Value
@Builder
public class Span {

    String traceId;
    String spanId;

    /**
     * Null for the root span.
     */
    String parentSpanId;

    String operationName;
    String serviceName;
    String serviceType;
    SpanKind kind;
    Instant startTime;
    Instant endTime;
    long durationNanos;

    @Builder.Default
    StatusCode statusCode = StatusCode.OK;

    @Builder.Default
    String statusMessage = "";

    Map<String, Object> attributes;

    @Singular
    List<SpanEvent> events;

    Map<String, Object> resource;

    public boolean isRoot() {
        return parentSpanId == null;
    }
}
