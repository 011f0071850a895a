package com.worldmaker.core.trace.format;

import java.util.List;
import java.util.Map;

/**
 * OpenTelemetry JSON shape of a span. Component names are the wire names.
 *
 * @param parentSpanId empty string for a root span
 */
public record OtelSpan(
        String traceId,
        String spanId,
        String parentSpanId,
        String operationName,
        String serviceName,
        String kind,
        long startTimeUnixNano,
        long endTimeUnixNano,
        long durationNano,
        double durationMs,
        Status status,
        Map<String, Object> attributes,
        List<Event> events,
        List<Link> links,
        Resource resource
) {

    public record Status(String code, String message) {}

    /**
     * @param timestamp ISO-8601 instant in UTC
     */
    public record Event(String name, String timestamp, Map<String, Object> attributes) {}

    public record Link(String traceId, String spanId, Map<String, Object> attributes) {}

    public record Resource(Map<String, Object> attributes) {}
}
