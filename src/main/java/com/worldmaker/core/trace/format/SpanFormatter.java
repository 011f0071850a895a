package com.worldmaker.core.trace.format;

import com.worldmaker.core.trace.Span;
import com.worldmaker.core.trace.SpanEvent;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link Span}s into their OpenTelemetry and Jaeger JSON shapes.
 */
public final class SpanFormatter {

    static final String JAEGER_ROOT_PARENT = "0000000000000000";
    static final String CHILD_OF = "CHILD_OF";

    private SpanFormatter() {
    }

    // ==================== OpenTelemetry ====================

    public static OtelSpan toOtel(Span span) {
        return new OtelSpan(
                span.getTraceId(),
                span.getSpanId(),
                span.isRoot() ? "" : span.getParentSpanId(),
                span.getOperationName(),
                span.getServiceName(),
                span.getKind().wireName(),
                epochNanos(span.getStartTime()),
                span.getEndTime() != null ? epochNanos(span.getEndTime()) : 0L,
                span.getDurationNanos(),
                roundMillis(span.getDurationNanos()),
                new OtelSpan.Status(span.getStatusCode().wireName(), span.getStatusMessage()),
                span.getAttributes(),
                span.getEvents().stream()
                        .map(SpanFormatter::toOtelEvent)
                        .toList(),
                List.of(),
                new OtelSpan.Resource(span.getResource())
        );
    }

    private static OtelSpan.Event toOtelEvent(SpanEvent event) {
        return new OtelSpan.Event(
                event.name(),
                event.timestamp().truncatedTo(ChronoUnit.MICROS).toString(),
                event.attributes()
        );
    }

    // ==================== Jaeger ====================

    public static JaegerSpan toJaeger(Span span) {
        List<JaegerSpan.Reference> references = span.isRoot()
                ? List.of()
                : List.of(new JaegerSpan.Reference(CHILD_OF, span.getTraceId(), span.getParentSpanId()));

        return new JaegerSpan(
                span.getTraceId(),
                span.getSpanId(),
                span.isRoot() ? JAEGER_ROOT_PARENT : span.getParentSpanId(),
                span.getOperationName(),
                references,
                epochMicros(span.getStartTime()),
                span.getDurationNanos() / 1_000,
                toTags(span.getAttributes()),
                span.getEvents().stream()
                        .map(event -> new JaegerSpan.Log(epochMicros(event.timestamp()), toTags(event.attributes())))
                        .toList(),
                new JaegerSpan.Process(span.getServiceName(), toTags(span.getResource()))
        );
    }

    static List<JaegerSpan.Tag> toTags(Map<String, Object> values) {
        return values.entrySet().stream()
                .map(entry -> new JaegerSpan.Tag(entry.getKey(), tagType(entry.getValue()), entry.getValue()))
                .toList();
    }

    static String tagType(Object value) {
        if (value instanceof Boolean) return "bool";
        if (value instanceof Integer || value instanceof Long || value instanceof Short) return "int64";
        if (value instanceof Double || value instanceof Float) return "float64";
        return "string";
    }

    // ==================== Time ====================

    static long epochNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    static long epochMicros(Instant instant) {
        return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000;
    }

    static double roundMillis(long nanos) {
        return Math.round(nanos / 10_000.0) / 100.0;
    }
}
