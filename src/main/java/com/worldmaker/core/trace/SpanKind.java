package com.worldmaker.core.trace;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a span within a call.
 */
public enum SpanKind {
    CLIENT,
    SERVER,
    INTERNAL;

    /**
     * OTLP enum name, e.g. {@code SPAN_KIND_CLIENT}.
     */
    @JsonValue
    public String wireName() {
        return "SPAN_KIND_" + name();
    }
}
