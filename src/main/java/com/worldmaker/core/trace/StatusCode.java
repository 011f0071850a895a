package com.worldmaker.core.trace;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a span or of a whole trace.
 */
public enum StatusCode {
    OK,
    ERROR,
    UNSET;

    /**
     * OTLP enum name, e.g. {@code STATUS_CODE_ERROR}.
     */
    @JsonValue
    public String wireName() {
        return "STATUS_CODE_" + name();
    }
}
