package com.worldmaker.core.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a dependency edge, also used to classify simulated failures.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value, falling back to {@link #MEDIUM} when absent.
     *
     * @throws IllegalArgumentException for unrecognised values
     */
    @JsonCreator
    public static Severity fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + value, e);
        }
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
