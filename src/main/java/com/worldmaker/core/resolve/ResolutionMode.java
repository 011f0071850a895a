package com.worldmaker.core.resolve;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How far a dependency resolution reaches.
 */
public enum ResolutionMode {
    DIRECT("direct"),
    TRANSITIVE("transitive"),
    BLAST_RADIUS("blast-radius"),
    FULL("full");

    private final String wireName;

    ResolutionMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException for unrecognised values
     */
    @JsonCreator
    public static ResolutionMode fromWire(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.wireName.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown depth: " + value + " (expected direct, transitive, blast-radius or full)"));
    }
}
