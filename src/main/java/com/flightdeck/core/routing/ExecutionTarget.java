package com.flightdeck.core.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Model backend an agent runs on. {@link #AUTO} lets the router decide.
 */
public enum ExecutionTarget {
    CLOUD,
    LOCAL,
    AUTO;

    @JsonCreator
    public static ExecutionTarget fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
