package com.flightdeck.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Specialty of an agent. Determines the system prompt the agent starts with.
 */
public enum AgentType {
    FRONTEND,
    BACKEND,
    TESTING,
    BROWSER,
    GENERAL,
    CLEANER;

    /**
     * Lenient lookup used when reading planner output. Unknown or blank values map to {@link #GENERAL}.
     */
    @JsonCreator
    public static AgentType fromString(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERAL;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
