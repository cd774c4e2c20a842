package com.flightdeck.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MemoryEntryType {
    TASK(1.0),
    DECISION(1.0),
    ERROR(1.3),
    SUCCESS(1.5),
    CONTEXT(1.0);

    private final double queryBoost;

    MemoryEntryType(double queryBoost) {
        this.queryBoost = queryBoost;
    }

    /** Multiplier applied to keyword overlap when ranking semantic memory. */
    public double queryBoost() {
        return queryBoost;
    }

    @JsonCreator
    public static MemoryEntryType fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
