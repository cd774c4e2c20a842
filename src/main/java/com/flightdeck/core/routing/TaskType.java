package com.flightdeck.core.routing;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskType {
    /** Short question or low-complexity request; suited to the cloud backend. */
    QUICK,
    /** Bulk code generation, multi-file work, large inputs; suited to the local backend. */
    HEAVY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
