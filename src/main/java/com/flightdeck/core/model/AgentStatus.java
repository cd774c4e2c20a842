package com.flightdeck.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Life-cycle state of an agent.
 * <p>
 * {@code IDLE -> RUNNING -> {COMPLETED | ERROR | STOPPED | WAITING_USER}}; the only
 * re-entrant transition is {@code WAITING_USER -> RUNNING}.
 */
public enum AgentStatus {
    IDLE,
    RUNNING,
    WAITING_USER,
    COMPLETED,
    ERROR,
    STOPPED;

    /** Final states. {@link #WAITING_USER} is not final: the agent may be resumed. */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == STOPPED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
