package com.flightdeck.core.persistence;

import java.time.Instant;

/**
 * A notable message exchanged during a session, e.g. a plan or step outcome from the orchestrator.
 *
 * @param toAgent recipient agent id, or {@code broadcast}
 * @param type    {@code request}, {@code response}, {@code info} or {@code handoff}
 */
public record SessionMessage(
    String id,
    String fromAgent,
    String toAgent,
    String type,
    String content,
    Instant timestamp
) {}
