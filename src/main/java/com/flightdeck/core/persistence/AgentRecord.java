package com.flightdeck.core.persistence;

import java.time.Instant;
import java.util.List;

/**
 * Session-history view of one agent run.
 *
 * @param output the agent's assistant messages, in order
 */
public record AgentRecord(
    String id,
    String type,
    String task,
    String status,
    List<String> output,
    Instant startTime,
    Instant endTime
) {

    public AgentRecord {
        output = output == null ? List.of() : List.copyOf(output);
    }
}
