package com.flightdeck.core.persistence;

import java.time.Instant;
import java.util.List;

/**
 * Everything recorded during one session, as stored in {@code sessions/<id>.json}.
 */
public record SessionHistory(
    String id,
    Instant startTime,
    Instant endTime,
    List<AgentRecord> agents,
    List<Artifact> artifacts,
    List<SessionMessage> messages
) {

    public SessionHistory {
        agents = agents == null ? List.of() : List.copyOf(agents);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
