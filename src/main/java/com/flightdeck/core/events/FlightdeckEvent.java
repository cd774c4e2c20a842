package com.flightdeck.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by agents and the orchestrator.
 *
 * @param eventType one of the type constants below
 * @param agentId   the agent this event belongs to; the plan id for plan-level events
 * @param stepId    the plan step this event relates to, null outside a plan
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FlightdeckEvent(
    String eventType,
    String agentId,
    Integer stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String AGENT_SPAWNED = "agent.spawned";
    public static final String AGENT_STATUS = "agent.status";
    public static final String AGENT_OUTPUT = "agent.output";
    public static final String AGENT_LOOP_DETECTED = "agent.loop_detected";
    public static final String PLAN_CREATED = "plan.created";
    public static final String STEP_STARTED = "step.started";
    public static final String STEP_COMPLETED = "step.completed";
    public static final String STEP_SKIPPED = "step.skipped";

    public FlightdeckEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static FlightdeckEvent of(String eventType, String agentId, Integer stepId, Map<String, Object> payload) {
        return new FlightdeckEvent(eventType, agentId, stepId, payload, Instant.now());
    }
}
