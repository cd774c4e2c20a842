package com.flightdeck.core.model;

import java.io.Serializable;

/**
 * Outcome of one plan step, as recorded by the orchestrator.
 *
 * @param agentId     the agent that executed the step
 * @param stepId      the plan step id
 * @param agentType   the agent's specialty
 * @param instruction the instruction the agent was given
 * @param status      terminal status of the agent
 * @param summary     completion summary, or the failure reason
 */
public record AgentResult(
    String agentId,
    int stepId,
    AgentType agentType,
    String instruction,
    AgentStatus status,
    String summary
) implements Serializable {

    public boolean succeeded() {
        return status == AgentStatus.COMPLETED;
    }
}
