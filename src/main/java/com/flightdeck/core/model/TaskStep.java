package com.flightdeck.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.io.Serializable;
import java.util.List;

/**
 * A single step of a {@link TaskPlan}, delegated to one agent.
 *
 * @param id            step id, unique within the plan
 * @param description   short human-readable description
 * @param agentType     specialty of the agent that executes the step
 * @param dependencyIds ids of steps that must complete successfully first
 * @param instruction   the task text handed to the agent
 */
public record TaskStep(
    int id,
    String description,
    AgentType agentType,
    @JsonAlias("dependencies") List<Integer> dependencyIds,
    @JsonAlias("task") String instruction
) implements Serializable {

    public TaskStep {
        dependencyIds = dependencyIds == null ? List.of() : List.copyOf(dependencyIds);
        agentType = agentType == null ? AgentType.GENERAL : agentType;
    }
}
