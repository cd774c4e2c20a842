package com.flightdeck.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.io.Serializable;
import java.util.List;

/**
 * Decomposition of a user request into dependency-ordered steps.
 *
 * @param summary    brief description of what the plan does
 * @param steps      the steps; their dependency graph must be acyclic
 * @param complexity overall complexity, decides whether a failure stops execution
 */
public record TaskPlan(
    String summary,
    List<TaskStep> steps,
    @JsonAlias("estimatedComplexity") PlanComplexity complexity
) implements Serializable {

    public TaskPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        complexity = complexity == null ? PlanComplexity.MEDIUM : complexity;
    }
}
