package com.flightdeck.core.orchestrator;

import java.util.List;

/**
 * Thrown when the step dependencies of a plan form a cycle.
 */
public class CyclicPlanException extends InvalidPlanException {

    private final List<Integer> cycle;

    public CyclicPlanException(List<Integer> cycle) {
        super("Plan has a dependency cycle: " + cycle);
        this.cycle = List.copyOf(cycle);
    }

    /** Step ids along the cycle, first id repeated at the end. */
    public List<Integer> cycle() {
        return cycle;
    }
}
