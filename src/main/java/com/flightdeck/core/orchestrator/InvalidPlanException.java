package com.flightdeck.core.orchestrator;

/**
 * Thrown when a plan cannot be executed: duplicate step ids, dependencies on
 * unknown steps, or a dependency cycle.
 */
public class InvalidPlanException extends RuntimeException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
