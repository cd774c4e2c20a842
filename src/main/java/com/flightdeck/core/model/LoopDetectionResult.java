package com.flightdeck.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Verdict of the loop detector for one agent.
 */
public record LoopDetectionResult(
    boolean stuck,
    String reason,
    List<String> evidence,
    String suggestion
) implements Serializable {

    private static final LoopDetectionResult NOT_STUCK = new LoopDetectionResult(false, null, List.of(), null);

    public LoopDetectionResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static LoopDetectionResult notStuck() {
        return NOT_STUCK;
    }

    public static LoopDetectionResult stuck(String reason, List<String> evidence, String suggestion) {
        return new LoopDetectionResult(true, reason, evidence, suggestion);
    }
}
