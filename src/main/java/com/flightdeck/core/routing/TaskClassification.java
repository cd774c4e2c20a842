package com.flightdeck.core.routing;

import java.io.Serializable;

/**
 * Result of {@link HybridRouter#classify(String, String)}.
 *
 * @param type            quick or heavy
 * @param confidence      0.5 to 0.95
 * @param reason          short explanation of the decision
 * @param estimatedTokens rough token estimate of the task text (and context, if any)
 */
public record TaskClassification(
    TaskType type,
    double confidence,
    String reason,
    int estimatedTokens
) implements Serializable {

    public boolean isHeavy() {
        return type == TaskType.HEAVY;
    }
}
