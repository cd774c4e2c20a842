package com.flightdeck.core.logging;

import org.slf4j.MDC;

/**
 * Manages the Flightdeck MDC keys used by the log pattern.
 */
public final class MdcContext {

    public static final String AGENT_ID = "agentId";
    public static final String AGENT_TYPE = "agentType";
    public static final String STEP_ID = "stepId";

    private MdcContext() {}

    public static void setAgent(String agentId, String agentType) {
        MDC.put(AGENT_ID, agentId);
        MDC.put(AGENT_TYPE, agentType);
    }

    public static void setStep(int stepId) {
        MDC.put(STEP_ID, String.valueOf(stepId));
    }

    public static void clearStep() {
        MDC.remove(STEP_ID);
    }

    public static void clear() {
        MDC.remove(AGENT_ID);
        MDC.remove(AGENT_TYPE);
        MDC.remove(STEP_ID);
    }
}
