package com.flightdeck.core.agent;

import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.ToolCall;
import com.flightdeck.core.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no tool executor bean is registered. Every call fails with a message
 * the model can read, so agents can still plan and complete tool-free tasks.
 */
public class UnconfiguredToolExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredToolExecutor.class);

    @Override
    public ToolResult execute(ToolCall call, AgentType agentType) {
        log.warn("Tool '{}' requested but no tool executor is configured", call.name());
        return ToolResult.failure("Unknown tool '" + call.name() + "': no tool executor is configured");
    }
}
