package com.flightdeck.core.agent;

import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.ToolCall;
import com.flightdeck.core.model.ToolResult;

/**
 * Runs the tools agents ask for (file I/O, shell, git, browser). Implementations
 * live outside the engine and are registered as a Spring bean.
 * <p>
 * The engine calls {@link #execute} from a worker thread, interrupts it when the
 * tool timeout expires or the agent is stopped, and converts thrown exceptions into
 * failed results.
 */
public interface ToolExecutor {

    ToolResult execute(ToolCall call, AgentType agentType);

    /**
     * Tool documentation included in the agent's system prompt.
     */
    default String describeTools(AgentType agentType) {
        return "";
    }
}
