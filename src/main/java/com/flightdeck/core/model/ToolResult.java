package com.flightdeck.core.model;

import java.io.Serializable;

/**
 * Outcome of a tool execution as reported by the tool executor.
 */
public record ToolResult(boolean success, String output, String error) implements Serializable {

    public ToolResult {
        output = output == null ? "" : output;
    }

    public static ToolResult success(String output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, "", error);
    }
}
