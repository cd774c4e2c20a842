package com.flightdeck.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit-trail entry of an agent's tool history.
 */
public record ToolExecution(
    String toolName,
    Map<String, Object> params,
    ToolResult result,
    Instant timestamp
) implements Serializable {

    public ToolExecution {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static ToolExecution of(ToolCall call, ToolResult result, Instant timestamp) {
        return new ToolExecution(call.name(), call.params(), result, timestamp);
    }
}
