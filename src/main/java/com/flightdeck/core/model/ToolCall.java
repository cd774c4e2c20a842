package com.flightdeck.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the model.
 *
 * @param name   tool name, e.g. {@code read_file} or one of the reserved names
 * @param params tool parameters, never null
 */
public record ToolCall(String name, Map<String, Object> params) implements Serializable {

    public static final String TASK_COMPLETE = "task_complete";
    public static final String ASK_USER = "ask_user";

    public ToolCall {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /** Returns the string value of a parameter, or {@code null} when absent. */
    public String param(String key) {
        Object value = params.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    public boolean isReserved() {
        return TASK_COMPLETE.equals(name) || ASK_USER.equals(name);
    }
}
