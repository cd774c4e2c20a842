package com.flightdeck.core.agent;

import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.ToolCall;

import java.util.Map;

/**
 * System prompts per agent type and the corrective messages of the no-progress policy.
 */
public final class AgentPrompts {

    private AgentPrompts() {}

    private static final Map<AgentType, String> ROLES = Map.of(
            AgentType.FRONTEND, """
                    You are a Frontend Agent. You build and fix user interfaces: components,
                    styles, client-side state and routing.""",
            AgentType.BACKEND, """
                    You are a Backend Agent. You build and fix servers, APIs, data models,
                    persistence and business logic.""",
            AgentType.TESTING, """
                    You are a Testing Agent. You write and run tests and fix what fails.
                    RULES:
                    - Fix source code, not tests (unless the test is wrong)
                    - Ignore security warnings in test files if they're fake credentials""",
            AgentType.BROWSER, """
                    You are a Browser Agent. You drive a browser: navigate, inspect elements,
                    click, type and take screenshots to verify that an app works.""",
            AgentType.GENERAL, """
                    You are a General Agent. You handle any development task: files, shell
                    commands, git and project setup.""",
            AgentType.CLEANER, """
                    You are a Cleaner Agent. Your job is to clean up code: remove unused
                    imports and dead code, fix formatting and lint errors."""
    );

    private static final String TOOL_FORMAT = """
            # Tool Format
            Work one step at a time. Every reply must contain exactly ONE tool call in this EXACT format:
            ```tool
            {"name": "tool_name", "params": {"key": "value"}}
            ```

            OR for task completion:
            ```tool
            {"name": "task_complete", "params": {"summary": "What you accomplished"}}
            ```

            OR to ask the user a question:
            ```tool
            {"name": "ask_user", "params": {"question": "Your question here"}}
            ```

            Only the first tool block of a reply is executed. You will receive its result
            as the next message.""";

    static final String NO_TOOL_CALL_CORRECTION = """
            STOP! Your response did not contain a valid tool call.

            DO NOT explain what you will do. DO NOT say "I will" or "Let me".
            JUST OUTPUT THE TOOL BLOCK directly.

            FORMAT (copy this exactly):
            ```tool
            {"name": "tool_name", "params": {"key": "value"}}
            ```

            When you are done:
            ```tool
            {"name": "task_complete", "params": {"summary": "What I did"}}
            ```

            OUTPUT A TOOL BLOCK NOW - nothing else!""";

    static final String INVALID_JSON_CORRECTION = """
            Your tool block could not be parsed as JSON:
            %s

            The block must hold ONE JSON object with a "name" string and a "params" object.
            Escape quotes and newlines inside strings (\\" and \\n). Do not add text inside the block.

            ```tool
            {"name": "tool_name", "params": {"key": "value"}}
            ```

            Send the corrected tool block now.""";

    static final String NEXT_ACTION = "Next action?";

    public static String systemPrompt(AgentType type, String toolDescriptions) {
        var sb = new StringBuilder(ROLES.get(type)).append("\n\n");
        if (toolDescriptions != null && !toolDescriptions.isBlank()) {
            sb.append("# Available Tools\n").append(toolDescriptions.strip()).append("\n\n");
        }
        return sb.append(TOOL_FORMAT).toString();
    }

    static String invalidJsonCorrection(String preview) {
        return INVALID_JSON_CORRECTION.formatted(preview);
    }

    static String toolResultMessage(String toolName, String output, String lessonsHint) {
        return "Result of " + toolName + ":\n" + output + lessonsHint + "\n\n" + NEXT_ACTION;
    }

    /** Short human-readable description of what a successful call did, used as a lesson's fix description. */
    static String describeFix(ToolCall call) {
        String name = call.name();
        String code = call.param("code");
        if (code != null) {
            if (code.contains("fs.write")) return "File edit";
            if (code.contains("shell.run")) return "Shell command";
            if (code.contains("test.")) return "Test execution";
        }
        String path = call.param("path");
        if (name.contains("write") || name.contains("edit")) {
            return path != null ? "File edit of " + path : "File edit";
        }
        if (name.contains("command") || name.contains("shell")) {
            String command = call.param("command");
            return command != null ? "Shell command: " + command : "Shell command";
        }
        return name + " call";
    }
}
