package com.flightdeck.core.loop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flightdeck.core.model.LoopDetectionResult;
import com.flightdeck.core.model.ToolExecution;
import com.flightdeck.core.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flags agents that keep doing the same thing without making progress.
 * <p>
 * Per agent it keeps a bounded window of recent tool calls and errors. An agent is
 * stuck when any of these holds, checked in this order:
 * <ol>
 *   <li>the last {@value #REPEAT_THRESHOLD} calls have the same name and parameters</li>
 *   <li>one normalized error occurs {@value #REPEAT_THRESHOLD} or more times among the
 *       last {@value #ERROR_WINDOW} errors</li>
 *   <li>the last {@code 2 * }{@value #REPEAT_THRESHOLD} calls alternate between two tool
 *       names and each call repeats the one two positions before it</li>
 * </ol>
 * The verdict depends only on the recorded sequence.
 */
@Service
public class LoopDetector {

    private static final Logger log = LoggerFactory.getLogger(LoopDetector.class);

    static final int REPEAT_THRESHOLD = 3;
    static final int TOOL_WINDOW = 20;
    static final int ERROR_WINDOW = 5;

    private final ConcurrentHashMap<String, AgentWindow> windows = new ConcurrentHashMap<>();
    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    /** Recent history of one agent. */
    private static final class AgentWindow {
        final Deque<String> callSignatures = new ArrayDeque<>();
        final Deque<String> callNames = new ArrayDeque<>();
        final Deque<String> errors = new ArrayDeque<>();
        int totalCalls;
        int totalErrors;
    }

    public void recordToolExecution(String agentId, ToolExecution execution) {
        String signature = signature(execution);
        AgentWindow window = windows.computeIfAbsent(agentId, k -> new AgentWindow());
        synchronized (window) {
            window.callSignatures.addLast(signature);
            window.callNames.addLast(execution.toolName());
            window.totalCalls++;
            if (window.callSignatures.size() > TOOL_WINDOW) {
                window.callSignatures.removeFirst();
                window.callNames.removeFirst();
            }
        }
    }

    public void recordError(String agentId, String error) {
        String normalized = TextNormalizer.normalizeError(error);
        AgentWindow window = windows.computeIfAbsent(agentId, k -> new AgentWindow());
        synchronized (window) {
            window.errors.addLast(normalized);
            window.totalErrors++;
            if (window.errors.size() > ERROR_WINDOW) {
                window.errors.removeFirst();
            }
        }
    }

    public LoopDetectionResult detectLoop(String agentId) {
        AgentWindow window = windows.get(agentId);
        if (window == null) {
            return LoopDetectionResult.notStuck();
        }
        List<String> signatures;
        List<String> names;
        List<String> errors;
        synchronized (window) {
            signatures = new ArrayList<>(window.callSignatures);
            names = new ArrayList<>(window.callNames);
            errors = new ArrayList<>(window.errors);
        }

        LoopDetectionResult result = detectRepeatedCall(signatures);
        if (!result.stuck()) {
            result = detectRepeatedError(errors);
        }
        if (!result.stuck()) {
            result = detectPingPong(signatures, names);
        }
        if (result.stuck()) {
            log.info("Agent {} is stuck: {}", agentId, result.reason());
        }
        return result;
    }

    private static LoopDetectionResult detectRepeatedCall(List<String> signatures) {
        if (signatures.size() < REPEAT_THRESHOLD) {
            return LoopDetectionResult.notStuck();
        }
        List<String> tail = signatures.subList(signatures.size() - REPEAT_THRESHOLD, signatures.size());
        if (tail.stream().distinct().count() != 1) {
            return LoopDetectionResult.notStuck();
        }
        return LoopDetectionResult.stuck(
                "Repeating same tool call",
                new ArrayList<>(tail),
                "Try a different approach or break down the task differently");
    }

    private static LoopDetectionResult detectRepeatedError(List<String> errors) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String error : errors) {
            counts.merge(error, 1, Integer::sum);
        }
        for (var entry : counts.entrySet()) {
            if (entry.getValue() >= REPEAT_THRESHOLD) {
                List<String> evidence = errors.stream().filter(entry.getKey()::equals).toList();
                return LoopDetectionResult.stuck(
                        "Repeating same error (" + entry.getValue() + " times in last " + errors.size() + " errors)",
                        evidence,
                        "Agent may need different tools or permissions to proceed");
            }
        }
        return LoopDetectionResult.notStuck();
    }

    private static LoopDetectionResult detectPingPong(List<String> signatures, List<String> names) {
        int span = 2 * REPEAT_THRESHOLD;
        if (signatures.size() < span) {
            return LoopDetectionResult.notStuck();
        }
        int from = signatures.size() - span;
        List<String> tailNames = names.subList(from, names.size());
        List<String> tailSignatures = signatures.subList(from, signatures.size());
        if (new LinkedHashSet<>(tailNames).size() != 2) {
            return LoopDetectionResult.notStuck();
        }
        for (int i = 1; i < span; i++) {
            if (tailNames.get(i).equals(tailNames.get(i - 1))) {
                return LoopDetectionResult.notStuck();
            }
            if (i >= 2 && !tailSignatures.get(i).equals(tailSignatures.get(i - 2))) {
                return LoopDetectionResult.notStuck();
            }
        }
        return LoopDetectionResult.stuck(
                "Alternating between " + tailNames.get(0) + " and " + tailNames.get(1) + " without progress",
                new ArrayList<>(tailSignatures),
                "Agent needs to try a fundamentally different strategy");
    }

    /** Forgets everything recorded for the agent, e.g. before a retry with a new approach. */
    public void clearAgent(String agentId) {
        windows.remove(agentId);
    }

    public LoopStats stats(String agentId) {
        AgentWindow window = windows.get(agentId);
        if (window == null) {
            return new LoopStats(0, 0, 0, List.of());
        }
        synchronized (window) {
            var names = new ArrayList<>(window.callNames);
            List<String> recent = names.subList(Math.max(0, names.size() - 5), names.size());
            return new LoopStats(window.totalCalls, window.totalErrors,
                    (int) names.stream().distinct().count(), List.copyOf(recent));
        }
    }

    /**
     * Debug counters for one agent.
     *
     * @param toolExecutions calls recorded since the agent was last cleared
     * @param errors         errors recorded since the agent was last cleared
     * @param uniqueTools    distinct tool names in the current window
     * @param recentTools    the last five tool names, oldest first
     */
    public record LoopStats(int toolExecutions, int errors, int uniqueTools, List<String> recentTools) {}

    private String signature(ToolExecution execution) {
        try {
            return execution.toolName() + " " + canonicalMapper.writeValueAsString(execution.params());
        } catch (JsonProcessingException e) {
            return execution.toolName() + " " + execution.params();
        }
    }
}
