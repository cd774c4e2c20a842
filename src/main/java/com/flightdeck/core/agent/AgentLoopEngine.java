package com.flightdeck.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightdeck.core.events.FlightdeckEvent;
import com.flightdeck.core.lessons.Lesson;
import com.flightdeck.core.lessons.LessonStore;
import com.flightdeck.core.llm.ChatStream;
import com.flightdeck.core.llm.ProviderException;
import com.flightdeck.core.logging.MdcContext;
import com.flightdeck.core.memory.AgentMemory;
import com.flightdeck.core.model.Agent;
import com.flightdeck.core.model.AgentStatus;
import com.flightdeck.core.model.ChatMessage;
import com.flightdeck.core.model.LoopDetectionResult;
import com.flightdeck.core.model.ToolCall;
import com.flightdeck.core.model.ToolExecution;
import com.flightdeck.core.model.ToolResult;
import com.flightdeck.core.persistence.Artifact;
import com.flightdeck.core.protocol.ToolCallProtocol.ParseResult;
import com.flightdeck.core.routing.HybridRouter;
import com.flightdeck.core.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one agent through the think-act-observe loop.
 * <p>
 * Each iteration streams the model's reply to the full history, executes the first
 * tool call in it and feeds the result back. The loop ends when the agent completes,
 * asks the user something, is stopped, gets stuck, fails, or runs out of iterations.
 * <p>
 * Not thread-safe: the {@link AgentManager} guarantees a single active loop per agent.
 */
public class AgentLoopEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentLoopEngine.class);

    static final int MAX_NO_PROGRESS = 3;
    static final int MAX_TOOL_OUTPUT = 50_000;
    static final Duration LESSON_WINDOW = Duration.ofSeconds(120);
    static final long TOOL_POLL_MS = 100;

    private static final ObjectMapper PARAMS_MAPPER = new ObjectMapper();

    private final Agent agent;
    private final AgentServices services;
    private final AgentMemory memory;
    private final ExecutorService toolPool;

    private int noProgressCount;
    private PendingError pendingError;

    /** A tool failure waiting for the call that fixes it. */
    private record PendingError(String error, String context, Instant at) {}

    public AgentLoopEngine(Agent agent, AgentServices services, AgentMemory memory, ExecutorService toolPool) {
        this.agent = agent;
        this.services = services;
        this.memory = memory;
        this.toolPool = toolPool;
    }

    public Agent agent() {
        return agent;
    }

    public AgentMemory memory() {
        return memory;
    }

    /** Seeds the conversation with the system prompt and the task. */
    void initialize() {
        memory.setTask(agent.task());
        String systemPrompt = AgentPrompts.systemPrompt(agent.agentType(),
                services.toolExecutor().describeTools(agent.agentType())) + memory.formatForPrompt();
        agent.appendMessage(ChatMessage.system(systemPrompt));
        agent.appendMessage(ChatMessage.user(agent.task()));
    }

    /**
     * Runs iterations until the agent leaves {@link AgentStatus#RUNNING}.
     */
    public void run() {
        MdcContext.setAgent(agent.id(), agent.agentType().wireName());
        try {
            log.info("Agent loop started (iteration {}/{})", agent.iterationCount(), agent.maxIterations());
            while (agent.status() == AgentStatus.RUNNING && !agent.iterationBudgetExhausted()) {
                if (!iterate()) {
                    return;
                }
            }
            if (agent.status() == AgentStatus.RUNNING) {
                finish(AgentStatus.ERROR, "Maximum iterations reached (" + agent.maxIterations() + ")");
            }
        } catch (RuntimeException e) {
            log.error("Agent loop failed unexpectedly: {}", e.getMessage(), e);
            finish(AgentStatus.ERROR, "Unexpected error: " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * One think-act-observe cycle.
     *
     * @return false when the loop must end
     */
    private boolean iterate() {
        if (agent.cancelToken().isCancelled()) {
            finish(AgentStatus.STOPPED, "Stopped by user");
            return false;
        }
        int iteration = agent.incrementIterations();
        log.debug("--- Iteration {} ---", iteration);

        String response;
        try {
            response = streamResponse();
        } catch (ProviderException e) {
            log.warn("Provider error: {}", e.getMessage());
            finish(AgentStatus.ERROR, "Provider error: " + e.getMessage());
            return false;
        }

        agent.appendMessage(ChatMessage.assistant(response));
        for (Artifact artifact : Artifact.extractCode(agent.id(), response, services.clock().instant())) {
            services.sessionStore().recordArtifact(artifact);
        }
        if (agent.cancelToken().isCancelled()) {
            finish(AgentStatus.STOPPED, "Stopped by user");
            return false;
        }

        ParseResult parsed = services.protocol().parse(response);
        Optional<ToolCall> first = parsed.first();
        if (first.isEmpty()) {
            return handleNoToolCall(response, parsed);
        }
        noProgressCount = 0;
        if (parsed.calls().size() > 1) {
            log.debug("Reply held {} tool calls; executing only '{}'", parsed.calls().size(), first.get().name());
        }
        return handleToolCall(first.get());
    }

    private String streamResponse() {
        var backend = services.backends().get(agent.target());
        var sb = new StringBuilder();
        try (ChatStream stream = backend.stream(agent.messageHistory(), agent.modelId())) {
            Optional<String> chunk;
            while ((chunk = stream.next(agent.cancelToken())).isPresent()) {
                sb.append(chunk.get());
                publish(FlightdeckEvent.AGENT_OUTPUT, Map.of("kind", "thought", "text", chunk.get()));
            }
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(e.getMessage(), e);
        }
        String response = sb.toString();
        services.router().recordCall(agent.target(), HybridRouter.estimateTokens(response));
        return response;
    }

    private boolean handleNoToolCall(String response, ParseResult parsed) {
        if (signalsCompletion(response)) {
            agent.setCompletionSummary(TextNormalizer.preview(response.strip(), 500));
            finish(AgentStatus.COMPLETED, null);
            return false;
        }
        noProgressCount++;
        services.metrics().recordParseFailure();
        log.debug("No usable tool call ({} of {})", noProgressCount, MAX_NO_PROGRESS);
        if (noProgressCount >= MAX_NO_PROGRESS) {
            String reason = parsed.hasInvalid()
                    ? "No parseable tool call after " + MAX_NO_PROGRESS + " attempts"
                    : "No tool call after " + MAX_NO_PROGRESS + " attempts";
            finish(AgentStatus.ERROR, reason);
            return false;
        }
        String correction = parsed.hasInvalid()
                ? AgentPrompts.invalidJsonCorrection(parsed.invalid().get(0))
                : AgentPrompts.NO_TOOL_CALL_CORRECTION;
        agent.appendMessage(ChatMessage.user(correction));
        return true;
    }

    static boolean signalsCompletion(String response) {
        String lower = response.toLowerCase(Locale.ROOT);
        return lower.contains(ToolCall.TASK_COMPLETE) || lower.contains("task complete");
    }

    private boolean handleToolCall(ToolCall call) {
        publish(FlightdeckEvent.AGENT_OUTPUT, Map.of("kind", "tool", "text", call.name()));
        memory.recordDecision(call.name() + " " + paramsJson(call));

        ToolResult result = call.isReserved() ? reservedResult(call) : executeTool(call);
        Instant now = services.clock().instant();
        ToolExecution execution = ToolExecution.of(call, result, now);
        agent.appendToolExecution(execution);
        services.loopDetector().recordToolExecution(agent.id(), execution);
        memory.recordAction(call.name() + (result.success() ? " -> ok" : " -> failed"));

        String output = result.success()
                ? TextNormalizer.preview(result.output(), MAX_TOOL_OUTPUT)
                : "Error: " + result.error();
        publish(FlightdeckEvent.AGENT_OUTPUT, Map.of("kind", "result", "text", TextNormalizer.preview(output, 2000)));

        String lessonsHint = result.success() ? learnFromRecovery(call, now) : rememberFailure(call, result, now);

        LoopDetectionResult loop = services.loopDetector().detectLoop(agent.id());
        if (loop.stuck()) {
            agent.setLoopDetection(loop);
            services.metrics().recordLoopDetected(loop.reason());
            publish(FlightdeckEvent.AGENT_LOOP_DETECTED, Map.of(
                    "reason", loop.reason(),
                    "evidence", loop.evidence(),
                    "suggestion", loop.suggestion()));
            finish(AgentStatus.ERROR, "Loop detected: " + loop.reason());
            return false;
        }

        if (ToolCall.TASK_COMPLETE.equals(call.name())) {
            String summary = call.param("summary");
            agent.setCompletionSummary(summary != null ? summary : "Task completed");
            finish(AgentStatus.COMPLETED, null);
            return false;
        }
        if (ToolCall.ASK_USER.equals(call.name())) {
            String question = call.param("question");
            agent.transitionTo(AgentStatus.WAITING_USER, null);
            publish(FlightdeckEvent.AGENT_STATUS, statusPayload(Map.of("question", question != null ? question : "")));
            services.sessionStore().recordAgent(agent);
            log.info("Waiting for user: {}", question);
            return false;
        }

        agent.appendMessage(ChatMessage.user(AgentPrompts.toolResultMessage(call.name(), output, lessonsHint)));
        return true;
    }

    private static ToolResult reservedResult(ToolCall call) {
        if (ToolCall.TASK_COMPLETE.equals(call.name())) {
            String summary = call.param("summary");
            return ToolResult.success(summary != null ? summary : "");
        }
        String question = call.param("question");
        return ToolResult.success(question != null ? question : "");
    }

    private String rememberFailure(ToolCall call, ToolResult result, Instant now) {
        String error = result.error() != null ? result.error() : "Tool " + call.name() + " failed";
        services.loopDetector().recordError(agent.id(), error);
        memory.recordError(error);
        pendingError = new PendingError(error, call.name() + ": " + paramsJson(call), now);

        List<Lesson> relevant = services.lessonStore().findRelevant(error);
        if (!relevant.isEmpty()) {
            log.debug("Found {} relevant fix(es) from past experience", relevant.size());
        }
        return LessonStore.formatForPrompt(relevant);
    }

    private String learnFromRecovery(ToolCall call, Instant now) {
        PendingError pending = pendingError;
        if (pending == null || call.isReserved()) {
            return "";
        }
        pendingError = null;
        if (Duration.between(pending.at(), now).compareTo(LESSON_WINDOW) < 0) {
            String fixDescription = AgentPrompts.describeFix(call);
            services.lessonStore().recordFix(pending.error(), pending.context(),
                    call.name() + ": " + paramsJson(call), fixDescription);
            services.metrics().recordLessonLearned();
            publish(FlightdeckEvent.AGENT_OUTPUT, Map.of("kind", "lesson",
                    "text", "Learned: \"" + fixDescription + "\" fixes \"" + TextNormalizer.preview(pending.error(), 50) + "\""));
        }
        return "";
    }

    /**
     * Runs the tool on the tool pool, bounded by the configured tool timeout and the
     * agent's cancellation token. Never throws.
     */
    private ToolResult executeTool(ToolCall call) {
        long start = System.currentTimeMillis();
        long deadline = start + services.properties().getToolTimeoutMs();
        ToolResult result;
        Future<ToolResult> future = toolPool.submit(() -> services.toolExecutor().execute(call, agent.agentType()));
        try {
            result = awaitTool(call, future, deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Tool {} threw: {}", call.name(), cause.getMessage());
            result = ToolResult.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            result = ToolResult.failure("Interrupted while running " + call.name());
        }
        if (result == null) {
            result = ToolResult.failure("Tool " + call.name() + " returned no result");
        }
        services.metrics().recordToolCall(call.name(), result.success(), System.currentTimeMillis() - start);
        return result;
    }

    private ToolResult awaitTool(ToolCall call, Future<ToolResult> future, long deadline)
            throws ExecutionException, InterruptedException {
        while (true) {
            try {
                return future.get(TOOL_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (agent.cancelToken().isCancelled()) {
                    future.cancel(true);
                    return ToolResult.failure("Cancelled while running " + call.name());
                }
                if (System.currentTimeMillis() >= deadline) {
                    future.cancel(true);
                    log.warn("Tool {} timed out", call.name());
                    return ToolResult.failure("Tool " + call.name() + " timed out after "
                            + services.properties().getToolTimeoutMs() + " ms");
                }
            }
        }
    }

    /**
     * Moves the agent to a final (or waiting) state and records the outcome.
     * A no-op when the transition is not allowed, e.g. the agent already finished.
     */
    void finish(AgentStatus status, String reason) {
        if (!agent.transitionTo(status, reason)) {
            return;
        }
        if (reason != null) {
            log.info("Agent {} -> {}: {}", agent.id(), status.wireName(), reason);
        } else {
            log.info("Agent {} -> {}", agent.id(), status.wireName());
        }
        if (status == AgentStatus.COMPLETED) {
            memory.recordSuccess(agent.task() + " -> " + agent.completionSummary());
        }
        memory.summarizeSession();
        services.loopDetector().clearAgent(agent.id());
        services.metrics().recordAgentResult(agent.agentType().wireName(), status.wireName());
        services.metrics().recordAgentIterations(agent.agentType().wireName(), agent.iterationCount());
        services.sessionStore().recordAgent(agent);
        publish(FlightdeckEvent.AGENT_STATUS, statusPayload(Map.of()));
    }

    private Map<String, Object> statusPayload(Map<String, Object> extra) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", agent.status().wireName());
        payload.put("iterations", agent.iterationCount());
        if (agent.failureReason() != null) {
            payload.put("reason", agent.failureReason());
        }
        if (agent.completionSummary() != null) {
            payload.put("summary", agent.completionSummary());
        }
        payload.putAll(extra);
        return payload;
    }

    private void publish(String type, Map<String, Object> payload) {
        services.eventBus().publish(FlightdeckEvent.of(type, agent.id(), null, payload));
    }

    private static String paramsJson(ToolCall call) {
        try {
            return PARAMS_MAPPER.writeValueAsString(call.params());
        } catch (JsonProcessingException e) {
            return String.valueOf(call.params());
        }
    }
}
