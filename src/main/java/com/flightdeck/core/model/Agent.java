package com.flightdeck.core.model;

import com.flightdeck.core.routing.ExecutionTarget;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One instance of the think-act-observe loop bound to a single task.
 * <p>
 * The message and tool histories are append-only. Status changes go through
 * {@link #transitionTo(AgentStatus, String)}, which enforces the state machine:
 * terminal states are final and {@code WAITING_USER -> RUNNING} is the only
 * way back into the loop.
 */
public class Agent {

    private final String id;
    private final AgentType agentType;
    private final String task;
    private final String modelId;
    private final ExecutionTarget target;
    private final int maxIterations;
    private final Instant startedAt;
    private final Clock clock;
    private final CancellationToken cancelToken = new CancellationToken();

    private final List<ChatMessage> messageHistory = new ArrayList<>();
    private final List<ToolExecution> toolHistory = new ArrayList<>();

    private volatile AgentStatus status = AgentStatus.IDLE;
    private volatile int iterationCount;
    private volatile Instant endedAt;
    private volatile String failureReason;
    private volatile String completionSummary;
    private volatile LoopDetectionResult loopDetection;

    public Agent(String id, AgentType agentType, String task, String modelId,
                 ExecutionTarget target, int maxIterations, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.agentType = Objects.requireNonNull(agentType, "agentType");
        this.task = Objects.requireNonNull(task, "task");
        this.modelId = modelId;
        this.target = target;
        this.maxIterations = maxIterations;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    public String id() { return id; }
    public AgentType agentType() { return agentType; }
    public String task() { return task; }
    public String modelId() { return modelId; }
    public ExecutionTarget target() { return target; }
    public int maxIterations() { return maxIterations; }
    public Instant startedAt() { return startedAt; }
    public Instant endedAt() { return endedAt; }
    public AgentStatus status() { return status; }
    public int iterationCount() { return iterationCount; }
    public CancellationToken cancelToken() { return cancelToken; }

    /** Human-readable reason attached to a terminal non-completed state, null otherwise. */
    public String failureReason() { return failureReason; }

    /** Summary given by the agent when it completed, null otherwise. */
    public String completionSummary() { return completionSummary; }

    public void setCompletionSummary(String completionSummary) { this.completionSummary = completionSummary; }

    /** The loop detector's verdict when the agent was stopped for looping, null otherwise. */
    public LoopDetectionResult loopDetection() { return loopDetection; }

    public void setLoopDetection(LoopDetectionResult loopDetection) { this.loopDetection = loopDetection; }

    public synchronized List<ChatMessage> messageHistory() {
        return Collections.unmodifiableList(new ArrayList<>(messageHistory));
    }

    public synchronized List<ToolExecution> toolHistory() {
        return Collections.unmodifiableList(new ArrayList<>(toolHistory));
    }

    public synchronized void appendMessage(ChatMessage message) {
        messageHistory.add(Objects.requireNonNull(message, "message"));
    }

    public synchronized void appendToolExecution(ToolExecution execution) {
        toolHistory.add(Objects.requireNonNull(execution, "execution"));
    }

    public int incrementIterations() {
        synchronized (this) {
            return ++iterationCount;
        }
    }

    public boolean iterationBudgetExhausted() {
        return iterationCount >= maxIterations;
    }

    /**
     * Applies a status transition.
     *
     * @param next   the new status
     * @param reason failure reason for {@code ERROR}/{@code STOPPED}, ignored otherwise
     * @return true if the transition was applied, false if it is not allowed from the current state
     */
    public synchronized boolean transitionTo(AgentStatus next, String reason) {
        if (!isAllowed(status, next)) {
            return false;
        }
        status = next;
        if (next == AgentStatus.ERROR || next == AgentStatus.STOPPED) {
            failureReason = reason;
        } else if (next == AgentStatus.RUNNING) {
            failureReason = null;
        }
        if (next.isTerminal()) {
            endedAt = clock.instant();
        }
        return true;
    }

    private static boolean isAllowed(AgentStatus from, AgentStatus to) {
        if (from.isTerminal() || from == to) {
            return false;
        }
        return switch (from) {
            case IDLE -> to == AgentStatus.RUNNING || to == AgentStatus.STOPPED;
            case RUNNING -> to != AgentStatus.IDLE;
            case WAITING_USER -> to == AgentStatus.RUNNING || to == AgentStatus.STOPPED;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return "Agent[" + id + ", " + agentType.wireName() + ", " + status.wireName() + "]";
    }
}
