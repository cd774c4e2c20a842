package com.flightdeck.core.memory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Working and session memory of a single agent run, backed by the shared semantic store.
 * <p>
 * Working memory keeps the last {@value #CONTEXT_CAPACITY} context items and the last
 * {@value #ACTION_CAPACITY} actions. Session memory is the full log of this run.
 * Errors and successes are also written to the semantic store.
 */
public class AgentMemory {

    static final int CONTEXT_CAPACITY = 10;
    static final int ACTION_CAPACITY = 20;
    static final int PROMPT_ITEMS = 5;

    private final String agentId;
    private final String agentType;
    private final SemanticMemoryStore semanticStore;
    private final Clock clock;

    private final Deque<String> context = new ArrayDeque<>();
    private final Deque<String> recentActions = new ArrayDeque<>();
    private final List<MemoryEntry> session = new ArrayList<>();
    private String currentTask = "";
    private String summary;

    public AgentMemory(String agentId, String agentType, SemanticMemoryStore semanticStore, Clock clock) {
        this.agentId = agentId;
        this.agentType = agentType;
        this.semanticStore = semanticStore;
        this.clock = clock;
    }

    /** Sets the task and pulls related past successes and errors into working context. */
    public synchronized void setTask(String task) {
        currentTask = task;
        addSessionEntry(MemoryEntryType.TASK, task);
        for (MemoryEntry past : semanticStore.query(task, 10)) {
            if (past.type() == MemoryEntryType.SUCCESS || past.type() == MemoryEntryType.ERROR) {
                addContext("[Past " + past.type().wireName() + "]: " + past.content());
            }
        }
    }

    public synchronized void addContext(String item) {
        push(context, item, CONTEXT_CAPACITY);
    }

    public synchronized void recordAction(String action) {
        push(recentActions, action, ACTION_CAPACITY);
    }

    public synchronized void recordDecision(String decision) {
        addSessionEntry(MemoryEntryType.DECISION, decision);
    }

    public synchronized void recordError(String error) {
        semanticStore.add(addSessionEntry(MemoryEntryType.ERROR, error));
    }

    public synchronized void recordSuccess(String outcome) {
        semanticStore.add(addSessionEntry(MemoryEntryType.SUCCESS, outcome));
    }

    /** Past experience, current context and recent actions, for the system prompt. Empty when there is nothing to say. */
    public synchronized String formatForPrompt() {
        var sb = new StringBuilder();
        List<MemoryEntry> relevant = currentTask.isEmpty() ? List.of() : semanticStore.query(currentTask, PROMPT_ITEMS);
        if (!relevant.isEmpty()) {
            sb.append("\n## Relevant Past Experience\n");
            for (MemoryEntry entry : relevant) {
                String marker = switch (entry.type()) {
                    case SUCCESS -> "+";
                    case ERROR -> "x";
                    default -> "-";
                };
                sb.append(marker).append(' ').append(entry.content()).append('\n');
            }
        }
        if (!context.isEmpty()) {
            sb.append("\n## Current Context\n").append(String.join("\n", tail(context)));
        }
        if (!recentActions.isEmpty()) {
            sb.append("\n## Recent Actions\n").append(String.join("\n", tail(recentActions)));
        }
        return sb.toString();
    }

    /** Counts of this run's session entries by kind; also stored as the session summary. */
    public synchronized String summarizeSession() {
        long successes = countSession(MemoryEntryType.SUCCESS);
        long errors = countSession(MemoryEntryType.ERROR);
        long decisions = countSession(MemoryEntryType.DECISION);
        summary = "Session " + agentId + ": " + successes + " successes, " + errors + " errors, "
                + decisions + " decisions. Task: " + currentTask;
        return summary;
    }

    public synchronized List<String> context() {
        return List.copyOf(context);
    }

    public synchronized List<String> recentActions() {
        return List.copyOf(recentActions);
    }

    public synchronized List<MemoryEntry> sessionEntries() {
        return List.copyOf(session);
    }

    public synchronized String summary() {
        return summary;
    }

    private MemoryEntry addSessionEntry(MemoryEntryType type, String content) {
        MemoryEntry entry = MemoryEntry.of(agentId, agentType, type, content, clock.instant());
        session.add(entry);
        return entry;
    }

    private long countSession(MemoryEntryType type) {
        return session.stream().filter(e -> e.type() == type).count();
    }

    private static void push(Deque<String> ring, String item, int capacity) {
        ring.addLast(item);
        while (ring.size() > capacity) {
            ring.removeFirst();
        }
    }

    private static List<String> tail(Deque<String> ring) {
        var items = new ArrayList<>(ring);
        return items.subList(Math.max(0, items.size() - PROMPT_ITEMS), items.size());
    }
}
