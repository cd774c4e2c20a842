package com.flightdeck.core.agent;

import com.flightdeck.core.events.FlightdeckEvent;
import com.flightdeck.core.llm.ModelBackend;
import com.flightdeck.core.memory.AgentMemory;
import com.flightdeck.core.model.Agent;
import com.flightdeck.core.model.AgentStatus;
import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.ChatMessage;
import com.flightdeck.core.routing.ExecutionTarget;
import com.flightdeck.core.routing.TaskClassification;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of agents. Spawns them, runs their loops on a shared executor and
 * guarantees that at most one loop per agent id is active at a time.
 */
@Service
public class AgentManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentManager.class);

    private final AgentServices services;
    private final Map<String, AgentLoopEngine> engines = new ConcurrentHashMap<>();
    /** Ids of agents whose loop is currently submitted or running. */
    private final Map<String, Boolean> activeLoops = new ConcurrentHashMap<>();

    private final ExecutorService loopPool = Executors.newCachedThreadPool(daemonThreads("agent-loop"));
    private final ExecutorService toolPool = Executors.newCachedThreadPool(daemonThreads("agent-tool"));

    private volatile boolean closed;

    public AgentManager(AgentServices services) {
        this.services = services;
    }

    /**
     * Creates an agent for the task, routes it to a backend and starts its loop.
     *
     * @param forced {@link ExecutionTarget#AUTO} (or null) lets the router decide
     */
    public Agent spawn(AgentType agentType, String task, ExecutionTarget forced) {
        if (closed) {
            throw new IllegalStateException("AgentManager is closed");
        }
        TaskClassification classification = services.router().classify(task, null);
        ExecutionTarget target = services.router().decideTarget(classification, forced);
        services.metrics().recordRoutingDecision(target.wireName(), classification.type().wireName());

        ModelBackend backend = services.backends().get(target);
        String id = "agent-" + UUID.randomUUID().toString().substring(0, 8);
        var agent = new Agent(id, agentType, task, backend.defaultModelId(), target,
                services.properties().getMaxIterations(), services.clock());
        var memory = new AgentMemory(id, agentType.wireName(), services.semanticMemory(), services.clock());
        var engine = new AgentLoopEngine(agent, services, memory, toolPool);
        engine.initialize();
        engines.put(id, engine);

        log.info("Spawned {} agent {} on {} ({}, {})", agentType.wireName(), id, target.wireName(),
                classification.type().wireName(), classification.reason());
        services.eventBus().publish(FlightdeckEvent.of(FlightdeckEvent.AGENT_SPAWNED, id, null, Map.of(
                "agentType", agentType.wireName(),
                "task", task,
                "target", target.wireName(),
                "modelId", agent.modelId())));
        services.sessionStore().recordAgent(agent);

        startLoop(id);
        return agent;
    }

    /**
     * Starts the agent's loop unless one is already active, in which case this is a no-op.
     *
     * @return true if a new loop was submitted
     */
    public boolean startLoop(String agentId) {
        AgentLoopEngine engine = engineFor(agentId);
        if (activeLoops.putIfAbsent(agentId, Boolean.TRUE) != null) {
            log.debug("Loop already active for {}", agentId);
            return false;
        }
        Agent agent = engine.agent();
        if (agent.status() == AgentStatus.IDLE) {
            agent.transitionTo(AgentStatus.RUNNING, null);
        }
        if (agent.status() != AgentStatus.RUNNING) {
            activeLoops.remove(agentId);
            return false;
        }
        try {
            loopPool.submit(() -> runLoop(engine));
            return true;
        } catch (RejectedExecutionException e) {
            activeLoops.remove(agentId);
            engine.finish(AgentStatus.STOPPED, "Agent manager shut down");
            return false;
        }
    }

    private void runLoop(AgentLoopEngine engine) {
        String id = engine.agent().id();
        try {
            engine.run();
        } finally {
            activeLoops.remove(id);
        }
        // Resumed while this loop was winding down: the resume's own start was a no-op
        if (engine.agent().status() == AgentStatus.RUNNING && !closed) {
            startLoop(id);
        }
    }

    /**
     * Answers an agent's {@code ask_user} question and resumes its loop.
     *
     * @throws IllegalStateException if the agent is not waiting for the user
     */
    public void continueAgent(String agentId, String message) {
        AgentLoopEngine engine = engineFor(agentId);
        Agent agent = engine.agent();
        if (agent.status() != AgentStatus.WAITING_USER) {
            throw new IllegalStateException("Agent " + agentId + " is not waiting for input (status: "
                    + agent.status().wireName() + ")");
        }
        agent.appendMessage(ChatMessage.user(message));
        engine.memory().addContext("User: " + message);
        agent.transitionTo(AgentStatus.RUNNING, null);
        services.eventBus().publish(FlightdeckEvent.of(FlightdeckEvent.AGENT_STATUS, agentId, null,
                Map.of("status", AgentStatus.RUNNING.wireName(), "iterations", agent.iterationCount())));
        startLoop(agentId);
    }

    /**
     * Requests cancellation. A running loop stops at its next suspension point;
     * an idle or waiting agent is stopped right away.
     *
     * @return false if the agent had already finished
     */
    public boolean stopAgent(String agentId) {
        AgentLoopEngine engine = engineFor(agentId);
        Agent agent = engine.agent();
        if (agent.status().isTerminal()) {
            return false;
        }
        agent.cancelToken().cancel();
        if (!activeLoops.containsKey(agentId) || agent.status() != AgentStatus.RUNNING) {
            engine.finish(AgentStatus.STOPPED, "Stopped by user");
        }
        log.info("Stop requested for {}", agentId);
        return true;
    }

    public Optional<Agent> get(String agentId) {
        AgentLoopEngine engine = engines.get(agentId);
        return engine == null ? Optional.empty() : Optional.of(engine.agent());
    }

    public List<Agent> all() {
        return engines.values().stream().map(AgentLoopEngine::agent).toList();
    }

    public List<Agent> running() {
        return all().stream().filter(a -> a.status() == AgentStatus.RUNNING).toList();
    }

    boolean isLoopActive(String agentId) {
        return activeLoops.containsKey(agentId);
    }

    private AgentLoopEngine engineFor(String agentId) {
        AgentLoopEngine engine = engines.get(agentId);
        if (engine == null) {
            throw new IllegalArgumentException("Unknown agent: " + agentId);
        }
        return engine;
    }

    /**
     * Stops every agent and drains the executors.
     */
    @PreDestroy
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (AgentLoopEngine engine : engines.values()) {
            if (!engine.agent().status().isTerminal()) {
                stopAgent(engine.agent().id());
            }
        }
        loopPool.shutdown();
        try {
            if (!loopPool.awaitTermination(5, TimeUnit.SECONDS)) {
                loopPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        toolPool.shutdownNow();
        log.info("Agent manager stopped ({} agents)", engines.size());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
