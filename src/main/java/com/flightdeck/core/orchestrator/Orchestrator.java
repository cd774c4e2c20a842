package com.flightdeck.core.orchestrator;

import com.flightdeck.core.agent.AgentManager;
import com.flightdeck.core.config.FlightdeckProperties;
import com.flightdeck.core.events.EventBus;
import com.flightdeck.core.events.FlightdeckEvent;
import com.flightdeck.core.llm.LlmService;
import com.flightdeck.core.logging.MdcContext;
import com.flightdeck.core.metrics.FlightdeckMetrics;
import com.flightdeck.core.model.Agent;
import com.flightdeck.core.model.AgentResult;
import com.flightdeck.core.model.AgentStatus;
import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.LoopDetectionResult;
import com.flightdeck.core.model.PlanComplexity;
import com.flightdeck.core.model.TaskPlan;
import com.flightdeck.core.model.TaskStep;
import com.flightdeck.core.persistence.SessionStore;
import com.flightdeck.core.routing.ExecutionTarget;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Turns a user request into a {@link TaskPlan} with the planning model, then runs
 * the plan's steps in dependency order, one agent per step.
 */
@Service
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final long POLL_INTERVAL_MS = 500;
    static final long STOP_GRACE_MS = 5_000;
    static final String SOURCE = "orchestrator";

    private static final String SYSTEM_PROMPT = """
            You are the planner for Flightdeck, a system of specialized coding agents.
            Break the user's request into concrete steps and assign each step to one agent.

            Available agent types:
            - frontend: React/Vue/CSS, UI components, styling, builds
            - backend: APIs, databases, server code, Python/Node
            - testing: run tests, analyze failures, fix test issues
            - browser: automated browser testing, UI interaction
            - cleaner: code cleanup, formatting, dead code removal
            - general: anything else

            Each step has:
            - id: a unique integer
            - description: what the step accomplishes
            - agentType: one of the types above
            - dependencyIds: ids of steps that must finish successfully first
            - instruction: the specific task for the agent, self-contained

            Rules:
            1. Keep plans focused and minimal. A single step is often enough.
            2. Dependencies must only point at other steps in the plan and must not form a cycle.
            3. Be specific in instructions: name files, commands and expected results.
            4. Include a testing step for code changes.
            5. Set complexity to "simple", "medium" or "complex".

            Respond with valid JSON matching the schema provided.
            """;

    private static final String USER_PROMPT = """
            User request: "%s"

            Analyze this request and create an execution plan.
            """;

    private final LlmService planner;
    private final AgentManager agentManager;
    private final EventBus eventBus;
    private final SessionStore sessionStore;
    private final FlightdeckMetrics metrics;
    private final FlightdeckProperties properties;
    private final Clock clock;

    private volatile boolean closed;
    private volatile String currentAgentId;

    public Orchestrator(LlmService planner, AgentManager agentManager, EventBus eventBus,
                        SessionStore sessionStore, FlightdeckMetrics metrics,
                        FlightdeckProperties properties, Clock clock) {
        this.planner = planner;
        this.agentManager = agentManager;
        this.eventBus = eventBus;
        this.sessionStore = sessionStore;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Asks the planning model for a plan. Any failure (empty or unparseable output,
     * an empty or invalid plan, a provider error) yields a single-step fallback plan.
     */
    public TaskPlan createPlan(String request) {
        long start = System.currentTimeMillis();
        TaskPlan plan;
        try {
            plan = planner.structuredCall(SYSTEM_PROMPT, USER_PROMPT.formatted(request), TaskPlan.class);
            if (plan == null || plan.steps().isEmpty()) {
                log.warn("Planner returned no steps, using fallback plan");
                plan = fallbackPlan(request);
            } else {
                PlanValidator.topologicalOrder(plan);
            }
        } catch (InvalidPlanException e) {
            log.warn("Planner returned an invalid plan ({}), using fallback plan", e.getMessage());
            plan = fallbackPlan(request);
        } catch (RuntimeException e) {
            log.warn("Planning failed ({}), using fallback plan", e.getMessage());
            plan = fallbackPlan(request);
        }
        metrics.recordPlanningDuration(System.currentTimeMillis() - start);

        String planId = "plan-" + clock.millis();
        eventBus.publish(FlightdeckEvent.of(FlightdeckEvent.PLAN_CREATED, planId, null, Map.of(
                "summary", plan.summary() != null ? plan.summary() : "",
                "steps", plan.steps().size(),
                "complexity", plan.complexity().wireName())));
        sessionStore.recordMessage(SOURCE, "user", "plan", describePlan(plan));
        log.info("Plan: {} step(s), {} - {}", plan.steps().size(), plan.complexity().wireName(),
                plan.steps().stream().map(s -> s.id() + "[" + s.agentType().wireName() + "](deps:" + s.dependencyIds() + ")").toList());
        return plan;
    }

    static TaskPlan fallbackPlan(String request) {
        AgentType agentType = inferAgentType(request);
        var step = new TaskStep(1, request, agentType, List.of(), request);
        return new TaskPlan("Execute: " + request, List.of(step), PlanComplexity.SIMPLE);
    }

    /**
     * Keyword pick of the agent type for a request the planner could not handle.
     */
    static AgentType inferAgentType(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (containsAny(lower, "test", "spec", "coverage")) {
            return AgentType.TESTING;
        }
        if (containsAny(lower, "react", "vue", "css", "component", "ui", "frontend")) {
            return AgentType.FRONTEND;
        }
        if (containsAny(lower, "api", "database", "server", "backend", "python", "endpoint")) {
            return AgentType.BACKEND;
        }
        if (containsAny(lower, "browser", "click", "navigate")) {
            return AgentType.BROWSER;
        }
        if (containsAny(lower, "clean", "format", "lint", "unused", "dead code")) {
            return AgentType.CLEANER;
        }
        return AgentType.GENERAL;
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs the plan's steps one at a time in topological order.
     * <p>
     * A step runs only if all its dependencies completed; otherwise it is skipped.
     * A failed step stops the plan unless the plan is {@link PlanComplexity#SIMPLE}.
     *
     * @return one result per step that ran or was skipped, in execution order
     * @throws InvalidPlanException if the plan's dependency graph is invalid
     */
    public List<AgentResult> executePlan(TaskPlan plan) {
        List<TaskStep> ordered = PlanValidator.topologicalOrder(plan);
        long start = System.currentTimeMillis();
        var results = new ArrayList<AgentResult>();
        Set<Integer> succeeded = new HashSet<>();
        int spawns = 0;
        String outcome = "completed";

        for (TaskStep step : ordered) {
            if (closed) {
                outcome = "stopped";
                break;
            }
            MdcContext.setStep(step.id());
            try {
                List<Integer> unmet = step.dependencyIds().stream().filter(d -> !succeeded.contains(d)).toList();
                if (!unmet.isEmpty()) {
                    log.info("Skipping step {}: dependencies {} did not complete", step.id(), unmet);
                    eventBus.publish(FlightdeckEvent.of(FlightdeckEvent.STEP_SKIPPED, null, step.id(),
                            Map.of("unmetDependencies", unmet)));
                    results.add(new AgentResult(null, step.id(), step.agentType(), step.instruction(),
                            AgentStatus.STOPPED, "Skipped: dependencies " + unmet + " did not complete"));
                    continue;
                }

                String instruction = step.instruction();
                AgentResult result = null;
                int retriesLeft = properties.getLoopRetries();
                while (true) {
                    if (spawns >= properties.getOrchestratorMaxIterations()) {
                        log.warn("Spawn limit of {} reached, stopping plan", properties.getOrchestratorMaxIterations());
                        break;
                    }
                    spawns++;
                    StepRun run = runStep(step, instruction);
                    Agent agent = run.agent();
                    result = toResult(step, instruction, run);
                    LoopDetectionResult loop = agent.loopDetection();
                    if (agent.status() == AgentStatus.ERROR && loop != null && loop.stuck() && retriesLeft > 0) {
                        retriesLeft--;
                        log.info("Step {} got stuck ({}), retrying with the detector's hint", step.id(), loop.reason());
                        instruction = step.instruction() + "\n\nA previous attempt got stuck: " + loop.reason()
                                + ". " + loop.suggestion();
                        continue;
                    }
                    break;
                }
                if (result == null) {
                    outcome = "spawn_limit";
                    break;
                }
                results.add(result);
                if (result.succeeded()) {
                    succeeded.add(step.id());
                } else if (plan.complexity() != PlanComplexity.SIMPLE) {
                    log.info("Step {} failed, stopping execution", step.id());
                    outcome = "failed";
                    break;
                }
            } finally {
                MdcContext.clearStep();
            }
        }
        if ("completed".equals(outcome) && results.stream().anyMatch(r -> !r.succeeded())) {
            outcome = "partial";
        }
        metrics.recordPlanResult(outcome, results.size(), System.currentTimeMillis() - start);
        return results;
    }

    /**
     * Spawns the step's agent and blocks until it reaches a terminal state or
     * the default timeout elapses, in which case the agent is stopped.
     */
    private StepRun runStep(TaskStep step, String instruction) {
        log.info("Executing step {}: {}", step.id(), step.description());
        Agent agent = agentManager.spawn(step.agentType(), instruction, ExecutionTarget.AUTO);
        currentAgentId = agent.id();
        eventBus.publish(FlightdeckEvent.of(FlightdeckEvent.STEP_STARTED, agent.id(), step.id(), Map.of(
                "description", step.description() != null ? step.description() : "",
                "agentType", step.agentType().wireName())));
        sessionStore.recordMessage(SOURCE, agent.id(), "task", instruction);

        boolean timedOut = false;
        try {
            boolean finished = awaitTerminal(agent, properties.getDefaultTimeoutMs());
            if (!finished) {
                timedOut = true;
                log.warn("Step {} timed out after {} ms, stopping agent {}", step.id(),
                        properties.getDefaultTimeoutMs(), agent.id());
                agentManager.stopAgent(agent.id());
                awaitTerminal(agent, STOP_GRACE_MS);
                if (!agent.status().isTerminal()) {
                    agent.transitionTo(AgentStatus.STOPPED, "Timed out after " + properties.getDefaultTimeoutMs() + " ms");
                }
            }
            if (agent.status() == AgentStatus.WAITING_USER) {
                log.info("Agent {} asked for input during plan execution, stopping it", agent.id());
                agentManager.stopAgent(agent.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            agentManager.stopAgent(agent.id());
        } finally {
            currentAgentId = null;
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", agent.status().wireName());
        if (agent.failureReason() != null) {
            payload.put("reason", agent.failureReason());
        }
        eventBus.publish(FlightdeckEvent.of(FlightdeckEvent.STEP_COMPLETED, agent.id(), step.id(), payload));
        return new StepRun(agent, timedOut);
    }

    private record StepRun(Agent agent, boolean timedOut) {}

    /**
     * Waits on the agent's status events, polling as a fallback for events that
     * fired before the subscription existed. {@code WAITING_USER} counts as finished:
     * nobody answers questions during plan execution.
     */
    private boolean awaitTerminal(Agent agent, long timeoutMs) throws InterruptedException {
        var latch = new CountDownLatch(1);
        try (EventBus.Subscription ignored = eventBus.subscribe(agent.id(), event -> {
            if (FlightdeckEvent.AGENT_STATUS.equals(event.eventType()) && isFinished(agent.status())) {
                latch.countDown();
            }
        })) {
            long deadline = System.currentTimeMillis() + timeoutMs;
            while (!isFinished(agent.status())) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                latch.await(Math.min(POLL_INTERVAL_MS, remaining), TimeUnit.MILLISECONDS);
            }
            return true;
        }
    }

    private static boolean isFinished(AgentStatus status) {
        return status.isTerminal() || status == AgentStatus.WAITING_USER;
    }

    private AgentResult toResult(TaskStep step, String instruction, StepRun run) {
        Agent agent = run.agent();
        String summary;
        if (run.timedOut() && agent.status() != AgentStatus.COMPLETED) {
            summary = "Timed out after " + properties.getDefaultTimeoutMs() + " ms";
        } else if (agent.status() == AgentStatus.COMPLETED) {
            summary = agent.completionSummary() != null ? agent.completionSummary() : "Completed";
        } else if (agent.failureReason() != null) {
            summary = agent.failureReason();
        } else if (agent.toolHistory().isEmpty()) {
            summary = "No actions taken";
        } else {
            summary = "Executed " + agent.toolHistory().size() + " actions";
        }
        sessionStore.recordMessage(agent.id(), SOURCE, "result", summary);
        AgentStatus status = agent.status().isTerminal() ? agent.status() : AgentStatus.STOPPED;
        return new AgentResult(agent.id(), step.id(), step.agentType(), instruction, status, summary);
    }

    /**
     * Human-readable plan outline.
     */
    public static String describePlan(TaskPlan plan) {
        var sb = new StringBuilder();
        sb.append("Plan: ").append(plan.summary()).append('\n');
        sb.append("Complexity: ").append(plan.complexity().wireName()).append('\n');
        for (TaskStep step : plan.steps()) {
            sb.append(step.id()).append(". [").append(step.agentType().wireName()).append("] ")
              .append(step.description());
            if (!step.dependencyIds().isEmpty()) {
                sb.append(" (after ").append(step.dependencyIds()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Per-step success and failure counts followed by one line per result.
     */
    public String summarize(TaskPlan plan, List<AgentResult> results) {
        long completed = results.stream().filter(AgentResult::succeeded).count();
        long failed = results.size() - completed;
        var sb = new StringBuilder();
        sb.append(completed).append('/').append(plan.steps().size()).append(" steps completed");
        if (failed > 0) {
            sb.append(" (").append(failed).append(" failed)");
        }
        sb.append("\n\n");
        for (AgentResult result : results) {
            sb.append(result.succeeded() ? "[ok]   " : "[fail] ")
              .append(result.stepId()).append(". [").append(result.agentType().wireName()).append("] ")
              .append(result.summary()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Stops the plan in progress, if any. The step currently running is stopped.
     */
    @PreDestroy
    @Override
    public void close() {
        closed = true;
        String agentId = currentAgentId;
        if (agentId != null) {
            agentManager.stopAgent(agentId);
        }
    }
}
