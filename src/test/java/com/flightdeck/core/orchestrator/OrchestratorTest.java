package com.flightdeck.core.orchestrator;

import com.flightdeck.core.agent.AgentManager;
import com.flightdeck.core.config.FlightdeckProperties;
import com.flightdeck.core.events.EventBus;
import com.flightdeck.core.events.FlightdeckEvent;
import com.flightdeck.core.llm.LlmParseException;
import com.flightdeck.core.llm.LlmService;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link Orchestrator}.
 * <p>
 * The agent manager is mocked: each spawn returns an agent already in the state
 * the test scripted for that instruction.
 */
class OrchestratorTest {

    private LlmService planner;
    private AgentManager agentManager;
    private EventBus eventBus;
    private SessionStore sessionStore;
    private SimpleMeterRegistry registry;
    private FlightdeckProperties properties;
    private Orchestrator orchestrator;

    private final List<FlightdeckEvent> events = new CopyOnWriteArrayList<>();
    private final List<String> spawnedInstructions = new CopyOnWriteArrayList<>();
    private final Map<String, Agent> agentsById = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private Function<String, AgentStatus> outcomes;

    @BeforeEach
    void setUp() {
        planner = mock(LlmService.class);
        agentManager = mock(AgentManager.class);
        sessionStore = mock(SessionStore.class);
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        properties = new FlightdeckProperties();
        orchestrator = new Orchestrator(planner, agentManager, eventBus, sessionStore,
                new FlightdeckMetrics(registry), properties, Clock.systemUTC());

        outcomes = instruction -> AgentStatus.COMPLETED;
        when(agentManager.spawn(any(AgentType.class), anyString(), eq(ExecutionTarget.AUTO))).thenAnswer(inv -> {
            AgentType type = inv.getArgument(0);
            String instruction = inv.getArgument(1);
            spawnedInstructions.add(instruction);
            Agent agent = agent(type, instruction, outcomes.apply(instruction));
            agentsById.put(agent.id(), agent);
            return agent;
        });
        when(agentManager.stopAgent(anyString())).thenAnswer(inv -> {
            Agent agent = agentsById.get(inv.<String>getArgument(0));
            return agent != null && agent.transitionTo(AgentStatus.STOPPED, "Stopped by user");
        });
    }

    private Agent agent(AgentType type, String instruction, AgentStatus status) {
        var agent = new Agent("agent-" + ids.incrementAndGet(), type, instruction, "m", ExecutionTarget.LOCAL, 10,
                Clock.systemUTC());
        agent.transitionTo(AgentStatus.RUNNING, null);
        switch (status) {
            case COMPLETED -> {
                agent.setCompletionSummary("did " + instruction);
                agent.transitionTo(AgentStatus.COMPLETED, null);
            }
            case ERROR -> agent.transitionTo(AgentStatus.ERROR, "broke on " + instruction);
            case RUNNING -> { }
            default -> agent.transitionTo(status, null);
        }
        return agent;
    }

    private static TaskStep step(int id, String instruction, Integer... deps) {
        return new TaskStep(id, "step " + id, AgentType.BACKEND, List.of(deps), instruction);
    }

    private static TaskPlan plan(PlanComplexity complexity, TaskStep... steps) {
        return new TaskPlan("Test plan", List.of(steps), complexity);
    }

    @Nested
    @DisplayName("createPlan")
    class CreatePlanTests {

        @Test
        @DisplayName("returns the planner's plan and announces it")
        void plannerPlan() {
            TaskPlan planned = plan(PlanComplexity.MEDIUM, step(1, "a"), step(2, "b", 1));
            when(planner.structuredCall(anyString(), anyString(), eq(TaskPlan.class))).thenReturn(planned);

            TaskPlan plan = orchestrator.createPlan("Build a todo API");

            assertSame(planned, plan);
            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(planner).structuredCall(anyString(), user.capture(), eq(TaskPlan.class));
            assertTrue(user.getValue().contains("User request: \"Build a todo API\""));

            FlightdeckEvent created = events.get(0);
            assertEquals(FlightdeckEvent.PLAN_CREATED, created.eventType());
            assertTrue(created.agentId().startsWith("plan-"));
            assertEquals(2, created.payload().get("steps"));
            assertEquals("medium", created.payload().get("complexity"));
            verify(sessionStore).recordMessage(eq("orchestrator"), eq("user"), eq("plan"), contains("Plan: Test plan"));
            assertEquals(1, registry.find("flightdeck.planning.duration").timer().count());
        }

        @Test
        @DisplayName("planner failure yields a single-step fallback")
        void fallbackOnFailure() {
            when(planner.structuredCall(anyString(), anyString(), eq(TaskPlan.class)))
                    .thenThrow(new LlmParseException("bad json"));

            TaskPlan plan = orchestrator.createPlan("Fix the failing login test");

            assertEquals(1, plan.steps().size());
            assertEquals(PlanComplexity.SIMPLE, plan.complexity());
            assertEquals("Execute: Fix the failing login test", plan.summary());
            TaskStep only = plan.steps().get(0);
            assertEquals(AgentType.TESTING, only.agentType());
            assertEquals("Fix the failing login test", only.instruction());
            assertTrue(only.dependencyIds().isEmpty());
        }

        @Test
        @DisplayName("an empty plan yields the fallback")
        void fallbackOnEmpty() {
            when(planner.structuredCall(anyString(), anyString(), eq(TaskPlan.class)))
                    .thenReturn(new TaskPlan("nothing", List.of(), null));

            assertEquals(1, orchestrator.createPlan("Tidy up").steps().size());
        }

        @Test
        @DisplayName("a cyclic plan yields the fallback")
        void fallbackOnCycle() {
            when(planner.structuredCall(anyString(), anyString(), eq(TaskPlan.class)))
                    .thenReturn(plan(PlanComplexity.MEDIUM, step(1, "a", 2), step(2, "b", 1)));

            TaskPlan plan = orchestrator.createPlan("Add a REST endpoint");

            assertEquals(1, plan.steps().size());
            assertEquals(AgentType.BACKEND, plan.steps().get(0).agentType());
        }
    }

    @Nested
    @DisplayName("executePlan")
    class ExecutePlanTests {

        @Test
        @DisplayName("runs steps in dependency order")
        void dependencyOrder() {
            List<AgentResult> results = orchestrator.executePlan(
                    plan(PlanComplexity.MEDIUM, step(3, "third", 2), step(1, "first"), step(2, "second", 1)));

            assertEquals(List.of("first", "second", "third"), spawnedInstructions);
            assertEquals(List.of(1, 2, 3), results.stream().map(AgentResult::stepId).toList());
            assertTrue(results.stream().allMatch(AgentResult::succeeded));
            assertEquals("did first", results.get(0).summary());
            assertEquals(1.0, registry.find("flightdeck.plans.total").tag("outcome", "completed").counter().count());
        }

        @Test
        @DisplayName("publishes step start and completion events")
        void stepEvents() {
            orchestrator.executePlan(plan(PlanComplexity.SIMPLE, step(1, "only")));

            FlightdeckEvent started = events.stream()
                    .filter(e -> e.eventType().equals(FlightdeckEvent.STEP_STARTED)).findFirst().orElseThrow();
            FlightdeckEvent completed = events.stream()
                    .filter(e -> e.eventType().equals(FlightdeckEvent.STEP_COMPLETED)).findFirst().orElseThrow();
            assertEquals(1, started.stepId());
            assertEquals("backend", started.payload().get("agentType"));
            assertEquals("completed", completed.payload().get("status"));
        }

        @Test
        @DisplayName("a failed step stops a non-simple plan")
        void stopsOnFailure() {
            outcomes = instruction -> "first".equals(instruction) ? AgentStatus.ERROR : AgentStatus.COMPLETED;

            List<AgentResult> results = orchestrator.executePlan(
                    plan(PlanComplexity.MEDIUM, step(1, "first"), step(2, "second")));

            assertEquals(1, results.size());
            assertFalse(results.get(0).succeeded());
            assertEquals("broke on first", results.get(0).summary());
            assertEquals(List.of("first"), spawnedInstructions);
            assertEquals(1.0, registry.find("flightdeck.plans.total").tag("outcome", "failed").counter().count());
        }

        @Test
        @DisplayName("a simple plan continues past failures and skips dependents")
        void simplePlanSkips() {
            outcomes = instruction -> "first".equals(instruction) ? AgentStatus.ERROR : AgentStatus.COMPLETED;

            List<AgentResult> results = orchestrator.executePlan(
                    plan(PlanComplexity.SIMPLE, step(1, "first"), step(2, "second", 1), step(3, "third")));

            assertEquals(3, results.size());
            AgentResult skipped = results.get(1);
            assertNull(skipped.agentId());
            assertEquals(AgentStatus.STOPPED, skipped.status());
            assertEquals("Skipped: dependencies [1] did not complete", skipped.summary());
            assertTrue(results.get(2).succeeded());
            assertEquals(List.of("first", "third"), spawnedInstructions);
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(FlightdeckEvent.STEP_SKIPPED)
                    && Integer.valueOf(2).equals(e.stepId())));
            assertEquals(1.0, registry.find("flightdeck.plans.total").tag("outcome", "partial").counter().count());
        }

        @Test
        @DisplayName("a stuck agent is retried once with the detector's hint")
        void loopRetry() {
            var attempts = new AtomicInteger();
            doAnswer(inv -> {
                String instruction = inv.getArgument(1);
                spawnedInstructions.add(instruction);
                if (attempts.incrementAndGet() == 1) {
                    Agent stuck = agent(AgentType.BACKEND, instruction, AgentStatus.RUNNING);
                    stuck.setLoopDetection(LoopDetectionResult.stuck("Repeating same tool call",
                            List.of("read_file", "read_file", "read_file"), "Try a different approach"));
                    stuck.transitionTo(AgentStatus.ERROR, "Loop detected: Repeating same tool call");
                    return stuck;
                }
                return agent(AgentType.BACKEND, instruction, AgentStatus.COMPLETED);
            }).when(agentManager).spawn(any(AgentType.class), anyString(), eq(ExecutionTarget.AUTO));

            List<AgentResult> results = orchestrator.executePlan(plan(PlanComplexity.MEDIUM, step(1, "read config")));

            assertEquals(2, spawnedInstructions.size());
            assertEquals("read config\n\nA previous attempt got stuck: Repeating same tool call. Try a different approach",
                    spawnedInstructions.get(1));
            assertEquals(1, results.size());
            assertTrue(results.get(0).succeeded());
        }

        @Test
        @DisplayName("the spawn limit ends the plan")
        void spawnLimit() {
            properties.setOrchestratorMaxIterations(1);

            List<AgentResult> results = orchestrator.executePlan(
                    plan(PlanComplexity.MEDIUM, step(1, "first"), step(2, "second")));

            assertEquals(1, results.size());
            assertEquals(List.of("first"), spawnedInstructions);
            assertEquals(1.0, registry.find("flightdeck.plans.total").tag("outcome", "spawn_limit").counter().count());
        }

        @Test
        @DisplayName("an agent waiting for the user is stopped")
        void waitingUserStopped() {
            outcomes = instruction -> AgentStatus.WAITING_USER;

            List<AgentResult> results = orchestrator.executePlan(plan(PlanComplexity.SIMPLE, step(1, "ask")));

            verify(agentManager).stopAgent(results.get(0).agentId());
            assertEquals(AgentStatus.STOPPED, results.get(0).status());
            assertEquals("Stopped by user", results.get(0).summary());
        }

        @Test
        @DisplayName("a step that outlives the timeout is stopped and reported as timed out")
        void timeout() {
            properties.setDefaultTimeoutMs(100);
            outcomes = instruction -> AgentStatus.RUNNING;

            List<AgentResult> results = orchestrator.executePlan(plan(PlanComplexity.SIMPLE, step(1, "slow")));

            assertEquals(AgentStatus.STOPPED, results.get(0).status());
            assertEquals("Timed out after 100 ms", results.get(0).summary());
        }

        @Test
        @DisplayName("an invalid plan is rejected before anything runs")
        void invalidPlan() {
            assertThrows(CyclicPlanException.class, () -> orchestrator.executePlan(
                    plan(PlanComplexity.MEDIUM, step(1, "a", 2), step(2, "b", 1))));
            verifyNoInteractions(agentManager);
        }

        @Test
        @DisplayName("a closed orchestrator runs nothing")
        void closed() {
            orchestrator.close();

            List<AgentResult> results = orchestrator.executePlan(plan(PlanComplexity.MEDIUM, step(1, "a")));

            assertTrue(results.isEmpty());
            assertEquals(1.0, registry.find("flightdeck.plans.total").tag("outcome", "stopped").counter().count());
        }
    }

    @Nested
    @DisplayName("plan and execute")
    class PlanAndExecuteTests {

        @Test
        @DisplayName("entity creation runs before the tests that depend on it")
        void entityThenTests() {
            String request = "Add a Task entity with title and status, then test it";
            TaskPlan planned = new TaskPlan("Task entity with tests", List.of(
                    new TaskStep(2, "Test the Task entity", AgentType.TESTING, List.of(1),
                            "Write unit tests for the Task entity"),
                    new TaskStep(1, "Create the Task entity", AgentType.BACKEND, List.of(),
                            "Create a Task entity with title and status fields")),
                    PlanComplexity.MEDIUM);
            when(planner.structuredCall(anyString(), contains(request), eq(TaskPlan.class))).thenReturn(planned);

            TaskPlan plan = orchestrator.createPlan(request);
            List<AgentResult> results = orchestrator.executePlan(plan);

            assertTrue(plan.steps().size() >= 2);
            assertEquals(List.of("Create a Task entity with title and status fields", "Write unit tests for the Task entity"),
                    spawnedInstructions);
            assertEquals(List.of(AgentType.BACKEND, AgentType.TESTING),
                    results.stream().map(AgentResult::agentType).toList());
            assertTrue(results.stream().allMatch(AgentResult::succeeded));

            var order = inOrder(agentManager);
            order.verify(agentManager).spawn(eq(AgentType.BACKEND), anyString(), eq(ExecutionTarget.AUTO));
            order.verify(agentManager).spawn(eq(AgentType.TESTING), anyString(), eq(ExecutionTarget.AUTO));
        }
    }

    @Nested
    @DisplayName("formatting")
    class FormattingTests {

        @Test
        @DisplayName("describePlan lists steps with their dependencies")
        void describePlan() {
            String text = Orchestrator.describePlan(plan(PlanComplexity.COMPLEX, step(1, "a"), step(2, "b", 1)));

            assertEquals("Plan: Test plan\nComplexity: complex\n1. [backend] step 1\n2. [backend] step 2 (after [1])\n", text);
        }

        @Test
        @DisplayName("summarize counts completed and failed steps")
        void summarize() {
            TaskPlan plan = plan(PlanComplexity.SIMPLE, step(1, "a"), step(2, "b"));
            var results = new ArrayList<AgentResult>();
            results.add(new AgentResult("agent-1", 1, AgentType.BACKEND, "a", AgentStatus.COMPLETED, "done"));
            results.add(new AgentResult("agent-2", 2, AgentType.TESTING, "b", AgentStatus.ERROR, "tests failed"));

            String text = orchestrator.summarize(plan, results);

            assertTrue(text.startsWith("1/2 steps completed (1 failed)\n\n"));
            assertTrue(text.contains("[ok]   1. [backend] done\n"));
            assertTrue(text.contains("[fail] 2. [testing] tests failed\n"));
        }

        @Test
        @DisplayName("inferAgentType picks the first matching specialty")
        void inferAgentType() {
            assertEquals(AgentType.TESTING, Orchestrator.inferAgentType("Increase test coverage"));
            assertEquals(AgentType.FRONTEND, Orchestrator.inferAgentType("Style the React header"));
            assertEquals(AgentType.BACKEND, Orchestrator.inferAgentType("Add a database index"));
            assertEquals(AgentType.BROWSER, Orchestrator.inferAgentType("Navigate to the login page and click submit"));
            assertEquals(AgentType.CLEANER, Orchestrator.inferAgentType("Remove dead code"));
            assertEquals(AgentType.GENERAL, Orchestrator.inferAgentType("Say hello"));
        }
    }
}
