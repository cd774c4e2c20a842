package com.flightdeck.core.orchestrator;

import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.PlanComplexity;
import com.flightdeck.core.model.TaskPlan;
import com.flightdeck.core.model.TaskStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanValidatorTest {

    private static TaskStep step(int id, Integer... deps) {
        return new TaskStep(id, "step " + id, AgentType.GENERAL, List.of(deps), "do " + id);
    }

    private static TaskPlan plan(TaskStep... steps) {
        return new TaskPlan("plan", List.of(steps), PlanComplexity.MEDIUM);
    }

    private static List<Integer> ids(List<TaskStep> steps) {
        return steps.stream().map(TaskStep::id).toList();
    }

    @Test
    @DisplayName("an ordered plan keeps its order")
    void keepsOrder() {
        assertEquals(List.of(1, 2, 3), ids(PlanValidator.topologicalOrder(plan(step(1), step(2, 1), step(3, 2)))));
    }

    @Test
    @DisplayName("dependencies are moved before their dependents")
    void reorders() {
        List<Integer> order = ids(PlanValidator.topologicalOrder(plan(step(3, 2), step(2, 1), step(1))));
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    @DisplayName("a diamond visits the shared dependency once")
    void diamond() {
        List<Integer> order = ids(PlanValidator.topologicalOrder(plan(step(1), step(2, 1), step(3, 1), step(4, 2, 3))));
        assertEquals(List.of(1, 2, 3, 4), order);
    }

    @Test
    @DisplayName("every step appears after all of its dependencies")
    void dependenciesFirst() {
        TaskPlan plan = plan(step(5, 4, 1), step(4, 2), step(1), step(2, 1), step(3));
        List<Integer> order = ids(PlanValidator.topologicalOrder(plan));
        assertEquals(5, order.size());
        for (TaskStep s : plan.steps()) {
            for (Integer dep : s.dependencyIds()) {
                assertTrue(order.indexOf(dep) < order.indexOf(s.id()), dep + " before " + s.id());
            }
        }
    }

    @Test
    @DisplayName("a two-step cycle is reported with its path")
    void cycle() {
        CyclicPlanException e = assertThrows(CyclicPlanException.class,
                () -> PlanValidator.topologicalOrder(plan(step(1, 2), step(2, 1))));
        assertEquals(List.of(1, 2, 1), e.cycle());
        assertEquals("Plan has a dependency cycle: [1, 2, 1]", e.getMessage());
    }

    @Test
    @DisplayName("a self-dependency is a cycle")
    void selfCycle() {
        CyclicPlanException e = assertThrows(CyclicPlanException.class,
                () -> PlanValidator.topologicalOrder(plan(step(1, 1))));
        assertEquals(List.of(1, 1), e.cycle());
    }

    @Test
    @DisplayName("unknown dependencies are rejected")
    void unknownDependency() {
        InvalidPlanException e = assertThrows(InvalidPlanException.class,
                () -> PlanValidator.topologicalOrder(plan(step(1), step(2, 7))));
        assertEquals("Step 2 depends on unknown step 7", e.getMessage());
    }

    @Test
    @DisplayName("duplicate ids are rejected")
    void duplicateIds() {
        InvalidPlanException e = assertThrows(InvalidPlanException.class,
                () -> PlanValidator.topologicalOrder(plan(step(1), step(1))));
        assertEquals("Duplicate step id 1", e.getMessage());
    }

    @Test
    @DisplayName("an empty plan orders to an empty list")
    void empty() {
        assertTrue(PlanValidator.topologicalOrder(plan()).isEmpty());
    }
}
