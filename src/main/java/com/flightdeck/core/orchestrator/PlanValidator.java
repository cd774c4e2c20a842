package com.flightdeck.core.orchestrator;

import com.flightdeck.core.model.TaskPlan;
import com.flightdeck.core.model.TaskStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a plan's dependency graph and orders its steps so that every step
 * comes after all of its dependencies.
 */
public final class PlanValidator {

    private enum Mark { VISITING, DONE }

    private PlanValidator() {}

    /**
     * Depth-first topological sort. Roots are visited in plan order and dependencies
     * in the order they are listed, so an already-ordered plan keeps its order.
     *
     * @throws InvalidPlanException on duplicate ids or unknown dependencies
     * @throws CyclicPlanException  if the dependencies form a cycle
     */
    public static List<TaskStep> topologicalOrder(TaskPlan plan) {
        Map<Integer, TaskStep> byId = new LinkedHashMap<>();
        for (TaskStep step : plan.steps()) {
            if (byId.putIfAbsent(step.id(), step) != null) {
                throw new InvalidPlanException("Duplicate step id " + step.id());
            }
        }
        for (TaskStep step : plan.steps()) {
            for (Integer dep : step.dependencyIds()) {
                if (!byId.containsKey(dep)) {
                    throw new InvalidPlanException("Step " + step.id() + " depends on unknown step " + dep);
                }
            }
        }

        var sorted = new ArrayList<TaskStep>(byId.size());
        var marks = new HashMap<Integer, Mark>();
        for (TaskStep step : byId.values()) {
            visit(step, byId, marks, new ArrayList<>(), sorted);
        }
        return sorted;
    }

    private static void visit(TaskStep step, Map<Integer, TaskStep> byId, Map<Integer, Mark> marks,
                              List<Integer> path, List<TaskStep> sorted) {
        Mark mark = marks.get(step.id());
        if (mark == Mark.DONE) {
            return;
        }
        if (mark == Mark.VISITING) {
            var cycle = new ArrayList<>(path.subList(path.indexOf(step.id()), path.size()));
            cycle.add(step.id());
            throw new CyclicPlanException(cycle);
        }
        marks.put(step.id(), Mark.VISITING);
        path.add(step.id());
        for (Integer dep : step.dependencyIds()) {
            visit(byId.get(dep), byId, marks, path, sorted);
        }
        path.remove(path.size() - 1);
        marks.put(step.id(), Mark.DONE);
        sorted.add(step);
    }
}
