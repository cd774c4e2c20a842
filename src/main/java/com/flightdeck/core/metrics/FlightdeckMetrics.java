package com.flightdeck.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent runs, routing and plans.
 */
@Service
public class FlightdeckMetrics {

    private final MeterRegistry registry;

    public FlightdeckMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAgentResult(String agentType, String status) {
        Counter.builder("flightdeck.agents.total")
                .tag("type", agentType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAgentIterations(String agentType, int iterations) {
        DistributionSummary.builder("flightdeck.agent.iterations")
                .description("Think-act-observe iterations per agent run")
                .tag("type", agentType)
                .register(registry)
                .record(iterations);
    }

    public void recordToolCall(String tool, boolean success, long ms) {
        Timer.builder("flightdeck.tool.duration")
                .tag("tool", tool)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordParseFailure() {
        Counter.builder("flightdeck.tool.parse_failures")
                .description("Model turns without a usable tool call")
                .register(registry)
                .increment();
    }

    public void recordLoopDetected(String reason) {
        Counter.builder("flightdeck.loops.detected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param target   "cloud" or "local"
     * @param taskType "quick" or "heavy"
     */
    public void recordRoutingDecision(String target, String taskType) {
        Counter.builder("flightdeck.routing.decisions")
                .tag("target", target)
                .tag("task_type", taskType)
                .register(registry)
                .increment();
    }

    public void recordLessonLearned() {
        Counter.builder("flightdeck.lessons.learned")
                .register(registry)
                .increment();
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("flightdeck.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanResult(String outcome, int steps, long ms) {
        Counter.builder("flightdeck.plans.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        DistributionSummary.builder("flightdeck.plan.steps")
                .register(registry)
                .record(steps);
        Timer.builder("flightdeck.plan.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
