package com.flightdeck.dispatch.cli;

import com.flightdeck.core.model.TaskPlan;
import com.flightdeck.core.orchestrator.Orchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flightdeck plan "&lt;request&gt;"
 * <p>
 * Shows the plan the planning model produces, without executing it.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the execution plan for a request")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    private final Orchestrator orchestrator;

    public PlanCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Planning...");
        TaskPlan plan;
        try {
            plan = orchestrator.createPlan(request);
        } catch (Exception e) {
            ConsoleOutput.error("Planning failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }
        System.out.println();
        System.out.print(Orchestrator.describePlan(plan));
        for (var step : plan.steps()) {
            System.out.printf("  %d. %s%n", step.id(), ConsoleOutput.truncate(step.instruction(), 100));
        }
    }
}
