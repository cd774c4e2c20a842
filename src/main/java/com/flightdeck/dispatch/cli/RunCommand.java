package com.flightdeck.dispatch.cli;

import com.flightdeck.core.agent.AgentManager;
import com.flightdeck.core.events.EventBus;
import com.flightdeck.core.model.Agent;
import com.flightdeck.core.model.AgentResult;
import com.flightdeck.core.model.AgentStatus;
import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.TaskPlan;
import com.flightdeck.core.orchestrator.Orchestrator;
import com.flightdeck.core.routing.ExecutionTarget;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * CLI command: flightdeck run "&lt;request&gt;"
 * <p>
 * Without {@code --agent}, plans the request and executes the plan step by step.
 * With {@code --agent}, hands the request straight to a single agent and answers
 * its {@code ask_user} questions from standard input.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute a request")
@Component
public class RunCommand implements Runnable {

    static final long POLL_MS = 250;

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--agent", "-a"},
            description = "Skip planning and run one agent of this type: frontend, backend, testing, browser, general, cleaner")
    private String agentType;

    @Option(names = {"--target", "-t"}, description = "Backend for --agent: cloud, local, auto", defaultValue = "auto")
    private String target;

    private final Orchestrator orchestrator;
    private final AgentManager agentManager;
    private final EventBus eventBus;

    public RunCommand(Orchestrator orchestrator, AgentManager agentManager, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.agentManager = agentManager;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        long start = System.currentTimeMillis();
        try (EventBus.Subscription ignored = eventBus.subscribeAll(ConsoleOutput::event)) {
            if (agentType != null) {
                runSingleAgent();
            } else {
                runPlan();
            }
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }
        ConsoleOutput.info("Finished in " + ConsoleOutput.formatDuration(System.currentTimeMillis() - start));
    }

    private void runPlan() {
        ConsoleOutput.info("Planning...");
        TaskPlan plan = orchestrator.createPlan(request);
        System.out.println();
        System.out.print(Orchestrator.describePlan(plan));
        System.out.println();

        List<AgentResult> results = orchestrator.executePlan(plan);
        System.out.println();
        System.out.print(orchestrator.summarize(plan, results));
        if (results.stream().allMatch(AgentResult::succeeded) && results.size() == plan.steps().size()) {
            ConsoleOutput.success("All steps completed.");
        } else {
            ConsoleOutput.error("Some steps did not complete.");
        }
    }

    private void runSingleAgent() throws InterruptedException {
        AgentType type = AgentType.fromString(agentType);
        ExecutionTarget forced = ExecutionTarget.fromString(target);
        Agent agent = agentManager.spawn(type, request, forced);
        ConsoleOutput.agent(type.wireName(), agent.id() + " on " + agent.target().wireName() + " (" + agent.modelId() + ")");

        var stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (!agent.status().isTerminal()) {
            if (agent.status() == AgentStatus.WAITING_USER) {
                String answer = readLine(stdin);
                if (answer == null) {
                    agentManager.stopAgent(agent.id());
                    break;
                }
                agentManager.continueAgent(agent.id(), answer);
            }
            Thread.sleep(POLL_MS);
        }

        if (agent.status() == AgentStatus.COMPLETED) {
            ConsoleOutput.success(agent.completionSummary() != null ? agent.completionSummary() : "Completed");
        } else {
            ConsoleOutput.error("Agent " + agent.status().wireName()
                    + (agent.failureReason() != null ? ": " + agent.failureReason() : ""));
        }
    }

    private static String readLine(BufferedReader reader) {
        System.out.print("> ");
        System.out.flush();
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
