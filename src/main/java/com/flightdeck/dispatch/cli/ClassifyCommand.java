package com.flightdeck.dispatch.cli;

import com.flightdeck.core.routing.ExecutionTarget;
import com.flightdeck.core.routing.HybridRouter;
import com.flightdeck.core.routing.RoutingStats;
import com.flightdeck.core.routing.TaskClassification;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flightdeck classify "&lt;task&gt;"
 * <p>
 * Shows how the router classifies a task and which backend it would pick.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a task and show the routing decision")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Task text")
    private String task;

    @Option(names = {"--target", "-t"}, description = "Forced target: cloud, local, auto", defaultValue = "auto")
    private String target;

    private final HybridRouter router;

    public ClassifyCommand(HybridRouter router) {
        this.router = router;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        TaskClassification classification = router.classify(task, null);
        ExecutionTarget decided = router.decideTarget(classification, ExecutionTarget.fromString(target));
        RoutingStats stats = router.stats();

        ConsoleOutput.info(String.format("Type: %s | Confidence: %.2f | ~%d tokens",
                classification.type().wireName(), classification.confidence(), classification.estimatedTokens()));
        ConsoleOutput.info("Reason: " + classification.reason());
        ConsoleOutput.success("Target: " + decided.wireName());
        System.out.printf("  Cloud calls this hour: %d, local: %d%n",
                stats.cloudCallsThisHour(), stats.localCallsThisHour());
    }
}
