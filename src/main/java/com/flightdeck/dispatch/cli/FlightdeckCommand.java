package com.flightdeck.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Flightdeck.
 * Routes to subcommands: run, plan, classify, lessons, history.
 */
@Command(
        name = "flightdeck",
        mixinStandardHelpOptions = true,
        version = "Flightdeck 0.1.0",
        description = "Autonomous coding agents with cloud planning and local execution",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                ClassifyCommand.class,
                LessonsCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FlightdeckCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
