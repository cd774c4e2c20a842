package com.flightdeck.dispatch.cli;

import com.flightdeck.core.persistence.AgentRecord;
import com.flightdeck.core.persistence.SessionHistory;
import com.flightdeck.core.persistence.SessionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: flightdeck history
 * <p>
 * Lists past sessions, newest first, or shows the agents of one session.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List past sessions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--session", "-s"}, description = "Show the agents of one session")
    private String sessionId;

    @Option(names = {"--clear"}, description = "Delete all stored sessions")
    private boolean clear;

    private final SessionStore sessionStore;

    public HistoryCommand(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (clear) {
            int removed = sessionStore.clearHistory();
            ConsoleOutput.success("Removed " + removed + " session(s).");
            return;
        }
        if (sessionId != null) {
            showSession(sessionId);
            return;
        }

        List<SessionHistory> sessions = sessionStore.history();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }
        List<SessionHistory> display = sessions.size() > limit ? sessions.subList(0, limit) : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-22s %-7s %-9s %s%n", "SESSION ID", "STARTED", "AGENTS", "ARTIFACTS", "MESSAGES");
        System.out.println("  " + "-".repeat(76));
        for (SessionHistory session : display) {
            System.out.printf("  %-24s %-22s %-7d %-9d %d%n", session.id(), session.startTime(),
                    session.agents().size(), session.artifacts().size(), session.messages().size());
        }
    }

    private void showSession(String id) {
        Optional<SessionHistory> session = sessionStore.get(id);
        if (session.isEmpty()) {
            ConsoleOutput.error("Session not found: " + id);
            return;
        }
        ConsoleOutput.info("Session " + id + " (" + session.get().agents().size() + " agents):");
        System.out.println();
        System.out.printf("  %-16s %-9s %-10s %s%n", "AGENT", "TYPE", "STATUS", "TASK");
        System.out.println("  " + "-".repeat(76));
        for (AgentRecord agent : session.get().agents()) {
            System.out.printf("  %-16s %-9s %-10s %s%n", agent.id(), agent.type(), agent.status(),
                    ConsoleOutput.truncate(agent.task(), 40));
        }
    }
}
