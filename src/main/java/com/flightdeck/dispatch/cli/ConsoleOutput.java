package com.flightdeck.dispatch.cli;

import com.flightdeck.core.events.FlightdeckEvent;
import com.flightdeck.core.text.TextNormalizer;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Flightdeck CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLIGHTDECK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLIGHTDECK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String type, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + type + "]|@ " + message));
    }

    /**
     * One line per event. Streamed thought chunks are left out; they would
     * interleave with everything else.
     */
    public static void event(FlightdeckEvent event) {
        Object kind = event.payload().get("kind");
        if (FlightdeckEvent.AGENT_OUTPUT.equals(event.eventType()) && "thought".equals(kind)) {
            return;
        }
        String prefix = switch (event.eventType()) {
            case FlightdeckEvent.PLAN_CREATED -> "@|fg(cyan) [PLAN]|@";
            case FlightdeckEvent.AGENT_SPAWNED -> "@|fg(blue) [SPAWN]|@";
            case FlightdeckEvent.AGENT_STATUS -> "@|fg(blue) [STATUS]|@";
            case FlightdeckEvent.AGENT_OUTPUT -> "lesson".equals(kind) ? "@|fg(green) [LESSON]|@" : "@|fg(white) [" + kind + "]|@";
            case FlightdeckEvent.AGENT_LOOP_DETECTED -> "@|fg(red),bold [LOOP]|@";
            case FlightdeckEvent.STEP_STARTED, FlightdeckEvent.STEP_COMPLETED -> "@|bold,fg(yellow) [STEP]|@";
            case FlightdeckEvent.STEP_SKIPPED -> "@|fg(yellow) [SKIPPED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.stepId() != null ? "step " + event.stepId()
                : event.agentId() != null ? event.agentId() : "";
        String detail = event.payload().containsKey("text")
                ? TextNormalizer.preview(String.valueOf(event.payload().get("text")), 160)
                : event.payload().toString();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + " " + detail));
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
