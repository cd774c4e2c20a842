package com.flightdeck.dispatch.cli;

import com.flightdeck.core.lessons.Lesson;
import com.flightdeck.core.lessons.LessonStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: flightdeck lessons
 * <p>
 * Lists learned error fixes, optionally filtered by relevance to an error text.
 */
@Command(name = "lessons", mixinStandardHelpOptions = true, description = "List or manage learned fixes")
@Component
public class LessonsCommand implements Runnable {

    @Option(names = {"--query", "-q"}, description = "Show fixes relevant to this error text")
    private String query;

    @Option(names = {"--delete"}, description = "Delete the lesson with this id")
    private String deleteId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final LessonStore lessonStore;

    public LessonsCommand(LessonStore lessonStore) {
        this.lessonStore = lessonStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (deleteId != null) {
            if (lessonStore.delete(deleteId)) {
                ConsoleOutput.success("Deleted lesson " + deleteId);
            } else {
                ConsoleOutput.error("No lesson with id " + deleteId);
            }
            return;
        }

        List<Lesson> lessons = query != null ? lessonStore.findRelevant(query, limit) : lessonStore.all();
        if (lessons.isEmpty()) {
            ConsoleOutput.info(query != null ? "No relevant lessons." : "No lessons learned yet.");
            return;
        }
        List<Lesson> display = lessons.size() > limit ? lessons.subList(0, limit) : lessons;
        ConsoleOutput.info("Lessons (" + display.size() + " of " + lessons.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-5s %-40s %s%n", "ID", "USES", "ERROR", "FIX");
        System.out.println("  " + "-".repeat(90));
        for (Lesson lesson : display) {
            System.out.printf("  %-14s %-5d %-40s %s%n", lesson.getId(), lesson.getSuccessCount(),
                    ConsoleOutput.truncate(lesson.getErrorPattern(), 40),
                    ConsoleOutput.truncate(lesson.getFixDescription(), 40));
        }
    }
}
