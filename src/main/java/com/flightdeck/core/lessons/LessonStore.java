package com.flightdeck.core.lessons;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightdeck.core.persistence.DebouncedWriter;
import com.flightdeck.core.persistence.JsonFiles;
import com.flightdeck.core.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Cross-session memory of error-to-fix associations.
 * <p>
 * Relevance of a lesson to an error text:
 * <ul>
 *   <li>+100 when the lesson's normalized pattern occurs in the error (case-insensitive)</li>
 *   <li>+10 per significant keyword shared with the lesson's pattern and context</li>
 *   <li>+min(2 x successCount, 20) for proven fixes</li>
 *   <li>+10 when used in the last 7 days, else +5 when used in the last 30 days</li>
 * </ul>
 * Only lessons scoring above {@value #MIN_SCORE} are returned. The store holds at most
 * {@code capacity} lessons; the least successful (then least recently used) go first.
 * Changes are written to disk at most once per flush interval and on {@link #close()}.
 */
public class LessonStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LessonStore.class);

    public static final int DEFAULT_LIMIT = 3;
    static final int MIN_SCORE = 20;
    static final int EXACT_MATCH_SCORE = 100;
    static final int KEYWORD_SCORE = 10;
    static final int MAX_SUCCESS_BOOST = 20;

    private static final Comparator<Lesson> EVICTION_ORDER = Comparator
            .comparingInt(Lesson::getSuccessCount)
            .thenComparing(Lesson::getLastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Path file;
    private final int capacity;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final DebouncedWriter writer;
    private final List<Lesson> lessons = new ArrayList<>();

    public LessonStore(Path file, int capacity, long flushIntervalMs, ObjectMapper mapper, Clock clock) {
        this.file = file;
        this.capacity = capacity;
        this.mapper = mapper;
        this.clock = clock;
        this.writer = new DebouncedWriter("lessons", flushIntervalMs, this::writeToDisk);
        load();
    }

    private void load() {
        try {
            JsonFiles.read(mapper, file, LessonsDocument.class)
                    .ifPresent(doc -> lessons.addAll(doc.getLessons()));
            log.debug("Loaded {} lessons from {}", lessons.size(), file);
        } catch (UncheckedIOException e) {
            log.warn("Could not load lessons from {}, starting empty: {}", file, e.getMessage());
        }
    }

    /**
     * Lessons relevant to an error, best first.
     */
    public synchronized List<Lesson> findRelevant(String errorText, int limit) {
        if (errorText == null || errorText.isBlank() || lessons.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        String queryLower = errorText.toLowerCase(Locale.ROOT);
        String normalizedQueryLower = TextNormalizer.normalizeError(errorText).toLowerCase(Locale.ROOT);
        Set<String> queryKeywords = new HashSet<>(TextNormalizer.extractKeywords(errorText));

        record Scored(Lesson lesson, int score) {}
        return lessons.stream()
                .map(l -> new Scored(l, score(l, queryLower, normalizedQueryLower, queryKeywords, now)))
                .filter(s -> s.score() > MIN_SCORE)
                .sorted(Comparator.comparingInt(Scored::score).reversed())
                .limit(limit)
                .map(s -> s.lesson().copy())
                .toList();
    }

    public List<Lesson> findRelevant(String errorText) {
        return findRelevant(errorText, DEFAULT_LIMIT);
    }

    static int score(Lesson lesson, String queryLower, String normalizedQueryLower,
                     Set<String> queryKeywords, Instant now) {
        int score = 0;
        String pattern = lesson.getErrorPattern() != null ? lesson.getErrorPattern().toLowerCase(Locale.ROOT) : "";
        if (!pattern.isEmpty() && (queryLower.contains(pattern) || normalizedQueryLower.contains(pattern))) {
            score += EXACT_MATCH_SCORE;
        }
        String lessonText = lesson.getErrorPattern() + " " + (lesson.getErrorContext() != null ? lesson.getErrorContext() : "");
        long overlap = TextNormalizer.extractKeywords(lessonText).stream().filter(queryKeywords::contains).count();
        score += (int) overlap * KEYWORD_SCORE;
        score += Math.min(lesson.getSuccessCount() * 2, MAX_SUCCESS_BOOST);
        if (lesson.getLastUsedAt() != null) {
            Duration sinceUse = Duration.between(lesson.getLastUsedAt(), now);
            if (sinceUse.compareTo(Duration.ofDays(7)) < 0) {
                score += 10;
            } else if (sinceUse.compareTo(Duration.ofDays(30)) < 0) {
                score += 5;
            }
        }
        return score;
    }

    public Lesson recordFix(String errorPattern, String errorContext, String fix, String fixDescription) {
        return recordFix(errorPattern, errorContext, fix, fixDescription, List.of());
    }

    /**
     * Records a fix that worked. A lesson with the same normalized pattern and fix
     * (case-insensitive) is reinforced instead of duplicated.
     *
     * @return a snapshot of the created or reinforced lesson
     */
    public synchronized Lesson recordFix(String errorPattern, String errorContext, String fix,
                                         String fixDescription, List<String> tags) {
        String pattern = TextNormalizer.normalizeError(errorPattern);
        Instant now = clock.instant();
        Optional<Lesson> existing = lessons.stream()
                .filter(l -> pattern.equalsIgnoreCase(l.getErrorPattern()) && fix.equalsIgnoreCase(l.getFix()))
                .findFirst();
        if (existing.isPresent()) {
            Lesson lesson = existing.get();
            lesson.setSuccessCount(lesson.getSuccessCount() + 1);
            lesson.setLastUsedAt(now);
            writer.requestFlush();
            log.debug("Reinforced lesson {}", lesson);
            return lesson.copy();
        }

        var lesson = new Lesson("lesson-" + UUID.randomUUID().toString().substring(0, 8), pattern, errorContext,
                fix, fixDescription, 1, autoTag(errorPattern, fix, tags), now, now);
        lessons.add(0, lesson);
        while (lessons.size() > capacity) {
            Lesson evicted = lessons.stream().min(EVICTION_ORDER).orElseThrow();
            lessons.remove(evicted);
            log.debug("Evicted lesson {}", evicted.getId());
        }
        writer.requestFlush();
        log.info("Learned lesson: \"{}\" -> {}", pattern, fixDescription);
        return lesson.copy();
    }

    /** Reinforces a lesson that was applied successfully. Returns false for an unknown id. */
    public synchronized boolean markUsed(String lessonId) {
        for (Lesson lesson : lessons) {
            if (lesson.getId().equals(lessonId)) {
                lesson.setSuccessCount(lesson.getSuccessCount() + 1);
                lesson.setLastUsedAt(clock.instant());
                writer.requestFlush();
                return true;
            }
        }
        return false;
    }

    public synchronized boolean delete(String lessonId) {
        boolean removed = lessons.removeIf(l -> l.getId().equals(lessonId));
        if (removed) {
            writer.requestFlush();
        }
        return removed;
    }

    public synchronized List<Lesson> all() {
        return lessons.stream().map(Lesson::copy).toList();
    }

    public synchronized int size() {
        return lessons.size();
    }

    /** Renders lessons as a hint block appended to a tool failure message. Empty for no lessons. */
    public static String formatForPrompt(List<Lesson> relevant) {
        if (relevant.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder("\n\n## Relevant fixes from past experience:\n");
        for (int i = 0; i < relevant.size(); i++) {
            Lesson l = relevant.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append(i + 1).append(". Error: \"").append(l.getErrorPattern()).append("\"\n")
              .append("   Fix: ").append(l.getFixDescription()).append('\n')
              .append("   Command: ").append(l.getFix()).append('\n')
              .append("   (Worked ").append(l.getSuccessCount())
              .append(l.getSuccessCount() > 1 ? " times)" : " time)");
        }
        return sb.toString();
    }

    static List<String> autoTag(String error, String fix, List<String> userTags) {
        Set<String> tags = new LinkedHashSet<>(userTags);
        String combined = (error + " " + fix).toLowerCase(Locale.ROOT);
        if (containsAny(combined, "npm", "node_modules")) tags.add("npm");
        if (containsAny(combined, "pip", "python")) tags.add("python");
        if (containsAny(combined, "git")) tags.add("git");
        if (containsAny(combined, "typescript", "tsc")) tags.add("typescript");
        if (containsAny(combined, "eslint", "lint")) tags.add("lint");
        if (containsAny(combined, "test", "jest", "vitest")) tags.add("testing");
        if (containsAny(combined, "import", "module")) tags.add("modules");
        if (containsAny(combined, "permission", "access")) tags.add("permissions");
        return new ArrayList<>(tags);
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private void writeToDisk() {
        LessonsDocument doc;
        synchronized (this) {
            doc = new LessonsDocument(LessonsDocument.CURRENT_VERSION,
                    lessons.stream().map(Lesson::copy).collect(Collectors.toList()));
        }
        JsonFiles.write(mapper, file, doc);
        log.debug("Saved {} lessons to {}", doc.getLessons().size(), file);
    }

    /** Flushes pending changes. */
    @Override
    public void close() {
        writer.close();
    }
}
