package com.flightdeck.core.routing;

import com.flightdeck.core.config.FlightdeckProperties;
import com.flightdeck.core.llm.ModelBackends;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies tasks as quick or heavy and picks the backend to run them on.
 * <p>
 * Quick tasks (questions, explanations) go to the cloud backend; heavy tasks (code
 * generation, multi-file work, large inputs) go to the local backend. The cloud
 * backend is rate limited per wall-clock hour; over the limit, work moves local
 * when a local backend is available.
 */
@Service
public class HybridRouter {

    private static final Logger log = LoggerFactory.getLogger(HybridRouter.class);

    static final double FORCED_CONFIDENCE = 0.95;
    static final int HEAVY_SCORE_THRESHOLD = 3;
    static final int LONG_TASK_LENGTH = 500;

    private static final List<Pattern> FORCE_CLOUD_PATTERNS = List.of(
            Pattern.compile("^what\\s+(is|are)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^how\\s+do", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^explain", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^summarize", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> FORCE_LOCAL_PATTERNS = List.of(
            Pattern.compile("generate.*code", Pattern.CASE_INSENSITIVE),
            Pattern.compile("create.*function", Pattern.CASE_INSENSITIVE),
            Pattern.compile("implement", Pattern.CASE_INSENSITIVE),
            Pattern.compile("refactor", Pattern.CASE_INSENSITIVE),
            Pattern.compile("write.*test", Pattern.CASE_INSENSITIVE),
            Pattern.compile("analyze.*file", Pattern.CASE_INSENSITIVE),
            Pattern.compile("review.*code", Pattern.CASE_INSENSITIVE));

    static final List<String> HEAVY_KEYWORDS = List.of(
            "generate", "create", "write", "implement", "build", "develop",
            "refactor", "rewrite", "restructure", "redesign",
            "analyze", "review", "audit", "examine", "inspect",
            "test", "debug", "fix", "patch", "update",
            "document", "annotate", "comment",
            "optimize", "improve", "enhance",
            "convert", "migrate", "port", "transform");

    static final List<String> CODE_EXTENSIONS = List.of(
            ".py", ".js", ".ts", ".tsx", ".jsx", ".java", ".cpp", ".c", ".h",
            ".cs", ".go", ".rs", ".rb", ".php", ".swift", ".kt", ".scala",
            ".vue", ".svelte", ".html", ".css", ".scss", ".sql");

    private static final Pattern SOURCE_FILE_REFERENCE = Pattern.compile("\\.(py|js|ts|tsx|java|cpp|go|rs)");

    private final FlightdeckProperties properties;
    private final ModelBackends backends;
    private final Clock clock;

    private final AtomicReference<Instant> hourStart;
    private final AtomicInteger cloudCallsThisHour = new AtomicInteger();
    private final AtomicInteger localCallsThisHour = new AtomicInteger();
    private final AtomicLong cloudTokensUsed = new AtomicLong();
    private final AtomicLong localTokensUsed = new AtomicLong();

    public HybridRouter(FlightdeckProperties properties, ModelBackends backends, Clock clock) {
        this.properties = properties;
        this.backends = backends;
        this.clock = clock;
        this.hourStart = new AtomicReference<>(currentHour());
    }

    /**
     * Classifies a task. Pure function of the inputs and the configured token threshold.
     *
     * @param task    the task text
     * @param context optional extra text (file contents, history); counts toward size signals only
     */
    public TaskClassification classify(String task, String context) {
        String fullText = context != null && !context.isEmpty() ? task + " " + context : task;

        for (Pattern pattern : FORCE_CLOUD_PATTERNS) {
            if (pattern.matcher(task).find()) {
                return new TaskClassification(TaskType.QUICK, FORCED_CONFIDENCE,
                        "Matched cloud-preferred pattern", estimateTokens(task));
            }
        }
        for (Pattern pattern : FORCE_LOCAL_PATTERNS) {
            if (pattern.matcher(task).find()) {
                return new TaskClassification(TaskType.HEAVY, FORCED_CONFIDENCE,
                        "Matched local-preferred pattern", estimateTokens(fullText));
            }
        }

        String taskLower = task.toLowerCase(Locale.ROOT);
        long heavyKeywordCount = HEAVY_KEYWORDS.stream().filter(taskLower::contains).count();
        boolean hasCodeBlock = fullText.contains("```");
        boolean hasCodeExtension = CODE_EXTENSIONS.stream().anyMatch(fullText::contains);
        boolean hasMultipleFiles = countMatches(SOURCE_FILE_REFERENCE, fullText) > 1;
        int estimatedTokens = estimateTokens(fullText);
        boolean overTokenThreshold = estimatedTokens > properties.getHeavyTokenThreshold();

        int score = 0;
        if (heavyKeywordCount >= 3) {
            score += 3;
        } else if (heavyKeywordCount == 2) {
            score += 2;
        } else if (heavyKeywordCount == 1) {
            score += 1;
        }
        if (hasCodeBlock) score += 2;
        if (hasCodeExtension) score += 1;
        if (hasMultipleFiles) score += 2;
        if (overTokenThreshold) score += 2;
        if (task.length() > LONG_TASK_LENGTH) score += 1;

        boolean heavy = score >= HEAVY_SCORE_THRESHOLD;
        double confidence = Math.min(FORCED_CONFIDENCE, 0.5 + score * 0.1);

        String reason;
        if (heavy) {
            var reasons = new ArrayList<String>();
            if (heavyKeywordCount > 0) reasons.add(heavyKeywordCount + " heavy keywords");
            if (hasCodeBlock) reasons.add("code blocks");
            if (hasMultipleFiles) reasons.add("multiple files");
            if (overTokenThreshold) reasons.add("high token count");
            reason = "Heavy task: " + String.join(", ", reasons);
        } else {
            reason = "Quick task: simple query or low complexity";
        }
        return new TaskClassification(heavy ? TaskType.HEAVY : TaskType.QUICK, confidence, reason, estimatedTokens);
    }

    /**
     * Picks the backend for a classified task.
     *
     * @param classification result of {@link #classify(String, String)}
     * @param forced         explicit target, or null / {@link ExecutionTarget#AUTO} to let the router decide
     * @return {@link ExecutionTarget#CLOUD} or {@link ExecutionTarget#LOCAL}, never AUTO
     */
    public ExecutionTarget decideTarget(TaskClassification classification, ExecutionTarget forced) {
        boolean localAvailable = backends.isAvailable(ExecutionTarget.LOCAL);
        boolean cloudAvailable = backends.isAvailable(ExecutionTarget.CLOUD);

        if (forced != null && forced != ExecutionTarget.AUTO) {
            if (forced == ExecutionTarget.LOCAL && !localAvailable) {
                return ExecutionTarget.CLOUD;
            }
            if (forced == ExecutionTarget.CLOUD && !cloudAvailable) {
                return localAvailable ? ExecutionTarget.LOCAL : ExecutionTarget.CLOUD;
            }
            return forced;
        }

        rollHourIfNeeded();
        if (cloudCallsThisHour.get() >= properties.getCloudRateLimitPerHour() && localAvailable) {
            log.debug("Cloud rate limit of {}/h reached, routing local", properties.getCloudRateLimitPerHour());
            return ExecutionTarget.LOCAL;
        }

        if (classification.type() == TaskType.HEAVY) {
            return localAvailable ? ExecutionTarget.LOCAL : ExecutionTarget.CLOUD;
        }
        if (classification.type() == TaskType.QUICK) {
            if (cloudAvailable) {
                return ExecutionTarget.CLOUD;
            }
            return localAvailable ? ExecutionTarget.LOCAL : ExecutionTarget.CLOUD;
        }
        return properties.isPreferLocal() && localAvailable ? ExecutionTarget.LOCAL : ExecutionTarget.CLOUD;
    }

    /** Counts one call (and its estimated tokens) against the current hour. */
    public void recordCall(ExecutionTarget target, int tokens) {
        rollHourIfNeeded();
        if (target == ExecutionTarget.CLOUD) {
            cloudCallsThisHour.incrementAndGet();
            cloudTokensUsed.addAndGet(tokens);
        } else if (target == ExecutionTarget.LOCAL) {
            localCallsThisHour.incrementAndGet();
            localTokensUsed.addAndGet(tokens);
        }
    }

    public RoutingStats stats() {
        rollHourIfNeeded();
        return new RoutingStats(cloudCallsThisHour.get(), localCallsThisHour.get(),
                cloudTokensUsed.get(), localTokensUsed.get(), hourStart.get());
    }

    /** Rough estimate: about 2.5 characters per token for code, 4 for prose. */
    public static int estimateTokens(String text) {
        boolean code = text.contains("```") || CODE_EXTENSIONS.stream().anyMatch(text::contains);
        double charsPerToken = code ? 2.5 : 4.0;
        return (int) Math.ceil(text.length() / charsPerToken);
    }

    private void rollHourIfNeeded() {
        Instant now = currentHour();
        Instant previous = hourStart.get();
        if (now.isAfter(previous) && hourStart.compareAndSet(previous, now)) {
            cloudCallsThisHour.set(0);
            localCallsThisHour.set(0);
            log.debug("Routing counters reset for hour starting {}", now);
        }
    }

    private Instant currentHour() {
        return clock.instant().truncatedTo(ChronoUnit.HOURS);
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
