package com.flightdeck.core.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword extraction and error-message normalization shared by the lesson store,
 * the semantic memory and the loop detector.
 */
public final class TextNormalizer {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "shall", "can", "need", "dare",
            "ought", "used", "to", "of", "in", "for", "on", "with", "at", "by",
            "from", "as", "into", "through", "during", "before", "after",
            "above", "below", "between", "under", "again", "further", "then",
            "once", "here", "there", "when", "where", "why", "how", "all",
            "each", "few", "more", "most", "other", "some", "such", "no", "nor",
            "not", "only", "own", "same", "so", "than", "too", "very", "just",
            "and", "error", "failed", "cannot"
    );

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Any token containing a path separator, optionally with a drive letter
    private static final Pattern PATH = Pattern.compile("(?:[A-Za-z]:)?(?:[\\w.@~-]*[/\\\\])+[\\w.@~-]*");
    private static final Pattern LINE_COL = Pattern.compile(":\\d+(?::\\d+)?");
    private static final Pattern LINE_WORD = Pattern.compile("(?i)\\bline \\d+(?:, column \\d+)?");
    private static final Pattern TIMESTAMP = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}(?:[T ]\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?(?:Z|[+-]\\d{2}:?\\d{2})?)?");
    private static final Pattern CLOCK = Pattern.compile("\\b\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?\\b");

    private static final int MAX_PATTERN_LENGTH = 200;

    private TextNormalizer() {}

    /**
     * Lower-cases the text and returns distinct significant words in order of first
     * appearance. Stop words and words of two characters or fewer are dropped.
     */
    public static List<String> extractKeywords(String text, int maxKeywords) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = NON_ALNUM.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        var keywords = new LinkedHashSet<String>();
        for (String word : WHITESPACE.split(cleaned)) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
                if (keywords.size() >= maxKeywords) {
                    break;
                }
            }
        }
        return new ArrayList<>(keywords);
    }

    public static List<String> extractKeywords(String text) {
        return extractKeywords(text, Integer.MAX_VALUE);
    }

    /**
     * Strips the volatile parts of an error message (paths, line/column numbers,
     * dates and times) so that recurrences of the same failure compare equal.
     * Case is preserved; the result is at most 200 characters.
     */
    public static String normalizeError(String error) {
        if (error == null) {
            return "";
        }
        String result = TIMESTAMP.matcher(error).replaceAll("");
        result = CLOCK.matcher(result).replaceAll("");
        result = PATH.matcher(result).replaceAll("<path>");
        result = LINE_WORD.matcher(result).replaceAll("line <n>");
        result = LINE_COL.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        if (result.length() > MAX_PATTERN_LENGTH) {
            result = result.substring(0, MAX_PATTERN_LENGTH).trim();
        }
        return result;
    }

    /** Truncates text to {@code max} characters, appending an ellipsis when cut. */
    public static String preview(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
