package com.flightdeck.core.memory;

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
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable memory shared by all agents.
 * <p>
 * Entries are ranked against a query by {@code overlap x typeBoost + 0.1 x recency},
 * where overlap counts shared keywords and recency decays as {@code 1 / (1 + ageInDays)}.
 * Over capacity, the oldest entries are dropped.
 */
public class SemanticMemoryStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SemanticMemoryStore.class);

    static final double RECENCY_WEIGHT = 0.1;

    private final Path file;
    private final int capacity;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final DebouncedWriter writer;
    private final List<MemoryEntry> entries = new ArrayList<>();

    public SemanticMemoryStore(Path file, int capacity, long flushIntervalMs, ObjectMapper mapper, Clock clock) {
        this.file = file;
        this.capacity = capacity;
        this.mapper = mapper;
        this.clock = clock;
        this.writer = new DebouncedWriter("semantic-memory", flushIntervalMs, this::writeToDisk);
        try {
            JsonFiles.read(mapper, file, MemoryEntry[].class).ifPresent(loaded -> entries.addAll(Arrays.asList(loaded)));
            log.debug("Loaded {} memory entries", entries.size());
        } catch (UncheckedIOException e) {
            log.warn("Could not load semantic memory from {}, starting empty: {}", file, e.getMessage());
        }
    }

    public synchronized void add(MemoryEntry entry) {
        entries.add(entry);
        if (entries.size() > capacity) {
            entries.sort(Comparator.comparing(MemoryEntry::timestamp).reversed());
            entries.subList(capacity, entries.size()).clear();
        }
        writer.requestFlush();
    }

    /** Best matches first; entries sharing no keyword are ordered by recency alone. */
    public synchronized List<MemoryEntry> query(String text, int limit) {
        Set<String> queryKeywords = new HashSet<>(TextNormalizer.extractKeywords(text));
        Instant now = clock.instant();
        record Scored(MemoryEntry entry, double score) {}
        return entries.stream()
                .map(e -> new Scored(e, score(e, queryKeywords, now)))
                .filter(s -> s.score() > 0)
                .sorted(Comparator.comparingDouble(Scored::score).reversed())
                .limit(limit)
                .map(Scored::entry)
                .toList();
    }

    static double score(MemoryEntry entry, Set<String> queryKeywords, Instant now) {
        long overlap = entry.keywords().stream().filter(queryKeywords::contains).count();
        double ageDays = Math.max(0, Duration.between(entry.timestamp(), now).toMillis()) / 86_400_000.0;
        double recency = 1.0 / (1.0 + ageDays);
        return overlap * entry.type().queryBoost() + recency * RECENCY_WEIGHT;
    }

    public synchronized List<MemoryEntry> recent(MemoryEntryType type, int limit) {
        return entries.stream()
                .filter(e -> e.type() == type)
                .sorted(Comparator.comparing(MemoryEntry::timestamp).reversed())
                .limit(limit)
                .toList();
    }

    public synchronized List<MemoryEntry> byAgentType(String agentType) {
        return entries.stream().filter(e -> agentType.equals(e.agentType())).toList();
    }

    public synchronized Map<MemoryEntryType, Integer> countsByType() {
        Map<MemoryEntryType, Integer> counts = new EnumMap<>(MemoryEntryType.class);
        for (MemoryEntry entry : entries) {
            counts.merge(entry.type(), 1, Integer::sum);
        }
        return counts;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        writer.requestFlush();
    }

    private void writeToDisk() {
        List<MemoryEntry> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(entries);
        }
        JsonFiles.write(mapper, file, snapshot);
    }

    @Override
    public void close() {
        writer.close();
    }
}
