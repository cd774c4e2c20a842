package com.flightdeck.core.memory;

import com.flightdeck.core.text.TextNormalizer;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One remembered fact: a task, decision, error, success or piece of context.
 */
public record MemoryEntry(
    String id,
    Instant timestamp,
    String agentId,
    String agentType,
    String content,
    MemoryEntryType type,
    List<String> keywords
) {

    public MemoryEntry {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static MemoryEntry of(String agentId, String agentType, MemoryEntryType type, String content, Instant at) {
        return new MemoryEntry(agentId + "-" + type.wireName() + "-" + UUID.randomUUID().toString().substring(0, 8),
                at, agentId, agentType, content, type, TextNormalizer.extractKeywords(content));
    }
}
