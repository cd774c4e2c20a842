package com.flightdeck.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightdeck.core.model.Agent;
import com.flightdeck.core.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Records agents, artifacts and messages of the current session and keeps past
 * sessions as one JSON file each.
 */
public class SessionStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Path dir;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final DebouncedWriter writer;
    private boolean closed;

    private String sessionId;
    private Instant startTime;
    private final List<AgentRecord> agents = new ArrayList<>();
    private final List<Artifact> artifacts = new ArrayList<>();
    private final List<SessionMessage> messages = new ArrayList<>();

    public SessionStore(Path dir, long flushIntervalMs, ObjectMapper mapper, Clock clock) {
        this.dir = dir;
        this.mapper = mapper;
        this.clock = clock;
        this.writer = new DebouncedWriter("session", flushIntervalMs, this::writeCurrent);
        startNewSession();
    }

    private void startNewSession() {
        startTime = clock.instant();
        sessionId = "session-" + startTime.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 4);
        agents.clear();
        artifacts.clear();
        messages.clear();
    }

    /** Adds or replaces the record of an agent, including its assistant output. */
    public synchronized void recordAgent(Agent agent) {
        List<String> output = agent.messageHistory().stream()
                .filter(m -> m.role() == ChatMessage.Role.ASSISTANT)
                .map(ChatMessage::content)
                .toList();
        var record = new AgentRecord(agent.id(), agent.agentType().wireName(), agent.task(),
                agent.status().wireName(), output, agent.startedAt(), agent.endedAt());
        agents.removeIf(a -> a.id().equals(agent.id()));
        agents.add(record);
        writer.requestFlush();
    }

    public synchronized void recordArtifact(Artifact artifact) {
        artifacts.add(artifact);
        writer.requestFlush();
    }

    public synchronized void recordMessage(String fromAgent, String toAgent, String type, String content) {
        messages.add(new SessionMessage("msg-" + UUID.randomUUID().toString().substring(0, 8),
                fromAgent, toAgent, type, content, clock.instant()));
        writer.requestFlush();
    }

    public synchronized SessionHistory current() {
        return new SessionHistory(sessionId, startTime, null, agents, artifacts, messages);
    }

    /** Stamps the end time, writes the session and starts a fresh one. */
    public void endSession() {
        SessionHistory ended;
        synchronized (this) {
            ended = new SessionHistory(sessionId, startTime, clock.instant(), agents, artifacts, messages);
            startNewSession();
        }
        writer.flushNow();
        write(ended);
        log.info("Session {} saved ({} agents)", ended.id(), ended.agents().size());
    }

    /** Stored sessions, newest first. Unreadable files are skipped. */
    public List<SessionHistory> history() {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .map(this::readQuietly)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(SessionHistory::startTime).reversed())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list sessions in " + dir, e);
        }
    }

    public Optional<SessionHistory> get(String id) {
        return JsonFiles.read(mapper, dir.resolve(id + ".json"), SessionHistory.class);
    }

    public int clearHistory() {
        int deleted = 0;
        for (SessionHistory session : history()) {
            try {
                if (Files.deleteIfExists(dir.resolve(session.id() + ".json"))) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not delete session {}: {}", session.id(), e.getMessage());
            }
        }
        return deleted;
    }

    private Optional<SessionHistory> readQuietly(Path file) {
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), SessionHistory.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable session file {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCurrent() {
        SessionHistory snapshot;
        synchronized (this) {
            if (agents.isEmpty() && artifacts.isEmpty() && messages.isEmpty()) {
                return;
            }
            snapshot = current();
        }
        write(snapshot);
    }

    private void write(SessionHistory session) {
        if (session.agents().isEmpty() && session.artifacts().isEmpty() && session.messages().isEmpty()) {
            return;
        }
        JsonFiles.write(mapper, dir.resolve(session.id() + ".json"), session);
    }

    /** Flushes pending changes and stores the current session with its end time. */
    @Override
    public void close() {
        SessionHistory ended;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            ended = new SessionHistory(sessionId, startTime, clock.instant(), agents, artifacts, messages);
        }
        writer.close();
        write(ended);
    }
}
