package com.flightdeck.core.llm;

import com.flightdeck.core.MutableClock;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpHealthCheckTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger status = new AtomicInteger(200);
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/models", exchange -> {
            hits.incrementAndGet();
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private String serverUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private HttpHealthCheck check(String baseUrl) {
        return new HttpHealthCheck(baseUrl, Duration.ofSeconds(2), Duration.ofSeconds(30), clock);
    }

    @Nested
    @DisplayName("checking")
    class CheckTests {

        @Test
        @DisplayName("a server answering 2xx is up")
        void up() {
            assertTrue(check(serverUrl()).getAsBoolean());
            assertEquals(1, hits.get());
        }

        @Test
        @DisplayName("an error status is down")
        void errorStatus() {
            status.set(503);
            assertFalse(check(serverUrl()).getAsBoolean());
        }

        @Test
        @DisplayName("nothing listening is down")
        void unreachable() {
            assertFalse(check("http://127.0.0.1:1").getAsBoolean());
        }
    }

    @Nested
    @DisplayName("caching")
    class CacheTests {

        @Test
        @DisplayName("results are reused until the ttl passes")
        void reusesResult() {
            HttpHealthCheck check = check(serverUrl());
            assertTrue(check.getAsBoolean());

            status.set(500);
            clock.advance(Duration.ofSeconds(10));
            assertTrue(check.getAsBoolean());
            assertEquals(1, hits.get());

            clock.advance(Duration.ofSeconds(25));
            assertFalse(check.getAsBoolean());
            assertEquals(2, hits.get());
        }
    }

    @Test
    @DisplayName("the check targets /v1/models whether or not the base url ends in /v1")
    void modelsUri() {
        assertEquals(URI.create("http://localhost:11434/v1/models"), HttpHealthCheck.modelsUri("http://localhost:11434"));
        assertEquals(URI.create("http://localhost:1234/v1/models"), HttpHealthCheck.modelsUri("http://localhost:1234/v1/"));
    }
}
