package com.flightdeck.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Checks that an OpenAI-compatible server answers {@code GET /v1/models}.
 * <p>
 * Any 2xx response counts as up. A result is reused for {@code ttl} so routing
 * decisions do not hit the server on every call.
 */
public class HttpHealthCheck implements BooleanSupplier {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthCheck.class);

    private final URI uri;
    private final Duration timeout;
    private final Duration ttl;
    private final Clock clock;
    private final HttpClient httpClient;

    private Instant checkedAt;
    private Boolean lastResult;

    public HttpHealthCheck(String baseUrl, Duration timeout, Duration ttl, Clock clock) {
        this.uri = modelsUri(baseUrl);
        this.timeout = timeout;
        this.ttl = ttl;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    static URI modelsUri(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (base.endsWith("/v1")) {
            base = base.substring(0, base.length() - 3);
        }
        return URI.create(base + "/v1/models");
    }

    @Override
    public synchronized boolean getAsBoolean() {
        Instant now = clock.instant();
        if (lastResult != null && now.isBefore(checkedAt.plus(ttl))) {
            return lastResult;
        }
        boolean up = ping();
        if (lastResult == null || lastResult != up) {
            log.info("Model server {} is {}", uri, up ? "up" : "down");
        }
        lastResult = up;
        checkedAt = now;
        return up;
    }

    private boolean ping() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() / 100 != 2) {
                log.debug("Health check of {} returned HTTP {}", uri, response.statusCode());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.debug("Health check of {} failed: {}", uri, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
