package com.flightdeck.core.llm;

import com.flightdeck.core.model.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ChatStreamTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    @DisplayName("collect concatenates chunks in order")
    void collect() {
        try (var stream = ChatStream.from(Flux.just("Hel", "lo", " world"), TIMEOUT)) {
            assertEquals("Hello world", stream.collect(new CancellationToken()));
        }
    }

    @Test
    @DisplayName("next returns empty after normal completion, repeatedly")
    void endOfStream() {
        var stream = ChatStream.from(Flux.just("a"), TIMEOUT);
        var token = new CancellationToken();
        assertEquals(Optional.of("a"), stream.next(token));
        assertTrue(stream.next(token).isEmpty());
        assertTrue(stream.next(token).isEmpty());
    }

    @Test
    @DisplayName("a producer error surfaces as ProviderException after earlier chunks")
    void providerError() {
        var stream = ChatStream.from(
                Flux.concat(Flux.just("partial"), Flux.error(new IllegalStateException("503"))), TIMEOUT);
        var token = new CancellationToken();

        assertEquals(Optional.of("partial"), stream.next(token));
        ProviderException e = assertThrows(ProviderException.class, () -> stream.next(token));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    @DisplayName("a cancelled token ends the stream and disposes the subscription")
    void cancellation() {
        var disposed = new AtomicBoolean();
        var stream = ChatStream.from(Flux.<String>never().doOnCancel(() -> disposed.set(true)), TIMEOUT);
        var token = new CancellationToken();
        token.cancel();

        assertTrue(stream.next(token).isEmpty());
        assertTrue(disposed.get());
    }

    @Test
    @DisplayName("silence past the inactivity timeout is a provider failure")
    void inactivity() {
        var stream = ChatStream.from(Flux.never(), Duration.ofMillis(250));
        assertThrows(ProviderException.class, () -> stream.next(new CancellationToken()));
    }
}
