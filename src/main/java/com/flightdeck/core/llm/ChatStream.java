package com.flightdeck.core.llm;

import com.flightdeck.core.model.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pull-based view of a streamed model response.
 * <p>
 * The producer (a Reactor {@link Flux}) pushes chunks into a queue; the agent loop
 * pulls them with {@link #next(CancellationToken)}, which returns between chunks when
 * the token is cancelled. Normal end and provider failure are distinct: the former
 * yields an empty result, the latter throws {@link ProviderException}.
 */
public final class ChatStream implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatStream.class);

    static final long POLL_INTERVAL_MS = 100;

    private static final Object END = new Object();

    private record Failure(Throwable error) {}

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final long inactivityTimeoutMs;
    private volatile Disposable subscription;
    private boolean finished;

    private ChatStream(Duration inactivityTimeout) {
        this.inactivityTimeoutMs = inactivityTimeout.toMillis();
    }

    /**
     * Subscribes to the flux immediately.
     *
     * @param chunks            the model's content chunks
     * @param inactivityTimeout longest wait for the next chunk before the stream counts as failed
     */
    public static ChatStream from(Flux<String> chunks, Duration inactivityTimeout) {
        var stream = new ChatStream(inactivityTimeout);
        stream.subscription = chunks.subscribe(
                stream.queue::offer,
                error -> stream.queue.offer(new Failure(error)),
                () -> stream.queue.offer(END));
        return stream;
    }

    /**
     * Blocks until the next chunk arrives.
     *
     * @return the chunk, or empty when the stream ended or the token was cancelled
     * @throws ProviderException if the producer failed or stayed silent past the inactivity timeout
     */
    public Optional<String> next(CancellationToken token) {
        if (finished) {
            return Optional.empty();
        }
        long waited = 0;
        while (true) {
            if (token != null && token.isCancelled()) {
                close();
                return Optional.empty();
            }
            Object item;
            try {
                item = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new ProviderException("Interrupted while waiting for model output", e);
            }
            if (item == null) {
                waited += POLL_INTERVAL_MS;
                if (waited >= inactivityTimeoutMs) {
                    close();
                    throw new ProviderException("No output from model for " + inactivityTimeoutMs + " ms");
                }
                continue;
            }
            if (item == END) {
                finished = true;
                return Optional.empty();
            }
            if (item instanceof Failure failure) {
                finished = true;
                Throwable cause = failure.error();
                if (cause instanceof ProviderException pe) {
                    throw pe;
                }
                throw new ProviderException("Model stream failed: " + cause.getMessage(), cause);
            }
            return Optional.of((String) item);
        }
    }

    /**
     * Reads the stream to its end and concatenates the chunks.
     * Cancellation stops reading and returns what was read so far.
     */
    public String collect(CancellationToken token) {
        var sb = new StringBuilder();
        Optional<String> chunk;
        while ((chunk = next(token)).isPresent()) {
            sb.append(chunk.get());
        }
        return sb.toString();
    }

    @Override
    public void close() {
        finished = true;
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            current.dispose();
            log.debug("Model stream disposed");
        }
    }
}
