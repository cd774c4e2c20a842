package com.flightdeck.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coalesces save requests into at most one flush per interval.
 * <p>
 * The first {@link #requestFlush()} after a flush schedules the next one
 * {@code intervalMs} later; requests arriving in between only mark the state dirty.
 * {@link #close()} performs a final synchronous flush of pending changes.
 */
public class DebouncedWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebouncedWriter.class);

    private final String name;
    private final long intervalMs;
    private final Runnable flushAction;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DebouncedWriter(String name, long intervalMs, Runnable flushAction) {
        this.name = name;
        this.intervalMs = intervalMs;
        this.flushAction = flushAction;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "flush-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void requestFlush() {
        dirty.set(true);
        if (closed.get()) {
            return;
        }
        if (scheduled.compareAndSet(false, true)) {
            scheduler.schedule(this::scheduledFlush, intervalMs, TimeUnit.MILLISECONDS);
        }
    }

    private void scheduledFlush() {
        scheduled.set(false);
        flushNow();
    }

    /** Writes pending changes immediately on the calling thread. */
    public synchronized void flushNow() {
        if (!dirty.getAndSet(false)) {
            return;
        }
        try {
            flushAction.run();
        } catch (RuntimeException e) {
            log.warn("Flush of {} failed: {}", name, e.getMessage(), e);
        }
    }

    public boolean isDirty() {
        return dirty.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdownNow();
        flushNow();
    }
}
