package com.flightdeck.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for agent and plan events.
 * <p>
 * Subscribers register either for one agent id or globally. Delivery is synchronous
 * on the publishing thread; a throwing subscriber is logged and skipped so that it
 * cannot break the agent loop that published.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FlightdeckEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<FlightdeckEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(FlightdeckEvent event) {
        log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());

        List<Consumer<FlightdeckEvent>> subs = event.agentId() != null ? agentSubscribers.get(event.agentId()) : null;
        if (subs != null) {
            for (Consumer<FlightdeckEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<FlightdeckEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribes to the events of one agent.
     *
     * @return handle that removes exactly this subscription
     */
    public Subscription subscribe(String agentId, Consumer<FlightdeckEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> agentSubscribers.computeIfPresent(agentId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Subscribes to every event regardless of agent. */
    public Subscription subscribeAll(Consumer<FlightdeckEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    int subscriberCount(String agentId) {
        var subs = agentSubscribers.get(agentId);
        return subs != null ? subs.size() : 0;
    }

    /**
     * Handle for cancelling a subscription. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private void deliverSafely(Consumer<FlightdeckEvent> subscriber, FlightdeckEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
