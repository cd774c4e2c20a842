package com.flightdeck.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static FlightdeckEvent event(String type, String agentId) {
        return FlightdeckEvent.of(type, agentId, null, Map.of());
    }

    @Nested
    @DisplayName("FlightdeckEvent")
    class FlightdeckEventTests {

        @Test
        @DisplayName("creates event with all fields")
        void createsEventWithAllFields() {
            Instant now = Instant.now();
            var event = new FlightdeckEvent("step.started", "agent-1", 2, Map.of("key", "value"), now);

            assertEquals("step.started", event.eventType());
            assertEquals("agent-1", event.agentId());
            assertEquals(2, event.stepId());
            assertEquals(Map.of("key", "value"), event.payload());
            assertEquals(now, event.timestamp());
        }

        @Test
        @DisplayName("null payload becomes an empty map")
        void nullPayload() {
            var event = new FlightdeckEvent(FlightdeckEvent.AGENT_STATUS, "agent-1", null, null, Instant.now());
            assertEquals(Map.of(), event.payload());
            assertNull(event.stepId());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only the subscribed agent's events")
        void deliversToAgentSubscriber() {
            List<FlightdeckEvent> received = new ArrayList<>();
            eventBus.subscribe("agent-1", received::add);

            eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-1"));
            eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-2"));

            assertEquals(1, received.size());
            assertEquals("agent-1", received.get(0).agentId());
        }

        @Test
        @DisplayName("global subscribers receive every event")
        void globalSubscriber() {
            List<FlightdeckEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(FlightdeckEvent.AGENT_SPAWNED, "agent-1"));
            eventBus.publish(event(FlightdeckEvent.PLAN_CREATED, "plan-1"));
            eventBus.publish(event(FlightdeckEvent.AGENT_STATUS, null));

            assertEquals(3, received.size());
        }

        @Test
        @DisplayName("events arrive in publish order")
        void ordering() {
            List<String> types = new ArrayList<>();
            eventBus.subscribe("agent-1", e -> types.add(e.eventType()));

            eventBus.publish(event(FlightdeckEvent.AGENT_SPAWNED, "agent-1"));
            eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-1"));
            eventBus.publish(event(FlightdeckEvent.AGENT_STATUS, "agent-1"));

            assertEquals(List.of("agent.spawned", "agent.output", "agent.status"), types);
        }

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriber() {
            List<FlightdeckEvent> received = new ArrayList<>();
            eventBus.subscribe("agent-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("agent-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-1")));
            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("removes exactly the one subscription")
        void removesOnlyOne() {
            List<FlightdeckEvent> first = new ArrayList<>();
            List<FlightdeckEvent> second = new ArrayList<>();
            EventBus.Subscription sub = eventBus.subscribe("agent-1", first::add);
            eventBus.subscribe("agent-1", second::add);

            sub.unsubscribe();
            eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-1"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
            assertEquals(1, eventBus.subscriberCount("agent-1"));
        }

        @Test
        @DisplayName("closing twice is harmless and drops the empty entry")
        void idempotent() {
            EventBus.Subscription sub = eventBus.subscribe("agent-1", e -> { });
            sub.close();
            sub.close();
            assertEquals(0, eventBus.subscriberCount("agent-1"));
        }

        @Test
        @DisplayName("global subscription can be cancelled with try-with-resources")
        void globalClose() {
            List<FlightdeckEvent> received = new ArrayList<>();
            try (EventBus.Subscription ignored = eventBus.subscribeAll(received::add)) {
                eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-1"));
            }
            eventBus.publish(event(FlightdeckEvent.AGENT_OUTPUT, "agent-1"));
            assertEquals(1, received.size());
        }
    }
}
