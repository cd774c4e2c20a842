package com.flightdeck.core.config;

import com.flightdeck.core.MutableClock;
import com.flightdeck.core.llm.ModelBackends;
import com.flightdeck.core.routing.ExecutionTarget;
import com.flightdeck.core.routing.HybridRouter;
import com.flightdeck.core.routing.TaskClassification;
import com.flightdeck.core.routing.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class FlightdeckConfigTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private FlightdeckProperties properties;

    @BeforeEach
    void setUp() {
        properties = new FlightdeckProperties();
        properties.getCloud().setApiKey("hf_test");
        // nothing listens on port 1
        properties.getLocal().setBaseUrl("http://127.0.0.1:1");
        properties.setHealthCheckTimeoutMs(1_000);
    }

    private ModelBackends backends() {
        return new FlightdeckConfig().modelBackends(properties, mock(ChatClient.class), mock(ChatClient.class), clock);
    }

    @Nested
    @DisplayName("model backends")
    class ModelBackendTests {

        @Test
        @DisplayName("an enabled local backend with no server behind it is unavailable")
        void unreachableLocal() {
            assertFalse(backends().isAvailable(ExecutionTarget.LOCAL));
            assertTrue(backends().isAvailable(ExecutionTarget.CLOUD));
        }

        @Test
        @DisplayName("a disabled local backend is unavailable")
        void disabledLocal() {
            properties.getLocal().setEnabled(false);
            assertFalse(backends().isAvailable(ExecutionTarget.LOCAL));
        }

        @Test
        @DisplayName("the cloud backend needs an API key")
        void cloudWithoutKey() {
            properties.getCloud().setApiKey("");
            assertFalse(backends().isAvailable(ExecutionTarget.CLOUD));
        }

        @Test
        @DisplayName("heavy work goes to the cloud when the local server is down")
        void heavyFallsBackToCloud() {
            var router = new HybridRouter(properties, backends(), clock);
            var heavy = new TaskClassification(TaskType.HEAVY, 0.95, "Matched local-preferred pattern", 500);

            assertEquals(ExecutionTarget.CLOUD, router.decideTarget(heavy, ExecutionTarget.AUTO));
        }
    }
}
