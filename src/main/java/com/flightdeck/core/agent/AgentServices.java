package com.flightdeck.core.agent;

import com.flightdeck.core.config.FlightdeckProperties;
import com.flightdeck.core.events.EventBus;
import com.flightdeck.core.lessons.LessonStore;
import com.flightdeck.core.llm.ModelBackends;
import com.flightdeck.core.loop.LoopDetector;
import com.flightdeck.core.memory.SemanticMemoryStore;
import com.flightdeck.core.metrics.FlightdeckMetrics;
import com.flightdeck.core.persistence.SessionStore;
import com.flightdeck.core.protocol.ToolCallProtocol;
import com.flightdeck.core.routing.HybridRouter;

import java.time.Clock;

/**
 * The shared collaborators every agent loop needs, injected once into the {@link AgentManager}.
 */
public record AgentServices(
    FlightdeckProperties properties,
    ModelBackends backends,
    HybridRouter router,
    ToolCallProtocol protocol,
    ToolExecutor toolExecutor,
    LoopDetector loopDetector,
    LessonStore lessonStore,
    SemanticMemoryStore semanticMemory,
    SessionStore sessionStore,
    EventBus eventBus,
    FlightdeckMetrics metrics,
    Clock clock
) {}
