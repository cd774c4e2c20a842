package com.flightdeck.core.llm;

import com.flightdeck.core.model.ChatMessage;
import com.flightdeck.core.routing.ExecutionTarget;

import java.util.List;

/**
 * A chat model an agent can run on.
 */
public interface ModelBackend {

    ExecutionTarget target();

    String defaultModelId();

    boolean isAvailable();

    /**
     * Starts streaming the model's reply to the full conversation.
     *
     * @param history the conversation, system prompt first
     * @param modelId model to use; {@link #defaultModelId()} when null
     * @throws ProviderException if the request cannot be started
     */
    ChatStream stream(List<ChatMessage> history, String modelId);
}
