package com.flightdeck.core.llm;

import com.flightdeck.core.model.ChatMessage;
import com.flightdeck.core.routing.ExecutionTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * {@link ModelBackend} over a Spring AI {@link ChatClient}. Streams through
 * {@code ChatClient.prompt().stream().content()}.
 */
public class SpringAiModelBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelBackend.class);

    private final ExecutionTarget target;
    private final ChatClient chatClient;
    private final String defaultModelId;
    private final BooleanSupplier availability;
    private final Duration inactivityTimeout;

    public SpringAiModelBackend(ExecutionTarget target, ChatClient chatClient, String defaultModelId,
                                BooleanSupplier availability, Duration inactivityTimeout) {
        this.target = target;
        this.chatClient = chatClient;
        this.defaultModelId = defaultModelId;
        this.availability = availability;
        this.inactivityTimeout = inactivityTimeout;
    }

    @Override
    public ExecutionTarget target() {
        return target;
    }

    @Override
    public String defaultModelId() {
        return defaultModelId;
    }

    @Override
    public boolean isAvailable() {
        return availability.getAsBoolean();
    }

    @Override
    public ChatStream stream(List<ChatMessage> history, String modelId) {
        if (!isAvailable()) {
            throw new ProviderException(target.wireName() + " backend is not available");
        }
        String model = modelId != null ? modelId : defaultModelId;
        log.debug("Streaming {} messages to {} model {}", history.size(), target.wireName(), model);
        try {
            var chunks = chatClient.prompt()
                    .messages(toSpringMessages(history))
                    .options(ChatOptions.builder().model(model).build())
                    .stream()
                    .content();
            return ChatStream.from(chunks, inactivityTimeout);
        } catch (RuntimeException e) {
            throw new ProviderException("Failed to start " + target.wireName() + " stream: " + e.getMessage(), e);
        }
    }

    static List<Message> toSpringMessages(List<ChatMessage> history) {
        return history.stream()
                .map(SpringAiModelBackend::toSpringMessage)
                .toList();
    }

    private static Message toSpringMessage(ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
        };
    }
}
