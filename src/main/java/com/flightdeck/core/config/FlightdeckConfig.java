package com.flightdeck.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightdeck.core.agent.AgentServices;
import com.flightdeck.core.agent.ToolExecutor;
import com.flightdeck.core.agent.UnconfiguredToolExecutor;
import com.flightdeck.core.events.EventBus;
import com.flightdeck.core.lessons.LessonStore;
import com.flightdeck.core.llm.HttpHealthCheck;
import com.flightdeck.core.llm.LlmService;
import com.flightdeck.core.llm.ModelBackends;
import com.flightdeck.core.llm.SpringAiModelBackend;
import com.flightdeck.core.loop.LoopDetector;
import com.flightdeck.core.memory.SemanticMemoryStore;
import com.flightdeck.core.metrics.FlightdeckMetrics;
import com.flightdeck.core.persistence.SessionStore;
import com.flightdeck.core.protocol.ToolCallProtocol;
import com.flightdeck.core.routing.ExecutionTarget;
import com.flightdeck.core.routing.HybridRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Wires the model backends, the planning model and the file-backed stores.
 * <p>
 * Both backends speak the OpenAI chat-completions protocol: the cloud one against a
 * hosted router, the local one against Ollama or LM Studio.
 */
@Configuration
public class FlightdeckConfig {

    private static final Logger log = LoggerFactory.getLogger(FlightdeckConfig.class);

    /** Placeholder sent to local servers that ignore the key. */
    private static final String NO_KEY = "none";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("cloud")
    public ChatClient cloudChatClient(FlightdeckProperties properties) {
        return chatClient(properties.getCloud());
    }

    @Bean
    @Qualifier("local")
    public ChatClient localChatClient(FlightdeckProperties properties) {
        return chatClient(properties.getLocal());
    }

    private static ChatClient chatClient(FlightdeckProperties.Backend backend) {
        String baseUrl = backend.getBaseUrl();
        // OpenAiApi appends /v1/chat/completions itself
        if (baseUrl.endsWith("/v1")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 3);
        }
        var api = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(backend.hasApiKey() ? backend.getApiKey() : NO_KEY)
                .build();
        var chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(backend.getModelId()).build())
                .build();
        return ChatClient.create(chatModel);
    }

    @Bean
    public ModelBackends modelBackends(FlightdeckProperties properties,
                                       @Qualifier("cloud") ChatClient cloudChatClient,
                                       @Qualifier("local") ChatClient localChatClient,
                                       Clock clock) {
        var cloud = properties.getCloud();
        var local = properties.getLocal();
        Duration inactivity = Duration.ofMillis(properties.getDefaultTimeoutMs());
        boolean cloudConfigured = cloud.isEnabled() && cloud.hasApiKey();
        BooleanSupplier localAvailability = () -> false;
        if (local.isEnabled()) {
            localAvailability = new HttpHealthCheck(local.getBaseUrl(),
                    Duration.ofMillis(properties.getHealthCheckTimeoutMs()),
                    Duration.ofMillis(properties.getHealthCheckTtlMs()), clock);
        }
        log.info("Model backends: cloud={} ({}), local={} ({})",
                cloudConfigured ? "configured" : "unconfigured", cloud.getModelId(),
                local.isEnabled() ? "health-checked at " + local.getBaseUrl() : "disabled", local.getModelId());
        return new ModelBackends(
                new SpringAiModelBackend(ExecutionTarget.CLOUD, cloudChatClient, cloud.getModelId(), () -> cloudConfigured, inactivity),
                new SpringAiModelBackend(ExecutionTarget.LOCAL, localChatClient, local.getModelId(), localAvailability, inactivity));
    }

    /**
     * Planning runs on the cloud model when it is usable, else on the local one.
     */
    @Bean
    public LlmService llmService(ModelBackends backends,
                                 @Qualifier("cloud") ChatClient cloudChatClient,
                                 @Qualifier("local") ChatClient localChatClient) {
        boolean useCloud = backends.isAvailable(ExecutionTarget.CLOUD);
        log.info("Planning model: {}", useCloud ? "cloud" : "local");
        return new LlmService(useCloud ? cloudChatClient : localChatClient);
    }

    @Bean
    public LessonStore lessonStore(FlightdeckProperties properties, ObjectMapper objectMapper, Clock clock) {
        var storage = properties.getStorage();
        return new LessonStore(storage.lessonsFile(), storage.getLessonCapacity(),
                storage.getFlushIntervalMs(), objectMapper, clock);
    }

    @Bean
    public SemanticMemoryStore semanticMemoryStore(FlightdeckProperties properties, ObjectMapper objectMapper, Clock clock) {
        var storage = properties.getStorage();
        return new SemanticMemoryStore(storage.semanticMemoryFile(), storage.getSemanticCapacity(),
                storage.getFlushIntervalMs(), objectMapper, clock);
    }

    @Bean
    public SessionStore sessionStore(FlightdeckProperties properties, ObjectMapper objectMapper, Clock clock) {
        var storage = properties.getStorage();
        return new SessionStore(storage.sessionsDir(), storage.getFlushIntervalMs(), objectMapper, clock);
    }

    /**
     * Fallback used until a real tool executor (filesystem, shell, browser) is registered.
     */
    @Bean
    @ConditionalOnMissingBean(ToolExecutor.class)
    public ToolExecutor toolExecutor() {
        log.warn("No ToolExecutor bean registered; every tool call will fail");
        return new UnconfiguredToolExecutor();
    }

    @Bean
    public AgentServices agentServices(FlightdeckProperties properties, ModelBackends backends,
                                       HybridRouter router, ToolCallProtocol protocol,
                                       ToolExecutor toolExecutor, LoopDetector loopDetector,
                                       LessonStore lessonStore, SemanticMemoryStore semanticMemory,
                                       SessionStore sessionStore, EventBus eventBus,
                                       FlightdeckMetrics metrics, Clock clock) {
        return new AgentServices(properties, backends, router, protocol, toolExecutor, loopDetector,
                lessonStore, semanticMemory, sessionStore, eventBus, metrics, clock);
    }
}
