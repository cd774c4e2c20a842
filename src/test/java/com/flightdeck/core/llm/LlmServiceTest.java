package com.flightdeck.core.llm;

import com.flightdeck.core.model.AgentType;
import com.flightdeck.core.model.PlanComplexity;
import com.flightdeck.core.model.TaskPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
 */
class LlmServiceTest {

    private static final String PLAN_JSON = """
            {"summary":"Add login","complexity":"medium","steps":[
              {"id":1,"description":"API","agentType":"backend","dependencyIds":[],"instruction":"Add /login"},
              {"id":2,"description":"Form","agentType":"frontend","dependencyIds":[1],"instruction":"Add form"}]}
            """;

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        llmService = new LlmService(mockChatClient);
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and appends format instructions to the user prompt")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn(PLAN_JSON);

        llmService.structuredCall("System prompt", "User prompt", TaskPlan.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        String user = userCaptor.getValue();
        assertTrue(user.startsWith("User prompt\n\n"));
        assertTrue(user.length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("structuredCall deserializes the response into the target type")
    void deserializes() {
        when(mockCallResponse.content()).thenReturn(PLAN_JSON);

        TaskPlan plan = llmService.structuredCall("sys", "usr", TaskPlan.class);

        assertEquals("Add login", plan.summary());
        assertEquals(PlanComplexity.MEDIUM, plan.complexity());
        assertEquals(2, plan.steps().size());
        assertEquals(AgentType.FRONTEND, plan.steps().get(1).agentType());
        assertEquals(List.of(1), plan.steps().get(1).dependencyIds());
    }

    @Test
    @DisplayName("prose around fenced JSON falls back to lenient parsing with field aliases")
    void lenientFallback() {
        when(mockCallResponse.content()).thenReturn("""
                Here is your plan:
                ```json
                {"summary":"Fix bug","estimatedComplexity":"simple","extra":true,"steps":[
                  {"id":1,"description":"Fix","agentType":"general","dependencies":[],"task":"Fix the bug"}]}
                ```
                Good luck!
                """);

        TaskPlan plan = llmService.structuredCall("sys", "usr", TaskPlan.class);

        assertEquals(PlanComplexity.SIMPLE, plan.complexity());
        assertEquals("Fix the bug", plan.steps().get(0).instruction());
    }

    @Test
    @DisplayName("blank content raises LlmEmptyResponseException")
    void blankContent() {
        when(mockCallResponse.content()).thenReturn("  ");
        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", TaskPlan.class));
    }

    @Test
    @DisplayName("content that is not JSON raises LlmParseException")
    void garbage() {
        when(mockCallResponse.content()).thenReturn("I cannot help with that.");
        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("sys", "usr", TaskPlan.class));
    }

    @Test
    @DisplayName("extractJsonObject keeps the outermost object")
    void extractJsonObject() {
        assertEquals("{\"a\":{\"b\":1}}", LlmService.extractJsonObject("```json\nsure: {\"a\":{\"b\":1}} done\n```"));
        assertEquals("no json", LlmService.extractJsonObject("no json"));
    }
}
