package me.golemcore.sceneagent.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.sceneagent.domain.model.Attachment;
import me.golemcore.sceneagent.domain.model.LlmRequest;
import me.golemcore.sceneagent.domain.model.LlmResponse;
import me.golemcore.sceneagent.domain.model.Message;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String MODEL = "openai/gpt-4.1";

    private AgentProperties properties;
    private ChatModel chatModel;
    private List<Long> backoffs;
    private AtomicInteger createdModels;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        AgentProperties.ProviderProperties openai = new AgentProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        chatModel = mock(ChatModel.class);
        backoffs = new ArrayList<>();
        createdModels = new AtomicInteger();
        adapter = new Langchain4jAdapter(properties) {
            @Override
            protected ChatModel createModel(String model, Double temperature, Integer maxTokens) {
                createdModels.incrementAndGet();
                return chatModel;
            }

            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                backoffs.add(backoffMs);
            }
        };
    }

    @Test
    void shouldReturnTextAndUsage() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("function setup() {}"))
                .tokenUsage(new TokenUsage(10, 5))
                .finishReason(FinishReason.STOP)
                .build());

        LlmResponse response = adapter.chat(request()).join();

        assertEquals("function setup() {}", response.getContent());
        assertEquals(MODEL, response.getModel());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertFalse(response.hasToolCalls());
    }

    @Test
    void shouldParseToolCallsWhenToolsAreOffered() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(ToolExecutionRequest.builder()
                        .id("call-1")
                        .name("generate_fix_code")
                        .arguments("{\"instruction\":\"add a cube\"}")
                        .build()))
                .build());
        LlmRequest request = request();
        request.setTools(List.of(ToolDefinition.builder()
                .name("generate_fix_code")
                .description("Generates code")
                .build()));

        LlmResponse response = adapter.chat(request).join();

        assertTrue(response.hasToolCalls());
        Message.ToolCall call = response.getToolCalls().get(0);
        assertEquals("call-1", call.getId());
        assertEquals("generate_fix_code", call.getName());
        assertEquals(Map.of("instruction", "add a cube"), call.getArguments());
    }

    @Test
    void shouldRetryRateLimitWithExponentialBackoff() {
        when(chatModel.chat(anyList()))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenThrow(new RuntimeException("rate_limit_exceeded"))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

        LlmResponse response = adapter.chat(request()).join();

        assertEquals("ok", response.getContent());
        assertEquals(List.of(5_000L, 10_000L), backoffs);
        verify(chatModel, times(3)).chat(anyList());
    }

    @Test
    void shouldWrapOtherFailures() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("Connection refused"));

        CompletionException error = assertThrows(CompletionException.class, () -> adapter.chat(request()).join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("Connection refused"));
        assertTrue(backoffs.isEmpty());
    }

    @Test
    void shouldReuseModelForSameSettings() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

        adapter.chat(request()).join();
        adapter.chat(request()).join();
        LlmRequest warmer = request();
        warmer.setTemperature(0.9);
        adapter.chat(warmer).join();

        assertEquals(2, createdModels.get());
    }

    @Test
    void shouldFailSynchronouslyForUnconfiguredProvider() {
        Langchain4jAdapter real = new Langchain4jAdapter(properties);
        LlmRequest request = request();
        request.setModel("anthropic/claude-sonnet-4");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> real.chat(request));
        assertTrue(error.getMessage().contains("agent.llm.providers.anthropic.api-key"));
    }

    @Test
    void shouldConvertConversation() {
        Message assistant = Message.builder()
                .role("assistant")
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id("call-1").name("analyze_screenshot").arguments(Map.of("userRequirement", "cube"))
                        .build()))
                .build();
        Message tool = Message.builder()
                .role("tool").toolCallId("call-1").toolName("analyze_screenshot").content("looks fine").build();
        Message user = Message.builder()
                .role("user")
                .content("Does this match?")
                .attachments(List.of(Attachment.fromImage("data:image/jpeg;base64,AAAA")))
                .build();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("You are a scene editor")
                .messages(List.of(user, assistant, tool))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        UserMessage userMessage = assertInstanceOf(UserMessage.class, messages.get(1));
        assertEquals(2, userMessage.contents().size());
        ImageContent image = assertInstanceOf(ImageContent.class, userMessage.contents().get(1));
        assertEquals("image/jpeg", image.image().mimeType());
        AiMessage aiMessage = assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("analyze_screenshot", aiMessage.toolExecutionRequests().get(0).name());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("looks fine", result.text());
    }

    @Test
    void shouldConvertToolSchema() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("generate_3d_model")
                .description("Generates a model")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "prompt", Map.of("type", "string", "description", "What to build"),
                                "quality", Map.of("type", "string", "enum", List.of("high", "low")),
                                "bboxCondition", Map.of("type", "array", "items", Map.of("type", "integer"))),
                        "required", List.of("prompt")))
                .build();
        LlmRequest request = LlmRequest.builder().tools(List.of(definition)).build();

        List<ToolSpecification> specs = adapter.convertTools(request);

        assertEquals(1, specs.size());
        assertEquals("generate_3d_model", specs.get(0).name());
        assertEquals(3, specs.get(0).parameters().properties().size());
        assertEquals(List.of("prompt"), specs.get(0).parameters().required());
    }

    @Test
    void shouldSplitProviderPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet-4"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4.1"));
        assertEquals("gpt-4.1", Langchain4jAdapter.stripProviderPrefix("openai/gpt-4.1"));
        assertEquals("gpt-4.1", Langchain4jAdapter.stripProviderPrefix("gpt-4.1"));
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.user("add a red cube")))
                .build();
    }
}
