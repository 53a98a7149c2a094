package me.golemcore.sceneagent.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.model.LlmRequest;
import me.golemcore.sceneagent.domain.model.LlmResponse;
import me.golemcore.sceneagent.domain.model.LlmUsage;
import me.golemcore.sceneagent.domain.model.Message;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link LlmPort} backed by langchain4j chat models.
 *
 * <p>
 * Models are addressed as {@code provider/model}, e.g. {@code openai/gpt-4.1}
 * or {@code anthropic/claude-sonnet-4-0}. A bare name means OpenAI. Anthropic
 * uses its native client; any other provider is assumed to speak the OpenAI
 * protocol at its configured {@code base-url}. Built models are kept per
 * (model, temperature, max tokens).
 *
 * <p>
 * Rate-limit errors are retried with exponential backoff; all other failures
 * complete the future exceptionally. An unconfigured provider throws
 * {@link IllegalStateException} before anything runs asynchronously.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String DEFAULT_PROVIDER = "openai";
    private static final List<String> RATE_LIMIT_MARKERS = List.of("rate_limit", "Too Many Requests", "429");
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final AgentProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(AgentProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
        ChatModel chatModel = resolveModel(model, request);
        return CompletableFuture.supplyAsync(() -> {
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);
            ChatResponse response = callWithBackoff(model, () -> tools.isEmpty()
                    ? chatModel.chat(messages)
                    : chatModel.chat(ChatRequest.builder().messages(messages).toolSpecifications(tools).build()));
            return toLlmResponse(response, model);
        });
    }

    private ChatResponse callWithBackoff(String model, Supplier<ChatResponse> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (RuntimeException e) { // NOSONAR
                if (attempt >= MAX_RETRIES || !isRateLimitError(e)) {
                    log.warn("[LLM] Chat with {} failed: {}", model, e.getMessage());
                    throw new IllegalArgumentException("LLM chat failed: " + e.getMessage(), e);
                }
                long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                attempt++;
                log.warn("[LLM] {} rate limited (attempt {}/{}), backing off {}ms", model, attempt, MAX_RETRIES,
                        backoffMs);
                sleepBeforeRetry(backoffMs);
            }
        }
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    // ===== Model construction =====

    private ChatModel resolveModel(String model, LlmRequest request) {
        AgentProperties.LlmProperties llm = properties.getLlm();
        Double temperature = request.getTemperature() != null ? request.getTemperature() : llm.getTemperature();
        Integer maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : llm.getMaxTokens();
        return models.computeIfAbsent(model + "|" + temperature + "|" + maxTokens,
                key -> createModel(model, temperature, maxTokens));
    }

    protected ChatModel createModel(String model, Double temperature, Integer maxTokens) {
        String provider = providerOf(model);
        AgentProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.debug("[LLM] Building {} client for {}", provider, modelName);

        // maxRetries(0): backoff is handled in callWithBackoff
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .baseUrl(config.getBaseUrl())
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .timeout(timeout)
                    .maxRetries(0)
                    .build();
        }
        return OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .baseUrl(config.getBaseUrl())
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }

    AgentProperties.ProviderProperties getProviderConfig(String providerName) {
        AgentProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerName);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add agent.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    static String providerOf(String model) {
        int slash = model != null ? model.indexOf('/') : -1;
        return slash > 0 ? model.substring(0, slash) : DEFAULT_PROVIDER;
    }

    static String stripProviderPrefix(String model) {
        int slash = model.indexOf('/');
        return slash >= 0 ? model.substring(slash + 1) : model;
    }

    private static boolean isRateLimitError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && RATE_LIMIT_MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
        }
        return false;
    }

    // ===== Request conversion =====

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message message : request.getMessages()) {
            String text = message.getContent() != null ? message.getContent() : "";
            switch (message.getRole()) {
            case "user" -> messages.add(toUserMessage(message));
            case "assistant" -> messages.add(message.hasToolCalls()
                    ? AiMessage.from(toExecutionRequests(message.getToolCalls()))
                    : AiMessage.from(text));
            case "tool" -> messages.add(ToolExecutionResultMessage.from(message.getToolCallId(),
                    message.getToolName(), text));
            case "system" -> messages.add(SystemMessage.from(text));
            default -> log.warn("[LLM] Skipping message with unknown role '{}'", message.getRole());
            }
        }
        return messages;
    }

    private UserMessage toUserMessage(Message message) {
        if (!message.hasAttachments()) {
            return UserMessage.from(message.getContent());
        }
        List<Content> contents = new ArrayList<>();
        if (message.getContent() != null && !message.getContent().isBlank()) {
            contents.add(TextContent.from(message.getContent()));
        }
        message.getAttachments().forEach(image -> contents.add(
                ImageContent.from(image.getDataBase64(), image.getMimeType())));
        return UserMessage.from(contents);
    }

    private List<ToolExecutionRequest> toExecutionRequests(List<Message.ToolCall> calls) {
        return calls.stream()
                .map(call -> ToolExecutionRequest.builder()
                        .id(call.getId())
                        .name(call.getName())
                        .arguments(writeArguments(call.getArguments()))
                        .build())
                .toList();
    }

    List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null) {
            return List.of();
        }
        List<ToolSpecification> specifications = new ArrayList<>(request.getTools().size());
        for (ToolDefinition tool : request.getTools()) {
            ToolSpecification.Builder builder = ToolSpecification.builder()
                    .name(tool.getName())
                    .description(tool.getDescription());
            if (tool.getInputSchema() != null && tool.getInputSchema().get("properties") instanceof Map<?, ?>) {
                builder.parameters(objectSchema(tool.getInputSchema()));
            }
            specifications.add(builder.build());
        }
        return specifications;
    }

    /**
     * Maps a JSON-schema object node ({@code properties}, {@code required},
     * {@code description}) onto langchain4j's schema model.
     */
    private JsonObjectSchema objectSchema(Map<?, ?> node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(text(node.get("description")));
        if (node.get("properties") instanceof Map<?, ?> children) {
            children.forEach((name, child) -> {
                if (child instanceof Map<?, ?> childNode) {
                    builder.addProperty(String.valueOf(name), schemaElement(childNode));
                }
            });
        }
        if (node.get("required") instanceof List<?> required && !required.isEmpty()) {
            builder.required(required.stream().map(String::valueOf).toList());
        }
        return builder.build();
    }

    private JsonSchemaElement schemaElement(Map<?, ?> node) {
        String description = text(node.get("description"));
        if (node.get("enum") instanceof List<?> values && !values.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(values.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }
        String type = node.get("type") instanceof String value ? value : "string";
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "object" -> objectSchema(node);
        case "array" -> {
            JsonArraySchema.Builder array = JsonArraySchema.builder().description(description);
            if (node.get("items") instanceof Map<?, ?> items) {
                array.items(schemaElement(items));
            }
            yield array.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private static String text(Object value) {
        return value instanceof String string && !string.isBlank() ? string : null;
    }

    // ===== Response conversion =====

    private LlmResponse toLlmResponse(ChatResponse response, String model) {
        AiMessage reply = response.aiMessage();
        List<Message.ToolCall> toolCalls = null;
        if (reply.hasToolExecutionRequests()) {
            toolCalls = reply.toolExecutionRequests().stream()
                    .map(request -> Message.ToolCall.builder()
                            .id(request.id())
                            .name(request.name())
                            .arguments(readArguments(request.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] {} requested {} tool calls", model, toolCalls.size());
        }

        TokenUsage tokens = response.tokenUsage();
        LlmUsage usage = tokens == null ? null
                : LlmUsage.builder()
                        .inputTokens(count(tokens.inputTokenCount()))
                        .outputTokens(count(tokens.outputTokenCount()))
                        .totalTokens(count(tokens.totalTokenCount()))
                        .build();

        return LlmResponse.builder()
                .content(reply.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int count(Integer tokens) {
        return tokens != null ? tokens : 0;
    }

    private String writeArguments(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Tool arguments not serializable: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private Map<String, Object> readArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Tool arguments are not a JSON object: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
