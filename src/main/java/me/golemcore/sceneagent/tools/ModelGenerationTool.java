package me.golemcore.sceneagent.tools;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.ModelAsset;
import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;
import me.golemcore.sceneagent.domain.model.ModelGenerationResult;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.CodeNormalizer;
import me.golemcore.sceneagent.domain.service.ModelGenerationService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Generates a 3D model through {@link ModelGenerationService}.
 *
 * <p>
 * Arguments are either structured ({@code prompt}, {@code imageUrls},
 * {@code meshMode}, {@code quality}, {@code material}, {@code useHyper}) or a
 * single {@code input} string holding JSON or a bare prompt. Missing options
 * default to {@code Quad}/{@code low}/{@code pbr}. Missing provider
 * configuration propagates as {@link IllegalStateException}; every other
 * failure is a recoverable tool result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelGenerationTool implements ToolComponent {

    static final String NEXT_STEP = "generate_code_with_model_url";

    private static final String PARAM_INPUT = "input";
    private static final String PARAM_PROMPT = "prompt";
    private static final String PARAM_IMAGE_URLS = "imageUrls";
    private static final String PARAM_MESH_MODE = "meshMode";
    private static final String PARAM_QUALITY = "quality";
    private static final String PARAM_MATERIAL = "material";
    private static final String PARAM_USE_HYPER = "useHyper";
    private static final String DEFAULT_MESH_MODE = "Quad";
    private static final String DEFAULT_QUALITY = "low";
    private static final String DEFAULT_MATERIAL = "pbr";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private final ModelGenerationService modelGenerationService;
    private final ObjectMapper objectMapper;

    @Override
    public ToolKind getKind() {
        return ToolKind.GENERATE_3D_MODEL;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Generate a 3D model from a text prompt or reference images. Returns a validated "
                        + "model URL to reference in the scene code.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_PROMPT, Map.of(TYPE, "string",
                                        DESCRIPTION, "Description of the model to generate"),
                                PARAM_IMAGE_URLS, Map.of(TYPE, "array",
                                        DESCRIPTION, "Reference image URLs",
                                        "items", Map.of(TYPE, "string")),
                                PARAM_MESH_MODE, Map.of(TYPE, "string",
                                        "enum", List.of("Raw", "Quad", "Ultra")),
                                PARAM_QUALITY, Map.of(TYPE, "string",
                                        "enum", List.of("high", "medium", "low", "extra-low")),
                                PARAM_MATERIAL, Map.of(TYPE, "string",
                                        "enum", List.of("pbr", "shaded")))))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ModelGenerationOptions options;
        try {
            options = parseOptions(parameters);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, e.getMessage()));
        }
        if (!options.hasInput()) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                    "Either prompt or imageUrls is required"));
        }

        log.info("[ModelGen] Tool invoked, prompt {} chars, {} images",
                options.getPrompt() != null ? options.getPrompt().length() : 0,
                options.getImageUrls() != null ? options.getImageUrls().size() : 0);
        return modelGenerationService.generate(options).thenApply(this::toToolResult);
    }

    ModelGenerationOptions parseOptions(Map<String, Object> parameters) {
        Object input = parameters.get(PARAM_INPUT);
        if (input instanceof String text && !text.isBlank()) {
            return parseInput(text);
        }
        return ModelGenerationOptions.builder()
                .prompt(stringOr(parameters.get(PARAM_PROMPT), null))
                .imageUrls(stringList(parameters.get(PARAM_IMAGE_URLS)))
                .meshMode(stringOr(parameters.get(PARAM_MESH_MODE), DEFAULT_MESH_MODE))
                .quality(stringOr(parameters.get(PARAM_QUALITY), DEFAULT_QUALITY))
                .material(stringOr(parameters.get(PARAM_MATERIAL), DEFAULT_MATERIAL))
                .useHyper(Boolean.TRUE.equals(parameters.get(PARAM_USE_HYPER)))
                .build();
    }

    private ModelGenerationOptions parseInput(String input) {
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                List<String> imageUrls = new ArrayList<>();
                node.path(PARAM_IMAGE_URLS).forEach(url -> imageUrls.add(url.asText()));
                return ModelGenerationOptions.builder()
                        .prompt(node.hasNonNull(PARAM_PROMPT) ? node.get(PARAM_PROMPT).asText() : null)
                        .imageUrls(imageUrls.isEmpty() ? null : imageUrls)
                        .meshMode(node.path(PARAM_MESH_MODE).asText(DEFAULT_MESH_MODE))
                        .quality(node.path(PARAM_QUALITY).asText(DEFAULT_QUALITY))
                        .material(node.path(PARAM_MATERIAL).asText(DEFAULT_MATERIAL))
                        .useHyper(node.path(PARAM_USE_HYPER).asBoolean(false))
                        .build();
            } catch (JsonProcessingException e) {
                log.debug("[ModelGen] Input is not JSON, using it as the prompt");
            }
        }
        return ModelGenerationOptions.builder()
                .prompt(trimmed)
                .meshMode(DEFAULT_MESH_MODE)
                .quality(DEFAULT_QUALITY)
                .material(DEFAULT_MATERIAL)
                .useHyper(false)
                .build();
    }

    private ToolResult toToolResult(ModelGenerationResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", result.isSuccess());
        data.put("requestId", result.getRequestId());
        if (!result.isSuccess()) {
            data.put("recoverable", result.isRecoverable());
            data.put("message", result.getMessage());
            return ToolResult.failure(result.getError(), data);
        }

        List<Map<String, String>> assets = new ArrayList<>();
        for (ModelAsset asset : result.getModelUrls()) {
            assets.add(Map.of("name", String.valueOf(asset.getName()), "url", String.valueOf(asset.getUrl())));
        }
        data.put("modelUrl", result.getModelUrl());
        data.put("modelUrls", assets);
        data.put("message", "3D model generated successfully. Now generate code that uses this model URL.");
        data.put("modelComment", CodeNormalizer.markerComment(result.getModelUrl()));
        data.put("nextStep", NEXT_STEP);
        return ToolResult.success("3D model generated: " + result.getModelUrl(), data);
    }

    private static String stringOr(Object value, String fallback) {
        return value instanceof String s && !s.isBlank() ? s : fallback;
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
