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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.LlmRequest;
import me.golemcore.sceneagent.domain.model.Message;
import me.golemcore.sceneagent.domain.model.ModelHistoryEntry;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.CodeBaseStore;
import me.golemcore.sceneagent.domain.service.CodeNormalizer;
import me.golemcore.sceneagent.domain.service.SessionMemoryService;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Generates or fixes the scene script with the code model.
 *
 * <p>
 * The response is normalized into a {@code setup} function. Model URLs that
 * the previous version of the script referenced, and that are part of the
 * session's model history, are re-embedded through the marker comment when
 * the new version drops them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CodeFixTool implements ToolComponent {

    static final String PARAM_INSTRUCTION = "instruction";

    private static final String RULES = """
            Requirements:
            1. Return directly executable JavaScript that uses the Three.js library.
            2. Use the function setup(scene, camera, renderer, THREE, OrbitControls) { ... } format.
            3. Create interaction controls only through OrbitControls.create(camera, renderer.domElement); never call new OrbitControls().
            4. Keep the setup function structure unchanged and end with return scene.
            5. Do not place several models at the same spot. Scale generated models from their bounding box so they do not overlap and sit plausibly next to the surrounding objects.
            6. Only use model URLs returned by generate_3d_model and keep every URL valid.
            7. Do not redeclare variable names; give separate materials distinct names.
            8. When asked to delete an object, identify it by type, color or position and remove it from its parent with parent.remove(object).

            Answer with the setup function code only: no explanation, no markdown fences, no prefix or suffix.""";

    private final LlmPort llmPort;
    private final SessionMemoryService memoryService;
    private final CodeBaseStore codeBaseStore;
    private final AgentProperties properties;

    @Override
    public ToolKind getKind() {
        return ToolKind.GENERATE_FIX_CODE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Generate or fix Three.js code for the user's request. Returns the complete setup "
                        + "function.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_INSTRUCTION, Map.of(
                                        "type", "string",
                                        "description", "Feature to implement or problem to fix")),
                        "required", List.of(PARAM_INSTRUCTION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object instructionValue = parameters.get(PARAM_INSTRUCTION);
        if (!(instructionValue instanceof String instruction) || instruction.isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "instruction is required"));
        }
        String sessionId = parameters.get(SESSION_ID_PARAM) instanceof String s ? s : DEFAULT_SESSION_ID;
        List<ModelHistoryEntry> modelHistory = memoryService.loadModelHistory(sessionId);
        log.debug("[CodeFix] Instruction for session {}: {} chars, {} known models",
                sessionId, instruction.length(), modelHistory.size());

        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getCodeModel())
                .temperature(properties.getLlm().getTemperature())
                .sessionId(sessionId)
                .messages(List.of(Message.user(buildPrompt(instruction, modelHistory))))
                .build();

        long start = System.currentTimeMillis();
        return llmPort.chat(request)
                .thenApply(response -> {
                    String code = CodeNormalizer.cleanCode(response.getContent());
                    code = preserveModelUrls(sessionId, code, modelHistory);
                    log.info("[CodeFix] Generated {} chars in {}ms", code.length(),
                            System.currentTimeMillis() - start);
                    return ToolResult.success("Generated setup code (" + code.length() + " chars)",
                            Map.of("code", code));
                })
                .exceptionally(e -> {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("[CodeFix] Code generation failed: {}", cause.getMessage());
                    return ToolResult.failure("Code generation failed: " + cause.getMessage());
                });
    }

    static String buildPrompt(String instruction, List<ModelHistoryEntry> modelHistory) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("As a Three.js expert, generate or fix code for the following instruction:\n\n")
                .append(instruction)
                .append("\n\n");
        if (!modelHistory.isEmpty()) {
            prompt.append("# Available 3D models\n")
                    .append("These models were already generated. Reference their URLs directly to keep the scene ")
                    .append("consistent:\n");
            for (int i = 0; i < modelHistory.size(); i++) {
                prompt.append("- Model ").append(i + 1).append(": ").append(modelHistory.get(i).getModelUrl())
                        .append('\n');
            }
            prompt.append("Make sure the code includes these models.\n\n");
        }
        prompt.append(RULES);
        return prompt.toString();
    }

    private String preserveModelUrls(String sessionId, String code, List<ModelHistoryEntry> modelHistory) {
        String previous = codeBaseStore.get(sessionId).orElse("");
        String result = code;
        for (ModelHistoryEntry entry : modelHistory) {
            String url = entry.getModelUrl();
            if (url != null && !result.contains(url) && previous.contains(url)) {
                log.debug("[CodeFix] Re-embedding dropped model URL");
                result = CodeNormalizer.embedAssetUrl(result, url);
            }
        }
        return result;
    }
}
