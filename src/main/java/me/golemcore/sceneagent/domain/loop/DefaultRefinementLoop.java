package me.golemcore.sceneagent.domain.loop;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.AssetUrls;
import me.golemcore.sceneagent.domain.model.LlmRequest;
import me.golemcore.sceneagent.domain.model.LlmResponse;
import me.golemcore.sceneagent.domain.model.Message;
import me.golemcore.sceneagent.domain.model.ModelHistoryEntry;
import me.golemcore.sceneagent.domain.model.RefinementRequest;
import me.golemcore.sceneagent.domain.model.RefinementResult;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.domain.model.ScreenshotAnalysis;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.CodeNormalizer;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Refinement loop driven by a planning model.
 *
 * <p>
 * Turn order:
 * <ol>
 * <li>Visual analysis, when a screenshot is supplied with a finished render or
 * explicitly requested.</li>
 * <li>Asset generation, when the instruction asks for a model and no model
 * generated for the same prompt can be reused. The URL is recorded in memory
 * before any code is generated.</li>
 * <li>Planner iterations: the model picks tools until it answers without tool
 * calls or a budget runs out. Every successful code fix is applied through the
 * patch tool right away.</li>
 * <li>If the planner failed or produced no code, one direct code-fix call with
 * the original instruction.</li>
 * <li>Asset URL marker embedding and best-effort persistence.</li>
 * </ol>
 * Tool failures never end the turn. Only configuration failures
 * ({@link IllegalStateException}) propagate.
 */
public class DefaultRefinementLoop implements RefinementLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultRefinementLoop.class);

    private static final String PARAM_INSTRUCTION = "instruction";
    private static final String PARAM_IMPROVED_CODE = "improvedCode";
    private static final String STOP_COMPLETED = "completed";
    private static final int LOG_PREVIEW = 80;

    private final LlmPort llmPort;
    private final RefinementRuntime runtime;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultRefinementLoop(LlmPort llmPort, RefinementRuntime runtime, ObjectMapper objectMapper,
            Clock clock) {
        this.llmPort = llmPort;
        this.runtime = runtime;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public RefinementResult refine(RefinementRequest request) {
        if (request == null || request.getInstruction() == null || request.getInstruction().isBlank()) {
            throw new IllegalArgumentException("instruction is required");
        }
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : ToolComponent.DEFAULT_SESSION_ID;
        String originalCode = request.getCurrentCode() != null ? request.getCurrentCode() : "";
        TurnState state = new TurnState(sessionId, request.getInstruction(), originalCode);
        state.setSuggestion(request.getSuggestion());

        long startMs = clock.millis();
        log.info("[Loop] Turn started for session {}: {}", sessionId, preview(request.getInstruction()));

        analyzeScreenshot(request, state);
        generateModelIfRequired(request, state);

        try {
            runPlanner(request, state);
        } catch (IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) { // NOSONAR
            Throwable cause = unwrap(e);
            if (cause instanceof IllegalStateException configurationFailure) {
                throw configurationFailure;
            }
            log.warn("[Loop] Planner failed, falling back to direct code fix: {}", cause.getMessage());
            state.note("Planner failed: " + cause.getMessage());
            state.setFallbackUsed(true);
            state.setStopReason("planner error");
        }

        if (!state.isCodeProduced() && (state.isFallbackUsed() || STOP_COMPLETED.equals(state.getStopReason()))) {
            directCodeFix(request, state);
        }

        RefinementResult result = finish(request, state);
        log.info("[Loop] Turn finished for session {} in {}ms: {} iterations, {} tool executions, stop: {}",
                sessionId, clock.millis() - startMs, result.getIterations(), result.getToolExecutions(),
                result.getStopReason());
        return result;
    }

    // ===== Visual analysis =====

    private void analyzeScreenshot(RefinementRequest request, TurnState state) {
        boolean supplied = request.hasScreenshot() && request.isRenderingComplete();
        if (!supplied && !request.isRequestScreenshot()) {
            return;
        }
        Map<String, Object> args = new HashMap<>();
        args.put("userRequirement", request.getInstruction());
        if (supplied) {
            args.put("screenshotBase64", request.getScreenshot());
        }
        if (request.getClientId() != null) {
            args.put("clientId", request.getClientId());
        }
        ToolResult result = executeTool(ToolKind.ANALYZE_SCREENSHOT.getToolName(), args, state);
        fold(ToolKind.ANALYZE_SCREENSHOT, result, state);
    }

    // ===== Asset generation =====

    private void generateModelIfRequired(RefinementRequest request, TurnState state) {
        if (!request.isModelRequired() && !mentionsModel(request.getInstruction())) {
            return;
        }
        Optional<ModelHistoryEntry> reusable = findReusableModel(state);
        if (reusable.isPresent()) {
            log.info("[Loop] Reusing model generated earlier for the same prompt");
            state.setModelUrl(reusable.get().getModelUrl());
            state.note("Reused previously generated model");
            return;
        }
        Map<String, Object> args = new HashMap<>();
        args.put("prompt", request.getInstruction());
        ToolResult result = executeTool(ToolKind.GENERATE_3D_MODEL.getToolName(), args, state);
        fold(ToolKind.GENERATE_3D_MODEL, result, state);
    }

    boolean mentionsModel(String instruction) {
        String lower = instruction.toLowerCase(Locale.ROOT);
        return runtime.properties().getLoop().getModelKeywords().stream()
                .anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    private Optional<ModelHistoryEntry> findReusableModel(TurnState state) {
        List<ModelHistoryEntry> history = runtime.memory().loadModelHistory(state.getSessionId());
        for (int i = history.size() - 1; i >= 0; i--) {
            ModelHistoryEntry entry = history.get(i);
            if (entry.getPrompt() != null && entry.getPrompt().trim().equalsIgnoreCase(state.getInstruction().trim())
                    && entry.getModelUrl() != null) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    // ===== Planner =====

    private void runPlanner(RefinementRequest request, TurnState state) {
        AgentProperties.LoopProperties settings = runtime.properties().getLoop();
        int maxIterations = request.getMaxIterations() != null && request.getMaxIterations() > 0
                ? request.getMaxIterations()
                : settings.getMaxIterations();
        int maxToolExecutions = settings.getMaxToolExecutions();

        String sessionId = state.getSessionId();
        List<ModelHistoryEntry> modelHistory = runtime.memory().loadModelHistory(sessionId);
        List<SceneObjectRecord> sceneState = request.hasSceneObjects()
                ? request.getSceneObjects()
                : runtime.memory().loadLatestSceneObjects(sessionId);
        String systemPrompt = runtime.prompts().systemPrompt(request.getLintDiagnostics(),
                runtime.memory().formatHistoryForPrompt(sessionId), modelHistory, sceneState,
                runtime.memory().formatSceneHistoryForPrompt(sessionId));
        state.getConversation().add(Message.user(runtime.prompts().userPrompt(state.getInstruction(), modelHistory,
                sceneState, plannerSuggestion(state), state.getOriginalCode())));

        while (state.getIterations() < maxIterations && state.getToolExecutions() < maxToolExecutions) {
            LlmResponse response = llmPort.chat(LlmRequest.builder()
                    .model(runtime.properties().getLlm().getModel())
                    .systemPrompt(systemPrompt)
                    .messages(new ArrayList<>(state.getConversation()))
                    .tools(runtime.registry().definitions())
                    .sessionId(sessionId)
                    .build()).join();
            state.countIteration();

            if (response == null || !response.hasToolCalls()) {
                acceptFinalAnswer(response, state);
                state.setStopReason(STOP_COMPLETED);
                return;
            }

            state.getConversation().add(Message.builder()
                    .role("assistant")
                    .content(response.getContent())
                    .toolCalls(response.getToolCalls())
                    .timestamp(clock.instant())
                    .build());

            for (Message.ToolCall call : response.getToolCalls()) {
                ToolResult result = executeTool(call.getName(), withDefaults(call, request), state);
                ToolKind.fromToolName(call.getName()).ifPresent(kind -> fold(kind, result, state));
                state.getConversation().add(Message.builder()
                        .role("tool")
                        .toolCallId(call.getId())
                        .toolName(call.getName())
                        .content(describe(result))
                        .timestamp(clock.instant())
                        .build());
            }
        }

        state.setStopReason(buildStopReason(state, maxIterations, maxToolExecutions));
        log.info("[Loop] Budget exhausted: {}", state.getStopReason());
    }

    private String plannerSuggestion(TurnState state) {
        StringBuilder suggestion = new StringBuilder();
        if (state.getSuggestion() != null && !state.getSuggestion().isBlank()) {
            suggestion.append("Screenshot analysis:\n").append(state.getSuggestion());
        }
        if (state.getModelUrl() != null) {
            if (!suggestion.isEmpty()) {
                suggestion.append("\n\n");
            }
            suggestion.append("A 3D model was generated for this request. Use it and keep the comment ")
                    .append(CodeNormalizer.markerComment(state.getModelUrl()));
        }
        return suggestion.toString();
    }

    private void acceptFinalAnswer(LlmResponse response, TurnState state) {
        if (state.isCodeProduced() || response == null || response.getContent() == null) {
            return;
        }
        String content = response.getContent();
        if (content.contains("function setup")) {
            log.debug("[Loop] Planner answered with code directly");
            applyCode(CodeNormalizer.cleanCode(content), state);
        }
    }

    private Map<String, Object> withDefaults(Message.ToolCall call, RefinementRequest request) {
        Map<String, Object> args = new HashMap<>(call.getArguments() != null ? call.getArguments() : Map.of());
        if (ToolKind.ANALYZE_SCREENSHOT.getToolName().equals(call.getName())) {
            if (!args.containsKey("screenshotBase64") && request.hasScreenshot()) {
                args.put("screenshotBase64", request.getScreenshot());
            }
            if (!args.containsKey("clientId") && request.getClientId() != null) {
                args.put("clientId", request.getClientId());
            }
        }
        return args;
    }

    private String buildStopReason(TurnState state, int maxIterations, int maxToolExecutions) {
        if (state.getIterations() >= maxIterations) {
            return "reached max iterations (" + maxIterations + ")";
        }
        if (state.getToolExecutions() >= maxToolExecutions) {
            return "reached max tool executions (" + maxToolExecutions + ")";
        }
        return "stopped by guard";
    }

    // ===== Tool execution =====

    private ToolResult executeTool(String name, Map<String, Object> arguments, TurnState state) {
        Map<String, Object> args = new HashMap<>(arguments);
        args.put(ToolComponent.SESSION_ID_PARAM, state.getSessionId());
        state.countToolExecution();
        try {
            ToolResult result = runtime.registry().execute(name, args).join();
            if (result == null) {
                return ToolResult.failure("Tool returned no result");
            }
            return result;
        } catch (IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) { // NOSONAR
            Throwable cause = unwrap(e);
            if (cause instanceof IllegalStateException configurationFailure) {
                throw configurationFailure;
            }
            log.warn("[Loop] Tool '{}' failed: {}", name, cause.getMessage());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + cause.getMessage());
        }
    }

    /**
     * Folds a tool result into the turn state and session memory.
     */
    private void fold(ToolKind kind, ToolResult result, TurnState state) {
        if (!result.isSuccess()) {
            state.note(kind.getToolName() + ": " + result.getError());
            if (kind == ToolKind.ANALYZE_SCREENSHOT && result.getData() instanceof ScreenshotAnalysis analysis) {
                log.debug("[Loop] Screenshot analysis failed ({})", analysis.getErrorType());
            }
            return;
        }
        switch (kind) {
        case ANALYZE_SCREENSHOT -> {
            if (result.getData() instanceof ScreenshotAnalysis analysis) {
                state.setSuggestion(analysis.getAnalysis());
            }
        }
        case GENERATE_3D_MODEL -> dataValue(result, "modelUrl").ifPresent(url -> {
            state.setModelUrl(url);
            runtime.memory().recordModelGenerated(state.getSessionId(), url, state.getInstruction());
        });
        case GENERATE_FIX_CODE -> dataValue(result, "code").ifPresent(code -> applyCode(code, state));
        case APPLY_PATCH -> dataValue(result, "updatedCode").ifPresent(state::acceptCode);
        default -> log.trace("[Loop] No state change for {}", kind);
        }
    }

    /**
     * Applies freshly generated code through the patch tool. A failed apply
     * still accepts the code as a full replacement.
     */
    private void applyCode(String code, TurnState state) {
        ToolResult applied = executeTool(ToolKind.APPLY_PATCH.getToolName(), Map.of(PARAM_IMPROVED_CODE, code),
                state);
        if (applied.isSuccess()) {
            state.acceptCode(dataValue(applied, "updatedCode").orElse(code));
        } else {
            state.note(ToolKind.APPLY_PATCH.getToolName() + ": " + applied.getError());
            state.acceptCode(code);
        }
    }

    private void directCodeFix(RefinementRequest request, TurnState state) {
        String instruction = runtime.prompts().codeFixInstruction(state.getInstruction(), state.getOriginalCode(),
                state.getSuggestion(), request.getLintDiagnostics(), state.getModelUrl());
        log.info("[Loop] Direct code fix for session {}", state.getSessionId());
        ToolResult result = executeTool(ToolKind.GENERATE_FIX_CODE.getToolName(),
                Map.of(PARAM_INSTRUCTION, instruction), state);
        fold(ToolKind.GENERATE_FIX_CODE, result, state);
        if (!result.isSuccess()) {
            state.setFallbackUsed(true);
        }
    }

    // ===== Finish =====

    private RefinementResult finish(RefinementRequest request, TurnState state) {
        String code = state.getModelUrl() != null
                ? CodeNormalizer.embedAssetUrl(state.getCode(), state.getModelUrl())
                : CodeNormalizer.cleanCode(state.getCode());
        if (!state.isCodeProduced()) {
            state.note("No new code produced; returning the previous code");
        } else if (!code.equals(state.getCode())) {
            runtime.codeBase().put(state.getSessionId(), code);
        }

        persist(request, state, code);

        AssetUrls assetUrls = CodeNormalizer.extractAssetUrls(code);
        String primary = state.getModelUrl() != null ? state.getModelUrl() : assetUrls.primaryUrl();
        return RefinementResult.builder()
                .code(code)
                .assetUrls(new ArrayList<>(assetUrls.urls()))
                .primaryAssetUrl(primary)
                .suggestion(state.getSuggestion())
                .iterations(state.getIterations())
                .toolExecutions(state.getToolExecutions())
                .stopReason(state.getStopReason())
                .fallbackUsed(state.isFallbackUsed())
                .diagnostics(new ArrayList<>(state.getDiagnostics()))
                .build();
    }

    private void persist(RefinementRequest request, TurnState state, String code) {
        String sessionId = state.getSessionId();
        if (state.isCodeProduced()) {
            runtime.memory().recordCodeState(sessionId, state.getInstruction(), code);
        }
        if (!request.hasSceneObjects()) {
            return;
        }
        runtime.memory().recordSceneSnapshot(sessionId, state.getInstruction(), request.getSceneObjects());
        try {
            boolean stored = runtime.objectStore().store(request.getSceneObjects(), state.getInstruction()).join();
            if (stored) {
                runtime.registry().invalidateCache(ToolKind.RETRIEVE_OBJECTS.getToolName());
            } else {
                state.note("Scene objects were not persisted");
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Loop] Persisting scene objects failed: {}", unwrap(e).getMessage());
            state.note("Scene objects were not persisted");
        }
    }

    // ===== Helpers =====

    private String describe(ToolResult result) {
        if (!result.isSuccess()) {
            return "Error: " + result.getError();
        }
        if (result.getData() == null) {
            return result.getOutput();
        }
        try {
            return result.getOutput() + "\n" + objectMapper.writeValueAsString(result.getData());
        } catch (JsonProcessingException e) {
            log.debug("[Loop] Tool data not serializable: {}", e.getMessage());
            return result.getOutput();
        }
    }

    private static Optional<String> dataValue(ToolResult result, String key) {
        if (result.getData() instanceof Map<?, ?> data && data.get(key) instanceof String value && !value.isBlank()) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String preview(String text) {
        return text.length() > LOG_PREVIEW ? text.substring(0, LOG_PREVIEW) + "..." : text;
    }
}
