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
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.github.difflib.patch.PatchFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.CodeBaseStore;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Applies a code update against the session's cached code base.
 *
 * <p>
 * Accepted input shapes:
 * <ul>
 * <li>{@code code}: a full code version, which replaces the base
 * <li>{@code patch}: a unified diff against the base
 * <li>{@code input}: raw code, a raw diff, or a JSON string wrapping either
 * ({@code {"code": ...}}, nested {@code {"input": "{...}"}})
 * <li>{@code originalCode} + {@code improvedCode}: a full replacement on first
 * use, a generated unified diff once a base exists
 * </ul>
 * The first call for a session must carry full code; diffs without a base are
 * rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApplyPatchTool implements ToolComponent {

    private static final String PARAM_CODE = "code";
    private static final String PARAM_PATCH = "patch";
    private static final String PARAM_INPUT = "input";
    private static final String PARAM_ORIGINAL = "originalCode";
    private static final String PARAM_IMPROVED = "improvedCode";
    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";

    static final String MODE_FULL = "full";
    static final String MODE_PATCH = "patch";

    private final CodeBaseStore codeBaseStore;
    private final ObjectMapper objectMapper;

    @Override
    public ToolKind getKind() {
        return ToolKind.APPLY_PATCH;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Apply code to the server-side code base. Submit the full code first; after that "
                        + "a unified diff is enough for incremental updates.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_CODE, Map.of(TYPE, TYPE_STRING,
                                        "description", "Full setup function code"),
                                PARAM_PATCH, Map.of(TYPE, TYPE_STRING,
                                        "description", "Unified diff against the cached code"),
                                PARAM_INPUT, Map.of(TYPE, TYPE_STRING,
                                        "description", "Code, diff text, or a JSON object with a code property"))))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String sessionId = stringParam(parameters, SESSION_ID_PARAM).orElse(DEFAULT_SESSION_ID);
            try {
                return apply(sessionId, parameters);
            } catch (Exception e) { // NOSONAR
                log.warn("[Patch] Processing failed for session {}: {}", sessionId, e.getMessage());
                return ToolResult.failure("Processing failed: " + e.getMessage());
            }
        });
    }

    private ToolResult apply(String sessionId, Map<String, Object> parameters) {
        Optional<String> improved = stringParam(parameters, PARAM_IMPROVED);
        if (improved.isPresent()) {
            return applyImproved(sessionId, improved.get(), stringParam(parameters, PARAM_ORIGINAL));
        }

        String content = stringParam(parameters, PARAM_PATCH)
                .or(() -> stringParam(parameters, PARAM_CODE))
                .or(() -> stringParam(parameters, PARAM_INPUT).map(this::unwrapInput))
                .orElse(null);
        if (content == null || content.isBlank()) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                    "No code or patch supplied. Provide code, patch or input");
        }

        log.debug("[Patch] Received {} chars for session {}", content.length(), sessionId);
        if (looksLikePatch(content)) {
            return applyPatch(sessionId, content);
        }
        return replace(sessionId, content);
    }

    private ToolResult applyImproved(String sessionId, String improvedCode, Optional<String> originalCode) {
        Optional<String> base = codeBaseStore.get(sessionId).or(() -> originalCode);
        if (base.isEmpty()) {
            return replace(sessionId, improvedCode);
        }
        String patch = diff(base.get(), improvedCode);
        if (patch.isEmpty()) {
            codeBaseStore.put(sessionId, improvedCode);
            return updated(improvedCode, MODE_PATCH, "No changes against the cached code", patch);
        }
        codeBaseStore.put(sessionId, base.get());
        return applyPatch(sessionId, patch);
    }

    private ToolResult applyPatch(String sessionId, String patchText) {
        Optional<String> base = codeBaseStore.get(sessionId);
        if (base.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                    "No cached base code. Submit the full code first to initialize");
        }
        try {
            Patch<String> patch = UnifiedDiffUtils.parseUnifiedDiff(patchText.lines().toList());
            List<String> result = patch.applyTo(toLines(base.get()));
            String updatedCode = String.join("\n", result);
            codeBaseStore.put(sessionId, updatedCode);
            log.info("[Patch] Applied {} deltas for session {} ({} chars)",
                    patch.getDeltas().size(), sessionId, updatedCode.length());
            return updated(updatedCode, MODE_PATCH, "Patch applied", patchText);
        } catch (PatchFailedException e) {
            log.warn("[Patch] Patch rejected for session {}: {}", sessionId, e.getMessage());
            return ToolResult.failure("Patch does not match current code: " + e.getMessage());
        }
    }

    private ToolResult replace(String sessionId, String code) {
        codeBaseStore.put(sessionId, code);
        return updated(code, MODE_FULL, "Code cached; ready for incremental patches", null);
    }

    private ToolResult updated(String code, String mode, String message, String patch) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("updatedCode", code);
        data.put("codeLength", code.length());
        data.put("mode", mode);
        if (patch != null) {
            data.put(PARAM_PATCH, patch);
        }
        return ToolResult.success(message + " (" + code.length() + " chars)", data);
    }

    String unwrapInput(String input) {
        String trimmed = input.trim();
        if (!trimmed.startsWith("{")) {
            return input;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node.hasNonNull(PARAM_CODE)) {
                return node.get(PARAM_CODE).asText();
            }
            if (node.hasNonNull(PARAM_PATCH)) {
                return node.get(PARAM_PATCH).asText();
            }
            if (node.hasNonNull(PARAM_INPUT) && node.get(PARAM_INPUT).isTextual()) {
                return unwrapInput(node.get(PARAM_INPUT).asText());
            }
            return input;
        } catch (JsonProcessingException e) {
            // Not JSON: raw code or diff
            return input;
        }
    }

    static boolean looksLikePatch(String content) {
        return content.contains("---") && content.contains("+++") && content.contains("@@");
    }

    static String diff(String oldCode, String newCode) {
        List<String> oldLines = toLines(oldCode);
        Patch<String> patch = DiffUtils.diff(oldLines, toLines(newCode));
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        return String.join("\n", UnifiedDiffUtils.generateUnifiedDiff("scene.js", "scene.js", oldLines, patch, 3));
    }

    private static List<String> toLines(String content) {
        return Arrays.asList(content.split("\\R", -1));
    }

    private static Optional<String> stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value instanceof String s && !s.isEmpty() ? Optional.of(s) : Optional.empty();
    }
}
