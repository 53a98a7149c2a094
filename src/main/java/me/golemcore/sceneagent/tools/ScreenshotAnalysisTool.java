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
import me.golemcore.sceneagent.domain.model.ScreenshotAnalysis;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.ScreenshotAnalyzer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Analyzes the rendered scene against the user's requirement. Without a
 * usable screenshot argument the tool requests one from the connected client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScreenshotAnalysisTool implements ToolComponent {

    static final String PARAM_REQUIREMENT = "userRequirement";
    static final String PARAM_SCREENSHOT = "screenshotBase64";
    static final String PARAM_FORCE_REQUEST = "forceRequest";
    static final String PARAM_CLIENT_ID = "clientId";

    private final ScreenshotAnalyzer analyzer;

    @Override
    public ToolKind getKind() {
        return ToolKind.ANALYZE_SCREENSHOT;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Analyze a screenshot of the Three.js scene to decide whether it meets the user "
                        + "requirements. If no screenshot is provided, one is requested from the browser.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_REQUIREMENT, Map.of("type", "string",
                                        "description", "The user's original requirement"),
                                PARAM_SCREENSHOT, Map.of("type", "string",
                                        "description", "Base64 screenshot (optional)"),
                                PARAM_FORCE_REQUEST, Map.of("type", "boolean",
                                        "description", "Request a fresh screenshot even if one is provided")),
                        "required", List.of(PARAM_REQUIREMENT)))
                .build();
    }

    /**
     * Only analyses of a supplied image are cacheable. A screenshot fetched
     * through the bridge is not part of the arguments.
     */
    @Override
    public boolean isCacheable(Map<String, Object> parameters) {
        return getKind().isCacheable()
                && parameters.get(PARAM_SCREENSHOT) instanceof String img && !img.isBlank()
                && !Boolean.TRUE.equals(parameters.get(PARAM_FORCE_REQUEST));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String sessionId = parameters.get(SESSION_ID_PARAM) instanceof String s ? s : DEFAULT_SESSION_ID;
        String requirement = parameters.get(PARAM_REQUIREMENT) instanceof String r ? r : "";
        String screenshot = parameters.get(PARAM_SCREENSHOT) instanceof String img ? img : null;
        String clientId = parameters.get(PARAM_CLIENT_ID) instanceof String c ? c : null;
        boolean force = Boolean.TRUE.equals(parameters.get(PARAM_FORCE_REQUEST));

        return analyzer.analyze(sessionId, requirement, screenshot, clientId, force)
                .thenApply(ScreenshotAnalysisTool::toToolResult);
    }

    static ToolResult toToolResult(ScreenshotAnalysis analysis) {
        if (!analysis.isSuccessful()) {
            return ToolResult.failure(analysis.getMessage(), analysis);
        }
        String verdict = analysis.isMatchesRequirements() ? "matches requirements" : "does not match requirements";
        String output = "Scene " + verdict + (analysis.isNeedsImprovements() ? "; improvements needed: " : ": ")
                + analysis.getKeyImprovements();
        return ToolResult.success(output, analysis);
    }
}
