package me.golemcore.sceneagent.domain.service;

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
import me.golemcore.sceneagent.domain.model.Attachment;
import me.golemcore.sceneagent.domain.model.LlmRequest;
import me.golemcore.sceneagent.domain.model.Message;
import me.golemcore.sceneagent.domain.model.ScreenshotAnalysis;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.LlmPort;
import me.golemcore.sceneagent.port.outbound.ScreenshotPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Obtains a screenshot of the rendered scene and asks the vision model whether
 * it satisfies the user's requirement.
 *
 * <p>
 * A supplied screenshot is used when it looks like real image data; otherwise
 * one is requested from the connected client through {@link ScreenshotPort}.
 * Every failure after that point is reported as an error
 * {@link ScreenshotAnalysis} with {@code needs_improvements=true}. Successful
 * analyses are summarized into session memory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScreenshotAnalyzer {

    public static final String PLACEHOLDER = "<screenshot>";

    static final String RECOMMEND_FIX = "The scene needs adjustment; use generate_fix_code to modify the code";
    static final String RECOMMEND_KEEP = "The scene matches the requirements; no major changes needed";
    static final String NO_IMPROVEMENTS = "No specific improvements listed";

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/=]+$");
    private static final Pattern IMPROVEMENTS = Pattern.compile("Concrete Improvements:(.*?)(?:\\n\\n|\\n$|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final List<String> IMPROVEMENT_WORDS = List.of("no", "partially", "improve", "missing", "需要改进");

    private final LlmPort llmPort;
    private final ScreenshotPort screenshotPort;
    private final SessionMemoryService memoryService;
    private final AgentProperties properties;

    /**
     * Runs one analysis.
     *
     * @param sessionId
     *            session whose memory provides history and receives the summary
     * @param requirement
     *            the user's requirement text
     * @param screenshot
     *            supplied base64 or data-URL image, may be null
     * @param clientId
     *            client to ask when a screenshot must be requested, null to
     *            broadcast
     * @param forceRequest
     *            request a fresh screenshot even if one was supplied
     */
    public CompletableFuture<ScreenshotAnalysis> analyze(String sessionId, String requirement, String screenshot,
            String clientId, boolean forceRequest) {
        if (!forceRequest && isUsable(screenshot)) {
            log.debug("[Screenshot] Using supplied screenshot ({} chars)", screenshot.length());
            return analyzeImage(sessionId, requirement, screenshot, "supplied");
        }

        String requestId = "analysis-" + UUID.randomUUID();
        log.debug("[Screenshot] No usable screenshot supplied, requesting {}", requestId);
        return screenshotPort.requestScreenshot(requestId, clientId)
                .handle((image, error) -> {
                    if (error != null) {
                        log.warn("[Screenshot] Request {} failed: {}", requestId, error.getMessage());
                        return CompletableFuture.completedFuture(ScreenshotAnalysis.error(
                                ScreenshotAnalysis.ERROR_SOCKET_REQUEST_FAILED,
                                "Failed to get screenshot from the client: " + error.getMessage()));
                    }
                    return analyzeImage(sessionId, requirement, image, "bridge");
                })
                .thenCompose(future -> future);
    }

    private CompletableFuture<ScreenshotAnalysis> analyzeImage(String sessionId, String requirement,
            String screenshot, String source) {
        if (!isUsable(screenshot)) {
            return CompletableFuture.completedFuture(ScreenshotAnalysis.error(
                    ScreenshotAnalysis.ERROR_INVALID_SCREENSHOT_DATA, "Screenshot data too short or empty"));
        }
        if (!isValidBase64Image(screenshot, properties.getScreenshot().getMinLength())
                && !screenshot.startsWith("data:image")) {
            log.warn("[Screenshot] Invalid image format ({} chars)", screenshot.length());
            return CompletableFuture.completedFuture(ScreenshotAnalysis.error(
                    ScreenshotAnalysis.ERROR_INVALID_IMAGE_FORMAT, "Invalid image data format"));
        }

        String historyContext = memoryService.formatHistoryForPrompt(sessionId);
        Message message = Message.builder()
                .role("user")
                .content(buildPrompt(requirement, historyContext))
                .attachments(List.of(Attachment.fromImage(screenshot)))
                .build();
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getVisionModel())
                .sessionId(sessionId)
                .messages(List.of(message))
                .build();

        long start = System.currentTimeMillis();
        return llmPort.chat(request)
                .thenApply(response -> {
                    String analysis = response.getContent() != null ? response.getContent() : "";
                    log.info("[Screenshot] Vision analysis done in {}ms ({} chars)",
                            System.currentTimeMillis() - start, analysis.length());
                    memoryService.saveAnalysis(sessionId, requirement, analysis);
                    return interpret(analysis, source);
                })
                .exceptionally(e -> {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("[Screenshot] Vision analysis failed: {}", cause.getMessage());
                    return ScreenshotAnalysis.error(ScreenshotAnalysis.ERROR_ANALYSIS_FAILURE,
                            "Error analyzing screenshot: " + cause.getMessage());
                });
    }

    /**
     * Derives the structured verdict from the free-text analysis.
     */
    static ScreenshotAnalysis interpret(String analysis, String source) {
        String lower = analysis.toLowerCase(Locale.ROOT);
        boolean matches = lower.contains("yes") && (lower.contains("match") || lower.contains("符合需求"));
        boolean needsImprovements = IMPROVEMENT_WORDS.stream().anyMatch(lower::contains);

        Matcher matcher = IMPROVEMENTS.matcher(analysis);
        String improvements = matcher.find() && !matcher.group(1).isBlank()
                ? matcher.group(1).trim()
                : NO_IMPROVEMENTS;

        return ScreenshotAnalysis.builder()
                .status("success")
                .analysis(analysis)
                .matchesRequirements(matches)
                .needsImprovements(needsImprovements)
                .keyImprovements(improvements)
                .recommendation(needsImprovements ? RECOMMEND_FIX : RECOMMEND_KEEP)
                .source(source)
                .build();
    }

    static String buildPrompt(String requirement, String historyContext) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze this Three.js scene screenshot and determine if it meets the user requirements:\n\n")
                .append("User requirements:\n")
                .append(requirement != null && !requirement.isBlank()
                        ? requirement
                        : "No specific requirements provided")
                .append("\n\n");
        if (historyContext != null && !historyContext.isBlank()) {
            prompt.append("Historical context:\n").append(historyContext).append("\n\n");
        }
        prompt.append("""
                Based on the screenshot, provide your analysis in the following structure:
                1. Overall Assessment: Does the scene match the user requirements? (Yes/No/Partially)
                2. Visual Elements: What objects are visible in the scene?
                3. Missing Components: What aspects of the requirements are missing or incomplete?
                4. Position/Scale Issues: Are there any problems with object positioning or scaling?
                5. Visual Quality: Evaluate lighting, colors, textures, and overall appearance
                6. Concrete Improvements: List specific, actionable changes needed

                Focus on being specific and precise. Your analysis will be used to decide if code modifications are needed.
                """);
        return prompt.toString();
    }

    private boolean isUsable(String screenshot) {
        return screenshot != null
                && !PLACEHOLDER.equals(screenshot)
                && screenshot.length() >= properties.getScreenshot().getMinLength();
    }

    /**
     * Checks padding-aligned base64 (optionally inside a data URL) of at least
     * {@code minLength} chars.
     */
    static boolean isValidBase64Image(String value, int minLength) {
        String data = value;
        if (data.startsWith("data:image")) {
            String[] parts = data.split(",");
            if (parts.length != 2) {
                return false;
            }
            data = parts[1];
        }
        return data.length() % 4 == 0 && BASE64.matcher(data).matches() && data.length() >= minLength;
    }
}
