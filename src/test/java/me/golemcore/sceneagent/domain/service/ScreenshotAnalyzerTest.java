package me.golemcore.sceneagent.domain.service;

import me.golemcore.sceneagent.domain.model.LlmRequest;
import me.golemcore.sceneagent.domain.model.LlmResponse;
import me.golemcore.sceneagent.domain.model.Message;
import me.golemcore.sceneagent.domain.model.ScreenshotAnalysis;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.LlmPort;
import me.golemcore.sceneagent.port.outbound.ScreenshotPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScreenshotAnalyzerTest {

    private static final String SESSION = "s1";
    private static final String IMAGE = "A".repeat(120);
    private static final String DATA_URL = "data:image/jpeg;base64," + IMAGE;
    private static final String POSITIVE = "1. Overall Assessment: Yes, the scene matches the request.";
    private static final String NEGATIVE = "1. Overall Assessment: Partially.\n"
            + "3. Missing Components: the red light is missing.\n"
            + "6. Concrete Improvements: add a red point light above the cube\n\nThanks";

    private LlmPort llmPort;
    private ScreenshotPort screenshotPort;
    private SessionMemoryService memory;
    private ScreenshotAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        screenshotPort = mock(ScreenshotPort.class);
        AgentProperties properties = new AgentProperties();
        properties.getLlm().setVisionModel("openai/gpt-4o");
        memory = new SessionMemoryService(properties, Clock.systemUTC());
        analyzer = new ScreenshotAnalyzer(llmPort, screenshotPort, memory, properties);
    }

    @Test
    void shouldAnalyzeSuppliedScreenshotWithVisionModel() {
        when(llmPort.chat(any())).thenReturn(response(POSITIVE));

        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", DATA_URL, null, false).join();

        assertTrue(analysis.isSuccessful());
        assertEquals("supplied", analysis.getSource());
        assertTrue(analysis.isMatchesRequirements());
        verify(screenshotPort, never()).requestScreenshot(anyString(), any());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("openai/gpt-4o", captor.getValue().getModel());
        Message message = captor.getValue().getMessages().get(0);
        assertEquals("image/jpeg", message.getAttachments().get(0).getMimeType());
        assertEquals(IMAGE, message.getAttachments().get(0).getDataBase64());
        assertTrue(message.getContent().contains("a red cube"));
    }

    @Test
    void shouldSaveAnalysisSummaryToMemory() {
        when(llmPort.chat(any())).thenReturn(response(NEGATIVE));

        analyzer.analyze(SESSION, "a red cube", IMAGE, null, false).join();

        assertEquals(NEGATIVE, memory.loadCode(SESSION).get(SessionMemoryService.KEY_ANALYSIS_SUMMARY));
    }

    @Test
    void shouldRequestScreenshotForPlaceholder() {
        when(screenshotPort.requestScreenshot(startsWith("analysis-"), eq("client-1")))
                .thenReturn(CompletableFuture.completedFuture(IMAGE));
        when(llmPort.chat(any())).thenReturn(response(NEGATIVE));

        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", ScreenshotAnalyzer.PLACEHOLDER,
                "client-1", false).join();

        assertTrue(analysis.isSuccessful());
        assertEquals("bridge", analysis.getSource());
        assertTrue(analysis.isNeedsImprovements());
        assertEquals("add a red point light above the cube", analysis.getKeyImprovements());
    }

    @Test
    void shouldRequestFreshScreenshotWhenForced() {
        when(screenshotPort.requestScreenshot(anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(IMAGE));
        when(llmPort.chat(any())).thenReturn(response(POSITIVE));

        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", DATA_URL, null, true).join();

        assertEquals("bridge", analysis.getSource());
    }

    @Test
    void shouldReportEmptyBridgeResultAsInvalidData() {
        when(screenshotPort.requestScreenshot(anyString(), any())).thenReturn(CompletableFuture.completedFuture(""));

        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", null, null, false).join();

        assertFalse(analysis.isSuccessful());
        assertEquals(ScreenshotAnalysis.ERROR_INVALID_SCREENSHOT_DATA, analysis.getErrorType());
        assertTrue(analysis.isNeedsImprovements());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldReportBridgeFailure() {
        when(screenshotPort.requestScreenshot(anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bridge not started")));

        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", null, null, false).join();

        assertEquals(ScreenshotAnalysis.ERROR_SOCKET_REQUEST_FAILED, analysis.getErrorType());
    }

    @Test
    void shouldRejectNonBase64Image() {
        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", "!".repeat(120), null, false).join();

        assertEquals(ScreenshotAnalysis.ERROR_INVALID_IMAGE_FORMAT, analysis.getErrorType());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldReportVisionFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(
                new IllegalArgumentException("LLM chat failed: 500")));

        ScreenshotAnalysis analysis = analyzer.analyze(SESSION, "a red cube", IMAGE, null, false).join();

        assertEquals(ScreenshotAnalysis.ERROR_ANALYSIS_FAILURE, analysis.getErrorType());
        assertTrue(analysis.getMessage().contains("LLM chat failed: 500"));
    }

    @Test
    void shouldInterpretPositiveAnalysis() {
        ScreenshotAnalysis analysis = ScreenshotAnalyzer.interpret(POSITIVE, "supplied");

        assertTrue(analysis.isMatchesRequirements());
        assertFalse(analysis.isNeedsImprovements());
        assertEquals(ScreenshotAnalyzer.NO_IMPROVEMENTS, analysis.getKeyImprovements());
        assertEquals(ScreenshotAnalyzer.RECOMMEND_KEEP, analysis.getRecommendation());
    }

    @Test
    void shouldInterpretChineseVerdict() {
        ScreenshotAnalysis analysis = ScreenshotAnalyzer.interpret("Yes, 符合需求", "bridge");

        assertTrue(analysis.isMatchesRequirements());
    }

    @Test
    void shouldInterpretNegativeAnalysis() {
        ScreenshotAnalysis analysis = ScreenshotAnalyzer.interpret(NEGATIVE, "supplied");

        assertFalse(analysis.isMatchesRequirements());
        assertTrue(analysis.isNeedsImprovements());
        assertEquals(ScreenshotAnalyzer.RECOMMEND_FIX, analysis.getRecommendation());
    }

    @Test
    void shouldValidateBase64Images() {
        assertTrue(ScreenshotAnalyzer.isValidBase64Image(IMAGE, 100));
        assertTrue(ScreenshotAnalyzer.isValidBase64Image(DATA_URL, 100));
        assertFalse(ScreenshotAnalyzer.isValidBase64Image("A".repeat(121), 100));
        assertFalse(ScreenshotAnalyzer.isValidBase64Image("AAAA", 100));
        assertFalse(ScreenshotAnalyzer.isValidBase64Image("data:image/png;base64", 1));
    }

    @Test
    void shouldIncludeHistoryInPrompt() {
        String prompt = ScreenshotAnalyzer.buildPrompt("", "- Last analysis: dim");

        assertTrue(prompt.contains("No specific requirements provided"));
        assertTrue(prompt.contains("Historical context:\n- Last analysis: dim"));
        assertTrue(prompt.contains("6. Concrete Improvements"));
    }

    private static CompletableFuture<LlmResponse> response(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
