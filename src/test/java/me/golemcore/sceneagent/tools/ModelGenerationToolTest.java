package me.golemcore.sceneagent.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sceneagent.domain.model.ModelAsset;
import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;
import me.golemcore.sceneagent.domain.model.ModelGenerationResult;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.ModelGenerationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelGenerationToolTest {

    private static final String MODEL_URL = "https://cdn.example.com/dragon.glb";

    private ModelGenerationService service;
    private ModelGenerationTool tool;

    @BeforeEach
    void setUp() {
        service = mock(ModelGenerationService.class);
        tool = new ModelGenerationTool(service, new ObjectMapper());
    }

    @Test
    void shouldReturnModelUrlAndNextStep() {
        when(service.generate(any(ModelGenerationOptions.class))).thenReturn(CompletableFuture.completedFuture(
                ModelGenerationResult.builder()
                        .success(true)
                        .requestId("model-1")
                        .modelUrl(MODEL_URL)
                        .modelUrls(List.of(ModelAsset.builder().name("task.glb").url(MODEL_URL).build()))
                        .build()));

        ToolResult result = tool.execute(Map.of("prompt", "a small dragon")).join();

        assertTrue(result.isSuccess());
        assertEquals("3D model generated: " + MODEL_URL, result.getOutput());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(MODEL_URL, data.get("modelUrl"));
        assertEquals("// MODEL_URL: " + MODEL_URL, data.get("modelComment"));
        assertEquals(ModelGenerationTool.NEXT_STEP, data.get("nextStep"));
        assertEquals(List.of(Map.of("name", "task.glb", "url", MODEL_URL)), data.get("modelUrls"));
    }

    @Test
    void shouldReturnRecoverableFailure() {
        when(service.generate(any(ModelGenerationOptions.class))).thenReturn(CompletableFuture.completedFuture(
                ModelGenerationResult.failed("model-1", "No model URLs returned from API")));

        ToolResult result = tool.execute(Map.of("prompt", "a small dragon")).join();

        assertFalse(result.isSuccess());
        assertEquals("No model URLs returned from API", result.getError());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(true, data.get("recoverable"));
        assertEquals("model-1", data.get("requestId"));
    }

    @Test
    void shouldRejectMissingPromptAndImages() {
        ToolResult result = tool.execute(Map.of("quality", "high")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        verify(service, never()).generate(any(ModelGenerationOptions.class));
    }

    @Test
    void shouldApplyToolDefaults() {
        ModelGenerationOptions options = tool.parseOptions(Map.of("prompt", "castle"));

        assertEquals("castle", options.getPrompt());
        assertEquals("Quad", options.getMeshMode());
        assertEquals("low", options.getQuality());
        assertEquals("pbr", options.getMaterial());
        assertEquals(false, options.getUseHyper());
        assertNull(options.getImageUrls());
    }

    @Test
    void shouldParseJsonInput() {
        ModelGenerationOptions options = tool.parseOptions(Map.of("input",
                "{\"prompt\":\"tree\",\"quality\":\"high\",\"imageUrls\":[\"https://img.example/a.jpg\"]}"));

        assertEquals("tree", options.getPrompt());
        assertEquals("high", options.getQuality());
        assertEquals(List.of("https://img.example/a.jpg"), options.getImageUrls());
    }

    @Test
    void shouldUseBareInputAsPrompt() {
        ModelGenerationOptions options = tool.parseOptions(Map.of("input", "  a wooden chair "));

        assertEquals("a wooden chair", options.getPrompt());
        assertEquals("Quad", options.getMeshMode());
    }

    @Test
    void shouldUseMalformedJsonInputAsPrompt() {
        ModelGenerationOptions options = tool.parseOptions(Map.of("input", "{broken"));

        assertEquals("{broken", options.getPrompt());
    }
}
