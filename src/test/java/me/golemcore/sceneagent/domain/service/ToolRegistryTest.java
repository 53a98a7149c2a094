package me.golemcore.sceneagent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.ScreenshotAnalysis;
import me.golemcore.sceneagent.domain.model.ToolCategory;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.testsupport.MutableClock;
import me.golemcore.sceneagent.tools.ScreenshotAnalysisTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private static final Map<String, Object> ARGS = Map.of("instruction", "add a red cube");

    private MutableClock clock;
    private AgentProperties properties;
    private StubTool codeFix;
    private StubTool modelGeneration;
    private StubTool patch;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        properties = new AgentProperties();
        codeFix = new StubTool(ToolKind.GENERATE_FIX_CODE, true);
        modelGeneration = new StubTool(ToolKind.GENERATE_3D_MODEL, true);
        patch = new StubTool(ToolKind.APPLY_PATCH, true);
        registry = new ToolRegistry(List.of(codeFix, modelGeneration, patch), properties, new ObjectMapper(), clock);
    }

    @Test
    void shouldServeSecondIdenticalCallFromCache() {
        ToolResult first = registry.execute("generate_fix_code", ARGS).join();
        ToolResult second = registry.execute("generate_fix_code", ARGS).join();

        assertEquals(1, codeFix.calls.get());
        assertSame(first, second);
        assertEquals(1, registry.cacheStats().hits());
    }

    @Test
    void shouldRecomputeAfterCostlyTtlExpires() {
        registry.execute("generate_fix_code", ARGS).join();
        clock.advance(properties.getCache().getCostlyTtl());
        registry.execute("generate_fix_code", ARGS).join();

        assertEquals(2, codeFix.calls.get());
    }

    @Test
    void shouldNeverCacheModelGeneration() {
        registry.execute("generate_3d_model", Map.of("prompt", "dragon")).join();
        registry.execute("generate_3d_model", Map.of("prompt", "dragon")).join();

        assertEquals(2, modelGeneration.calls.get());
        assertEquals(0, registry.cacheStats().size());
    }

    @Test
    void shouldNotCacheStatefulPatchTool() {
        registry.execute("apply_patch", Map.of("code", "x")).join();
        registry.execute("apply_patch", Map.of("code", "x")).join();

        assertEquals(2, patch.calls.get());
    }

    @Test
    void shouldNotCacheFailures() {
        StubTool failing = new StubTool(ToolKind.RETRIEVE_OBJECTS, false);
        registry.register(failing);

        registry.execute("retrieve_objects", Map.of("query", "q")).join();
        registry.execute("retrieve_objects", Map.of("query", "q")).join();

        assertEquals(2, failing.calls.get());
    }

    @Test
    void shouldBypassCacheWhenDisabled() {
        properties.getCache().setEnabled(false);

        registry.execute("generate_fix_code", ARGS).join();
        registry.execute("generate_fix_code", ARGS).join();

        assertEquals(2, codeFix.calls.get());
    }

    @Test
    void shouldReturnInvalidInputForUnknownTool() {
        ToolResult result = registry.execute("nope", Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        assertTrue(result.getError().contains("nope"));
    }

    @Test
    void shouldFilterByCategoryAndSortByName() {
        List<ToolComponent> codeTools = registry.all(ToolCategory.CODE);

        assertEquals(List.of("apply_patch", "generate_fix_code"),
                codeTools.stream().map(ToolComponent::getToolName).toList());
        assertEquals(3, registry.all().size());
    }

    @Test
    void shouldReplaceToolRegisteredUnderSameName() {
        StubTool replacement = new StubTool(ToolKind.GENERATE_FIX_CODE, true);
        registry.register(replacement);

        registry.execute("generate_fix_code", ARGS).join();

        assertEquals(0, codeFix.calls.get());
        assertEquals(1, replacement.calls.get());
        assertSame(replacement, registry.get("generate_fix_code").orElseThrow());
    }

    @Test
    void shouldUseTtlMatchingKind() {
        assertEquals(properties.getCache().getCostlyTtl(), registry.ttlFor(ToolKind.GENERATE_FIX_CODE));
        assertEquals(properties.getCache().getDefaultTtl(), registry.ttlFor(ToolKind.RETRIEVE_OBJECTS));
    }

    @Test
    void shouldInvalidateCacheByPrefix() {
        registry.execute("generate_fix_code", ARGS).join();

        assertEquals(1, registry.invalidateCache("generate_fix_code"));
        registry.execute("generate_fix_code", ARGS).join();
        assertEquals(2, codeFix.calls.get());
    }

    @Test
    void shouldHonourExplicitTtl() {
        registry.executeWithCache("generate_fix_code", ARGS, Duration.ofSeconds(1)).join();
        clock.advance(Duration.ofSeconds(2));
        registry.executeWithCache("generate_fix_code", ARGS, Duration.ofSeconds(1)).join();

        assertEquals(2, codeFix.calls.get());
    }

    @Test
    void shouldAnalyzeEveryScreenshotFetchedThroughBridge() {
        ScreenshotAnalyzer analyzer = mock(ScreenshotAnalyzer.class);
        when(analyzer.analyze(eq("s1"), eq("a red cube"), isNull(), isNull(), eq(false))).thenReturn(
                CompletableFuture.completedFuture(analysis(false, "scene is empty")),
                CompletableFuture.completedFuture(analysis(true, "none")));
        registry.register(new ScreenshotAnalysisTool(analyzer));
        Map<String, Object> args = Map.of("userRequirement", "a red cube", "sessionId", "s1");

        ToolResult first = registry.execute("analyze_screenshot", args).join();
        ToolResult second = registry.execute("analyze_screenshot", args).join();

        verify(analyzer, times(2)).analyze(eq("s1"), eq("a red cube"), isNull(), isNull(), eq(false));
        assertEquals("Scene does not match requirements; improvements needed: scene is empty", first.getOutput());
        assertEquals("Scene matches requirements: none", second.getOutput());
        assertEquals(0, registry.cacheStats().size());
    }

    @Test
    void shouldCacheAnalysisOfSuppliedScreenshot() {
        ScreenshotAnalyzer analyzer = mock(ScreenshotAnalyzer.class);
        when(analyzer.analyze("s1", "a red cube", "img-1", null, false))
                .thenReturn(CompletableFuture.completedFuture(analysis(true, "none")));
        registry.register(new ScreenshotAnalysisTool(analyzer));
        Map<String, Object> args = Map.of("userRequirement", "a red cube", "sessionId", "s1",
                "screenshotBase64", "img-1");

        registry.execute("analyze_screenshot", args).join();
        registry.execute("analyze_screenshot", args).join();

        verify(analyzer, times(1)).analyze("s1", "a red cube", "img-1", null, false);
    }

    @Test
    void shouldNotCacheForcedScreenshotRequest() {
        ScreenshotAnalyzer analyzer = mock(ScreenshotAnalyzer.class);
        when(analyzer.analyze("s1", "a red cube", "img-1", null, true))
                .thenReturn(CompletableFuture.completedFuture(analysis(true, "none")));
        registry.register(new ScreenshotAnalysisTool(analyzer));
        Map<String, Object> args = Map.of("userRequirement", "a red cube", "sessionId", "s1",
                "screenshotBase64", "img-1", "forceRequest", true);

        registry.execute("analyze_screenshot", args).join();
        registry.execute("analyze_screenshot", args).join();

        verify(analyzer, times(2)).analyze("s1", "a red cube", "img-1", null, true);
    }

    @Test
    void shouldDropCachedRetrievalsAfterSuccessfulWrite() {
        StubTool retrieve = new StubTool(ToolKind.RETRIEVE_OBJECTS, true);
        registry.register(retrieve);
        registry.register(new StubTool(ToolKind.WRITE_OBJECTS, true));
        Map<String, Object> query = Map.of("query", "cube");

        registry.execute("retrieve_objects", query).join();
        registry.execute("retrieve_objects", query).join();
        assertEquals(1, retrieve.calls.get());

        registry.execute("write_objects", Map.of("objects", List.of())).join();
        registry.execute("retrieve_objects", query).join();

        assertEquals(2, retrieve.calls.get());
    }

    @Test
    void shouldKeepCachedRetrievalsWhenWriteFails() {
        StubTool retrieve = new StubTool(ToolKind.RETRIEVE_OBJECTS, true);
        registry.register(retrieve);
        registry.register(new StubTool(ToolKind.WRITE_OBJECTS, false));
        Map<String, Object> query = Map.of("query", "cube");

        registry.execute("retrieve_objects", query).join();
        registry.execute("write_objects", Map.of("objects", List.of())).join();
        registry.execute("retrieve_objects", query).join();

        assertEquals(1, retrieve.calls.get());
    }

    @Test
    void shouldListDefinitionsOfRegisteredTools() {
        List<ToolDefinition> definitions = registry.definitions();

        assertEquals(3, definitions.size());
        assertEquals("generate_fix_code", definitions.get(0).getName());
    }

    private static ScreenshotAnalysis analysis(boolean matches, String improvements) {
        return ScreenshotAnalysis.builder()
                .status("success")
                .matchesRequirements(matches)
                .needsImprovements(!matches)
                .keyImprovements(improvements)
                .build();
    }

    private static final class StubTool implements ToolComponent {

        private final ToolKind kind;
        private final boolean succeed;
        private final AtomicInteger calls = new AtomicInteger();

        private StubTool(ToolKind kind, boolean succeed) {
            this.kind = kind;
            this.succeed = succeed;
        }

        @Override
        public ToolKind getKind() {
            return kind;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name(kind.getToolName())
                    .description("stub")
                    .build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            int call = calls.incrementAndGet();
            return CompletableFuture.completedFuture(succeed
                    ? ToolResult.success("call " + call)
                    : ToolResult.failure("boom"));
        }
    }
}
