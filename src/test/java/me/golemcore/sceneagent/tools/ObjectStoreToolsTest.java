package me.golemcore.sceneagent.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ObjectStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ObjectStoreToolsTest {

    private static final SceneObjectRecord CUBE = SceneObjectRecord.builder()
            .id("c1").type("Mesh").name("red cube").position(List.of(1.0, 0.5, 0.0)).build();

    private ObjectStorePort objectStore;
    private ObjectRetrievalTool retrievalTool;
    private ObjectWriteTool writeTool;

    @BeforeEach
    void setUp() {
        objectStore = mock(ObjectStorePort.class);
        retrievalTool = new ObjectRetrievalTool(objectStore, new AgentProperties());
        writeTool = new ObjectWriteTool(objectStore, new ObjectMapper());
    }

    // ===== retrieve_objects =====

    @Test
    void shouldListRetrievedObjects() {
        when(objectStore.retrieve("cube", 3)).thenReturn(CompletableFuture.completedFuture(List.of(CUBE)));

        ToolResult result = retrievalTool.execute(Map.of("query", "cube", "limit", 3)).join();

        assertTrue(result.isSuccess());
        assertEquals("Found 1 objects:\n- c1: Mesh red cube at [1.0, 0.5, 0.0]", result.getOutput());
        assertEquals(1, ((Map<?, ?>) result.getData()).get("count"));
    }

    @Test
    void shouldUseDefaultLimit() {
        when(objectStore.retrieve(anyString(), anyInt())).thenReturn(CompletableFuture.completedFuture(List.of()));

        ToolResult result = retrievalTool.execute(Map.of("query", "cube")).join();

        verify(objectStore).retrieve("cube", 10);
        assertEquals("No matching objects found", result.getOutput());
    }

    @Test
    void shouldRejectBlankQuery() {
        ToolResult result = retrievalTool.execute(Map.of("query", "  ")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        verify(objectStore, never()).retrieve(anyString(), anyInt());
    }

    @Test
    void shouldReportRetrievalError() {
        when(objectStore.retrieve(anyString(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk gone")));

        ToolResult result = retrievalTool.execute(Map.of("query", "cube")).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("disk gone"));
    }

    // ===== write_objects =====

    @Test
    @SuppressWarnings("unchecked")
    void shouldConvertAndStoreObjects() {
        when(objectStore.store(anyList(), eq("add a cube"))).thenReturn(CompletableFuture.completedFuture(true));

        ToolResult result = writeTool.execute(Map.of(
                "objects", List.of(Map.of("id", "c1", "type", "Mesh", "position", List.of(1, 2, 3))),
                "prompt", "add a cube")).join();

        assertTrue(result.isSuccess());
        assertEquals(Map.of("count", 1), result.getData());
        ArgumentCaptor<List<SceneObjectRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(objectStore).store(captor.capture(), eq("add a cube"));
        SceneObjectRecord stored = captor.getValue().get(0);
        assertEquals("Mesh", stored.getType());
        assertEquals(List.of(1.0, 2.0, 3.0), stored.getPosition());
    }

    @Test
    void shouldRejectEmptyObjects() {
        ToolResult result = writeTool.execute(Map.of("objects", List.of(), "prompt", "p")).join();

        assertFalse(result.isSuccess());
        assertEquals("No valid objects to store", result.getError());
        verify(objectStore, never()).store(anyList(), any());
    }

    @Test
    void shouldRejectMalformedObjects() {
        ToolResult result = writeTool.execute(Map.of("objects", "not a list", "prompt", "p")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
    }

    @Test
    void shouldReportStoreFailure() {
        when(objectStore.store(anyList(), any())).thenReturn(CompletableFuture.completedFuture(false));

        ToolResult result = writeTool.execute(Map.of("objects", List.of(Map.of("type", "Mesh")))).join();

        assertFalse(result.isSuccess());
        assertEquals("Failed to store objects", result.getError());
    }
}
