package me.golemcore.sceneagent.adapter.outbound.objectstore;

import me.golemcore.sceneagent.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.infrastructure.config.AutoConfiguration;
import me.golemcore.sceneagent.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LocalObjectStoreAdapterTest {

    @TempDir
    Path tempDir;

    private AgentProperties properties;
    private LocalObjectStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new LocalObjectStoreAdapter(storage, AutoConfiguration.objectMapper(), properties,
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldStoreAndRetrieveByTerm() {
        assertTrue(store.store(List.of(object("c1", "Mesh", "red cube"), object("l1", "PointLight", "lamp")),
                "scene setup").join());

        List<SceneObjectRecord> found = store.retrieve("cube", 10).join();

        assertEquals(1, found.size());
        assertEquals("c1", found.get(0).getId());
    }

    @Test
    void shouldMatchPromptText() {
        store.store(List.of(object("l1", "PointLight", "lamp")), "warm evening lighting").join();

        assertEquals(1, store.retrieve("evening", 10).join().size());
    }

    @Test
    void shouldRankByMatchedTermsThenRecency() {
        store.store(List.of(object("a", "Mesh", "red cube")), "first").join();
        store.store(List.of(object("b", "Mesh", "blue cube")), "second").join();
        store.store(List.of(object("c", "Mesh", "red sphere")), "third").join();

        List<SceneObjectRecord> found = store.retrieve("red cube", 10).join();

        assertEquals(List.of("a", "c", "b"), found.stream().map(SceneObjectRecord::getId).toList());
    }

    @Test
    void shouldReturnNewestFirstForBlankQueryAndHonourLimit() {
        store.store(List.of(object("a", "Mesh", "one"), object("b", "Mesh", "two"),
                object("c", "Mesh", "three")), "p").join();

        List<SceneObjectRecord> found = store.retrieve(" ", 2).join();

        assertEquals(List.of("c", "b"), found.stream().map(SceneObjectRecord::getId).toList());
    }

    @Test
    void shouldLookUpById() {
        store.store(List.of(object("cube-7", "Mesh", "cube")), "p").join();

        List<SceneObjectRecord> found = store.retrieve("id:cube-7", 5).join();

        assertEquals(1, found.size());
        assertTrue(store.retrieve("id:other", 5).join().isEmpty());
    }

    @Test
    void shouldAssignIdsWhenMissing() {
        store.store(List.of(object(null, "Mesh", "cube")), "p").join();

        List<String> ids = store.listIds().join();

        assertEquals(1, ids.size());
        assertNotNull(ids.get(0));
        assertTrue(ids.get(0).startsWith("obj-"));
    }

    @Test
    void shouldRejectEmptyInput() {
        assertFalse(store.store(List.of(), "p").join());
        assertFalse(store.store(null, "p").join());
    }

    @Test
    void shouldReportStorageFailureAsFalse() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.appendText(anyString(), anyString(), anyString())).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));
        LocalObjectStoreAdapter broken = new LocalObjectStoreAdapter(failing, AutoConfiguration.objectMapper(),
                properties, Clock.systemUTC());

        assertFalse(broken.store(List.of(object("a", "Mesh", "cube")), "p").join());
    }

    @Test
    void shouldReturnEmptyWhenNothingStored() {
        assertTrue(store.retrieve("cube", 10).join().isEmpty());
        assertTrue(store.listIds().join().isEmpty());
    }

    private static SceneObjectRecord object(String id, String type, String name) {
        return SceneObjectRecord.builder()
                .id(id)
                .type(type)
                .name(name)
                .position(List.of(0.0, 1.0, 0.0))
                .build();
    }
}
