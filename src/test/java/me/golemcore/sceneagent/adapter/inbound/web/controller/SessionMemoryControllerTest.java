package me.golemcore.sceneagent.adapter.inbound.web.controller;

import me.golemcore.sceneagent.domain.service.CodeBaseStore;
import me.golemcore.sceneagent.domain.service.SessionMemoryService;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionMemoryControllerTest {

    private SessionMemoryService memoryService;
    private CodeBaseStore codeBaseStore;
    private SessionMemoryController controller;

    @BeforeEach
    void setUp() {
        memoryService = new SessionMemoryService(new AgentProperties(), Clock.systemUTC());
        codeBaseStore = new CodeBaseStore();
        controller = new SessionMemoryController(memoryService, codeBaseStore);
    }

    @Test
    void shouldReturnMemorySnapshot() {
        memoryService.recordModelGenerated("s1", "https://assets.example.com/dragon.glb", "a dragon");

        StepVerifier.create(controller.memory("s1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    Map<String, Object> body = response.getBody();
                    assertNotNull(body);
                    assertEquals("s1", body.get("sessionId"));
                    assertEquals(true, body.get("exists"));
                    assertTrue(((Map<?, ?>) body.get("code")).containsKey(SessionMemoryService.KEY_MODEL_HISTORY));
                })
                .verifyComplete();
    }

    @Test
    void shouldClearMemoryAndCodeBase() {
        memoryService.recordCodeState("s1", "add a cube", "function setup(scene) { return scene; }");
        codeBaseStore.put("s1", "function setup(scene) { return scene; }");

        StepVerifier.create(controller.clear("s1"))
                .assertNext(response -> assertEquals(true, response.getBody().get("cleared")))
                .verifyComplete();

        assertTrue(memoryService.find("s1").isEmpty());
        assertTrue(codeBaseStore.get("s1").isEmpty());
    }

    @Test
    void shouldReportNothingClearedForUnknownSession() {
        StepVerifier.create(controller.clear("nobody"))
                .assertNext(response -> assertFalse((Boolean) response.getBody().get("cleared")))
                .verifyComplete();
    }
}
