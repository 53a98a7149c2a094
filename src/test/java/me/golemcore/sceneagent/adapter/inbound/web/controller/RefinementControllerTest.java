package me.golemcore.sceneagent.adapter.inbound.web.controller;

import me.golemcore.sceneagent.domain.loop.RefinementLoop;
import me.golemcore.sceneagent.domain.model.RefinementRequest;
import me.golemcore.sceneagent.domain.model.RefinementResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RefinementControllerTest {

    private RefinementLoop refinementLoop;
    private RefinementController controller;

    @BeforeEach
    void setUp() {
        refinementLoop = mock(RefinementLoop.class);
        controller = new RefinementController(refinementLoop);
    }

    @Test
    void shouldReturnLoopResult() {
        RefinementRequest request = RefinementRequest.builder().instruction("add a red cube").build();
        RefinementResult result = RefinementResult.builder()
                .code("function setup(scene) { return scene; }")
                .stopReason("completed")
                .iterations(1)
                .build();
        when(refinementLoop.refine(request)).thenReturn(result);

        StepVerifier.create(controller.refine(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(result, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldSurfaceLoopErrorsThroughMono() {
        RefinementRequest request = RefinementRequest.builder().instruction("").build();
        when(refinementLoop.refine(request)).thenThrow(new IllegalArgumentException("instruction is required"));

        StepVerifier.create(controller.refine(request))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
