package me.golemcore.sceneagent.adapter.inbound.web.controller;

import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus;
import me.golemcore.sceneagent.domain.service.ModelGenerationService;
import me.golemcore.sceneagent.domain.service.ModelGenerationStatusTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelGenerationControllerTest {

    private ModelGenerationService modelGenerationService;
    private ModelGenerationStatusTracker statusTracker;
    private ModelGenerationController controller;

    @BeforeEach
    void setUp() {
        modelGenerationService = mock(ModelGenerationService.class);
        statusTracker = mock(ModelGenerationStatusTracker.class);
        controller = new ModelGenerationController(modelGenerationService, statusTracker);
    }

    @Test
    void shouldAcceptGenerationAndReturnRequestId() {
        ModelGenerationOptions options = ModelGenerationOptions.builder().prompt("a dragon").build();
        when(modelGenerationService.newRequestId()).thenReturn("req-42");

        StepVerifier.create(controller.generate(options))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    Map<String, Object> body = response.getBody();
                    assertNotNull(body);
                    assertEquals("req-42", body.get("requestId"));
                    assertEquals(ModelGenerationStatus.Status.PENDING, body.get("status"));
                })
                .verifyComplete();
        verify(modelGenerationService).generate("req-42", options);
    }

    @Test
    void shouldAcceptImageOnlyGeneration() {
        ModelGenerationOptions options = ModelGenerationOptions.builder()
                .imageUrls(List.of("https://images.example.com/front.png"))
                .build();
        when(modelGenerationService.newRequestId()).thenReturn("req-img");

        StepVerifier.create(controller.generate(options))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldRejectGenerationWithoutInput() {
        ModelGenerationOptions options = ModelGenerationOptions.builder().prompt(" ").build();

        assertThrows(IllegalArgumentException.class, () -> controller.generate(options));
        verify(modelGenerationService, never()).generate(any(), any());
    }

    @Test
    void shouldReturnTrackedStatus() {
        ModelGenerationStatus status = ModelGenerationStatus.builder()
                .requestId("req-1")
                .status(ModelGenerationStatus.Status.COMPLETED)
                .phase(ModelGenerationStatus.Phase.READY)
                .modelUrl("https://assets.example.com/dragon.glb")
                .build();
        when(statusTracker.get("req-1")).thenReturn(Optional.of(status));

        StepVerifier.create(controller.status("req-1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(status, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownRequest() {
        when(statusTracker.get("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.status("missing"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
