package me.golemcore.sceneagent.domain.service;

import me.golemcore.sceneagent.domain.model.ModelGenerationStatus;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus.Phase;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus.Status;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelGenerationStatusTrackerTest {

    private static final String REQUEST_ID = "model-1";

    private MutableClock clock;
    private ModelGenerationStatusTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        tracker = new ModelGenerationStatusTracker(new AgentProperties(), clock);
    }

    @Test
    void shouldStartPending() {
        tracker.start(REQUEST_ID, "dragon");

        ModelGenerationStatus status = tracker.get(REQUEST_ID).orElseThrow();
        assertEquals(Status.PENDING, status.getStatus());
        assertEquals(Phase.SUBMITTED, status.getPhase());
        assertEquals("dragon", status.getPrompt());
        assertFalse(tracker.isFinished(REQUEST_ID));
    }

    @Test
    void shouldTrackPhasesUntilCompletion() {
        tracker.start(REQUEST_ID, "dragon");
        tracker.advance(REQUEST_ID, Phase.POLLING);
        clock.advance(Duration.ofSeconds(5));
        tracker.validationRound(REQUEST_ID, 2);

        ModelGenerationStatus validating = tracker.get(REQUEST_ID).orElseThrow();
        assertEquals(Phase.VALIDATING, validating.getPhase());
        assertEquals(2, validating.getValidationRound());
        assertEquals(clock.instant(), validating.getUpdatedAt());

        tracker.complete(REQUEST_ID, "https://cdn.example/a.glb");

        ModelGenerationStatus done = tracker.get(REQUEST_ID).orElseThrow();
        assertEquals(Status.COMPLETED, done.getStatus());
        assertEquals(Phase.READY, done.getPhase());
        assertEquals("https://cdn.example/a.glb", done.getModelUrl());
    }

    @Test
    void shouldNotLeaveTerminalState() {
        tracker.start(REQUEST_ID, "dragon");
        tracker.fail(REQUEST_ID, "boom");
        tracker.complete(REQUEST_ID, "https://cdn.example/a.glb");
        tracker.advance(REQUEST_ID, Phase.POLLING);

        ModelGenerationStatus status = tracker.get(REQUEST_ID).orElseThrow();
        assertEquals(Status.FAILED, status.getStatus());
        assertEquals("boom", status.getError());
        assertEquals(null, status.getModelUrl());
    }

    @Test
    void shouldIgnoreUpdatesForUnknownRequest() {
        tracker.complete("unknown", "https://cdn.example/a.glb");

        assertTrue(tracker.get("unknown").isEmpty());
    }

    @Test
    void shouldPurgeOnlyOldFinishedRecords() {
        tracker.start("old-finished", "a");
        tracker.fail("old-finished", "boom");
        tracker.start("old-running", "b");
        clock.advance(Duration.ofHours(2));
        tracker.start("fresh", "c");
        tracker.complete("fresh", "https://cdn.example/c.glb");

        int removed = tracker.purgeExpired();

        assertEquals(1, removed);
        assertTrue(tracker.get("old-finished").isEmpty());
        assertTrue(tracker.get("old-running").isPresent());
        assertTrue(tracker.get("fresh").isPresent());
    }
}
