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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus.Phase;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus.Status;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Table of {@link ModelGenerationStatus} records keyed by request id, so the
 * progress of a running generation can be queried out-of-band.
 *
 * <p>
 * Records are replaced, never mutated in place, and a finished record is
 * final: later transitions for the same id are ignored. Finished records older
 * than {@code agent.model-generation.status-max-age} are purged periodically.
 */
@Component
@Slf4j
public class ModelGenerationStatusTracker {

    private final Map<String, ModelGenerationStatus> statuses = new ConcurrentHashMap<>();
    private final AgentProperties.ModelGenerationProperties settings;
    private final Clock clock;

    private ScheduledExecutorService cleanupExecutor;

    public ModelGenerationStatusTracker(AgentProperties properties, Clock clock) {
        this.settings = properties.getModelGeneration();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        long intervalMs = Math.max(1000L, settings.getStatusCleanupInterval().toMillis());
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "model-status-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::purgeExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public ModelGenerationStatus start(String requestId, String prompt) {
        Instant now = clock.instant();
        ModelGenerationStatus status = ModelGenerationStatus.builder()
                .requestId(requestId)
                .status(Status.PENDING)
                .phase(Phase.SUBMITTED)
                .startTime(now)
                .updatedAt(now)
                .prompt(prompt)
                .build();
        statuses.put(requestId, status);
        return status;
    }

    public void advance(String requestId, Phase phase) {
        transition(requestId, current -> current.toBuilder().phase(phase));
    }

    public void validationRound(String requestId, int round) {
        transition(requestId, current -> current.toBuilder().phase(Phase.VALIDATING).validationRound(round));
    }

    public void complete(String requestId, String modelUrl) {
        transition(requestId, current -> current.toBuilder()
                .status(Status.COMPLETED)
                .phase(Phase.READY)
                .modelUrl(modelUrl));
    }

    public void fail(String requestId, String error) {
        transition(requestId, current -> current.toBuilder()
                .status(Status.FAILED)
                .phase(Phase.FAILED)
                .error(error));
    }

    public Optional<ModelGenerationStatus> get(String requestId) {
        return Optional.ofNullable(statuses.get(requestId));
    }

    public boolean isFinished(String requestId) {
        ModelGenerationStatus status = statuses.get(requestId);
        return status != null && status.isFinished();
    }

    /**
     * Removes finished records that started longer than the max age ago.
     *
     * @return number of removed records
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(settings.getStatusMaxAge());
        int before = statuses.size();
        statuses.values().removeIf(s -> s.isFinished() && s.getStartTime().isBefore(cutoff));
        int removed = before - statuses.size();
        if (removed > 0) {
            log.debug("[ModelGen] Purged {} expired status records", removed);
        }
        return removed;
    }

    public int size() {
        return statuses.size();
    }

    private void transition(String requestId,
            Function<ModelGenerationStatus, ModelGenerationStatus.ModelGenerationStatusBuilder> change) {
        statuses.computeIfPresent(requestId, (id, current) -> {
            if (current.isFinished()) {
                return current;
            }
            return change.apply(current).updatedAt(clock.instant()).build();
        });
    }
}
