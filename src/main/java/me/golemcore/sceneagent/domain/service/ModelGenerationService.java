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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.model.ModelAsset;
import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;
import me.golemcore.sceneagent.domain.model.ModelGenerationResult;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus.Phase;
import me.golemcore.sceneagent.domain.model.UrlValidationResult;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ModelGenerationApiPort;
import me.golemcore.sceneagent.port.outbound.ModelGenerationApiPort.JobStatus;
import me.golemcore.sceneagent.port.outbound.ModelGenerationApiPort.SubmittedJob;
import me.golemcore.sceneagent.port.outbound.UrlValidationPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one 3D model generation from submission to a validated download URL.
 *
 * <p>
 * Per request: submit the job, poll its status every
 * {@code poll-interval} until all sub-jobs report done, fetch the candidate
 * files, then run up to {@code validation-rounds} validation passes over the
 * candidates in order, {@code validation-round-delay} apart. The first
 * reachable candidate wins. Progress is recorded in the
 * {@link ModelGenerationStatusTracker} at every transition.
 *
 * <p>
 * Apart from the upfront configuration check, nothing here throws: every
 * failure becomes a {@link ModelGenerationResult} with
 * {@code recoverable=true}. Jobs run on a dedicated daemon pool and are cut
 * off by {@code agent.model-generation.timeout}.
 */
@Service
@Slf4j
public class ModelGenerationService {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService GENERATION_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "model-generation-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ModelGenerationApiPort api;
    private final UrlValidationPort urlValidator;
    private final ModelGenerationStatusTracker tracker;
    private final AgentProperties.ModelGenerationProperties settings;

    public ModelGenerationService(ModelGenerationApiPort api, UrlValidationPort urlValidator,
            ModelGenerationStatusTracker tracker, AgentProperties properties) {
        this.api = api;
        this.urlValidator = urlValidator;
        this.tracker = tracker;
        this.settings = properties.getModelGeneration();
    }

    public String newRequestId() {
        return "model-" + UUID.randomUUID();
    }

    public CompletableFuture<ModelGenerationResult> generate(ModelGenerationOptions options) {
        return generate(newRequestId(), options);
    }

    /**
     * Starts a generation in the background.
     *
     * @throws IllegalStateException
     *             if the generation API is not configured
     */
    public CompletableFuture<ModelGenerationResult> generate(String requestId, ModelGenerationOptions options) {
        api.ensureConfigured();
        tracker.start(requestId, options != null ? options.getPrompt() : null);
        long timeoutMs = settings.getTimeout().toMillis();
        return CompletableFuture.supplyAsync(() -> runGeneration(requestId, options), GENERATION_EXECUTOR)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    String error = ex instanceof TimeoutException
                            ? "Model generation timed out after " + timeoutMs + "ms"
                            : "Model generation failed: " + ex.getMessage();
                    log.warn("[ModelGen] {} ({})", error, requestId);
                    tracker.fail(requestId, error);
                    return ModelGenerationResult.failed(requestId, error);
                });
    }

    /**
     * Runs the whole pipeline on the calling thread. The status record must
     * already exist.
     */
    ModelGenerationResult runGeneration(String requestId, ModelGenerationOptions options) {
        if (options == null || !options.hasInput()) {
            return fail(requestId, "Either prompt or imageUrls is required");
        }
        try {
            ModelGenerationOptions effective = applyDefaults(options);
            SubmittedJob job = api.submit(effective);
            log.info("[ModelGen] Submitted {} as task {}", requestId, job.taskUuid());

            tracker.advance(requestId, Phase.POLLING);
            if (!awaitJobs(requestId, job)) {
                return fail(requestId, "Generation job failed on the provider side");
            }
            if (tracker.isFinished(requestId)) {
                return ModelGenerationResult.failed(requestId, "Model generation was cancelled");
            }

            List<ModelAsset> candidates = api.download(job.taskUuid(), effective.getGeometryFileFormat());
            if (candidates == null || candidates.isEmpty()) {
                return fail(requestId, "No model URLs returned from API");
            }
            log.info("[ModelGen] {} produced {} candidate file(s)", requestId, candidates.size());

            return validateCandidates(requestId, candidates);
        } catch (IllegalStateException e) {
            return fail(requestId, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[ModelGen] Generation {} failed", requestId, e);
            return fail(requestId, e.getMessage());
        }
    }

    private boolean awaitJobs(String requestId, SubmittedJob job) {
        int polls = 0;
        while (!tracker.isFinished(requestId)) {
            List<JobStatus> jobs = api.status(job.subscriptionKey());
            polls++;
            if (jobs.stream().anyMatch(JobStatus::isFailed)) {
                return false;
            }
            if (!jobs.isEmpty() && jobs.stream().allMatch(JobStatus::isDone)) {
                log.debug("[ModelGen] {} done after {} poll(s)", requestId, polls);
                return true;
            }
            sleep(settings.getPollInterval());
        }
        return true;
    }

    private ModelGenerationResult validateCandidates(String requestId, List<ModelAsset> candidates) {
        int rounds = Math.max(1, settings.getValidationRounds());
        for (int round = 1; round <= rounds; round++) {
            if (tracker.isFinished(requestId)) {
                return ModelGenerationResult.failed(requestId, "Model generation was cancelled");
            }
            tracker.validationRound(requestId, round);
            for (ModelAsset candidate : candidates) {
                UrlValidationResult validation = urlValidator.validate(candidate.getUrl());
                if (validation.isValid()) {
                    log.info("[ModelGen] {} validated in round {}/{}", requestId, round, rounds);
                    tracker.complete(requestId, candidate.getUrl());
                    return success(requestId, candidate, candidates);
                }
                log.debug("[ModelGen] Candidate {} not ready: {}", candidate.getName(), validation.getError());
            }
            if (round < rounds) {
                sleep(settings.getValidationRoundDelay());
            }
        }
        return fail(requestId, "Failed to validate model URL after " + rounds + " rounds. "
                + "The model generation may have failed.");
    }

    private ModelGenerationResult success(String requestId, ModelAsset chosen, List<ModelAsset> candidates) {
        List<ModelAsset> ordered = new ArrayList<>();
        ordered.add(chosen);
        for (ModelAsset candidate : candidates) {
            if (candidate != chosen) {
                ordered.add(candidate);
            }
        }
        return ModelGenerationResult.builder()
                .success(true)
                .requestId(requestId)
                .modelUrl(chosen.getUrl())
                .modelUrls(ordered)
                .message("3D model generated successfully")
                .build();
    }

    private ModelGenerationResult fail(String requestId, String error) {
        tracker.fail(requestId, error);
        log.warn("[ModelGen] {} failed: {}", requestId, error);
        return ModelGenerationResult.failed(requestId, error);
    }

    ModelGenerationOptions applyDefaults(ModelGenerationOptions options) {
        ModelGenerationOptions.ModelGenerationOptionsBuilder builder = options.toBuilder();
        if (options.getMeshMode() == null) {
            builder.meshMode(settings.getMeshMode());
        }
        if (options.getQuality() == null) {
            builder.quality(settings.getQuality());
        }
        if (options.getMaterial() == null) {
            builder.material(settings.getMaterial());
        }
        if (options.getTier() == null) {
            builder.tier(settings.getTier());
        }
        if (options.getGeometryFileFormat() == null) {
            builder.geometryFileFormat(settings.getGeometryFileFormat());
        }
        return builder.build();
    }

    private static void sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Model generation interrupted", e);
        }
    }
}
