package me.golemcore.sceneagent.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;
import me.golemcore.sceneagent.domain.model.ModelGenerationStatus;
import me.golemcore.sceneagent.domain.service.ModelGenerationService;
import me.golemcore.sceneagent.domain.service.ModelGenerationStatusTracker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts model generations in the background and reports their progress.
 */
@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelGenerationController {

    private final ModelGenerationService modelGenerationService;
    private final ModelGenerationStatusTracker statusTracker;

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> generate(@RequestBody ModelGenerationOptions options) {
        if (options == null || !options.hasInput()) {
            throw new IllegalArgumentException("Either prompt or imageUrls is required");
        }
        String requestId = modelGenerationService.newRequestId();
        modelGenerationService.generate(requestId, options);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requestId", requestId);
        body.put("status", ModelGenerationStatus.Status.PENDING);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(body));
    }

    @GetMapping("/{requestId}/status")
    public Mono<ResponseEntity<ModelGenerationStatus>> status(@PathVariable String requestId) {
        ModelGenerationStatus status = statusTracker.get(requestId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Unknown model generation request: " + requestId));
        return Mono.just(ResponseEntity.ok(status));
    }
}
