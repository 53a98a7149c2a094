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
import me.golemcore.sceneagent.domain.loop.RefinementLoop;
import me.golemcore.sceneagent.domain.model.RefinementRequest;
import me.golemcore.sceneagent.domain.model.RefinementResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for refinement turns.
 */
@RestController
@RequestMapping("/api/refine")
@RequiredArgsConstructor
public class RefinementController {

    private final RefinementLoop refinementLoop;

    @PostMapping
    public Mono<ResponseEntity<RefinementResult>> refine(@RequestBody RefinementRequest request) {
        // The loop blocks on tool futures; keep it off the event loop
        return Mono.fromCallable(() -> refinementLoop.refine(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
