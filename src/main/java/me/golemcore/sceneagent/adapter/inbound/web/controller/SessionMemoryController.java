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
import me.golemcore.sceneagent.domain.service.CodeBaseStore;
import me.golemcore.sceneagent.domain.service.SessionMemoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Inspect and reset the bounded memory of a session.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionMemoryController {

    private final SessionMemoryService memoryService;
    private final CodeBaseStore codeBaseStore;

    @GetMapping("/{sessionId}/memory")
    public Mono<ResponseEntity<Map<String, Object>>> memory(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(memoryService.snapshot(sessionId)));
    }

    @DeleteMapping("/{sessionId}/memory")
    public Mono<ResponseEntity<Map<String, Object>>> clear(@PathVariable String sessionId) {
        boolean memoryCleared = memoryService.clear(sessionId);
        boolean codeCleared = codeBaseStore.clear(sessionId);
        return Mono.just(ResponseEntity.ok(Map.of(
                "sessionId", sessionId,
                "cleared", memoryCleared || codeCleared)));
    }
}
