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
import me.golemcore.sceneagent.domain.model.CacheStats;
import me.golemcore.sceneagent.domain.service.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Tool result cache statistics and invalidation.
 */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ToolRegistry toolRegistry;

    @GetMapping("/stats")
    public Mono<ResponseEntity<CacheStats>> stats() {
        return Mono.just(ResponseEntity.ok(toolRegistry.cacheStats()));
    }

    @DeleteMapping
    public Mono<ResponseEntity<Map<String, Object>>> invalidate(
            @RequestParam(value = "prefix", required = false) String prefix) {
        int removed = toolRegistry.invalidateCache(prefix);
        return Mono.just(ResponseEntity.ok(Map.of("removed", removed)));
    }
}
