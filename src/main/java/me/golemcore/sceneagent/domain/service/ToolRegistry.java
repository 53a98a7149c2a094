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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.cache.ToolCacheKeys;
import me.golemcore.sceneagent.domain.cache.TtlCache;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.CacheStats;
import me.golemcore.sceneagent.domain.model.ToolCategory;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of tools with a result cache in front of them.
 *
 * <p>
 * Tools are keyed by wire name and carry a {@link ToolCategory}. Cached
 * execution looks up {@code toolName:canonicalArgs} first and only calls the
 * tool on a miss. Model generation is never cached since its output is not a
 * function of its input. Exceptions raised by a tool propagate unchanged and
 * nothing is stored for them; failed results are not stored either.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final Map<String, ToolCategory> categories = new ConcurrentHashMap<>();
    private final TtlCache<ToolResult> cache;
    private final ToolCacheKeys cacheKeys;
    private final AgentProperties.CacheProperties settings;

    public ToolRegistry(List<ToolComponent> toolComponents, AgentProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.cache = new TtlCache<>(clock);
        this.cacheKeys = new ToolCacheKeys(objectMapper);
        this.settings = properties.getCache();
        for (ToolComponent tool : toolComponents) {
            register(tool);
        }
        log.info("[Registry] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public void register(ToolComponent tool) {
        register(tool.getToolName(), tool, tool.getKind().getCategory());
    }

    /**
     * Registers or replaces a tool under {@code name}.
     */
    public void register(String name, ToolComponent tool, ToolCategory category) {
        tools.put(name, tool);
        categories.put(name, category);
        log.debug("[Registry] Registered tool '{}' in category {}", name, category);
    }

    public Optional<ToolComponent> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Returns registered tools ordered by name, optionally filtered by category.
     */
    public List<ToolComponent> all(ToolCategory category) {
        return tools.entrySet().stream()
                .filter(e -> category == null || category == categories.get(e.getKey()))
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .toList();
    }

    public List<ToolComponent> all() {
        return all(null);
    }

    public List<ToolDefinition> definitions() {
        return all().stream()
                .filter(ToolComponent::isEnabled)
                .sorted(Comparator.comparing(ToolComponent::getKind))
                .map(ToolComponent::getDefinition)
                .toList();
    }

    /**
     * Executes a tool through the cache, using the TTL that matches its kind.
     * Unknown names complete with an {@code INVALID_INPUT} failure.
     */
    public CompletableFuture<ToolResult> execute(String name, Map<String, Object> arguments) {
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Unknown tool: " + name));
        }
        return executeWithCache(name, arguments, ttlFor(tool.getKind()));
    }

    public CompletableFuture<ToolResult> executeWithCache(String name, Map<String, Object> arguments,
            Duration ttl) {
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Unknown tool: " + name));
        }
        if (!settings.isEnabled() || !tool.isCacheable(arguments)) {
            log.debug("[Registry] Executing '{}' without cache", name);
            return tool.execute(arguments).thenApply(result -> invalidateStale(tool.getKind(), result));
        }

        String key;
        try {
            key = cacheKeys.keyFor(name, arguments);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Cache] Key computation failed for '{}', executing directly: {}", name, e.getMessage());
            return tool.execute(arguments);
        }

        Optional<ToolResult> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("[Cache] Hit for '{}'", name);
            return CompletableFuture.completedFuture(cached.get());
        }

        log.debug("[Cache] Miss for '{}'", name);
        return tool.execute(arguments).thenApply(result -> {
            if (result != null && result.isSuccess()) {
                cache.put(key, result, ttl);
            }
            return result;
        });
    }

    private ToolResult invalidateStale(ToolKind kind, ToolResult result) {
        if (result != null && result.isSuccess()) {
            kind.getInvalidates().forEach(stale -> invalidateCache(stale.getToolName()));
        }
        return result;
    }

    public Duration ttlFor(ToolKind kind) {
        return kind.isCostly() ? settings.getCostlyTtl() : settings.getDefaultTtl();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public int invalidateCache(String prefix) {
        int removed = cache.invalidate(prefix);
        log.info("[Cache] Invalidated {} entries (prefix: {})", removed, prefix != null ? prefix : "*");
        return removed;
    }
}
