package me.golemcore.sceneagent.tools;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.domain.service.SessionMemoryService;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ObjectStorePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Finds previously stored scene objects so their parameters can be reused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ObjectRetrievalTool implements ToolComponent {

    static final String PARAM_QUERY = "query";
    static final String PARAM_LIMIT = "limit";

    private final ObjectStorePort objectStore;
    private final AgentProperties properties;

    @Override
    public ToolKind getKind() {
        return ToolKind.RETRIEVE_OBJECTS;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Retrieve stored Three.js scene objects by search words or by id (use the 'id:' "
                        + "prefix).")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of("type", "string",
                                        "description", "Search words or id:<objectId>"),
                                PARAM_LIMIT, Map.of("type", "integer",
                                        "description", "Maximum number of results")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        if (!(parameters.get(PARAM_QUERY) instanceof String query) || query.isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Query must be a non-empty string"));
        }
        int limit = parameters.get(PARAM_LIMIT) instanceof Number n && n.intValue() > 0
                ? n.intValue()
                : properties.getObjectStore().getDefaultLimit();

        return objectStore.retrieve(query, limit)
                .thenApply(objects -> {
                    log.debug("[ObjectStore] Retrieved {} objects", objects.size());
                    return ToolResult.success(format(objects), Map.of(
                            "objects", objects,
                            "count", objects.size()));
                })
                .exceptionally(e -> {
                    log.warn("[ObjectStore] Retrieval failed: {}", e.getMessage());
                    return ToolResult.failure("Error retrieving objects: " + e.getMessage());
                });
    }

    private static String format(List<SceneObjectRecord> objects) {
        if (objects.isEmpty()) {
            return "No matching objects found";
        }
        StringBuilder sb = new StringBuilder("Found ").append(objects.size()).append(" objects:");
        for (SceneObjectRecord object : objects) {
            sb.append("\n- ").append(object.getId()).append(": ").append(object.getType())
                    .append(' ').append(object.displayName())
                    .append(" at [").append(SessionMemoryService.joinVector(object.getPosition(), "0, 0, 0")).append(']');
        }
        return sb.toString();
    }
}
