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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolFailureKind;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;
import me.golemcore.sceneagent.port.outbound.ObjectStorePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Persists scene objects together with the prompt that produced them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ObjectWriteTool implements ToolComponent {

    static final String PARAM_OBJECTS = "objects";
    static final String PARAM_PROMPT = "prompt";

    private static final TypeReference<List<SceneObjectRecord>> RECORDS = new TypeReference<>() {
    };

    private final ObjectStorePort objectStore;
    private final ObjectMapper objectMapper;

    @Override
    public ToolKind getKind() {
        return ToolKind.WRITE_OBJECTS;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Store scene objects (id, type, name, position, rotation, scale) with a prompt "
                        + "describing them.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_OBJECTS, Map.of("type", "array",
                                        "description", "Scene objects to store",
                                        "items", Map.of("type", "object")),
                                PARAM_PROMPT, Map.of("type", "string",
                                        "description", "Prompt or note describing the objects")),
                        "required", List.of(PARAM_OBJECTS, PARAM_PROMPT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        List<SceneObjectRecord> objects;
        try {
            objects = objectMapper.convertValue(parameters.get(PARAM_OBJECTS), RECORDS);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Invalid objects: " + e.getMessage()));
        }
        if (objects == null || objects.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "No valid objects to store"));
        }
        String prompt = parameters.get(PARAM_PROMPT) instanceof String p ? p : "";

        return objectStore.store(objects, prompt)
                .thenApply(stored -> {
                    if (!stored) {
                        return ToolResult.failure("Failed to store objects");
                    }
                    log.info("[ObjectStore] Stored {} objects via tool", objects.size());
                    return ToolResult.success("Stored " + objects.size() + " objects",
                            Map.of("count", objects.size()));
                });
    }
}
