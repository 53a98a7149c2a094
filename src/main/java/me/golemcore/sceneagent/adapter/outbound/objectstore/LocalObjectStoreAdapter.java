package me.golemcore.sceneagent.adapter.outbound.objectstore;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ObjectStorePort;
import me.golemcore.sceneagent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Scene object store backed by a JSONL file in the local workspace.
 *
 * <p>
 * Each stored object becomes one line holding the record, the prompt that
 * produced it and the store time. Retrieval is either {@code id:<id>} or a
 * free-text query scored by the number of matching terms across type, name,
 * id, prompt and payload, ties broken newest first.
 */
@Component
@Slf4j
public class LocalObjectStoreAdapter implements ObjectStorePort {

    static final String FILE_NAME = "scene-objects.jsonl";
    private static final String ID_PREFIX = "id:";

    private final StoragePort storage;
    private final ObjectMapper objectMapper;
    private final AgentProperties.ObjectStoreProperties settings;
    private final Clock clock;

    public LocalObjectStoreAdapter(StoragePort storage, ObjectMapper objectMapper, AgentProperties properties,
            Clock clock) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.settings = properties.getObjectStore();
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Boolean> store(List<SceneObjectRecord> objects, String prompt) {
        if (objects == null || objects.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        StringBuilder lines = new StringBuilder();
        Instant now = clock.instant();
        try {
            for (SceneObjectRecord object : objects) {
                String id = object.getId() != null && !object.getId().isBlank()
                        ? object.getId()
                        : "obj-" + UUID.randomUUID();
                StoredObject stored = StoredObject.builder()
                        .object(copyWithId(object, id))
                        .prompt(prompt)
                        .storedAt(now)
                        .build();
                lines.append(objectMapper.writeValueAsString(stored)).append('\n');
            }
        } catch (JsonProcessingException e) {
            log.warn("[ObjectStore] Failed to serialize objects: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(false);
        }
        return storage.appendText(settings.getDirectory(), FILE_NAME, lines.toString())
                .thenApply(ignored -> {
                    log.info("[ObjectStore] Stored {} object(s)", objects.size());
                    return true;
                })
                .exceptionally(ex -> {
                    log.warn("[ObjectStore] Failed to store objects: {}", ex.getMessage());
                    return false;
                });
    }

    @Override
    public CompletableFuture<List<SceneObjectRecord>> retrieve(String query, int limit) {
        int max = limit > 0 ? limit : settings.getDefaultLimit();
        return readAll().thenApply(all -> {
            List<StoredObject> newestFirst = new ArrayList<>(all);
            Collections.reverse(newestFirst);
            String q = query != null ? query.trim() : "";

            if (q.regionMatches(true, 0, ID_PREFIX, 0, ID_PREFIX.length())) {
                String id = q.substring(ID_PREFIX.length()).trim();
                return newestFirst.stream()
                        .filter(s -> id.equals(s.getObject().getId()))
                        .limit(max)
                        .map(StoredObject::getObject)
                        .toList();
            }

            List<String> terms = Arrays.stream(q.toLowerCase(Locale.ROOT).split("\\s+"))
                    .filter(t -> !t.isBlank())
                    .toList();
            if (terms.isEmpty()) {
                return newestFirst.stream().limit(max).map(StoredObject::getObject).toList();
            }

            List<ScoredObject> scored = new ArrayList<>();
            for (int i = 0; i < newestFirst.size(); i++) {
                int score = score(newestFirst.get(i), terms);
                if (score > 0) {
                    scored.add(new ScoredObject(newestFirst.get(i).getObject(), score, i));
                }
            }
            return scored.stream()
                    .sorted(Comparator.comparingInt(ScoredObject::score).reversed()
                            .thenComparingInt(ScoredObject::recency))
                    .limit(max)
                    .map(ScoredObject::object)
                    .toList();
        });
    }

    @Override
    public CompletableFuture<List<String>> listIds() {
        return readAll().thenApply(all -> {
            Set<String> ids = new LinkedHashSet<>();
            for (StoredObject stored : all) {
                ids.add(stored.getObject().getId());
            }
            return List.copyOf(ids);
        });
    }

    private CompletableFuture<List<StoredObject>> readAll() {
        return storage.getText(settings.getDirectory(), FILE_NAME).thenApply(text -> {
            if (text == null || text.isBlank()) {
                return List.<StoredObject>of();
            }
            List<StoredObject> result = new ArrayList<>();
            for (String line : text.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    StoredObject stored = objectMapper.readValue(line, StoredObject.class);
                    if (stored.getObject() != null) {
                        result.add(stored);
                    }
                } catch (JsonProcessingException e) {
                    log.debug("[ObjectStore] Skipping malformed line: {}", e.getOriginalMessage());
                }
            }
            return result;
        });
    }

    private static int score(StoredObject stored, List<String> terms) {
        SceneObjectRecord object = stored.getObject();
        String haystack = String.join(" ",
                nullToEmpty(object.getType()),
                nullToEmpty(object.getName()),
                nullToEmpty(object.getId()),
                nullToEmpty(stored.getPrompt()),
                nullToEmpty(object.getObjectData())).toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            if (haystack.contains(term)) {
                score++;
            }
        }
        return score;
    }

    private static SceneObjectRecord copyWithId(SceneObjectRecord object, String id) {
        return SceneObjectRecord.builder()
                .id(id)
                .type(object.getType())
                .name(object.getName())
                .position(object.getPosition())
                .rotation(object.getRotation())
                .scale(object.getScale())
                .objectData(object.getObjectData())
                .build();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private record ScoredObject(SceneObjectRecord object, int score, int recency) {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredObject {
        private SceneObjectRecord object;
        private String prompt;
        private Instant storedAt;
    }
}
