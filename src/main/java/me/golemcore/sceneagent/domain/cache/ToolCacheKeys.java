package me.golemcore.sceneagent.domain.cache;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys of the form {@code toolName:canonicalJson}.
 *
 * <p>
 * Object keys are sorted at every depth and volatile fields
 * ({@code timestamp}, {@code requestId}) are dropped, so argument maps that
 * differ only in key order or in those fields share a key.
 */
public class ToolCacheKeys {

    private static final Set<String> VOLATILE_FIELDS = Set.of("timestamp", "requestId");

    private final ObjectMapper objectMapper;

    public ToolCacheKeys(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException
     *             if the arguments cannot be serialized
     */
    public String keyFor(String toolName, Map<String, Object> arguments) {
        Object canonical = canonicalize(arguments != null ? arguments : Map.of());
        try {
            return toolName + ":" + objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot build cache key for " + toolName + ": " + e.getOriginalMessage(),
                    e);
        }
    }

    static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (VOLATILE_FIELDS.contains(key)) {
                    continue;
                }
                sorted.put(key, canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(canonicalize(item));
            }
            return copy;
        }
        return value;
    }
}
