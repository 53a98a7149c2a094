package me.golemcore.sceneagent.domain.model;

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

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Memory scope of one conversational thread: a code window and a scene window
 * of equal capacity, plus the last code digest and scene snapshot seen.
 * Created on first use of an id and dropped only by an explicit clear.
 */
@Getter
public class SceneSession {

    private final String id;
    private final Instant createdAt;
    private final MemoryWindow<Map<String, Object>> codeWindow;
    private final MemoryWindow<Map<String, Object>> sceneWindow;

    @Setter
    private volatile Instant updatedAt;

    @Setter
    private volatile String lastCodeDigest;

    @Setter
    private volatile List<SceneObjectRecord> lastSceneSnapshot;

    public SceneSession(String id, int windowSize, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.codeWindow = new MemoryWindow<>(windowSize);
        this.sceneWindow = new MemoryWindow<>(windowSize);
    }
}
