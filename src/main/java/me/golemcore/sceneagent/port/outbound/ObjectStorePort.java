package me.golemcore.sceneagent.port.outbound;

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

import me.golemcore.sceneagent.domain.model.SceneObjectRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the scene object store: persists object snapshots with the prompt
 * that produced them and finds them again by text or id.
 */
public interface ObjectStorePort {

    /**
     * Stores the given objects.
     *
     * @return future completing with false if nothing could be stored
     */
    CompletableFuture<Boolean> store(List<SceneObjectRecord> objects, String prompt);

    /**
     * Finds objects by free text (case-insensitive term match, newest first) or
     * by {@code id:<id>}.
     */
    CompletableFuture<List<SceneObjectRecord>> retrieve(String query, int limit);

    CompletableFuture<List<String>> listIds();
}
