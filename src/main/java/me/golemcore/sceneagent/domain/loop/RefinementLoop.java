package me.golemcore.sceneagent.domain.loop;

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

import me.golemcore.sceneagent.domain.model.RefinementRequest;
import me.golemcore.sceneagent.domain.model.RefinementResult;

/**
 * Runs one refinement turn: analyze, optionally generate assets, fix and apply
 * code, persist.
 */
public interface RefinementLoop {

    /**
     * @throws IllegalArgumentException
     *             if the request carries no instruction
     * @throws IllegalStateException
     *             if a required external service is not configured
     */
    RefinementResult refine(RefinementRequest request);
}
