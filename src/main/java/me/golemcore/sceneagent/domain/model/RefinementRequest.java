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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of one refinement turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefinementRequest {

    private String sessionId;
    private String instruction;
    private String currentCode;

    /** Base64 or data-URL image of the current render, if the caller has one. */
    private String screenshot;

    /** Ask the connected client for a fresh screenshot when none is supplied. */
    private boolean requestScreenshot;

    private boolean renderingComplete;

    /** Pins the screenshot request to one client instead of broadcasting. */
    private String clientId;

    /** Pre-computed visual analysis text from an earlier turn. */
    private String suggestion;

    @Builder.Default
    private List<LintDiagnostic> lintDiagnostics = new ArrayList<>();

    @Builder.Default
    private List<SceneObjectRecord> sceneObjects = new ArrayList<>();

    /** Forces asset generation even when the instruction has no trigger word. */
    private boolean modelRequired;

    /** Overrides {@code agent.loop.max-iterations} for this turn. */
    private Integer maxIterations;

    public boolean hasScreenshot() {
        return screenshot != null && !screenshot.isBlank();
    }

    public boolean hasSceneObjects() {
        return sceneObjects != null && !sceneObjects.isEmpty();
    }
}
