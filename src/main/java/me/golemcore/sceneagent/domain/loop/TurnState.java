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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.sceneagent.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one refinement turn, owned by a single loop invocation.
 */
@Getter
@Setter
class TurnState {

    private final String sessionId;
    private final String instruction;
    private final String originalCode;
    private final List<Message> conversation = new ArrayList<>();
    private final List<String> diagnostics = new ArrayList<>();

    private String code;
    private boolean codeProduced;
    private String modelUrl;
    private String suggestion;
    private int iterations;
    private int toolExecutions;
    private boolean fallbackUsed;
    private String stopReason;

    TurnState(String sessionId, String instruction, String originalCode) {
        this.sessionId = sessionId;
        this.instruction = instruction;
        this.originalCode = originalCode;
        this.code = originalCode;
    }

    void acceptCode(String newCode) {
        this.code = newCode;
        this.codeProduced = true;
    }

    void countToolExecution() {
        toolExecutions++;
    }

    void countIteration() {
        iterations++;
    }

    void note(String diagnostic) {
        diagnostics.add(diagnostic);
    }
}
