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

import me.golemcore.sceneagent.domain.model.LintDiagnostic;
import me.golemcore.sceneagent.domain.model.ModelHistoryEntry;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the planner prompts from the turn's context: lint diagnostics,
 * session history, generated models and the current scene.
 */
@Component
public class PromptComposer {

    private static final int MODEL_PROMPT_PREVIEW = 20;
    private static final int RESOURCE_NAME_PREVIEW = 30;

    private static final String ROLE_AND_TOOLS = """
            You are a Three.js scene construction and optimization expert with autonomous decision-making and tool-calling capabilities.

            # Important Reminders
            Preserve complete URLs from the context and reuse all necessary URLs. Do not assume any models or URLs.
            After code generation or modification: check scene objects to keep context memory, persist objects, and never duplicate 3D model URLs.

            # Tool Set
            - generate_3d_model: Use only when complex 3D models are needed and existing URLs cannot be reused
            - generate_fix_code: Generate or fix Three.js code
            - apply_patch: Apply code (full code first, unified diffs afterwards)
            - analyze_screenshot: Analyze scene screenshots for visual feedback
            - retrieve_objects: Retrieve stored objects and URLs (query words or id:<id>)
            - write_objects: Persist scene objects

            # Core Workflow
            1. Requirement Analysis: Determine if a new 3D model is needed (only for complex models when existing URLs cannot be reused)
            2. Visual Analysis: If screenshots are available, use analyze_screenshot before changing code
            3. Code Generation: Generate code with generate_fix_code, keeping all historical URLs; adjust positions and sizes to avoid overlap
            4. Code Application: Apply the code with apply_patch
            5. Object Persistence: Save scene objects with write_objects

            # Object Format
            {"id": "cube_123", "type": "mesh", "name": "RedCube", "position": [0, 1, 0], "rotation": [0, 0, 0], "scale": [1, 1, 1]}

            # Output Requirements
            - When finished, answer with the complete Three.js setup() function source code
            - Do not include thought processes or Markdown markup

            # Workflow Process
            To ensure 3D models render correctly, first determine if a new 3D model needs to be generated. Complex models require 3D model generation, while environmental scenes and simple items generally don't.
            """;

    public String systemPrompt(List<LintDiagnostic> diagnostics, String historyContext,
            List<ModelHistoryEntry> modelHistory, List<SceneObjectRecord> sceneState, String sceneHistory) {
        StringBuilder prompt = new StringBuilder(ROLE_AND_TOOLS);

        if (diagnostics != null && !diagnostics.isEmpty()) {
            prompt.append("\n# Current code issues\n");
            for (LintDiagnostic diagnostic : diagnostics) {
                prompt.append(formatDiagnostic(diagnostic)).append('\n');
            }
        }

        if (historyContext != null && !historyContext.isBlank()) {
            prompt.append("\n# Historical Context\n")
                    .append(historyContext)
                    .append("\n\nRefer to the above edit history to keep code style and behavior consistent.\n");
        }

        if (modelHistory != null && !modelHistory.isEmpty()) {
            prompt.append("\n# Recently Generated 3D Models\n");
            for (int i = 0; i < modelHistory.size(); i++) {
                ModelHistoryEntry entry = modelHistory.get(i);
                prompt.append("- [").append(i + 1).append("] ").append(entry.getTimestamp()).append(": ")
                        .append(entry.getModelUrl())
                        .append(" (Requirement: ").append(preview(entry.getPrompt(), MODEL_PROMPT_PREVIEW))
                        .append("...)\n");
            }
            prompt.append("To reuse 3D models, load the URLs above directly.\n");
        }

        if (sceneState != null && !sceneState.isEmpty()) {
            prompt.append("\n# Current Scene State\n")
                    .append("These objects are already in the scene. Consider their positions and properties to ")
                    .append("avoid overlaps:\n");
            for (int i = 0; i < sceneState.size(); i++) {
                prompt.append(formatSceneObject(i + 1, sceneState.get(i))).append('\n');
            }
            prompt.append("\nWhen adding new objects, choose appropriate positions and don't remove existing ")
                    .append("objects.\n");
        }

        if (sceneHistory != null && !sceneHistory.isBlank()) {
            prompt.append("\n# Scene History Record\n")
                    .append(sceneHistory)
                    .append("\n\nRefer to the scene history to keep continuity and avoid conflicts with it.\n");
        }
        return prompt.toString();
    }

    public String userPrompt(String instruction, List<ModelHistoryEntry> modelHistory,
            List<SceneObjectRecord> sceneState, String suggestion, String currentCode) {
        StringBuilder prompt = new StringBuilder(instruction != null ? instruction : "");

        if (modelHistory != null && !modelHistory.isEmpty()) {
            prompt.append("\n\nAvailable model resources:\n");
            for (int i = 0; i < modelHistory.size(); i++) {
                ModelHistoryEntry entry = modelHistory.get(i);
                String name = entry.getPrompt() != null && !entry.getPrompt().isEmpty()
                        ? ellipsize(entry.getPrompt(), RESOURCE_NAME_PREVIEW)
                        : "Model" + (i + 1);
                prompt.append(i + 1).append(". ").append(name).append(": ").append(entry.getModelUrl()).append('\n');
            }
        }

        if (sceneState != null && !sceneState.isEmpty()) {
            prompt.append("\nCurrent scene objects (use THESE EXACT positions):\n");
            for (int i = 0; i < sceneState.size(); i++) {
                SceneObjectRecord object = sceneState.get(i);
                String name = object.getName() != null && !object.getName().isBlank()
                        ? object.getName()
                        : "Object" + i;
                prompt.append(i + 1).append(". ").append(name).append(" (").append(object.getType()).append(") @ [")
                        .append(SessionMemoryService.joinVector(object.getPosition(), "0, 0, 0")).append("]\n");
            }
        }

        prompt.append("\n\nExecution steps:")
                .append("\n1. First consider the scene state positions above")
                .append("\n2. If needed, use retrieve_objects to check stored objects, but never override current ")
                .append("positions")
                .append("\n3. If screenshots are available, analyze with analyze_screenshot")
                .append("\n4. Generate or modify code based on requirements")
                .append("\n5. Apply patches and persist objects");

        if (suggestion != null && !suggestion.isBlank()) {
            prompt.append("\n\n").append(suggestion);
        }
        prompt.append("\n\nCurrent code:\n```javascript\n")
                .append(currentCode != null ? currentCode : "")
                .append("\n```");
        return prompt.toString();
    }

    /**
     * Instruction for a direct code-fix call, used when the planner is skipped
     * or failed.
     */
    public String codeFixInstruction(String instruction, String currentCode, String suggestion,
            List<LintDiagnostic> diagnostics, String modelUrl) {
        StringBuilder prompt = new StringBuilder(instruction != null ? instruction : "");
        if (suggestion != null && !suggestion.isBlank()) {
            prompt.append("\n\nScreenshot analysis result:\n").append(suggestion);
        }
        if (diagnostics != null && !diagnostics.isEmpty()) {
            prompt.append("\n\nFix these code issues:\n");
            for (LintDiagnostic diagnostic : diagnostics) {
                prompt.append(formatDiagnostic(diagnostic)).append('\n');
            }
        }
        if (modelUrl != null && !modelUrl.isBlank()) {
            prompt.append("\n\nLoad the generated 3D model from this URL and keep the comment ")
                    .append(CodeNormalizer.markerComment(modelUrl))
                    .append(" in the code.");
        }
        if (currentCode != null && !currentCode.isBlank()) {
            prompt.append("\n\nCurrent code:\n").append(currentCode);
        }
        return prompt.toString();
    }

    static String formatDiagnostic(LintDiagnostic diagnostic) {
        String ruleId = diagnostic.getRuleId() != null ? diagnostic.getRuleId() : "Unknown rule";
        return "- Line " + diagnostic.getLine() + ":" + diagnostic.getColumn() + " - " + diagnostic.getMessage()
                + " (" + ruleId + ")";
    }

    static String formatSceneObject(int index, SceneObjectRecord object) {
        return "- Object[" + index + "]: type=" + object.getType()
                + ", name=" + (object.getName() != null && !object.getName().isBlank() ? object.getName() : "Unnamed")
                + ", position=(" + SessionMemoryService.joinVector(object.getPosition(), "0, 0, 0") + ")"
                + ", rotation=(" + SessionMemoryService.joinVector(object.getRotation(), "0, 0, 0") + ")"
                + ", scale=(" + SessionMemoryService.joinVector(object.getScale(), "1, 1, 1") + ")";
    }

    private static String preview(String text, int length) {
        if (text == null) {
            return "";
        }
        return text.length() > length ? text.substring(0, length) : text;
    }

    private static String ellipsize(String text, int length) {
        return text.length() > length ? text.substring(0, length) + "..." : text;
    }
}
