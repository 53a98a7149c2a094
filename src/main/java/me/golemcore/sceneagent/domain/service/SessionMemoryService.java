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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.model.MemoryWindow;
import me.golemcore.sceneagent.domain.model.ModelHistoryEntry;
import me.golemcore.sceneagent.domain.model.SceneHistoryEntry;
import me.golemcore.sceneagent.domain.model.SceneObjectRecord;
import me.golemcore.sceneagent.domain.model.SceneSession;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Bounded per-session memory of code, scene and model state.
 *
 * <p>
 * Every session owns two windows of capacity {@code agent.memory.window-size}:
 * a code window (analysis summaries, code digests, model history) and a scene
 * window (scene snapshots). {@code load} merges the payloads currently held in
 * a window, later entries overriding earlier keys, so derived writes read the
 * merged payload, update one key and save it back.
 *
 * <p>
 * Memory is advisory: every read or write failure is logged and treated as
 * empty memory.
 */
@Service
@Slf4j
public class SessionMemoryService {

    public static final String KEY_MODEL_HISTORY = "modelHistory";
    public static final String KEY_SCENE_HISTORY = "sceneHistory";
    public static final String KEY_ANALYSIS_SUMMARY = "analysisSummary";
    public static final String KEY_ANALYSIS_TIMESTAMP = "analysisTimestamp";
    public static final String KEY_CODE_DIGEST = "codeDigest";
    public static final String KEY_CODE_SIZE = "codeSize";
    public static final String KEY_CODE_TIMESTAMP = "codeTimestamp";
    public static final String KEY_LAST_UPDATE = "lastUpdateTimestamp";

    private static final int DIGEST_SLICE = 40;
    private static final int PROMPT_PREVIEW = 30;

    private final Map<String, SceneSession> sessions = new ConcurrentHashMap<>();
    private final AgentProperties.MemoryProperties settings;
    private final Clock clock;

    public SessionMemoryService(AgentProperties properties, Clock clock) {
        this.settings = properties.getMemory();
        this.clock = clock;
    }

    public SceneSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId,
                id -> new SceneSession(id, settings.getWindowSize(), clock.instant()));
    }

    public Optional<SceneSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    // ===== Window primitives =====

    public void saveCode(String sessionId, String inputKey, Map<String, Object> payload) {
        save(sessionId, SceneSession::getCodeWindow, inputKey, payload, "code");
    }

    public Map<String, Object> loadCode(String sessionId) {
        return load(sessionId, SceneSession::getCodeWindow, "code");
    }

    public void saveScene(String sessionId, String inputKey, Map<String, Object> payload) {
        save(sessionId, SceneSession::getSceneWindow, inputKey, payload, "scene");
    }

    public Map<String, Object> loadScene(String sessionId) {
        return load(sessionId, SceneSession::getSceneWindow, "scene");
    }

    private void save(String sessionId, Function<SceneSession, MemoryWindow<Map<String, Object>>> window,
            String inputKey, Map<String, Object> payload, String windowName) {
        try {
            SceneSession session = getOrCreate(sessionId);
            Instant now = clock.instant();
            window.apply(session).save(inputKey, Map.copyOf(withoutNulls(payload)), now);
            session.setUpdatedAt(now);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Memory] Failed to save {} memory for session {}: {}", windowName, sessionId, e.getMessage());
        }
    }

    private Map<String, Object> load(String sessionId,
            Function<SceneSession, MemoryWindow<Map<String, Object>>> window, String windowName) {
        try {
            SceneSession session = sessions.get(sessionId);
            if (session == null) {
                return Map.of();
            }
            Map<String, Object> merged = new LinkedHashMap<>();
            for (MemoryWindow.Entry<Map<String, Object>> entry : window.apply(session).entries()) {
                merged.putAll(entry.value());
            }
            return merged;
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Memory] Failed to load {} memory for session {}: {}", windowName, sessionId, e.getMessage());
            return Map.of();
        }
    }

    // ===== Derived operations =====

    /**
     * Fixed-format summary of a code blob: the first and last 40 characters
     * around the total length.
     */
    public static String codeDigest(String code) {
        if (code == null || code.isEmpty()) {
            return "[empty code]";
        }
        String head = code.substring(0, Math.min(DIGEST_SLICE, code.length()));
        String tail = code.substring(Math.max(0, code.length() - DIGEST_SLICE));
        return head + "...[" + code.length() + " chars]..." + tail;
    }

    public void recordModelGenerated(String sessionId, String modelUrl, String prompt) {
        Map<String, Object> payload = new LinkedHashMap<>(loadCode(sessionId));
        List<ModelHistoryEntry> history = new ArrayList<>(typedList(payload.get(KEY_MODEL_HISTORY),
                ModelHistoryEntry.class));
        history.add(ModelHistoryEntry.builder()
                .modelUrl(modelUrl)
                .prompt(prompt)
                .timestamp(clock.instant())
                .build());
        payload.put(KEY_MODEL_HISTORY, List.copyOf(trim(history)));
        saveCode(sessionId, prompt, payload);
        log.info("[Memory] Model recorded for session {}, history size {}", sessionId,
                Math.min(history.size(), settings.getHistoryLimit()));
    }

    public void recordSceneSnapshot(String sessionId, String prompt, List<SceneObjectRecord> objects) {
        List<SceneObjectRecord> snapshot = objects != null ? List.copyOf(objects) : List.of();
        Map<String, Object> payload = new LinkedHashMap<>(loadScene(sessionId));
        List<SceneHistoryEntry> history = new ArrayList<>(typedList(payload.get(KEY_SCENE_HISTORY),
                SceneHistoryEntry.class));
        history.add(SceneHistoryEntry.builder()
                .timestamp(clock.instant())
                .prompt(prompt)
                .objectCount(snapshot.size())
                .objects(new ArrayList<>(snapshot))
                .build());
        List<SceneHistoryEntry> trimmed = trim(history);
        payload.put(KEY_SCENE_HISTORY, List.copyOf(trimmed));
        payload.put(KEY_LAST_UPDATE, clock.instant().toString());
        saveScene(sessionId, prompt, payload);
        find(sessionId).ifPresent(session -> session.setLastSceneSnapshot(snapshot));
        log.info("[Memory] Scene state saved: {} objects, history: {} entries", snapshot.size(), trimmed.size());
    }

    /**
     * Stores an analysis summary truncated to
     * {@code agent.memory.analysis-summary-length} characters.
     */
    public void saveAnalysis(String sessionId, String prompt, String analysisText) {
        String text = analysisText != null ? analysisText : "";
        int limit = settings.getAnalysisSummaryLength();
        String summary = text.length() > limit ? text.substring(0, limit) + "..." : text;
        Map<String, Object> payload = new LinkedHashMap<>(loadCode(sessionId));
        payload.put(KEY_ANALYSIS_SUMMARY, summary);
        payload.put(KEY_ANALYSIS_TIMESTAMP, clock.instant().toString());
        saveCode(sessionId, prompt, payload);
        log.debug("[Memory] Analysis saved with prompt: \"{}...\"", preview(prompt, PROMPT_PREVIEW));
    }

    public void recordCodeState(String sessionId, String prompt, String code) {
        String digest = codeDigest(code);
        Map<String, Object> payload = new LinkedHashMap<>(loadCode(sessionId));
        payload.put(KEY_CODE_DIGEST, digest);
        payload.put(KEY_CODE_SIZE, code != null ? code.length() : 0);
        payload.put(KEY_CODE_TIMESTAMP, clock.instant().toString());
        saveCode(sessionId, prompt, payload);
        find(sessionId).ifPresent(session -> session.setLastCodeDigest(digest));
    }

    public List<ModelHistoryEntry> loadModelHistory(String sessionId) {
        return typedList(loadCode(sessionId).get(KEY_MODEL_HISTORY), ModelHistoryEntry.class);
    }

    public List<SceneHistoryEntry> loadSceneHistory(String sessionId) {
        return typedList(loadScene(sessionId).get(KEY_SCENE_HISTORY), SceneHistoryEntry.class);
    }

    public List<SceneObjectRecord> loadLatestSceneObjects(String sessionId) {
        List<SceneHistoryEntry> history = loadSceneHistory(sessionId);
        if (history.isEmpty()) {
            return List.of();
        }
        List<SceneObjectRecord> objects = history.get(history.size() - 1).getObjects();
        return objects != null ? List.copyOf(objects) : List.of();
    }

    /**
     * Renders the code window as prompt text, or an empty string when nothing
     * is stored.
     */
    public String formatHistoryForPrompt(String sessionId) {
        Map<String, Object> code = loadCode(sessionId);
        if (code.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        Object summary = code.get(KEY_ANALYSIS_SUMMARY);
        if (summary != null) {
            sb.append("- Last analysis (").append(code.get(KEY_ANALYSIS_TIMESTAMP)).append("): ")
                    .append(summary).append('\n');
        }
        Object digest = code.get(KEY_CODE_DIGEST);
        if (digest != null) {
            sb.append("- Last code (").append(code.get(KEY_CODE_SIZE)).append(" chars): ")
                    .append(digest).append('\n');
        }
        List<ModelHistoryEntry> models = typedList(code.get(KEY_MODEL_HISTORY), ModelHistoryEntry.class);
        if (!models.isEmpty()) {
            sb.append("- Generated models: ").append(models.size()).append(", latest ")
                    .append(models.get(models.size() - 1).getModelUrl()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders the scene history window, one block per snapshot.
     */
    public String formatSceneHistoryForPrompt(String sessionId) {
        List<SceneHistoryEntry> history = loadSceneHistory(sessionId);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < history.size(); i++) {
            SceneHistoryEntry entry = history.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("Scene history [").append(i + 1).append("] - ").append(entry.getTimestamp()).append(":\n");
            sb.append("- Requirement: \"").append(entry.getPrompt()).append("\"\n");
            sb.append("- Object count: ").append(entry.getObjectCount());
            for (SceneObjectRecord object : entry.getObjects()) {
                sb.append("\n  * ").append(object.getType()).append(": ").append(object.displayName())
                        .append(" at position [").append(joinVector(object.getPosition(), "0, 0, 0")).append(']');
            }
        }
        return sb.toString();
    }

    /**
     * Read-only view of a session's memory for diagnostics.
     */
    public Map<String, Object> snapshot(String sessionId) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("sessionId", sessionId);
        view.put("windowSize", settings.getWindowSize());
        SceneSession session = sessions.get(sessionId);
        view.put("exists", session != null);
        if (session != null) {
            view.put("createdAt", session.getCreatedAt());
            view.put("updatedAt", session.getUpdatedAt());
            view.put("lastCodeDigest", session.getLastCodeDigest());
        }
        view.put("code", loadCode(sessionId));
        view.put("scene", loadScene(sessionId));
        return view;
    }

    /**
     * Drops both memory windows of a session.
     *
     * @return true if the session existed
     */
    public boolean clear(String sessionId) {
        SceneSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("[Memory] Memory cleared for session {}", sessionId);
        }
        return removed != null;
    }

    public static String joinVector(List<Double> vector, String fallback) {
        if (vector == null || vector.isEmpty()) {
            return fallback;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < vector.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(vector.get(i));
        }
        return sb.toString();
    }

    private <T> List<T> trim(List<T> history) {
        int limit = settings.getHistoryLimit();
        return history.size() > limit ? history.subList(history.size() - limit, history.size()) : history;
    }

    private static <T> List<T> typedList(Object value, Class<T> type) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<T> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (type.isInstance(item)) {
                result.add(type.cast(item));
            }
        }
        return result;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> payload) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        return copy;
    }

    private static String preview(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) : text;
    }
}
