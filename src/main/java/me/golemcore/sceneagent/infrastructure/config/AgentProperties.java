package me.golemcore.sceneagent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the scene agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model providers and model selection</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link CacheProperties} - tool result cache</li>
 * <li>{@link MemoryProperties} - session memory windows</li>
 * <li>{@link ScreenshotProperties} - screenshot bridge</li>
 * <li>{@link ModelGenerationProperties} - 3D model generation and URL
 * probing</li>
 * <li>{@link LoopProperties} - refinement loop budgets</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private CacheProperties cache = new CacheProperties();
    private MemoryProperties memory = new MemoryProperties();
    private ScreenshotProperties screenshot = new ScreenshotProperties();
    private ModelGenerationProperties modelGeneration = new ModelGenerationProperties();
    private LoopProperties loop = new LoopProperties();
    private ObjectStoreProperties objectStore = new ObjectStoreProperties();
    private StorageProperties storage = new StorageProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private Map<String, ProviderProperties> providers = new HashMap<>();

        /** Planner model in {@code provider/model} form. */
        private String model = "openai/gpt-4.1";

        private String visionModel = "openai/gpt-4.1";
        private String codeModel = "openai/gpt-4.1";
        private double temperature = 0.2;
        private int maxTokens = 4096;
        private long timeoutMs = 120000;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private Duration defaultTtl = Duration.ofSeconds(30);

        /** TTL for tools whose execution is slow or billed. */
        private Duration costlyTtl = Duration.ofMinutes(5);
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /** Entries kept per memory window. */
        private int windowSize = 1;

        private int historyLimit = 5;
        private int analysisSummaryLength = 200;
    }

    // ==================== SCREENSHOT BRIDGE ====================

    @Data
    public static class ScreenshotProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private Duration pingInterval = Duration.ofSeconds(25);

        /** Shorter supplied screenshots are treated as placeholders. */
        private int minLength = 100;
    }

    // ==================== MODEL GENERATION ====================

    @Data
    public static class ModelGenerationProperties {
        private String apiUrl;
        private String apiKey;
        private Duration pollInterval = Duration.ofSeconds(3);
        private int validationRounds = 20;
        private Duration validationRoundDelay = Duration.ofSeconds(15);
        private Duration probeTimeout = Duration.ofSeconds(20);
        private int probeRetries = 3;
        private Duration probeRetryDelay = Duration.ofSeconds(1);
        private Duration statusMaxAge = Duration.ofHours(1);
        private Duration statusCleanupInterval = Duration.ofMinutes(10);

        /** Caller-level backstop for one whole generation, polling included. */
        private Duration timeout = Duration.ofMinutes(15);

        private String meshMode = "Quad";
        private String quality = "medium";
        private String material = "pbr";
        private String tier = "Regular";
        private String geometryFileFormat = "glb";
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        /** Max planner calls within one refinement turn. */
        private int maxIterations = 10;

        /** Max tool executions within one refinement turn. */
        private int maxToolExecutions = 30;

        /** Instruction words that trigger 3D model generation. */
        private List<String> modelKeywords = new ArrayList<>(List.of("model", "模型"));
    }

    // ==================== OBJECT STORE ====================

    @Data
    public static class ObjectStoreProperties {
        private String directory = "objects";
        private int defaultLimit = 10;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.sceneagent/workspace";
    }
}
