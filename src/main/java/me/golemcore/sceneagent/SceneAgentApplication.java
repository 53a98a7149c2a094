package me.golemcore.sceneagent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the scene agent.
 *
 * <p>
 * The scene agent iteratively edits a generated Three.js scene script until
 * it matches the user's instruction. It drives a closed set of tools (code
 * fix, patch apply, 3D model generation, screenshot analysis, object
 * retrieval and storage) from a planning model, keeps bounded per-session
 * memory, asks connected browsers for screenshots over WebSocket, and polls
 * long-running model generation jobs.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, screenshot WebSocket
 * Domain Layer       → RefinementLoop, ToolRegistry, SessionMemoryService
 * Infrastructure     → LLM/Hyper3D/URL probe/Storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code agent.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class SceneAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SceneAgentApplication.class, args);
    }

}
