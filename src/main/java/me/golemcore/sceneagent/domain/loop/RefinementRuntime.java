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

import me.golemcore.sceneagent.domain.service.CodeBaseStore;
import me.golemcore.sceneagent.domain.service.PromptComposer;
import me.golemcore.sceneagent.domain.service.SessionMemoryService;
import me.golemcore.sceneagent.domain.service.ToolRegistry;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ObjectStorePort;

/**
 * Process-wide services a refinement turn works against. Built once at startup
 * and handed to the loop by reference.
 */
public record RefinementRuntime(ToolRegistry registry,SessionMemoryService memory,CodeBaseStore codeBase,ObjectStorePort objectStore,PromptComposer prompts,AgentProperties properties){}
