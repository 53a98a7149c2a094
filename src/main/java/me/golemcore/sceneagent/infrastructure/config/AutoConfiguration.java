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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.component.ToolComponent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared beans and startup logging.
 *
 * <p>
 * Provides the process-wide {@link Clock} and {@link ObjectMapper} and reports
 * the effective model, storage and budget settings once on startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;
    private final List<ToolComponent> tools;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Scene agent starting...");
        log.info("Planner model: {}, code model: {}, vision model: {}", properties.getLlm().getModel(),
                properties.getLlm().getCodeModel(), properties.getLlm().getVisionModel());
        log.info("Storage path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Memory window size: {}, loop budget: {} iterations / {} tool executions",
                properties.getMemory().getWindowSize(), properties.getLoop().getMaxIterations(),
                properties.getLoop().getMaxToolExecutions());
        log.info("Tools available: {}", tools.stream().map(ToolComponent::getToolName).toList());
    }
}
