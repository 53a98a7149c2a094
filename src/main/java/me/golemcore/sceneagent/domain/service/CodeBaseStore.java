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
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last full code version per session, the base that incremental patches are
 * applied against.
 */
@Service
@Slf4j
public class CodeBaseStore {

    private final Map<String, String> codeBySession = new ConcurrentHashMap<>();

    public Optional<String> get(String sessionId) {
        return Optional.ofNullable(codeBySession.get(sessionId));
    }

    public void put(String sessionId, String code) {
        codeBySession.put(sessionId, code);
        log.debug("[Patch] Cached code base for session {} ({} chars)", sessionId, code.length());
    }

    public boolean clear(String sessionId) {
        return codeBySession.remove(sessionId) != null;
    }
}
