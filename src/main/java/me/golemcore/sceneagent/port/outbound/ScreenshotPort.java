package me.golemcore.sceneagent.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a connected rendering client for a screenshot of the current
 * scene.
 */
public interface ScreenshotPort {

    /**
     * Requests a screenshot and completes with base64 image data, or with an
     * empty string when no client is connected, the client reported an error,
     * or the deadline elapsed. Never completes exceptionally.
     *
     * @param requestId
     *            correlation id echoed by the client
     * @param clientId
     *            client to ask, or null to broadcast
     */
    CompletableFuture<String> requestScreenshot(String requestId, String clientId);

    boolean hasConnectedClients();
}
