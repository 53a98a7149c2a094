package me.golemcore.sceneagent.adapter.inbound.web;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Reactive WebSocket endpoint for rendering clients. Each connection becomes
 * one {@link ScreenshotBridge} client; JSON text frames are handed to the
 * bridge and bridge events are written back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScreenshotWebSocketHandler implements WebSocketHandler {

    private final ScreenshotBridge bridge;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String clientId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: clientId={}", clientId);

        Mono<Void> outbound = session.send(bridge.connect(clientId).map(session::textMessage));
        Mono<Void> inbound = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(message -> bridge.onMessage(clientId, message.getPayloadAsText()))
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: clientId={}, signal={}", clientId, signal);
                    bridge.disconnect(clientId);
                })
                .then();
        return Mono.when(inbound, outbound);
    }
}
