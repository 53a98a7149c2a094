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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ScreenshotPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Asks connected rendering clients for screenshots and hands their replies
 * back to the waiting caller.
 *
 * <p>
 * Wire events are JSON objects with a {@code type} field:
 * <ul>
 * <li>server to client: {@code connection_established {clientId}},
 * {@code request_screenshot {requestId, timestamp}}, {@code ping {timestamp}}
 * <li>client to server: {@code provide_screenshot {requestId, screenshot}},
 * {@code provide_screenshot_error {requestId, error}}, {@code pong}
 * </ul>
 *
 * <p>
 * Every pending request leaves the table through {@link #resolve}, whether a
 * screenshot arrives, the client reports an error, or the deadline fires, so
 * each request id is resolved at most once.
 */
@Component
@Slf4j
public class ScreenshotBridge implements ScreenshotPort {

    static final String TYPE_CONNECTION_ESTABLISHED = "connection_established";
    static final String TYPE_REQUEST_SCREENSHOT = "request_screenshot";
    static final String TYPE_PROVIDE_SCREENSHOT = "provide_screenshot";
    static final String TYPE_PROVIDE_SCREENSHOT_ERROR = "provide_screenshot_error";
    static final String TYPE_PING = "ping";
    static final String TYPE_PONG = "pong";

    private static final String KEY_TYPE = "type";
    private static final String KEY_REQUEST_ID = "requestId";
    private static final String KEY_TIMESTAMP = "timestamp";

    private final AgentProperties.ScreenshotProperties settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ClientConnection> clients = new ConcurrentHashMap<>();
    private final Map<String, PendingScreenshot> pending = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;

    public ScreenshotBridge(AgentProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.settings = properties.getScreenshot();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "screenshot-bridge");
            t.setDaemon(true);
            return t;
        });
        long pingMs = settings.getPingInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::pingClients, pingMs, pingMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stop() {
        List.copyOf(pending.keySet()).forEach(requestId -> resolve(requestId, "", "shutdown"));
        clients.values().forEach(client -> client.outbound().tryEmitComplete());
        clients.clear();
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    // ===== Client lifecycle =====

    /**
     * Registers a client and returns the stream of events to send to it.
     */
    public Flux<String> connect(String clientId) {
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        ClientConnection connection = new ClientConnection(clientId, outbound);
        clients.put(clientId, connection);
        log.info("[Screenshot] Client connected: {} ({} total)", clientId, clients.size());
        send(connection, event(TYPE_CONNECTION_ESTABLISHED, Map.of("clientId", clientId)));
        return outbound.asFlux();
    }

    public void disconnect(String clientId) {
        ClientConnection removed = clients.remove(clientId);
        if (removed != null) {
            removed.outbound().tryEmitComplete();
            log.info("[Screenshot] Client disconnected: {} ({} remaining)", clientId, clients.size());
        }
    }

    @Override
    public boolean hasConnectedClients() {
        return !clients.isEmpty();
    }

    int pendingCount() {
        return pending.size();
    }

    boolean isPending(String requestId) {
        return pending.containsKey(requestId);
    }

    // ===== Requests =====

    @Override
    public CompletableFuture<String> requestScreenshot(String requestId, String clientId) {
        if (clients.isEmpty()) {
            log.warn("[Screenshot] No connected clients, cannot request screenshot {}", requestId);
            return CompletableFuture.completedFuture("");
        }
        if (scheduler == null) {
            throw new IllegalStateException("Screenshot bridge is not started");
        }

        CompletableFuture<String> future = new CompletableFuture<>();
        PendingScreenshot record = new PendingScreenshot(clock.instant(), clientId, future);
        PendingScreenshot existing = pending.putIfAbsent(requestId, record);
        if (existing != null) {
            log.debug("[Screenshot] Request {} already pending", requestId);
            return existing.future();
        }
        record.setTimer(scheduler.schedule(() -> resolve(requestId, "", "timeout"),
                settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_REQUEST_ID, requestId);
        payload.put(KEY_TIMESTAMP, clock.millis());
        String message = event(TYPE_REQUEST_SCREENSHOT, payload);

        ClientConnection pinned = clientId != null ? clients.get(clientId) : null;
        if (pinned != null) {
            log.debug("[Screenshot] Requesting {} from client {}", requestId, clientId);
            send(pinned, message);
        } else {
            if (clientId != null) {
                log.debug("[Screenshot] Client {} not connected, broadcasting {}", clientId, requestId);
            }
            clients.values().forEach(client -> send(client, message));
        }
        return future;
    }

    /**
     * Removes the pending record and completes its future. Returns false when
     * the id was already resolved or never requested.
     */
    boolean resolve(String requestId, String screenshot, String reason) {
        if (requestId == null) {
            return false;
        }
        PendingScreenshot record = pending.remove(requestId);
        if (record == null) {
            log.debug("[Screenshot] Ignoring {} for unknown or resolved request {}", reason, requestId);
            return false;
        }
        record.cancelTimer();
        record.future().complete(screenshot != null ? screenshot : "");
        log.info("[Screenshot] Request {} resolved ({}) after {}ms, pinned client: {}", requestId, reason,
                clock.millis() - record.createdAt().toEpochMilli(),
                record.clientId() != null ? record.clientId() : "none");
        return true;
    }

    // ===== Inbound events =====

    public void onMessage(String clientId, String payload) {
        JsonNode json;
        try {
            json = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Screenshot] Unreadable message from {}: {}", clientId, e.getOriginalMessage());
            return;
        }
        String type = json.path(KEY_TYPE).asText("");
        String requestId = json.hasNonNull(KEY_REQUEST_ID) ? json.get(KEY_REQUEST_ID).asText() : null;

        switch (type) {
        case TYPE_PROVIDE_SCREENSHOT -> {
            String screenshot = json.path("screenshot").asText("");
            log.debug("[Screenshot] Received {} chars for {} from {}", screenshot.length(), requestId, clientId);
            resolve(requestId, screenshot, "screenshot");
        }
        case TYPE_PROVIDE_SCREENSHOT_ERROR -> {
            log.warn("[Screenshot] Client {} failed request {}: {}", clientId, requestId,
                    json.path("error").asText("unknown error"));
            resolve(requestId, "", "client error");
        }
        case TYPE_PONG -> log.trace("[Screenshot] Pong from {}", clientId);
        default -> log.debug("[Screenshot] Ignoring event '{}' from {}", type, clientId);
        }
    }

    private void pingClients() {
        if (clients.isEmpty()) {
            return;
        }
        String ping = event(TYPE_PING, Map.of(KEY_TIMESTAMP, clock.millis()));
        clients.values().forEach(client -> send(client, ping));
    }

    private String event(String type, Map<String, Object> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_TYPE, type);
        payload.putAll(fields);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type + " event", e);
        }
    }

    private void send(ClientConnection client, String message) {
        Sinks.EmitResult result;
        synchronized (client) {
            result = client.outbound().tryEmitNext(message);
        }
        if (result.isFailure()) {
            log.warn("[Screenshot] Failed to send to {}: {}", client.clientId(), result);
        }
    }

    private record ClientConnection(String clientId,Sinks.Many<String> outbound){}

    private static final class PendingScreenshot {

        private final Instant createdAt;
        private final String clientId;
        private final CompletableFuture<String> future;
        private volatile ScheduledFuture<?> timer;

        PendingScreenshot(Instant createdAt, String clientId, CompletableFuture<String> future) {
            this.createdAt = createdAt;
            this.clientId = clientId;
            this.future = future;
        }

        void setTimer(ScheduledFuture<?> timer) {
            this.timer = timer;
        }

        void cancelTimer() {
            ScheduledFuture<?> current = timer;
            if (current != null) {
                current.cancel(false);
            }
        }

        Instant createdAt() {
            return createdAt;
        }

        String clientId() {
            return clientId;
        }

        CompletableFuture<String> future() {
            return future;
        }
    }
}
