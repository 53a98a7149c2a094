package me.golemcore.sceneagent.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * {@link StoragePort} over a workspace directory on the local disk.
 *
 * <p>
 * The root comes from {@code agent.storage.local.base-path}; a literal
 * {@code ${user.home}} in it is expanded. Every resolved path must stay inside
 * the root.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    private final AgentProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        root = Path.of(configured.replace(USER_HOME_PLACEHOLDER, System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        Path objects = root.resolve(properties.getObjectStore().getDirectory());
        try {
            Files.createDirectories(objects);
            log.info("[Storage] Workspace ready at {}", root);
        } catch (IOException e) {
            log.error("[Storage] Cannot create workspace {}", objects, e);
        }
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolve(directory, path);
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, content, UTF_8, CREATE, APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            try {
                return Files.readString(file, UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + file, e);
            }
        });
    }

    private Path resolve(String directory, String path) {
        Path file = root.resolve(directory).resolve(path).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new IllegalArgumentException("Path escapes workspace: " + directory + "/" + path);
        }
        return file;
    }
}
