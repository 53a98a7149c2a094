package me.golemcore.sceneagent.adapter.outbound.http;

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
import me.golemcore.sceneagent.domain.model.UrlValidationResult;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.UrlValidationPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Checks that an asset URL is reachable with a {@code HEAD} request.
 *
 * <p>
 * Empty, malformed and non-http(s) URLs are rejected without a request.
 * Otherwise the probe follows redirects under {@code probe-timeout} and is
 * retried up to {@code probe-retries} times, {@code probe-retry-delay} apart.
 */
@Component
@Slf4j
public class UrlValidationAdapter implements UrlValidationPort {

    static final String USER_AGENT = "SceneAgent-URL-Validator/1.0";

    private final OkHttpClient httpClient;
    private final AgentProperties.ModelGenerationProperties settings;
    private final Clock clock;

    public UrlValidationAdapter(AgentProperties properties, OkHttpClient baseHttpClient, Clock clock) {
        this.settings = properties.getModelGeneration();
        this.clock = clock;
        long timeoutMs = settings.getProbeTimeout().toMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .followSslRedirects(true)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public UrlValidationResult validate(String url) {
        if (url == null || url.isBlank()) {
            return UrlValidationResult.invalid(url, "Invalid URL: empty or not a string");
        }
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            boolean hasScheme = url.contains("://");
            return UrlValidationResult.invalid(url, hasScheme && !url.startsWith("http")
                    ? "Invalid protocol: only http and https are supported"
                    : "Invalid URL format");
        }

        int attempts = Math.max(1, settings.getProbeRetries());
        UrlValidationResult last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            last = probe(url);
            if (last.isValid()) {
                return last;
            }
            log.debug("[UrlProbe] Attempt {}/{} failed: {}", attempt, attempts, last.getError());
            if (attempt < attempts) {
                sleep(settings.getProbeRetryDelay());
            }
        }
        return last;
    }

    private UrlValidationResult probe(String url) {
        long start = clock.millis();
        Request request = new Request.Builder()
                .url(url)
                .head()
                .header("User-Agent", USER_AGENT)
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            long elapsed = clock.millis() - start;
            String length = response.header("Content-Length");
            return UrlValidationResult.builder()
                    .valid(response.isSuccessful())
                    .url(url)
                    .statusCode(response.code())
                    .contentType(response.header("Content-Type"))
                    .contentLength(parseLength(length))
                    .responseTimeMs(elapsed)
                    .error(response.isSuccessful() ? null : "HTTP error: " + response.code())
                    .build();
        } catch (IOException e) {
            return UrlValidationResult.builder()
                    .valid(false)
                    .url(url)
                    .responseTimeMs(clock.millis() - start)
                    .error("Request failed: " + e.getMessage())
                    .build();
        }
    }

    private static Long parseLength(String header) {
        if (header == null) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("URL validation interrupted", e);
        }
    }
}
