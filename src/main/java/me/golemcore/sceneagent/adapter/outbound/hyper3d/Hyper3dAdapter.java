package me.golemcore.sceneagent.adapter.outbound.hyper3d;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sceneagent.domain.model.ModelAsset;
import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;
import me.golemcore.sceneagent.infrastructure.config.AgentProperties;
import me.golemcore.sceneagent.port.outbound.ModelGenerationApiPort;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Hyper3D Rodin adapter, communicating with the generation REST API over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /rodin - multipart job submission (prompt and/or reference
 * images)</li>
 * <li>POST /status - sub-job statuses for a subscription key</li>
 * <li>POST /download - downloadable files of a finished task</li>
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.model-generation.api-url} - API base URL</li>
 * <li>{@code agent.model-generation.api-key} - Bearer token</li>
 * </ul>
 */
@Component
@Slf4j
public class Hyper3dAdapter implements ModelGenerationApiPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType IMAGE = MediaType.get("image/jpeg");

    private final AgentProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public Hyper3dAdapter(AgentProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void ensureConfigured() {
        AgentProperties.ModelGenerationProperties settings = properties.getModelGeneration();
        if (settings.getApiUrl() == null || settings.getApiUrl().isBlank()) {
            throw new IllegalStateException("Model generation API not configured. "
                    + "Set agent.model-generation.api-url");
        }
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new IllegalStateException("Model generation API key not configured. "
                    + "Set agent.model-generation.api-key");
        }
    }

    @Override
    public SubmittedJob submit(ModelGenerationOptions options) {
        ensureConfigured();
        MultipartBody.Builder form = new MultipartBody.Builder().setType(MultipartBody.FORM);
        form.addFormDataPart("tier", options.getTier() != null ? options.getTier() : "Regular");
        if (options.getPrompt() != null && !options.getPrompt().isBlank()) {
            form.addFormDataPart("prompt", options.getPrompt());
        }

        List<String> imageUrls = options.getImageUrls() != null ? options.getImageUrls() : List.of();
        for (int i = 0; i < imageUrls.size(); i++) {
            form.addFormDataPart("images", "image" + i + ".jpg", RequestBody.create(fetchImage(imageUrls.get(i)),
                    IMAGE));
        }
        if (imageUrls.size() > 1) {
            form.addFormDataPart("condition_mode", "fuse".equals(options.getImageMode()) ? "fuse" : "concat");
        }

        String meshMode = options.getMeshMode() != null ? options.getMeshMode() : "Quad";
        form.addFormDataPart("mesh_mode", meshMode);
        if ("Raw".equals(meshMode)) {
            form.addFormDataPart("mesh_simplify", String.valueOf(!Boolean.FALSE.equals(options.getMeshSimplify())));
        } else if ("Quad".equals(meshMode)) {
            form.addFormDataPart("mesh_smooth", String.valueOf(!Boolean.FALSE.equals(options.getMeshSmooth())));
            form.addFormDataPart("quality", options.getQuality() != null ? options.getQuality() : "medium");
        }

        if (options.getBboxCondition() != null) {
            for (Integer condition : options.getBboxCondition()) {
                form.addFormDataPart("bbox_condition", String.valueOf(condition));
            }
        }

        form.addFormDataPart("use_hyper", String.valueOf(Boolean.TRUE.equals(options.getUseHyper())));
        form.addFormDataPart("TAPose", String.valueOf(Boolean.TRUE.equals(options.getTaPose())));
        form.addFormDataPart("material", materialValue(options.getMaterial()));
        form.addFormDataPart("geometry_file_format", geometryFormat(options.getGeometryFileFormat()));

        JsonNode response = post("/rodin", form.build());
        String taskUuid = response.path("uuid").asText(null);
        String subscriptionKey = response.path("jobs").path("subscription_key").asText(null);
        if (taskUuid == null || subscriptionKey == null) {
            throw new ModelGenerationApiException("Hyper3D response is missing uuid or subscription_key");
        }
        log.debug("[Hyper3D] Submitted task {}", taskUuid);
        return new SubmittedJob(taskUuid, subscriptionKey);
    }

    @Override
    public List<JobStatus> status(String subscriptionKey) {
        JsonNode response = postJson("/status", Map.of("subscription_key", subscriptionKey));
        List<JobStatus> jobs = new ArrayList<>();
        for (JsonNode job : response.path("jobs")) {
            jobs.add(new JobStatus(job.path("uuid").asText(""), job.path("status").asText("")));
        }
        log.trace("[Hyper3D] Status: {}", jobs);
        return jobs;
    }

    @Override
    public List<ModelAsset> download(String taskUuid, String format) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task_uuid", taskUuid);
        if (format != null) {
            body.put("format", format);
        }
        JsonNode response = postJson("/download", body);
        List<ModelAsset> assets = new ArrayList<>();
        for (JsonNode item : response.path("list")) {
            String name = item.path("name").asText("");
            int dot = name.lastIndexOf('.');
            String extension = dot >= 0 ? name.substring(dot + 1) : "";
            assets.add(ModelAsset.builder()
                    .name(taskUuid + "." + extension)
                    .originalName(name)
                    .format(extension.toLowerCase(Locale.ROOT))
                    .url(item.path("url").asText(null))
                    .build());
        }
        return assets;
    }

    static String materialValue(String material) {
        if (material == null || "pbr".equals(material)) {
            return "PBR";
        }
        if ("shaded".equals(material)) {
            return "Shaded";
        }
        return material;
    }

    static String geometryFormat(String format) {
        if (format == null || "usdz".equals(format)) {
            return "glb";
        }
        return format;
    }

    private JsonNode postJson(String path, Map<String, Object> body) {
        ensureConfigured();
        try {
            return post(path, RequestBody.create(objectMapper.writeValueAsString(body), JSON));
        } catch (JsonProcessingException e) {
            throw new ModelGenerationApiException("Failed to serialize request for " + path, e);
        }
    }

    private JsonNode post(String path, RequestBody body) {
        AgentProperties.ModelGenerationProperties settings = properties.getModelGeneration();
        Request request = new Request.Builder()
                .url(stripTrailingSlash(settings.getApiUrl()) + path)
                .header("Authorization", "Bearer " + settings.getApiKey())
                .post(body)
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new ModelGenerationApiException("Hyper3D API error: " + response.code() + " - " + text);
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new ModelGenerationApiException("Hyper3D request to " + path + " failed: " + e.getMessage(), e);
        }
    }

    private byte[] fetchImage(String url) {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new ModelGenerationApiException("Failed to fetch reference image: HTTP " + response.code());
            }
            return body.bytes();
        } catch (IOException e) {
            throw new ModelGenerationApiException("Failed to fetch reference image: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
