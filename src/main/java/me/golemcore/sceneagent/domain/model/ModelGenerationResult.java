package me.golemcore.sceneagent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a model generation request. Failures are values with
 * {@code recoverable=true} so the caller can continue with other tools.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelGenerationResult {

    private boolean success;
    private String requestId;
    private String modelUrl;

    @Builder.Default
    private List<ModelAsset> modelUrls = new ArrayList<>();

    private String error;
    private boolean recoverable;
    private String message;

    public static ModelGenerationResult failed(String requestId, String error) {
        return ModelGenerationResult.builder()
                .success(false)
                .requestId(requestId)
                .error(error)
                .recoverable(true)
                .message("Failed to generate 3D model. Try a different prompt or continue without a model.")
                .build();
    }
}
