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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parameters of a 3D model generation job. Unset values are filled from
 * {@code agent.model-generation.*} defaults before submission.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelGenerationOptions {

    private String prompt;
    private List<String> imageUrls;
    private String imageMode; // multi-view, fuse
    private String meshMode; // Raw, Quad, Ultra
    private Boolean meshSimplify;
    private Boolean meshSmooth;
    private String quality; // high, medium, low, extra-low
    private List<Integer> bboxCondition;
    private Boolean useHyper;
    private Boolean taPose;
    private String material; // pbr, shaded
    private String geometryFileFormat; // glb, usdz, fbx, obj, stl
    private String tier;

    public boolean hasInput() {
        return (prompt != null && !prompt.isBlank()) || (imageUrls != null && !imageUrls.isEmpty());
    }
}
