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
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structural fit/gap report for a rendered scene. Failures keep
 * {@code needsImprovements=true} and carry an {@code errorType} so the loop
 * still proceeds to code correction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScreenshotAnalysis {

    public static final String ERROR_SOCKET_REQUEST_FAILED = "socket_request_failed";
    public static final String ERROR_INVALID_SCREENSHOT_DATA = "invalid_screenshot_data";
    public static final String ERROR_INVALID_IMAGE_FORMAT = "invalid_image_format";
    public static final String ERROR_ANALYSIS_FAILURE = "analysis_failure";

    private String status; // success, error
    private String analysis;

    @JsonProperty("matches_requirements")
    private boolean matchesRequirements;

    @JsonProperty("needs_improvements")
    private boolean needsImprovements;

    @JsonProperty("key_improvements")
    private String keyImprovements;

    private String recommendation;
    private String source; // supplied, bridge

    @JsonProperty("error_type")
    private String errorType;

    private String message;

    public boolean isSuccessful() {
        return "success".equals(status);
    }

    public static ScreenshotAnalysis error(String errorType, String message) {
        return ScreenshotAnalysis.builder()
                .status("error")
                .errorType(errorType)
                .message(message)
                .matchesRequirements(false)
                .needsImprovements(true)
                .recommendation("Proceed with code improvements based on the user requirements")
                .build();
    }
}
