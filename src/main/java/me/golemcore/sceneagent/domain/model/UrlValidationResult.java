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
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a reachability probe against an asset URL.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UrlValidationResult {

    private boolean valid;
    private String url;
    private Integer statusCode;
    private String contentType;
    private Long contentLength;
    private String error;
    private Long responseTimeMs;

    public static UrlValidationResult invalid(String url, String error) {
        return UrlValidationResult.builder()
                .valid(false)
                .url(url != null ? url : "")
                .error(error)
                .build();
    }
}
