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

import lombok.Builder;
import lombok.Data;

/**
 * Image attached to a model message, carried as base64 text. Used to hand a
 * rendered scene screenshot to the vision model.
 */
@Data
@Builder
public class Attachment {

    private String mimeType;
    private String dataBase64;

    /**
     * Builds an attachment from either a bare base64 string or a
     * {@code data:image/...;base64,} URL.
     */
    public static Attachment fromImage(String image) {
        if (image != null && image.startsWith("data:")) {
            int comma = image.indexOf(',');
            int semicolon = image.indexOf(';');
            String mime = semicolon > 5 ? image.substring(5, semicolon) : "image/png";
            return Attachment.builder()
                    .mimeType(mime)
                    .dataBase64(comma >= 0 ? image.substring(comma + 1) : "")
                    .build();
        }
        return Attachment.builder()
                .mimeType("image/png")
                .dataBase64(image)
                .build();
    }
}
