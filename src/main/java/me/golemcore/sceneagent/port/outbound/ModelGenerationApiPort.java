package me.golemcore.sceneagent.port.outbound;

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

import me.golemcore.sceneagent.domain.model.ModelAsset;
import me.golemcore.sceneagent.domain.model.ModelGenerationOptions;

import java.util.List;

/**
 * Port for the external 3D generation API. Calls block the calling thread;
 * transport failures surface as {@link ModelGenerationApiException} and missing
 * credentials as {@link IllegalStateException}.
 */
public interface ModelGenerationApiPort {

    /**
     * Fails fast with {@link IllegalStateException} naming the missing property
     * when the API URL or key is not configured.
     */
    void ensureConfigured();

    SubmittedJob submit(ModelGenerationOptions options);

    /**
     * Returns the status of every sub-job of a submitted task.
     */
    List<JobStatus> status(String subscriptionKey);

    List<ModelAsset> download(String taskUuid, String format);

    record SubmittedJob(String taskUuid, String subscriptionKey) {
    }

    record JobStatus(String uuid, String status) {

        public boolean isDone() {
            return "Done".equalsIgnoreCase(status);
        }

        public boolean isFailed() {
            return "Failed".equalsIgnoreCase(status);
        }
    }

    class ModelGenerationApiException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ModelGenerationApiException(String message) {
            super(message);
        }

        public ModelGenerationApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
