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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress record for one model generation request, queryable by id while the
 * job runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelGenerationStatus {

    private String requestId;
    private Status status;
    private Phase phase;
    private Instant startTime;
    private Instant updatedAt;
    private String prompt;
    private String modelUrl;
    private String error;
    private int validationRound;

    public boolean isFinished() {
        return status == Status.COMPLETED || status == Status.FAILED;
    }

    public enum Status {
        PENDING("pending"), COMPLETED("completed"), FAILED("failed");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    /**
     * Fine-grained position in the submit, poll, validate pipeline.
     */
    public enum Phase {
        SUBMITTED("submitted"), POLLING("polling"), VALIDATING("validating"), READY("ready"), FAILED("failed");

        private final String value;

        Phase(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
