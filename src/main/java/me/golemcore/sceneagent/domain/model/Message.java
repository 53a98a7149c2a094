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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single message exchanged with the planning or generation model. Supports
 * the user, assistant, system and tool roles, tool calls requested by the
 * model, and image attachments for vision requests.
 */
@Data
@Builder
public class Message {

    private String role; // user, assistant, system, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private List<Attachment> attachments;
    private Instant timestamp;

    public static Message user(String content) {
        return Message.builder()
                .role("user")
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isToolMessage() {
        return "tool".equals(role);
    }

    /**
     * Checks if this message contains tool calls from the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }

    /**
     * Represents a function call requested by the model. Contains the tool name,
     * ID for correlation, and JSON arguments.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
