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

package dev.opscrew.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in a conversation between user, assistant and
 * tools. Supports the roles user, assistant, system and tool; tool messages
 * carry the {@code tool_call_id} of the call they answer.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Instant timestamp;

    public static Message user(String content) {
        return Message.builder()
                .role(ROLE_USER)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public static Message assistant(String content) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Deep copy: the tool call list and each call's arguments are copied too, so
     * the copy never shares mutable state with the original.
     */
    public static Message copyOf(Message source) {
        List<ToolCall> calls = null;
        if (source.getToolCalls() != null) {
            calls = new ArrayList<>();
            for (ToolCall tc : source.getToolCalls()) {
                calls.add(ToolCall.copyOf(tc));
            }
        }
        return Message.builder()
                .role(source.getRole())
                .content(source.getContent())
                .toolCalls(calls)
                .toolCallId(source.getToolCallId())
                .toolName(source.getToolName())
                .timestamp(source.getTimestamp())
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and structured arguments.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;

        public static ToolCall copyOf(ToolCall source) {
            return ToolCall.builder()
                    .id(source.getId())
                    .name(source.getName())
                    .arguments(source.getArguments() != null ? new LinkedHashMap<>(source.getArguments()) : null)
                    .build();
        }
    }
}
