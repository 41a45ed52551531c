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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed progress event of an orchestrator invocation.
 *
 * <p>
 * Payload shapes are fixed per type and only produced by the factory methods:
 * <ul>
 * <li>{@code agent_selected{personality}}
 * <li>{@code agent_delegation{to, task}}
 * <li>{@code chunk{text}}
 * <li>{@code tool_call{id, name, args}}
 * <li>{@code tool_result{tool_call_id, name, result}}
 * <li>{@code complete{}}
 * <li>{@code error{message}}
 * </ul>
 */
public record StreamEvent(StreamEventType type, Map<String, Object> payload) {

    public static final String KEY_PERSONALITY = "personality";
    public static final String KEY_TO = "to";
    public static final String KEY_TASK = "task";
    public static final String KEY_TEXT = "text";
    public static final String KEY_ID = "id";
    public static final String KEY_NAME = "name";
    public static final String KEY_ARGS = "args";
    public static final String KEY_TOOL_CALL_ID = "tool_call_id";
    public static final String KEY_RESULT = "result";
    public static final String KEY_MESSAGE = "message";

    public StreamEvent {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public static StreamEvent agentSelected(AgentPersonality personality) {
        return of(StreamEventType.AGENT_SELECTED, KEY_PERSONALITY, personality);
    }

    public static StreamEvent agentDelegation(AgentPersonality to, Map<String, Object> task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_TO, to);
        payload.put(KEY_TASK, task != null ? Collections.unmodifiableMap(new LinkedHashMap<>(task)) : Map.of());
        return new StreamEvent(StreamEventType.AGENT_DELEGATION, payload);
    }

    public static StreamEvent chunk(String text) {
        return of(StreamEventType.CHUNK, KEY_TEXT, text);
    }

    public static StreamEvent toolCall(String id, String name, Map<String, Object> args) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_ID, id);
        payload.put(KEY_NAME, name);
        payload.put(KEY_ARGS, args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of());
        return new StreamEvent(StreamEventType.TOOL_CALL, payload);
    }

    public static StreamEvent toolResult(String toolCallId, String name, Object result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_TOOL_CALL_ID, toolCallId);
        payload.put(KEY_NAME, name);
        payload.put(KEY_RESULT, result);
        return new StreamEvent(StreamEventType.TOOL_RESULT, payload);
    }

    public static StreamEvent complete() {
        return new StreamEvent(StreamEventType.COMPLETE, Map.of());
    }

    public static StreamEvent error(String message) {
        return of(StreamEventType.ERROR, KEY_MESSAGE, message);
    }

    private static StreamEvent of(StreamEventType type, String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return new StreamEvent(type, payload);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) payload.get(key);
    }

    public boolean is(StreamEventType other) {
        return type == other;
    }
}
