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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event kinds of the orchestrator stream. {@link #wireName()} is the name a
 * transport puts on the wire.
 */
public enum StreamEventType {

    AGENT_SELECTED("agent_selected"),
    AGENT_DELEGATION("agent_delegation"),
    CHUNK("chunk"),
    TOOL_CALL("tool_call"),
    TOOL_RESULT("tool_result"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
