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

package dev.opscrew.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.model.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link ToolResult} into the two forms the loop needs: the value put
 * in the {@code tool_result} event and the text of the tool-role message the
 * model observes next turn.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolResultRenderer {

    private static final int MAX_MESSAGE_LENGTH = 100_000;

    private final ObjectMapper objectMapper;

    /**
     * Structured data when the tool produced any, otherwise the output text, or
     * {@code "Error: ..."} for a failure without data.
     */
    public Object toEventResult(ToolResult result) {
        if (result == null) {
            return "Error: no result";
        }
        if (result.getData() != null) {
            return result.getData();
        }
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "";
        }
        return "Error: " + result.getError();
    }

    public String toMessageContent(ToolResult result) {
        Object eventResult = toEventResult(result);
        String content;
        if (eventResult instanceof String text) {
            content = text;
        } else {
            try {
                content = objectMapper.writeValueAsString(eventResult);
            } catch (JsonProcessingException e) {
                log.warn("[Tools] Failed to serialize tool result: {}", e.getMessage());
                content = String.valueOf(eventResult);
            }
        }
        if (content.length() > MAX_MESSAGE_LENGTH) {
            content = content.substring(0, MAX_MESSAGE_LENGTH) + "\n[Output truncated...]";
        }
        return content;
    }
}
