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

/**
 * One incremental piece of a streamed model response: a content delta, a
 * tool-call delta, or both.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private ToolCallDelta toolCallDelta;

    public static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    public static LlmChunk toolCall(int index, String id, String name, String argumentsJson) {
        return LlmChunk.builder()
                .toolCallDelta(ToolCallDelta.builder()
                        .index(index)
                        .id(id)
                        .name(name)
                        .argumentsFragment(argumentsJson)
                        .build())
                .build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * Partial tool call. Deltas sharing an index belong to the same call; the
     * argument fragments concatenate into one JSON object.
     */
    @Data
    @Builder
    public static class ToolCallDelta {
        private Integer index;
        private String id;
        private String name;
        private String argumentsFragment;
    }
}
