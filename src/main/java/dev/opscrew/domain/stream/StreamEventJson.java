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

package dev.opscrew.domain.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.model.StreamEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders events as {@code {"type": "...", "data": {...}}} JSON for transports.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamEventJson {

    private final ObjectMapper objectMapper;

    public String render(StreamEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.type().wireName());
        frame.put("data", event.payload());
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.warn("[Stream] Failed to render {} event: {}", event.type().wireName(), e.getMessage());
            return "{\"type\":\"error\",\"data\":{\"message\":\"unrenderable " + event.type().wireName()
                    + " event\"}}";
        }
    }
}
