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

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level invocation request: the client-side conversation, the advisory
 * agent name and an opaque context blob.
 */
@Data
@Builder
public class OrchestratorRequest {

    public static final String AUTO_AGENT = "Auto";

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /**
     * Advisory only. Routing always starts at the coordinator.
     */
    @Builder.Default
    private String requestedAgent = AUTO_AGENT;

    private Object context;

    public static OrchestratorRequest ofUserMessage(String content) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user(content));
        return OrchestratorRequest.builder().messages(messages).build();
    }
}
