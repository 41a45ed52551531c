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

package dev.opscrew.domain.agent;

import dev.opscrew.domain.exception.ConfigurationException;
import dev.opscrew.domain.model.AgentPersonality;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.port.outbound.LlmPort;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * An agent: a personality bound to a model session and an iteration budget.
 *
 * <p>
 * Agents are created once at startup and shared by all invocations; they hold
 * no per-request state. Construction fails with a
 * {@link ConfigurationException} when the model session has no credentials.
 */
@Getter
public class Agent {

    public static final String PARAM_TASK = "task";
    public static final int DEFAULT_MAX_ITERATIONS = 5;

    private final AgentPersonality personality;
    private final LlmPort llmPort;
    private final int maxIterations;

    public Agent(AgentPersonality personality, LlmPort llmPort) {
        this(personality, llmPort, DEFAULT_MAX_ITERATIONS);
    }

    public Agent(AgentPersonality personality, LlmPort llmPort, int maxIterations) {
        if (personality == null || personality.name() == null || personality.name().isBlank()) {
            throw new ConfigurationException("Agent personality must have a name");
        }
        if (llmPort == null || !llmPort.isAvailable()) {
            throw new ConfigurationException(
                    "No LLM API key provided for agent initialization: " + personality.name());
        }
        if (maxIterations < 1) {
            throw new ConfigurationException("maxIterations must be positive for agent " + personality.name());
        }
        this.personality = personality;
        this.llmPort = llmPort;
        this.maxIterations = maxIterations;
    }

    public String getName() {
        return personality.name();
    }

    /**
     * Function-calling definition under which a coordinator can delegate to
     * this agent. The model is asked for a {@code task}, but nothing is
     * required: whatever arguments the call carries are handed to the
     * sub-agent as JSON in its only user message.
     */
    public ToolDefinition getDelegationDefinition() {
        return ToolDefinition.builder()
                .name(personality.name())
                .description("Delegate a task to " + personality.name() + " " + nullToEmpty(personality.icon())
                        + ": " + nullToEmpty(personality.expertise()))
                .inputSchema(ToolDefinition.objectSchema(
                        Map.of(PARAM_TASK, Map.of("description", "Self-contained description of the sub-task")),
                        List.of()))
                .build();
    }

    /**
     * System prompt for one request: the personality prompt followed by a plain
     * text listing of the capabilities on offer.
     */
    public String buildSystemPrompt(List<ToolDefinition> capabilities) {
        String base = nullToEmpty(personality.systemPrompt());
        if (capabilities == null || capabilities.isEmpty()) {
            return base;
        }
        StringBuilder sb = new StringBuilder(base);
        sb.append("\n\nYou have access to the following tools:\n");
        for (ToolDefinition definition : capabilities) {
            sb.append(definition.getName()).append(": ").append(nullToEmpty(definition.getDescription()).strip())
                    .append('\n');
        }
        sb.append("\nYou must use these tools to answer the user's request.");
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    @Override
    public String toString() {
        return "Agent[" + personality.name() + "]";
    }
}
