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

package dev.opscrew.domain.capability;

import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.model.ToolDefinition;
import lombok.Getter;

import java.util.Objects;

/**
 * A named, invokable unit exposed to the model: either a tool or an agent that
 * can be delegated to. Callers switch on {@link #getKind()} and then use the
 * matching accessor.
 */
@Getter
public final class Capability {

    private final CapabilityKind kind;
    private final String name;
    private final ToolDefinition definition;
    private final ToolComponent tool;
    private final Agent agent;

    private Capability(CapabilityKind kind, String name, ToolDefinition definition, ToolComponent tool,
            Agent agent) {
        this.kind = kind;
        this.name = name;
        this.definition = definition;
        this.tool = tool;
        this.agent = agent;
    }

    public static Capability ofTool(ToolComponent tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        ToolDefinition definition = tool.getDefinition();
        return new Capability(CapabilityKind.TOOL, definition.getName(), definition, tool, null);
    }

    public static Capability ofAgent(Agent agent) {
        Objects.requireNonNull(agent, "agent must not be null");
        return new Capability(CapabilityKind.AGENT, agent.getName(), agent.getDelegationDefinition(), null, agent);
    }

    public ToolComponent requireTool() {
        if (kind != CapabilityKind.TOOL) {
            throw new IllegalStateException("Capability '" + name + "' is not a tool");
        }
        return tool;
    }

    public Agent requireAgent() {
        if (kind != CapabilityKind.AGENT) {
            throw new IllegalStateException("Capability '" + name + "' is not an agent");
        }
        return agent;
    }

    @Override
    public String toString() {
        return kind + ":" + name;
    }
}
