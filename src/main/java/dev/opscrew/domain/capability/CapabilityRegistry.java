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
import dev.opscrew.domain.exception.ConfigurationException;
import dev.opscrew.domain.model.ToolDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name to capability mapping presented to an agent's model session.
 *
 * <p>
 * Names are unique across tools and agents; {@link Builder#build()} rejects a
 * collision. Instances never change after construction and are shared across
 * concurrent invocations without locking.
 *
 * <p>
 * Specialists get {@link #toolsOnly()}: a registry without agents, which caps
 * delegation depth at one.
 */
@Slf4j
public final class CapabilityRegistry {

    private final Map<String, Capability> agents;
    private final Map<String, Capability> tools;
    private final List<ToolDefinition> definitions;

    private CapabilityRegistry(Map<String, Capability> agents, Map<String, Capability> tools) {
        this.agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        List<ToolDefinition> defs = new ArrayList<>();
        this.agents.values().forEach(c -> defs.add(c.getDefinition()));
        this.tools.values().forEach(c -> defs.add(c.getDefinition()));
        this.definitions = Collections.unmodifiableList(defs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CapabilityRegistry empty() {
        return new CapabilityRegistry(Map.of(), Map.of());
    }

    /**
     * Resolves a model-supplied name. Agents are consulted before tools.
     */
    public Optional<Capability> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Capability agent = agents.get(name);
        if (agent != null) {
            return Optional.of(agent);
        }
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Schemas advertised to the model, agents first.
     */
    public List<ToolDefinition> definitions() {
        return definitions;
    }

    public CapabilityRegistry toolsOnly() {
        if (agents.isEmpty()) {
            return this;
        }
        return new CapabilityRegistry(Map.of(), tools);
    }

    public boolean containsAgents() {
        return !agents.isEmpty();
    }

    public List<Agent> agents() {
        return agents.values().stream().map(Capability::getAgent).toList();
    }

    public List<ToolComponent> tools() {
        return tools.values().stream().map(Capability::getTool).toList();
    }

    public Map<String, Capability> all() {
        Map<String, Capability> merged = new LinkedHashMap<>(agents);
        merged.putAll(tools);
        return Collections.unmodifiableMap(merged);
    }

    public int size() {
        return agents.size() + tools.size();
    }

    public static final class Builder {

        private final Map<String, Capability> agents = new LinkedHashMap<>();
        private final Map<String, Capability> tools = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a tool. Disabled tools are skipped.
         */
        public Builder tool(ToolComponent tool) {
            if (!tool.isEnabled()) {
                log.info("[Registry] Skipping disabled tool: {}", tool.getToolName());
                return this;
            }
            Capability capability = Capability.ofTool(tool);
            checkUnique(capability.getName());
            tools.put(capability.getName(), capability);
            return this;
        }

        public Builder tools(List<? extends ToolComponent> toolComponents) {
            if (toolComponents != null) {
                toolComponents.forEach(this::tool);
            }
            return this;
        }

        public Builder agent(Agent agent) {
            Capability capability = Capability.ofAgent(agent);
            checkUnique(capability.getName());
            agents.put(capability.getName(), capability);
            return this;
        }

        public Builder agents(List<Agent> delegableAgents) {
            if (delegableAgents != null) {
                delegableAgents.forEach(this::agent);
            }
            return this;
        }

        public CapabilityRegistry build() {
            CapabilityRegistry registry = new CapabilityRegistry(agents, tools);
            log.info("[Registry] Built with agents {} and tools {}", agents.keySet(), tools.keySet());
            return registry;
        }

        private void checkUnique(String name) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Capability name must not be blank");
            }
            if (agents.containsKey(name) || tools.containsKey(name)) {
                throw new ConfigurationException("Duplicate capability name: " + name);
            }
        }
    }
}
