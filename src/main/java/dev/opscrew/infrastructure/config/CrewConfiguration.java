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

package dev.opscrew.infrastructure.config;

import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.agent.AgentRoster;
import dev.opscrew.domain.agent.BuiltinPersonalities;
import dev.opscrew.domain.capability.CapabilityRegistry;
import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.exception.ConfigurationException;
import dev.opscrew.domain.model.AgentPersonality;
import dev.opscrew.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the crew once at startup: the coordinator, its specialists and the
 * capability registry they share.
 */
@Configuration
@Slf4j
public class CrewConfiguration {

    @Bean
    public AgentRoster agentRoster(LlmPort llmPort, CrewProperties properties) {
        int maxIterations = properties.getLoop().getMaxIterations();
        CrewProperties.AgentsProperties agents = properties.getAgents();

        AgentPersonality coordinator = personality(agents.getCoordinator());
        List<Agent> specialists = new ArrayList<>();
        for (String name : agents.getSpecialists()) {
            AgentPersonality specialist = personality(name);
            if (specialist.name().equals(coordinator.name())) {
                throw new ConfigurationException("Coordinator cannot also be a specialist: " + name);
            }
            specialists.add(new Agent(specialist, llmPort, maxIterations));
        }
        log.info("[Crew] Coordinator {} with {} specialist(s)", coordinator.name(), specialists.size());
        return new AgentRoster(new Agent(coordinator, llmPort, maxIterations), specialists);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(AgentRoster roster, List<ToolComponent> tools) {
        return CapabilityRegistry.builder()
                .agents(roster.specialists())
                .tools(tools)
                .build();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler agentScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "crew-agent");
    }

    private AgentPersonality personality(String name) {
        return BuiltinPersonalities.byName(name)
                .orElseThrow(() -> new ConfigurationException("Unknown agent personality: " + name));
    }
}
