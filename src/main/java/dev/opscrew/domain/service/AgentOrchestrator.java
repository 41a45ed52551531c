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
import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.agent.AgentRoster;
import dev.opscrew.domain.capability.CapabilityRegistry;
import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.model.AgentPersonality;
import dev.opscrew.domain.model.Conversation;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.OrchestratorRequest;
import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.domain.model.ToolFailureKind;
import dev.opscrew.domain.model.ToolResult;
import dev.opscrew.domain.stream.CancellationToken;
import dev.opscrew.domain.stream.StreamEventChannel;
import dev.opscrew.domain.stream.StreamEventSink;
import dev.opscrew.domain.system.toolloop.AgentRunResult;
import dev.opscrew.domain.system.toolloop.DelegationPort;
import dev.opscrew.domain.system.toolloop.LoopContext;
import dev.opscrew.domain.system.toolloop.StopReason;
import dev.opscrew.domain.system.toolloop.ToolExecutionOutcome;
import dev.opscrew.domain.system.toolloop.ToolLoopSystem;
import dev.opscrew.infrastructure.config.CrewProperties;
import dev.opscrew.port.inbound.AgentInvocationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level entry point of the crew.
 *
 * <p>
 * Every invocation starts at the coordinator. Calls that resolve to a
 * specialist are delegated: the specialist runs its own loop on a fresh
 * conversation holding only the task, with tools but no agents, and its answer
 * comes back to the coordinator as {@code {"response": text}}. Specialist
 * progress is not forwarded to the caller.
 *
 * <p>
 * The loop runs on the agent scheduler and writes into a bounded
 * {@link StreamEventChannel}; the returned flux drains it.
 */
@Service
@Slf4j
public class AgentOrchestrator implements AgentInvocationPort, DelegationPort {

    public static final String RESPONSE_KEY = "response";

    private final AgentRoster roster;
    private final CapabilityRegistry coordinatorCapabilities;
    private final CapabilityRegistry specialistCapabilities;
    private final ToolLoopSystem toolLoopSystem;
    private final ObjectMapper objectMapper;
    private final Scheduler scheduler;
    private final int bufferCapacity;

    public AgentOrchestrator(AgentRoster roster, CapabilityRegistry capabilityRegistry,
            ToolLoopSystem toolLoopSystem, ObjectMapper objectMapper,
            @Qualifier("agentScheduler") Scheduler scheduler, CrewProperties properties) {
        this.roster = roster;
        this.coordinatorCapabilities = capabilityRegistry;
        this.specialistCapabilities = capabilityRegistry.toolsOnly();
        this.toolLoopSystem = toolLoopSystem;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.bufferCapacity = properties.getStream().getBufferCapacity();
    }

    @Override
    public Flux<StreamEvent> invoke(OrchestratorRequest request) {
        return Flux.defer(() -> {
            CancellationToken token = new CancellationToken();
            StreamEventChannel channel = new StreamEventChannel(bufferCapacity, token);
            scheduler.schedule(() -> run(request, channel, token));
            return channel.asFlux();
        });
    }

    /**
     * Runs one invocation on the calling thread, writing events into the sink.
     * Emits exactly one {@code complete} unless the token gets cancelled.
     */
    public void run(OrchestratorRequest request, StreamEventSink events, CancellationToken token) {
        boolean cancelled = false;
        try {
            Agent coordinator = roster.coordinator();
            String requested = request.getRequestedAgent();
            if (requested != null && !OrchestratorRequest.AUTO_AGENT.equalsIgnoreCase(requested)
                    && !requested.equalsIgnoreCase(coordinator.getName())) {
                log.info("[Orchestrator] Requested agent '{}' is advisory, routing via {}", requested,
                        coordinator.getName());
            }

            events.emit(StreamEvent.agentSelected(coordinator.getPersonality()));

            LoopContext context = LoopContext.builder()
                    .agent(coordinator)
                    .conversation(Conversation.of(request.getMessages()))
                    .capabilities(coordinatorCapabilities)
                    .events(events)
                    .delegation(this)
                    .cancellation(token)
                    .build();
            AgentRunResult result = toolLoopSystem.run(context);
            log.debug("[Orchestrator] {} stopped: {} after {} iteration(s), {} call(s)", coordinator.getName(),
                    result.stopReason(), result.iterations(), result.toolExecutions());
            cancelled = result.isCancelled();
        } catch (RuntimeException | Error e) {
            log.error("[Orchestrator] Invocation failed", e);
            if (!token.isCancelled()) {
                events.emit(StreamEvent.error(e.getMessage() != null ? e.getMessage()
                        : e.getClass().getSimpleName()));
            }
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        } finally {
            if (cancelled || token.isCancelled()) {
                log.debug("[Orchestrator] Invocation cancelled");
            } else {
                events.emit(StreamEvent.complete());
            }
        }
    }

    @Override
    public ToolExecutionOutcome delegate(Agent agent, Message.ToolCall toolCall, StreamEventSink events,
            CancellationToken cancellation) {
        events.emit(StreamEvent.agentDelegation(agent.getPersonality(), toolCall.getArguments()));
        log.info("[Orchestrator] Delegating to {}", agent.getName());

        Conversation subConversation = Conversation.empty();
        subConversation.append(Message.user(renderTask(toolCall.getArguments())));

        LoopContext context = LoopContext.builder()
                .agent(agent)
                .conversation(subConversation)
                .capabilities(specialistCapabilities)
                .events(StreamEventSink.discarding())
                .delegation(DelegationPort.disabled())
                .cancellation(cancellation)
                .build();
        AgentRunResult result = toolLoopSystem.run(context);

        if (result.stopReason() == StopReason.CANCELLED) {
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Delegation to " + agent.getName() + " cancelled");
        }
        if (result.stopReason() == StopReason.MODEL_ERROR) {
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Agent " + agent.getName() + " failed: " + result.errorMessage());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(RESPONSE_KEY, result.streamedText());
        return ToolExecutionOutcome.of(toolCall, ToolResult.success(result.streamedText(), data));
    }

    @Override
    public List<AgentPersonality> getAvailableAgents() {
        List<AgentPersonality> personalities = new ArrayList<>();
        personalities.add(roster.coordinator().getPersonality());
        roster.specialists().forEach(a -> personalities.add(a.getPersonality()));
        return personalities;
    }

    @Override
    public List<ToolDefinition> getAvailableTools() {
        return coordinatorCapabilities.tools().stream().map(ToolComponent::getDefinition).toList();
    }

    private String renderTask(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            log.warn("[Orchestrator] Failed to serialize delegation task: {}", e.getMessage());
            return String.valueOf(arguments);
        }
    }
}
