package dev.opscrew.port.inbound;

import dev.opscrew.domain.model.AgentPersonality;
import dev.opscrew.domain.model.OrchestratorRequest;
import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.ToolDefinition;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Port through which transports start an agent invocation. Transports render
 * the returned events; they never see the loop itself.
 */
public interface AgentInvocationPort {

    /**
     * Starts an invocation when subscribed. The stream ends with exactly one
     * {@code complete} event; cancelling the subscription stops the run and no
     * further events are delivered.
     */
    Flux<StreamEvent> invoke(OrchestratorRequest request);

    /**
     * Personalities of the coordinator and its specialists, coordinator first.
     */
    List<AgentPersonality> getAvailableAgents();

    /**
     * Definitions of the tools available to every agent.
     */
    List<ToolDefinition> getAvailableTools();
}
