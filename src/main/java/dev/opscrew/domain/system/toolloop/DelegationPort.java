package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.ToolFailureKind;
import dev.opscrew.domain.stream.CancellationToken;
import dev.opscrew.domain.stream.StreamEventSink;

/**
 * Handles calls that resolved to an agent instead of a tool: runs the agent's
 * own loop and reports its answer as one observation.
 */
@FunctionalInterface
public interface DelegationPort {

    ToolExecutionOutcome delegate(Agent agent, Message.ToolCall toolCall, StreamEventSink events,
            CancellationToken cancellation);

    /**
     * Used by loops that must not delegate. Their registries hold no agents, so
     * this only answers a call that should not have resolved in the first place.
     */
    static DelegationPort disabled() {
        return (agent, toolCall, events, cancellation) -> ToolExecutionOutcome.synthetic(toolCall,
                ToolFailureKind.POLICY_DENIED, "Delegation to " + agent.getName() + " is not available here");
    }
}
