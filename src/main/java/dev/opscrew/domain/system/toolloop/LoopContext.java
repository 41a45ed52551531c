package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.capability.CapabilityRegistry;
import dev.opscrew.domain.model.Conversation;
import dev.opscrew.domain.stream.CancellationToken;
import dev.opscrew.domain.stream.StreamEventSink;
import lombok.Builder;
import lombok.Data;

/**
 * Everything a single loop run works with. The conversation belongs to this run
 * alone; the registry is shared and read-only.
 */
@Data
@Builder
public class LoopContext {

    private Agent agent;
    private Conversation conversation;
    private CapabilityRegistry capabilities;

    @Builder.Default
    private StreamEventSink events = StreamEventSink.discarding();

    @Builder.Default
    private DelegationPort delegation = DelegationPort.disabled();

    @Builder.Default
    private CancellationToken cancellation = new CancellationToken();
}
