package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.model.Message;

/**
 * Hexagonal outbound port for executing a single tool call.
 *
 * <p>
 * ToolLoopSystem is the owner of the loop; it invokes this port for each call
 * that resolved to a tool. Implementations never throw.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(Message.ToolCall toolCall, ToolComponent tool);
}
