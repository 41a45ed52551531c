package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.ToolFailureKind;
import dev.opscrew.domain.model.ToolResult;

/**
 * Result of a single capability call (tool run, delegation, or synthetic).
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            capability name (as used in history)
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param synthetic
 *            whether this result was produced without running anything
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, boolean synthetic) {

    public static ToolExecutionOutcome of(Message.ToolCall toolCall, ToolResult result) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, false);
    }

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                true);
    }
}
