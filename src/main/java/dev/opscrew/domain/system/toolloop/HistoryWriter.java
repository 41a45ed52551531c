package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.model.Conversation;
import dev.opscrew.domain.model.Message;

import java.util.List;

/**
 * Appends loop output to a conversation so the next generation turn observes
 * it.
 */
public interface HistoryWriter {

    void appendAssistantTurn(Conversation conversation, String text, List<Message.ToolCall> toolCalls);

    void appendToolResult(Conversation conversation, ToolExecutionOutcome outcome, String content);
}
