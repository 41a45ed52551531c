package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.model.Conversation;
import dev.opscrew.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantTurn(Conversation conversation, String text, List<Message.ToolCall> toolCalls) {
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(text != null ? text : "")
                .toolCalls(toolCalls != null && !toolCalls.isEmpty() ? List.copyOf(toolCalls) : null)
                .timestamp(now())
                .build();

        conversation.append(assistant);
    }

    @Override
    public void appendToolResult(Conversation conversation, ToolExecutionOutcome outcome, String content) {
        Message toolMsg = Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(content)
                .timestamp(now())
                .build();

        conversation.append(toolMsg);
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
