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

package dev.opscrew.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.capability.Capability;
import dev.opscrew.domain.capability.CapabilityRegistry;
import dev.opscrew.domain.model.Conversation;
import dev.opscrew.domain.model.LlmChunk;
import dev.opscrew.domain.model.LlmRequest;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.domain.model.ToolFailureKind;
import dev.opscrew.domain.service.ToolInputValidator;
import dev.opscrew.domain.service.ToolResultRenderer;
import dev.opscrew.domain.stream.CancellationToken;
import dev.opscrew.domain.stream.StreamEventSink;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Agent loop (reason, act, observe).
 *
 * <p>
 * Each iteration streams one model turn, appends the assistant message, then
 * answers every requested call in emission order before the model is called
 * again. Reaching the agent's iteration budget stops the loop after the last
 * turn's calls have been answered, so every {@code tool_call} still gets its
 * {@code tool_result}.
 */
@Slf4j
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final String NOT_FOUND_PREFIX = "Tool or agent not found: ";

    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ToolInputValidator inputValidator;
    private final ToolResultRenderer resultRenderer;
    private final ObjectMapper objectMapper;

    public DefaultToolLoopSystem(ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ToolInputValidator inputValidator, ToolResultRenderer resultRenderer, ObjectMapper objectMapper) {
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.inputValidator = inputValidator;
        this.resultRenderer = resultRenderer;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentRunResult run(LoopContext context) {
        Agent agent = context.getAgent();
        Conversation conversation = context.getConversation();
        CapabilityRegistry capabilities = context.getCapabilities() != null ? context.getCapabilities()
                : CapabilityRegistry.empty();
        CancellationToken cancellation = context.getCancellation();
        StreamEventSink events = context.getEvents();

        int maxIterations = agent.getMaxIterations();
        int iterations = 0;
        int toolExecutions = 0;
        String finalText = "";
        StringBuilder streamed = new StringBuilder();

        while (iterations < maxIterations) {
            if (cancellation.isCancelled()) {
                return result(finalText, streamed, iterations, toolExecutions, StopReason.CANCELLED, null);
            }

            // 1) Generate
            iterations++;
            TurnOutput turn = generate(agent, conversation, capabilities, events, cancellation, streamed);
            finalText = turn.text();
            if (turn.error() != null) {
                log.warn("[ToolLoop] {} model stream failed on iteration {}: {}", agent.getName(), iterations,
                        turn.error());
                events.emit(StreamEvent.error(turn.error()));
                return result(finalText, streamed, iterations, toolExecutions, StopReason.MODEL_ERROR,
                        turn.error());
            }
            if (cancellation.isCancelled()) {
                return result(finalText, streamed, iterations, toolExecutions, StopReason.CANCELLED, null);
            }

            // 2) Append assistant turn, even when empty
            List<Message.ToolCall> calls = new ArrayList<>();
            turn.calls().forEach(c -> calls.add(c.call()));
            historyWriter.appendAssistantTurn(conversation, turn.text(), calls);

            // 3) Final answer
            if (calls.isEmpty()) {
                log.debug("[ToolLoop] {} finished after {} iteration(s)", agent.getName(), iterations);
                return result(finalText, streamed, iterations, toolExecutions, StopReason.COMPLETED, null);
            }

            // 4) Answer each call in order
            for (ToolCallAccumulator.AssembledCall assembled : turn.calls()) {
                if (cancellation.isCancelled()) {
                    return result(finalText, streamed, iterations, toolExecutions, StopReason.CANCELLED, null);
                }
                ToolExecutionOutcome outcome = dispatch(assembled, capabilities, context);
                toolExecutions++;

                events.emit(StreamEvent.toolResult(outcome.toolCallId(), outcome.toolName(),
                        resultRenderer.toEventResult(outcome.toolResult())));
                historyWriter.appendToolResult(conversation, outcome,
                        resultRenderer.toMessageContent(outcome.toolResult()));
            }
        }

        log.info("[ToolLoop] {} reached max iterations ({}), stopping", agent.getName(), maxIterations);
        return result(finalText, streamed, iterations, toolExecutions, StopReason.ITERATION_CAP, null);
    }

    private TurnOutput generate(Agent agent, Conversation conversation, CapabilityRegistry capabilities,
            StreamEventSink events, CancellationToken cancellation, StringBuilder streamed) {
        List<ToolDefinition> definitions = capabilities.definitions();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(agent.buildSystemPrompt(definitions))
                .messages(conversation.snapshot())
                .tools(definitions)
                .agentName(agent.getName())
                .build();

        StringBuilder text = new StringBuilder();
        ToolCallAccumulator accumulator = new ToolCallAccumulator(objectMapper);
        try {
            Flux<LlmChunk> flux = agent.getLlmPort().chatStream(request);
            try (Stream<LlmChunk> chunks = flux.toStream()) {
                Iterator<LlmChunk> iterator = chunks.iterator();
                while (iterator.hasNext()) {
                    if (cancellation.isCancelled()) {
                        break;
                    }
                    LlmChunk chunk = iterator.next();
                    if (chunk == null) {
                        continue;
                    }
                    if (chunk.hasText()) {
                        text.append(chunk.getText());
                        streamed.append(chunk.getText());
                        events.emit(StreamEvent.chunk(chunk.getText()));
                    }
                    accumulator.accept(chunk.getToolCallDelta());
                }
            }
        } catch (RuntimeException e) {
            return new TurnOutput(text.toString(), List.of(), safeMessage(e));
        }
        return new TurnOutput(text.toString(), accumulator.complete(), null);
    }

    private ToolExecutionOutcome dispatch(ToolCallAccumulator.AssembledCall assembled,
            CapabilityRegistry capabilities, LoopContext context) {
        Message.ToolCall call = assembled.call();
        Optional<Capability> resolved = capabilities.resolve(call.getName());
        if (resolved.isEmpty()) {
            log.warn("[ToolLoop] {} requested unknown capability '{}'", context.getAgent().getName(),
                    call.getName());
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.NOT_FOUND, NOT_FOUND_PREFIX + call.getName());
        }
        Capability capability = resolved.get();
        context.getEvents().emit(StreamEvent.toolCall(call.getId(), call.getName(), call.getArguments()));

        if (assembled.isMalformed()) {
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.INVALID_INPUT, assembled.parseError());
        }
        Optional<String> invalid = inputValidator.validate(capability.getDefinition().getInputSchema(),
                call.getArguments());
        if (invalid.isPresent()) {
            log.debug("[ToolLoop] Rejected arguments for '{}': {}", call.getName(), invalid.get());
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.INVALID_INPUT,
                    "Invalid input: " + invalid.get());
        }

        try {
            switch (capability.getKind()) {
            case TOOL:
                return toolExecutor.execute(call, capability.requireTool());
            case AGENT:
                if (context.getCancellation().isCancelled()) {
                    return ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED, "Cancelled");
                }
                return context.getDelegation().delegate(capability.requireAgent(), call, context.getEvents(),
                        context.getCancellation());
            default:
                throw new IllegalStateException("Unsupported capability kind: " + capability.getKind());
            }
        } catch (RuntimeException e) {
            log.error("[ToolLoop] Capability '{}' failed", call.getName(), e);
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeMessage(e));
        }
    }

    private AgentRunResult result(String finalText, StringBuilder streamed, int iterations, int toolExecutions,
            StopReason reason, String error) {
        return new AgentRunResult(finalText, streamed.toString(), iterations, toolExecutions, reason, error);
    }

    private static String safeMessage(Throwable error) {
        return DefaultToolExecutor.safeCauseMessage(error);
    }

    private record TurnOutput(String text, List<ToolCallAccumulator.AssembledCall> calls, String error) {
    }
}
