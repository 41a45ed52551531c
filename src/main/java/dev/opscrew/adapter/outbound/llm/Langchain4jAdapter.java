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

package dev.opscrew.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.opscrew.domain.exception.ConfigurationException;
import dev.opscrew.domain.model.LlmChunk;
import dev.opscrew.domain.model.LlmRequest;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.infrastructure.config.CrewProperties;
import dev.opscrew.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * LLM adapter using the langchain4j streaming chat models.
 *
 * <p>
 * Provider selection happens once, at construction:
 * <ul>
 * <li>Anthropic when {@code crew.llm.anthropic.api-key} is set
 * <li>otherwise OpenAI (or any OpenAI-compatible endpoint) when
 * {@code crew.llm.openai.api-key} is set
 * </ul>
 * Without either key construction fails with a {@link ConfigurationException}.
 *
 * <p>
 * Content deltas are forwarded as they arrive. Tool calls are emitted as
 * complete deltas, one per call, once the provider finishes the response.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    public static final String PROVIDER_ANTHROPIC = "anthropic";
    public static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final ObjectMapper objectMapper;
    private final StreamingChatModel chatModel;
    private final String providerId;
    private final String currentModel;

    @Autowired
    public Langchain4jAdapter(CrewProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        CrewProperties.LlmProperties llm = properties.getLlm();
        if (llm.getAnthropic().hasApiKey()) {
            this.providerId = PROVIDER_ANTHROPIC;
            this.currentModel = llm.getAnthropic().getModel();
            this.chatModel = createAnthropicModel(llm);
        } else if (llm.getOpenai().hasApiKey()) {
            this.providerId = PROVIDER_OPENAI;
            this.currentModel = llm.getOpenai().getModel();
            this.chatModel = createOpenAiModel(llm);
        } else {
            throw new ConfigurationException("No LLM API key provided: set crew.llm.anthropic.api-key"
                    + " or crew.llm.openai.api-key");
        }
        log.info("[LLM] Langchain4j adapter initialized with provider: {}, model: {}", providerId, currentModel);
    }

    // Visible for testing
    Langchain4jAdapter(StreamingChatModel chatModel, String providerId, String currentModel,
            ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.providerId = providerId;
        this.currentModel = currentModel;
        this.objectMapper = objectMapper;
    }

    private StreamingChatModel createAnthropicModel(CrewProperties.LlmProperties llm) {
        CrewProperties.ProviderProperties config = llm.getAnthropic();
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiModel(CrewProperties.LlmProperties llm) {
        CrewProperties.ProviderProperties config = llm.getOpenai();
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                log.trace("[LLM] Streaming {} with {} tools", request.getAgentName(), tools.size());
                chatRequest.toolSpecifications(tools);
            }
            try {
                chatModel.chat(chatRequest.build(), new SinkHandler(sink));
            } catch (RuntimeException e) {
                sink.error(e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return currentModel;
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    private final class SinkHandler implements StreamingChatResponseHandler {

        private final FluxSink<LlmChunk> sink;

        private SinkHandler(FluxSink<LlmChunk> sink) {
            this.sink = sink;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (partialResponse != null && !partialResponse.isEmpty()) {
                sink.next(LlmChunk.text(partialResponse));
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse response) {
            AiMessage aiMessage = response != null ? response.aiMessage() : null;
            if (aiMessage != null && aiMessage.hasToolExecutionRequests()) {
                List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
                for (int i = 0; i < requests.size(); i++) {
                    ToolExecutionRequest ter = requests.get(i);
                    sink.next(LlmChunk.toolCall(i, ter.id(), ter.name(), ter.arguments()));
                }
                log.trace("[LLM] Received {} tool calls", requests.size());
            }
            log.trace("[LLM] Stream finished: {}", response != null ? response.finishReason() : null);
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            log.error("[LLM] Streaming chat failed", error);
            sink.error(error);
        }
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    if (msg.getContent() != null && !msg.getContent().isBlank()) {
                        messages.add(AiMessage.from(msg.getContent(), toolRequests));
                    } else {
                        messages.add(AiMessage.from(toolRequests));
                    }
                } else if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    messages.add(AiMessage.from(msg.getContent()));
                } else {
                    // providers reject empty assistant turns
                    log.trace("[LLM] Skipping empty assistant message");
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent() != null ? msg.getContent() : ""));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }

        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }

        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nestedProps = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nestedProps.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }
}
