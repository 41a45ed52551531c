package dev.opscrew.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.model.LlmChunk;
import dev.opscrew.domain.model.Message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Assembles streamed tool-call deltas into complete calls.
 *
 * <p>
 * Deltas are grouped by index (falling back to the provider id when a provider
 * sends no index). The first non-empty id and name win; argument fragments are
 * concatenated and parsed once the turn's stream has ended. Not thread-safe:
 * one accumulator per generation turn.
 */
public class ToolCallAccumulator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Map<Object, Partial> partials = new LinkedHashMap<>();
    private Object lastKey;

    public ToolCallAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void accept(LlmChunk.ToolCallDelta delta) {
        if (delta == null) {
            return;
        }
        Object key = keyOf(delta);
        Partial partial = partials.computeIfAbsent(key, k -> new Partial());
        lastKey = key;
        if (partial.id == null && delta.getId() != null && !delta.getId().isBlank()) {
            partial.id = delta.getId();
        }
        if (partial.name == null && delta.getName() != null && !delta.getName().isBlank()) {
            partial.name = delta.getName();
        }
        if (delta.getArgumentsFragment() != null) {
            partial.arguments.append(delta.getArgumentsFragment());
        }
    }

    public boolean isEmpty() {
        return partials.isEmpty();
    }

    /**
     * Completed calls in emission order. Calls whose arguments do not parse
     * carry an empty argument map and a {@code parseError}.
     */
    public List<AssembledCall> complete() {
        List<AssembledCall> calls = new ArrayList<>();
        for (Partial partial : partials.values()) {
            String id = partial.id != null ? partial.id : "call_" + UUID.randomUUID().toString().replace("-", "");
            String rawArguments = partial.arguments.toString();
            Map<String, Object> arguments = new LinkedHashMap<>();
            String parseError = null;
            if (!rawArguments.isBlank()) {
                try {
                    Map<String, Object> parsed = objectMapper.readValue(rawArguments, MAP_TYPE_REF);
                    if (parsed != null) {
                        arguments.putAll(parsed);
                    }
                } catch (JsonProcessingException e) {
                    parseError = "Invalid arguments JSON: " + e.getOriginalMessage();
                }
            }
            Message.ToolCall call = Message.ToolCall.builder()
                    .id(id)
                    .name(partial.name != null ? partial.name : "")
                    .arguments(arguments)
                    .build();
            calls.add(new AssembledCall(call, parseError));
        }
        return calls;
    }

    private Object keyOf(LlmChunk.ToolCallDelta delta) {
        if (delta.getIndex() != null) {
            return delta.getIndex();
        }
        if (delta.getId() != null && !delta.getId().isBlank()) {
            return delta.getId();
        }
        // continuation fragment without index or id
        return lastKey != null ? lastKey : 0;
    }

    public record AssembledCall(Message.ToolCall call, String parseError) {

        public boolean isMalformed() {
            return parseError != null;
        }
    }

    private static final class Partial {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
