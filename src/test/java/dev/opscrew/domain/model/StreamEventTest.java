package dev.opscrew.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamEventTest {

    @Test
    void shouldCopyPayloadDefensively() {
        Map<String, Object> args = new HashMap<>();
        args.put("command", "ls");

        StreamEvent event = StreamEvent.agentDelegation(
                AgentPersonality.builder().name("Kube").build(), args);
        args.put("command", "rm");

        Map<String, Object> task = event.get(StreamEvent.KEY_TASK);
        assertEquals("ls", task.get("command"));
        assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
    }

    @Test
    void shouldBuildToolResultPayload() {
        StreamEvent event = StreamEvent.toolResult("c1", "shell", "Error: Tool or agent not found: shell");

        assertTrue(event.is(StreamEventType.TOOL_RESULT));
        assertEquals("c1", event.get(StreamEvent.KEY_TOOL_CALL_ID));
        assertEquals("shell", event.get(StreamEvent.KEY_NAME));
        assertEquals("tool_result", event.type().wireName());
    }

    @Test
    void shouldDefaultMissingArgsToEmptyMap() {
        StreamEvent event = StreamEvent.toolCall("c1", "shell", null);

        assertEquals(Map.of(), event.get(StreamEvent.KEY_ARGS));
        assertTrue(StreamEvent.complete().payload().isEmpty());
    }
}
