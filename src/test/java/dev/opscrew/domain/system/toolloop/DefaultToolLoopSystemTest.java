package dev.opscrew.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.agent.BuiltinPersonalities;
import dev.opscrew.domain.capability.CapabilityRegistry;
import dev.opscrew.domain.model.Conversation;
import dev.opscrew.domain.model.LlmChunk;
import dev.opscrew.domain.model.LlmRequest;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.StreamEventType;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.domain.model.ToolResult;
import dev.opscrew.domain.service.ToolInputValidator;
import dev.opscrew.domain.service.ToolResultRenderer;
import dev.opscrew.domain.stream.CancellationToken;
import dev.opscrew.testsupport.ScriptedLlmPort;
import dev.opscrew.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultToolLoopSystemTest {

    private static final String ECHO = "echo";

    private ScriptedLlmPort llm;
    private DefaultToolLoopSystem loop;
    private StubTool echoTool;
    private List<StreamEvent> events;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        llm = ScriptedLlmPort.create();
        loop = new DefaultToolLoopSystem(
                new DefaultToolExecutor(5_000),
                new DefaultHistoryWriter(Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneId.of("UTC"))),
                new ToolInputValidator(),
                new ToolResultRenderer(objectMapper),
                objectMapper);
        echoTool = new StubTool(StubTool.definition(ECHO),
                params -> CompletableFuture.completedFuture(ToolResult.success("echo:" + params.get("input"))));
        events = new ArrayList<>();
        conversation = Conversation.of(List.of(Message.user("hi")));
    }

    private LoopContext.LoopContextBuilder context(CapabilityRegistry registry) {
        return LoopContext.builder()
                .agent(new Agent(BuiltinPersonalities.RAPID, llm))
                .conversation(conversation)
                .capabilities(registry)
                .events(events::add);
    }

    private CapabilityRegistry echoOnly() {
        return CapabilityRegistry.builder().tool(echoTool).build();
    }

    private List<StreamEvent> ofType(StreamEventType type) {
        return events.stream().filter(e -> e.is(type)).collect(Collectors.toList());
    }

    @Test
    void shouldFinishAfterOneTurnWhenModelRequestsNoTools() {
        llm.thenText("Hello", " world");

        AgentRunResult result = loop.run(context(echoOnly()).build());

        assertEquals(StopReason.COMPLETED, result.stopReason());
        assertEquals(1, result.iterations());
        assertEquals(1, llm.callCount());
        assertEquals("Hello world", result.finalText());
        assertEquals(List.of("Hello", " world"),
                events.stream().map(e -> (String) e.get(StreamEvent.KEY_TEXT)).toList());
        Message last = conversation.last();
        assertTrue(last.isAssistantMessage());
        assertEquals("Hello world", last.getContent());
        assertFalse(last.hasToolCalls());
    }

    @Test
    void shouldStopAtIterationCapWhenModelAlwaysCallsTools() {
        llm.otherwise(LlmChunk.toolCall(0, null, ECHO, "{\"input\":\"again\"}"));

        AgentRunResult result = loop.run(context(echoOnly()).build());

        assertEquals(StopReason.ITERATION_CAP, result.stopReason());
        assertEquals(5, result.iterations());
        assertEquals(5, llm.callCount());
        assertEquals(5, echoTool.invocations().size());
        assertEquals(5, ofType(StreamEventType.TOOL_CALL).size());
        assertEquals(5, ofType(StreamEventType.TOOL_RESULT).size());
    }

    @Test
    void shouldPairEveryToolCallWithResultInEmissionOrder() {
        llm.thenTurn(
                LlmChunk.text("Checking"),
                LlmChunk.toolCall(0, "call_a", ECHO, "{\"input\":\"1\"}"),
                LlmChunk.toolCall(1, "call_b", ECHO, "{\"input\":\"2\"}"))
                .thenText("All good");

        loop.run(context(echoOnly()).build());

        List<StreamEventType> types = events.stream().map(StreamEvent::type).toList();
        assertEquals(List.of(
                StreamEventType.CHUNK,
                StreamEventType.TOOL_CALL,
                StreamEventType.TOOL_RESULT,
                StreamEventType.TOOL_CALL,
                StreamEventType.TOOL_RESULT,
                StreamEventType.CHUNK), types);
        assertEquals("call_a", events.get(1).get(StreamEvent.KEY_ID));
        assertEquals("call_a", events.get(2).get(StreamEvent.KEY_TOOL_CALL_ID));
        assertEquals("echo:1", events.get(2).get(StreamEvent.KEY_RESULT));
        assertEquals("call_b", events.get(3).get(StreamEvent.KEY_ID));
        assertEquals("call_b", events.get(4).get(StreamEvent.KEY_TOOL_CALL_ID));
    }

    @Test
    void shouldRoundTripToolCallIdIntoHistory() {
        llm.thenToolCall("call_42", ECHO, "{\"input\":\"x\"}").thenText("ok");

        loop.run(context(echoOnly()).build());

        List<Message> messages = conversation.messages();
        // user, assistant with call, tool result, final assistant
        assertEquals(4, messages.size());
        assertEquals("call_42", messages.get(1).getToolCalls().get(0).getId());
        Message toolMessage = messages.get(2);
        assertTrue(toolMessage.isToolMessage());
        assertEquals("call_42", toolMessage.getToolCallId());
        assertEquals(ECHO, toolMessage.getToolName());
        assertEquals("echo:x", toolMessage.getContent());

        LlmRequest second = llm.requests().get(1);
        assertEquals("call_42", second.getMessages().get(2).getToolCallId());
    }

    @Test
    void shouldReportUnknownCapabilityWithoutToolCallEvent() {
        llm.thenToolCall("call_1", "missing", "{}").thenText("sorry");

        AgentRunResult result = loop.run(context(echoOnly()).build());

        assertEquals(StopReason.COMPLETED, result.stopReason());
        assertTrue(ofType(StreamEventType.TOOL_CALL).isEmpty());
        StreamEvent toolResult = ofType(StreamEventType.TOOL_RESULT).get(0);
        assertEquals("call_1", toolResult.get(StreamEvent.KEY_TOOL_CALL_ID));
        assertEquals("Error: Tool or agent not found: missing", toolResult.get(StreamEvent.KEY_RESULT));
        assertEquals("call_1", conversation.messages().get(2).getToolCallId());
    }

    @Test
    void shouldTurnFailingToolIntoErrorResultAndContinue() {
        StubTool broken = StubTool.failingWith("broken", new IllegalStateException("kaput"));
        llm.thenToolCall("call_1", "broken", "{}").thenText("it failed");

        AgentRunResult result = loop.run(context(CapabilityRegistry.builder().tool(broken).build()).build());

        assertEquals(StopReason.COMPLETED, result.stopReason());
        assertEquals(2, result.iterations());
        String rendered = ofType(StreamEventType.TOOL_RESULT).get(0).get(StreamEvent.KEY_RESULT);
        assertTrue(rendered.startsWith("Error:"));
        assertTrue(rendered.contains("kaput"));
    }

    @Test
    void shouldRejectArgumentsMissingRequiredField() {
        StubTool strict = new StubTool(ToolDefinition.builder()
                .name("strict")
                .description("needs a command")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of("command", Map.of("type", "string")),
                        "required", List.of("command")))
                .build(), params -> CompletableFuture.completedFuture(ToolResult.success("ran")));
        llm.thenToolCall("call_1", "strict", "{}").thenText("fine");

        loop.run(context(CapabilityRegistry.builder().tool(strict).build()).build());

        assertTrue(strict.invocations().isEmpty());
        assertEquals(1, ofType(StreamEventType.TOOL_CALL).size());
        String rendered = ofType(StreamEventType.TOOL_RESULT).get(0).get(StreamEvent.KEY_RESULT);
        assertEquals("Error: Invalid input: Missing required field: command", rendered);
    }

    @Test
    void shouldRejectMalformedArgumentJson() {
        llm.thenToolCall("call_1", ECHO, "{not json").thenText("fine");

        loop.run(context(echoOnly()).build());

        assertTrue(echoTool.invocations().isEmpty());
        String rendered = ofType(StreamEventType.TOOL_RESULT).get(0).get(StreamEvent.KEY_RESULT);
        assertTrue(rendered.startsWith("Error: Invalid arguments JSON"));
    }

    @Test
    void shouldConcatenateArgumentFragmentsOfOneCall() {
        llm.thenTurn(
                LlmChunk.toolCall(0, "call_1", ECHO, "{\"inp"),
                LlmChunk.toolCall(0, null, null, "ut\":\"joined\"}"))
                .thenText("ok");

        loop.run(context(echoOnly()).build());

        assertEquals(1, echoTool.invocations().size());
        assertEquals("joined", echoTool.invocations().get(0).get("input"));
    }

    @Test
    void shouldEmitErrorAndStopWhenModelStreamFails() {
        llm.thenError(new IllegalStateException("provider down"));

        AgentRunResult result = loop.run(context(echoOnly()).build());

        assertEquals(StopReason.MODEL_ERROR, result.stopReason());
        assertEquals(1, events.size());
        assertTrue(events.get(0).is(StreamEventType.ERROR));
        assertTrue(((String) events.get(0).get(StreamEvent.KEY_MESSAGE)).contains("provider down"));
    }

    @Test
    void shouldNotCallModelWhenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        AgentRunResult result = loop.run(context(echoOnly()).cancellation(token).build());

        assertEquals(StopReason.CANCELLED, result.stopReason());
        assertEquals(0, llm.callCount());
        assertTrue(events.isEmpty());
    }

    @Test
    void shouldAdvertiseCapabilitiesInPromptAndRequest() {
        llm.thenText("ok");

        loop.run(context(echoOnly()).build());

        LlmRequest request = llm.requests().get(0);
        assertTrue(request.getSystemPrompt().contains("You have access to the following tools:"));
        assertTrue(request.getSystemPrompt().contains(ECHO + ": Stub tool echo"));
        assertEquals(List.of(ECHO), request.getTools().stream().map(ToolDefinition::getName).toList());
        assertEquals("Rapid", request.getAgentName());
    }

    @Test
    void shouldDispatchAgentCapabilitiesToDelegationPort() {
        Agent terra = new Agent(BuiltinPersonalities.TERRA, ScriptedLlmPort.create());
        CapabilityRegistry registry = CapabilityRegistry.builder().agent(terra).tool(echoTool).build();
        List<String> delegatedTo = new ArrayList<>();
        DelegationPort delegation = (agent, call, sink, token) -> {
            delegatedTo.add(agent.getName());
            return ToolExecutionOutcome.of(call, ToolResult.success("planned", Map.of("response", "planned")));
        };
        llm.thenToolCall("call_t", "Terra", "{\"task\":\"plan a VPC\"}").thenText("done");

        loop.run(context(registry).delegation(delegation).build());

        assertEquals(List.of("Terra"), delegatedTo);
        assertTrue(echoTool.invocations().isEmpty());
        StreamEvent toolResult = ofType(StreamEventType.TOOL_RESULT).get(0);
        assertEquals(Map.of("response", "planned"), toolResult.get(StreamEvent.KEY_RESULT));
        assertEquals("{\"response\":\"planned\"}", conversation.messages().get(2).getContent());
    }
}
