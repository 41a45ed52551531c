package dev.opscrew.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.agent.AgentRoster;
import dev.opscrew.domain.agent.BuiltinPersonalities;
import dev.opscrew.domain.capability.CapabilityRegistry;
import dev.opscrew.domain.model.AgentPersonality;
import dev.opscrew.domain.model.LlmChunk;
import dev.opscrew.domain.model.LlmRequest;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.OrchestratorRequest;
import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.StreamEventType;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.domain.stream.CancellationToken;
import dev.opscrew.domain.system.toolloop.DefaultHistoryWriter;
import dev.opscrew.domain.system.toolloop.DefaultToolExecutor;
import dev.opscrew.domain.system.toolloop.DefaultToolLoopSystem;
import dev.opscrew.domain.system.toolloop.ToolLoopSystem;
import dev.opscrew.infrastructure.config.CrewProperties;
import dev.opscrew.security.CommandGuard;
import dev.opscrew.testsupport.ScriptedLlmPort;
import dev.opscrew.testsupport.StubTool;
import dev.opscrew.tools.ShellTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    @TempDir
    Path workspace;

    private ObjectMapper objectMapper;
    private ScriptedLlmPort rapidLlm;
    private ScriptedLlmPort terraLlm;
    private ScriptedLlmPort kubeLlm;
    private ShellTool shellTool;
    private Scheduler scheduler;
    private CrewProperties properties;
    private AgentRoster roster;
    private CapabilityRegistry registry;
    private ToolLoopSystem loop;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        properties = new CrewProperties();
        properties.getTools().setWorkspace(workspace.toString());
        shellTool = new ShellTool(properties, new CommandGuard(properties));
        scheduler = Schedulers.newBoundedElastic(4, 16, "orchestrator-test");

        rapidLlm = ScriptedLlmPort.create();
        terraLlm = ScriptedLlmPort.create();
        kubeLlm = ScriptedLlmPort.create();
        Agent rapid = new Agent(BuiltinPersonalities.RAPID, rapidLlm);
        List<Agent> specialists = List.of(
                new Agent(BuiltinPersonalities.TERRA, terraLlm),
                new Agent(BuiltinPersonalities.KUBE, kubeLlm),
                new Agent(BuiltinPersonalities.METRIC, ScriptedLlmPort.create()),
                new Agent(BuiltinPersonalities.GUARD, ScriptedLlmPort.create()));
        roster = new AgentRoster(rapid, specialists);
        registry = CapabilityRegistry.builder().agents(specialists).tool(shellTool).build();

        loop = new DefaultToolLoopSystem(new DefaultToolExecutor(10_000), new DefaultHistoryWriter(Clock.systemUTC()),
                new ToolInputValidator(), new ToolResultRenderer(objectMapper), objectMapper);
    }

    @AfterEach
    void tearDown() {
        shellTool.shutdown();
        scheduler.dispose();
    }

    private AgentOrchestrator orchestrator(ToolLoopSystem toolLoopSystem) {
        return new AgentOrchestrator(roster, registry, toolLoopSystem, objectMapper, scheduler, properties);
    }

    private List<StreamEvent> runSync(AgentOrchestrator orchestrator, OrchestratorRequest request) {
        List<StreamEvent> events = new ArrayList<>();
        orchestrator.run(request, events::add, new CancellationToken());
        return events;
    }

    private static long count(List<StreamEvent> events, StreamEventType type) {
        return events.stream().filter(e -> e.is(type)).count();
    }

    @Test
    void shouldRunShellCommandAndCompleteForListFilesRequest() {
        rapidLlm.thenToolCall("call_ls", "shell", "{\"command\":\"ls /tmp\"}").thenText("Here are the files");

        StepVerifier.create(orchestrator(loop).invoke(OrchestratorRequest.ofUserMessage("list files in /tmp")))
                .assertNext(e -> {
                    assertTrue(e.is(StreamEventType.AGENT_SELECTED));
                    assertEquals(BuiltinPersonalities.RAPID, e.get(StreamEvent.KEY_PERSONALITY));
                })
                .assertNext(e -> {
                    assertTrue(e.is(StreamEventType.TOOL_CALL));
                    assertEquals("shell", e.get(StreamEvent.KEY_NAME));
                    assertEquals(Map.of("command", "ls /tmp"), e.get(StreamEvent.KEY_ARGS));
                })
                .assertNext(e -> {
                    assertTrue(e.is(StreamEventType.TOOL_RESULT));
                    assertEquals("call_ls", e.get(StreamEvent.KEY_TOOL_CALL_ID));
                    Map<String, Object> result = e.get(StreamEvent.KEY_RESULT);
                    assertTrue(result.get(ShellTool.KEY_STDOUT) instanceof String);
                    assertEquals(0, result.get(ShellTool.KEY_EXIT_CODE));
                })
                .assertNext(e -> assertEquals("Here are the files", e.get(StreamEvent.KEY_TEXT)))
                .assertNext(e -> assertTrue(e.is(StreamEventType.COMPLETE)))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void shouldRejectForbiddenCommandAndStillComplete() {
        rapidLlm.thenToolCall("call_rm", "shell", "{\"command\":\"rm -rf build\"}").thenText("Refused");

        List<StreamEvent> events = orchestrator(loop).invoke(OrchestratorRequest.ofUserMessage("clean up"))
                .collectList()
                .block(TIMEOUT);

        StreamEvent toolResult = events.stream().filter(e -> e.is(StreamEventType.TOOL_RESULT)).findFirst()
                .orElseThrow();
        Map<String, Object> result = toolResult.get(StreamEvent.KEY_RESULT);
        assertEquals("", result.get(ShellTool.KEY_STDOUT));
        assertEquals("Error: Command contains forbidden pattern: rm -rf", result.get(ShellTool.KEY_STDERR));
        assertTrue(events.get(events.size() - 1).is(StreamEventType.COMPLETE));
        assertEquals(1, count(events, StreamEventType.COMPLETE));
    }

    @Test
    void shouldDelegateTaskToSpecialistOnFreshConversation() {
        rapidLlm.thenToolCall("call_t", "Terra", "{\"task\":\"write a VPC module\"}").thenText("Terra is done");
        terraLlm.thenText("module ", "written");

        List<StreamEvent> events = runSync(orchestrator(loop),
                OrchestratorRequest.ofUserMessage("I need a VPC"));

        List<StreamEventType> types = events.stream().map(StreamEvent::type).toList();
        assertEquals(List.of(
                StreamEventType.AGENT_SELECTED,
                StreamEventType.TOOL_CALL,
                StreamEventType.AGENT_DELEGATION,
                StreamEventType.TOOL_RESULT,
                StreamEventType.CHUNK,
                StreamEventType.COMPLETE), types);

        StreamEvent delegation = events.get(2);
        assertEquals(BuiltinPersonalities.TERRA, delegation.get(StreamEvent.KEY_TO));
        assertEquals(Map.of("task", "write a VPC module"), delegation.get(StreamEvent.KEY_TASK));
        assertEquals(Map.of("response", "module written"), events.get(3).get(StreamEvent.KEY_RESULT));
        assertEquals("Terra is done", events.get(4).get(StreamEvent.KEY_TEXT));

        LlmRequest terraRequest = terraLlm.requests().get(0);
        assertEquals(1, terraRequest.getMessages().size());
        Message task = terraRequest.getMessages().get(0);
        assertTrue(task.isUserMessage());
        assertEquals("{\"task\":\"write a VPC module\"}", task.getContent());
    }

    @Test
    void shouldOfferOnlyToolsToSpecialists() {
        rapidLlm.thenToolCall("call_t", "Terra", "{\"task\":\"plan\"}").thenText("ok");
        terraLlm.thenToolCall("call_k", "Kube", "{\"task\":\"deploy\"}").thenText("did it myself");

        List<StreamEvent> events = runSync(orchestrator(loop), OrchestratorRequest.ofUserMessage("plan and deploy"));

        assertEquals(0, kubeLlm.callCount());
        List<String> terraTools = terraLlm.requests().get(0).getTools().stream()
                .map(ToolDefinition::getName)
                .toList();
        assertEquals(List.of("shell"), terraTools);
        List<String> rapidTools = rapidLlm.requests().get(0).getTools().stream()
                .map(ToolDefinition::getName)
                .toList();
        assertEquals(List.of("Terra", "Kube", "Metric", "Guard", "shell"), rapidTools);

        // the rejected nested call shows up in Terra's own history, not in the caller's stream
        LlmRequest terraSecond = terraLlm.requests().get(1);
        assertEquals("Error: Tool or agent not found: Kube", terraSecond.getMessages().get(2).getContent());
        assertEquals(Map.of("response", "did it myself"), events.get(3).get(StreamEvent.KEY_RESULT));
        assertEquals(1, count(events, StreamEventType.AGENT_DELEGATION));
    }

    @Test
    void shouldReportFailedDelegationAsErrorResult() {
        rapidLlm.thenToolCall("call_g", "Guard", "{\"task\":\"audit\"}").thenText("Guard is unavailable");
        Agent guard = new Agent(BuiltinPersonalities.GUARD,
                ScriptedLlmPort.create().thenError(new IllegalStateException("quota exceeded")));
        AgentOrchestrator orchestrator = new AgentOrchestrator(
                new AgentRoster(roster.coordinator(), List.of(guard)),
                CapabilityRegistry.builder().agent(guard).build(),
                loop, objectMapper, scheduler, properties);

        List<StreamEvent> events = runSync(orchestrator, OrchestratorRequest.ofUserMessage("audit"));

        String result = events.stream().filter(e -> e.is(StreamEventType.TOOL_RESULT)).findFirst().orElseThrow()
                .get(StreamEvent.KEY_RESULT);
        assertTrue(result.startsWith("Error: Agent Guard failed"));
        assertTrue(result.contains("quota exceeded"));
        assertEquals(0, count(events, StreamEventType.ERROR));
        assertTrue(events.get(events.size() - 1).is(StreamEventType.COMPLETE));
    }

    @Test
    void shouldEmitErrorThenSingleCompleteWhenLoopThrows() {
        ToolLoopSystem failing = mock(ToolLoopSystem.class);
        when(failing.run(any())).thenThrow(new IllegalStateException("boom"));

        List<StreamEvent> events = runSync(orchestrator(failing), OrchestratorRequest.ofUserMessage("hi"));

        assertEquals(List.of(StreamEventType.AGENT_SELECTED, StreamEventType.ERROR, StreamEventType.COMPLETE),
                events.stream().map(StreamEvent::type).toList());
        assertEquals("boom", events.get(1).get(StreamEvent.KEY_MESSAGE));
    }

    @Test
    void shouldNotEmitCompleteWhenCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        List<StreamEvent> events = new ArrayList<>();

        orchestrator(loop).run(OrchestratorRequest.ofUserMessage("hi"), events::add, token);

        assertEquals(0, count(events, StreamEventType.COMPLETE));
        assertEquals(0, rapidLlm.callCount());
    }

    @Test
    void shouldAlwaysStartAtCoordinatorRegardlessOfRequestedAgent() {
        rapidLlm.thenText("hello");
        OrchestratorRequest request = OrchestratorRequest.ofUserMessage("hi");
        request.setRequestedAgent("Guard");

        List<StreamEvent> events = runSync(orchestrator(loop), request);

        assertEquals(BuiltinPersonalities.RAPID, events.get(0).get(StreamEvent.KEY_PERSONALITY));
        assertEquals(1, rapidLlm.callCount());
        assertEquals(1, count(events, StreamEventType.COMPLETE));
    }

    @Test
    void shouldNotMutateCallerMessages() {
        rapidLlm.thenText("hello");
        OrchestratorRequest request = OrchestratorRequest.ofUserMessage("hi");

        runSync(orchestrator(loop), request);

        assertEquals(1, request.getMessages().size());
    }

    @Test
    void shouldListAgentsAndTools() {
        AgentOrchestrator orchestrator = orchestrator(loop);

        List<String> agents = orchestrator.getAvailableAgents().stream().map(AgentPersonality::name).toList();
        assertEquals(List.of("Rapid", "Terra", "Kube", "Metric", "Guard"), agents);
        assertEquals(List.of("shell"),
                orchestrator.getAvailableTools().stream().map(ToolDefinition::getName).toList());
        assertFalse(orchestrator.getAvailableTools().isEmpty());
    }

    @Test
    void shouldCapDelegatedSpecialistIndependently() {
        rapidLlm.thenToolCall("call_t", "Terra", "{\"task\":\"keep checking\"}").thenText("Terra gave up");
        terraLlm.otherwise(LlmChunk.toolCall(0, "call_echo", "shell", "{\"command\":\"echo hi\"}"));

        List<StreamEvent> events = runSync(orchestrator(loop), OrchestratorRequest.ofUserMessage("check it"));

        assertEquals(5, terraLlm.callCount());
        assertEquals(2, rapidLlm.callCount());
        assertEquals(List.of(
                StreamEventType.AGENT_SELECTED,
                StreamEventType.TOOL_CALL,
                StreamEventType.AGENT_DELEGATION,
                StreamEventType.TOOL_RESULT,
                StreamEventType.CHUNK,
                StreamEventType.COMPLETE), events.stream().map(StreamEvent::type).toList());
        assertEquals("call_t", events.get(3).get(StreamEvent.KEY_TOOL_CALL_ID));
        assertEquals(Map.of("response", ""), events.get(3).get(StreamEvent.KEY_RESULT));
    }

    @Test
    void shouldCompleteWhenToolThrowsError() {
        StubTool broken = new StubTool(StubTool.definition("broken"), params -> {
            throw new AssertionError("bad");
        });
        rapidLlm.thenToolCall("call_b", "broken", "{}").thenText("recovered");
        AgentOrchestrator orchestrator = new AgentOrchestrator(roster,
                CapabilityRegistry.builder().tool(broken).build(), loop, objectMapper, scheduler, properties);

        List<StreamEvent> events = orchestrator.invoke(OrchestratorRequest.ofUserMessage("try it"))
                .collectList()
                .block(TIMEOUT);

        assertEquals(1, count(events, StreamEventType.COMPLETE));
        assertTrue(events.get(events.size() - 1).is(StreamEventType.COMPLETE));
        String result = events.stream().filter(e -> e.is(StreamEventType.TOOL_RESULT)).findFirst().orElseThrow()
                .get(StreamEvent.KEY_RESULT);
        assertTrue(result.startsWith("Error:"));
        assertTrue(result.contains("bad"));
    }

    @Test
    void shouldEmitErrorThenCompleteWhenLoopThrowsError() {
        ToolLoopSystem failing = mock(ToolLoopSystem.class);
        when(failing.run(any())).thenThrow(new AssertionError("broken loop"));

        StepVerifier.create(orchestrator(failing).invoke(OrchestratorRequest.ofUserMessage("hi")))
                .assertNext(e -> assertTrue(e.is(StreamEventType.AGENT_SELECTED)))
                .assertNext(e -> assertEquals("broken loop", e.get(StreamEvent.KEY_MESSAGE)))
                .assertNext(e -> assertTrue(e.is(StreamEventType.COMPLETE)))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void shouldDelegateWhateverArgumentsTheCallCarries() {
        rapidLlm.thenToolCall("call_k", "Kube", "{\"namespace\":\"prod\",\"check\":\"pods\"}").thenText("ok");
        kubeLlm.thenText("all pods running");

        List<StreamEvent> events = runSync(orchestrator(loop), OrchestratorRequest.ofUserMessage("pods?"));

        StreamEvent delegation = events.stream().filter(e -> e.is(StreamEventType.AGENT_DELEGATION)).findFirst()
                .orElseThrow();
        assertEquals(Map.of("namespace", "prod", "check", "pods"), delegation.get(StreamEvent.KEY_TASK));
        assertEquals("{\"namespace\":\"prod\",\"check\":\"pods\"}",
                kubeLlm.requests().get(0).getMessages().get(0).getContent());
        assertEquals(Map.of("response", "all pods running"), events.get(3).get(StreamEvent.KEY_RESULT));
    }
}
