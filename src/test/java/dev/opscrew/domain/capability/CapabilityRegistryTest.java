package dev.opscrew.domain.capability;

import dev.opscrew.domain.agent.Agent;
import dev.opscrew.domain.agent.BuiltinPersonalities;
import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.exception.ConfigurationException;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.domain.model.ToolResult;
import dev.opscrew.testsupport.ScriptedLlmPort;
import dev.opscrew.testsupport.StubTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityRegistryTest {

    private final Agent terra = new Agent(BuiltinPersonalities.TERRA, ScriptedLlmPort.create());
    private final StubTool shell = StubTool.returning("shell", ToolResult.success("ok"));

    @Test
    void shouldResolveToolsAndAgentsByName() {
        CapabilityRegistry registry = CapabilityRegistry.builder().agent(terra).tool(shell).build();

        Capability agent = registry.resolve("Terra").orElseThrow();
        Capability tool = registry.resolve("shell").orElseThrow();

        assertEquals(CapabilityKind.AGENT, agent.getKind());
        assertSame(terra, agent.requireAgent());
        assertEquals(CapabilityKind.TOOL, tool.getKind());
        assertSame(shell, tool.requireTool());
        assertTrue(registry.resolve("unknown").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
        assertEquals(2, registry.size());
    }

    @Test
    void shouldRejectDuplicateNamesAcrossKinds() {
        StubTool clash = StubTool.returning("Terra", ToolResult.success("ok"));
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder().agent(terra);

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> builder.tool(clash));

        assertEquals("Duplicate capability name: Terra", error.getMessage());
    }

    @Test
    void shouldRejectDuplicateToolNames() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder().tool(shell);
        StubTool second = StubTool.returning("shell", ToolResult.success("other"));

        assertThrows(ConfigurationException.class, () -> builder.tool(second));
    }

    @Test
    void shouldSkipDisabledTools() {
        ToolComponent disabled = new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return StubTool.definition("disabled");
            }

            @Override
            public CompletableFuture<ToolResult> execute(java.util.Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(ToolResult.success("never"));
            }

            @Override
            public boolean isEnabled() {
                return false;
            }
        };

        CapabilityRegistry registry = CapabilityRegistry.builder().tool(disabled).tool(shell).build();

        assertTrue(registry.resolve("disabled").isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void shouldListAgentDefinitionsBeforeTools() {
        CapabilityRegistry registry = CapabilityRegistry.builder().tool(shell).agent(terra).build();

        List<String> names = registry.definitions().stream().map(ToolDefinition::getName).toList();

        assertEquals(List.of("Terra", "shell"), names);
    }

    @Test
    void shouldDropAgentsInToolsOnlyView() {
        CapabilityRegistry registry = CapabilityRegistry.builder().agent(terra).tool(shell).build();

        CapabilityRegistry toolsOnly = registry.toolsOnly();

        assertTrue(registry.containsAgents());
        assertFalse(toolsOnly.containsAgents());
        assertTrue(toolsOnly.resolve("Terra").isEmpty());
        assertSame(shell, toolsOnly.resolve("shell").orElseThrow().requireTool());
        assertSame(toolsOnly, toolsOnly.toolsOnly());
    }

    @Test
    void shouldRefuseWrongVariantAccess() {
        Capability tool = Capability.ofTool(shell);

        assertThrows(IllegalStateException.class, tool::requireAgent);
    }

    @Test
    void shouldExposeImmutableViews() {
        CapabilityRegistry registry = CapabilityRegistry.builder().agent(terra).tool(shell).build();

        assertThrows(UnsupportedOperationException.class, () -> registry.definitions().clear());
        assertThrows(UnsupportedOperationException.class, () -> registry.all().clear());
        assertEquals(List.of(terra), registry.agents());
    }
}
