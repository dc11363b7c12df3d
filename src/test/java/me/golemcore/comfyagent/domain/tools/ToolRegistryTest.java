package me.golemcore.comfyagent.domain.tools;

import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static ToolComponent tool(String name, boolean enabled) {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.builder().name(name).description(name).inputSchema(Map.of()).build();
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(ToolResult.success(name));
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }
        };
    }

    @Test
    void shouldListToolsSortedByName() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("submit_workflow", true), tool("get_queue", true),
                tool("list_nodes", true)));

        assertEquals(List.of("get_queue", "list_nodes", "submit_workflow"), registry.getToolNames());
        assertEquals("get_queue", registry.getDefinitions().get(0).getName());
    }

    @Test
    void shouldSkipDisabledTools() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("web_search", false), tool("get_queue", true)));

        assertEquals(List.of("get_queue"), registry.getToolNames());
        assertFalse(registry.contains("web_search"));
    }

    @Test
    void shouldRejectDuplicateNames() {
        ToolComponent first = tool("get_queue", true);
        ToolComponent second = tool("get_queue", true);

        assertThrows(IllegalStateException.class, () -> ToolRegistry.of(first, second));
    }

    @Test
    void shouldBuildSubsetIgnoringUnknownNames() {
        ToolRegistry registry = ToolRegistry.of(tool("list_nodes", true), tool("submit_workflow", true),
                tool("delegate_task", true));

        ToolRegistry subset = registry.subset(List.of("list_nodes", "web_search"));

        assertEquals(List.of("list_nodes"), subset.getToolNames());
        assertEquals(3, registry.size());
    }

    @Test
    void shouldReturnEmptyForNullName() {
        ToolRegistry registry = ToolRegistry.of(tool("list_nodes", true));

        assertTrue(registry.get(null).isEmpty());
        assertFalse(registry.contains(null));
    }
}
