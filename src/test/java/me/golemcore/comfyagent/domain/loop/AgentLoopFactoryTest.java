package me.golemcore.comfyagent.domain.loop;

import me.golemcore.comfyagent.domain.context.ModelSummaryCompressor;
import me.golemcore.comfyagent.domain.context.TurnWindowCompressor;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelResponse;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.ModelClient;
import me.golemcore.comfyagent.domain.service.PromptProvider;
import me.golemcore.comfyagent.domain.service.SessionService;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.domain.tools.ToolExecutor;
import me.golemcore.comfyagent.domain.tools.ToolRegistry;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentLoopFactoryTest {

    private AgentProperties properties;
    private ToolRegistry toolRegistry;
    private ModelPort modelPort;
    private AgentLoopFactory factory;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        modelPort = mock(ModelPort.class);
        toolRegistry = ToolRegistry.of(tool("list_nodes"), tool("get_node_info"), tool("submit_workflow"),
                tool("delegate_task"), tool("interrupt"), tool("validate_workflow"), tool("web_fetch"));
        factory = newFactory();
    }

    private AgentLoopFactory newFactory() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        return new AgentLoopFactory(mock(SessionPort.class), mock(ModelClient.class), mock(ToolExecutor.class),
                new EventBus(16, clock), toolRegistry, new PromptProvider(), modelPort, properties, clock);
    }

    private static ToolComponent tool(String name) {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.builder().name(name).description(name).inputSchema(Map.of()).build();
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(ToolResult.success(name));
            }
        };
    }

    @Test
    void shouldGiveMainLoopEveryTool() {
        AgentLoopSettings settings = factory.createMainLoop().getSettings();

        assertEquals("main", settings.name());
        assertEquals(7, settings.tools().size());
        assertEquals(50, settings.maxIterations());
        assertTrue(settings.systemPrompt().contains("delegate_task"));
    }

    @Test
    void shouldRestrictSubagentToReadOnlyTools() {
        AgentLoopSettings settings = factory.createSubagentLoop().getSettings();

        assertEquals("subagent", settings.name());
        assertEquals(List.of("get_node_info", "list_nodes", "validate_workflow", "web_fetch"),
                settings.tools().getToolNames());
        assertFalse(settings.tools().contains("delegate_task"));
        assertFalse(settings.tools().contains("submit_workflow"));
        assertEquals(10, settings.maxIterations());
        assertTrue(settings.systemPrompt().startsWith("You are a ComfyUI research assistant."));
    }

    @Test
    void shouldPickCompressorByStrategy() {
        AgentProperties.ContextProperties context = properties.getContext();

        assertInstanceOf(TurnWindowCompressor.class, AgentLoopFactory.createCompressor(context, modelPort));
        context.setStrategy("summarize");
        assertInstanceOf(ModelSummaryCompressor.class, AgentLoopFactory.createCompressor(context, modelPort));
    }

    @Test
    void shouldDropCachedSummaryWhenSessionIsDeleted() {
        properties.getContext().setStrategy("summarize");
        properties.getContext().setSummarizeThresholdTokens(100);
        properties.getContext().setKeepRecentTurns(1);
        when(modelPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                ModelResponse.builder().text("summary").build()));
        factory = newFactory();
        Instant now = Instant.parse("2026-02-14T00:00:00Z");
        List<Message> history = List.of(
                Message.userText("first " + "x".repeat(800), now),
                Message.assistant("done", List.of(), now),
                Message.userText("second " + "x".repeat(800), now),
                Message.assistant("done", List.of(), now));

        factory.getContextCompressor().compress("s1", history);
        factory.getContextCompressor().compress("s1", history);
        verify(modelPort, times(1)).chat(any());

        factory.onSessionDeleted(new SessionService.SessionDeletedEvent("s1"));
        factory.getContextCompressor().compress("s1", history);

        verify(modelPort, times(2)).chat(any());
    }
}
