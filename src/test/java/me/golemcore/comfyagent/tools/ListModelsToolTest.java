package me.golemcore.comfyagent.tools;

import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ListModelsToolTest {

    private WorkflowBackendPort backend;
    private ListModelsTool tool;

    @BeforeEach
    void setUp() {
        backend = mock(WorkflowBackendPort.class);
        tool = new ListModelsTool(backend);
    }

    @Test
    void shouldDefaultToCheckpointsFolder() {
        when(backend.listModels("checkpoints")).thenReturn(List.of("sd_xl_base_1.0.safetensors",
                "v1-5-pruned-emaonly.safetensors"));

        ToolResult result = tool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Models in 'checkpoints' (2):"));
        assertTrue(result.getOutput().contains("  - sd_xl_base_1.0.safetensors"));
    }

    @Test
    void shouldUseRequestedFolder() {
        when(backend.listModels("loras")).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("folder", " loras ")).join();

        assertTrue(result.isSuccess());
        assertEquals("No models found in 'loras' folder.", result.getOutput());
        verify(backend).listModels("loras");
    }

    @Test
    void shouldReportBackendFailure() {
        when(backend.listModels("vae"))
                .thenThrow(new WorkflowBackendPort.WorkflowBackendException("ComfyUI unreachable (models)"));

        ToolResult result = tool.execute(Map.of("folder", "vae")).join();

        assertFalse(result.isSuccess());
        assertEquals("Failed to list models: ComfyUI unreachable (models)", result.getError());
    }
}
