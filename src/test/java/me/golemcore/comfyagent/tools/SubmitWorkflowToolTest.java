package me.golemcore.comfyagent.tools;

import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SubmitWorkflowToolTest {

    private static final Map<String, Object> WORKFLOW = Map.of(
            "1", Map.of("class_type", "CheckpointLoaderSimple", "inputs", Map.of("ckpt_name", "sd15.safetensors")),
            "2", Map.of("class_type", "KSampler", "inputs", Map.of("model", List.of("1", 0))));

    private WorkflowBackendPort backend;
    private SubmitWorkflowTool tool;

    @BeforeEach
    void setUp() {
        backend = mock(WorkflowBackendPort.class);
        tool = new SubmitWorkflowTool(backend);
    }

    @Test
    void shouldQueueWorkflowAndExposePromptId() {
        when(backend.submit(WORKFLOW)).thenReturn("prompt-42");

        ToolResult result = tool.execute(Map.of("workflow", WORKFLOW)).join();

        assertTrue(result.isSuccess());
        assertEquals("Workflow submitted successfully. prompt_id: prompt-42", result.getOutput());
        assertEquals("prompt-42", result.getData().get("prompt_id"));
        assertSame(WORKFLOW, result.getData().get("workflow"));
    }

    @Test
    void shouldReportRejectedWorkflow() {
        when(backend.submit(WORKFLOW)).thenThrow(new WorkflowBackendPort.WorkflowBackendException(
                "ComfyUI queue prompt failed with HTTP 400: prompt_outputs_failed_validation"));

        ToolResult result = tool.execute(Map.of("workflow", WORKFLOW)).join();

        assertFalse(result.isSuccess());
        assertEquals("Failed to queue prompt: ComfyUI queue prompt failed with HTTP 400: "
                + "prompt_outputs_failed_validation", result.getError());
        assertNull(result.getData());
    }

    @Test
    void shouldRejectEmptyWorkflow() {
        ToolResult result = tool.execute(Map.of("workflow", Map.of())).join();

        assertFalse(result.isSuccess());
        verifyNoInteractions(backend);
    }

    @Test
    void shouldRequireWorkflowInSchema() {
        assertEquals(List.of("workflow"), tool.getDefinition().getInputSchema().get("required"));
    }
}
