package me.golemcore.comfyagent.tools;

import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.NodeCatalog;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GetNodeInfoToolTest {

    private static final Map<String, Object> CHECKPOINT_INFO = Map.of(
            "display_name", "Load Checkpoint",
            "category", "loaders",
            "input", Map.of("required", Map.of("ckpt_name", List.of(List.of("sd15.safetensors")))),
            "output", List.of("MODEL", "CLIP", "VAE"),
            "output_name", List.of("MODEL", "CLIP", "VAE"));

    private NodeCatalog catalog;
    private WorkflowBackendPort backend;
    private GetNodeInfoTool tool;

    @BeforeEach
    void setUp() {
        catalog = mock(NodeCatalog.class);
        backend = mock(WorkflowBackendPort.class);
        tool = new GetNodeInfoTool(catalog, backend);
    }

    @Test
    void shouldDescribeNodeFromCatalog() {
        when(catalog.find("CheckpointLoaderSimple")).thenReturn(Optional.of(new NodeCatalog.CatalogNode(
                "CheckpointLoaderSimple", "Load Checkpoint", "loaders", "", CHECKPOINT_INFO)));

        ToolResult result = tool.execute(Map.of("node_class", "CheckpointLoaderSimple")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Node: CheckpointLoaderSimple\n  Display: Load Checkpoint"));
        assertTrue(result.getOutput().contains("    ckpt_name: enum[sd15.safetensors]"));
        assertTrue(result.getOutput().contains("    [2] VAE: VAE"));
        verifyNoInteractions(backend);
    }

    @Test
    void shouldFallBackToBackendForUnindexedNode() {
        when(catalog.find("CustomNode")).thenReturn(Optional.empty());
        when(backend.queryNodeInfo("CustomNode")).thenReturn(Map.of("CustomNode", Map.of("category", "custom")));

        ToolResult result = tool.execute(Map.of("node_class", "CustomNode")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("Category: custom"));
    }

    @Test
    void shouldReportUnknownNode() {
        when(catalog.find("Nope")).thenReturn(Optional.empty());
        when(backend.queryNodeInfo("Nope")).thenReturn(Map.of());

        ToolResult result = tool.execute(Map.of("node_class", "Nope")).join();

        assertFalse(result.isSuccess());
        assertEquals("Node 'Nope' not found. Use list_nodes to search.", result.getError());
    }

    @Test
    void shouldReportBackendFailure() {
        when(catalog.find("X")).thenReturn(Optional.empty());
        when(backend.queryNodeInfo("X")).thenThrow(new WorkflowBackendPort.WorkflowBackendException("refused"));

        ToolResult result = tool.execute(Map.of("node_class", "X")).join();

        assertEquals("Failed to get node info: refused", result.getError());
    }
}
