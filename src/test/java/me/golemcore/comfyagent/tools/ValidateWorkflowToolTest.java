package me.golemcore.comfyagent.tools;

import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.NodeCatalog;
import me.golemcore.comfyagent.domain.service.NodeCatalog.CatalogNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ValidateWorkflowToolTest {

    private static final String WORKFLOW = "workflow";
    private static final String CHECKPOINT = "CheckpointLoaderSimple";
    private static final String ENCODE = "CLIPTextEncode";

    private static final CatalogNode CHECKPOINT_NODE = new CatalogNode(CHECKPOINT, "Load Checkpoint", "loaders", "",
            Map.of("input", Map.of("required", Map.of("ckpt_name", List.of(List.of("sd15.safetensors")))),
                    "output", List.of("MODEL", "CLIP", "VAE")));
    private static final CatalogNode ENCODE_NODE = new CatalogNode(ENCODE, "CLIP Text Encode", "conditioning", "",
            Map.of("input", Map.of(
                    "required", Map.of("text", List.of("STRING"), "clip", List.of("CLIP")),
                    "hidden", Map.of("unique_id", "UNIQUE_ID")),
                    "output", List.of("CONDITIONING")));

    private NodeCatalog catalog;
    private ValidateWorkflowTool tool;

    @BeforeEach
    void setUp() {
        catalog = mock(NodeCatalog.class);
        when(catalog.isBuilt()).thenReturn(true);
        when(catalog.find(anyString())).thenReturn(Optional.empty());
        when(catalog.find(CHECKPOINT)).thenReturn(Optional.of(CHECKPOINT_NODE));
        when(catalog.find(ENCODE)).thenReturn(Optional.of(ENCODE_NODE));
        tool = new ValidateWorkflowTool(catalog);
    }

    private static Map<String, Object> node(String classType, Map<String, Object> inputs) {
        return Map.of("class_type", classType, "inputs", inputs);
    }

    private static Map<String, Object> workflow(Object... idsAndNodes) {
        Map<String, Object> workflow = new LinkedHashMap<>();
        for (int i = 0; i < idsAndNodes.length; i += 2) {
            workflow.put((String) idsAndNodes[i], idsAndNodes[i + 1]);
        }
        return workflow;
    }

    private ToolResult validate(Map<String, Object> workflow) {
        return tool.execute(Map.of(WORKFLOW, workflow)).join();
    }

    @SuppressWarnings("unchecked")
    private static List<String> errors(ToolResult result) {
        return (List<String>) result.getData().get("errors");
    }

    // ==================== Valid ====================

    @Test
    void shouldAcceptWellFormedWorkflow() {
        ToolResult result = validate(workflow(
                "1", node(CHECKPOINT, Map.of("ckpt_name", "sd15.safetensors")),
                "2", node(ENCODE, Map.of("text", "a cat", "clip", List.of("1", 1)))));

        assertTrue(result.isSuccess());
        assertEquals("Workflow valid: 2 nodes, all checks passed.", result.getOutput());
        assertEquals(Boolean.TRUE, result.getData().get("valid"));
    }

    @Test
    void shouldAcceptHiddenInputs() {
        ToolResult result = validate(workflow(
                "1", node(CHECKPOINT, Map.of("ckpt_name", "sd15.safetensors")),
                "2", node(ENCODE, Map.of("text", "a cat", "clip", List.of("1", 1), "unique_id", "2"))));

        assertEquals("Workflow valid: 2 nodes, all checks passed.", result.getOutput());
    }

    // ==================== Errors ====================

    @Test
    void shouldReportUnknownClassType() {
        ToolResult result = validate(workflow("5", node("NoSuchNode", Map.of())));

        assertTrue(result.isSuccess());
        assertEquals("Errors (1):\n  - Node 5: unknown class_type 'NoSuchNode'", result.getOutput());
        assertEquals(Boolean.FALSE, result.getData().get("valid"));
    }

    @Test
    void shouldSuggestCorrectCasingForClassType() {
        when(catalog.find("checkpointloadersimple")).thenReturn(Optional.of(CHECKPOINT_NODE));

        ToolResult result = validate(workflow("1", node("checkpointloadersimple", Map.of())));

        assertEquals(List.of("Node 1: unknown class_type 'checkpointloadersimple' (did you mean '"
                + CHECKPOINT + "'?)"), errors(result));
    }

    @Test
    void shouldReportMissingClassTypeAndNonObjectNodes() {
        ToolResult result = validate(workflow("1", Map.of("inputs", Map.of()), "2", "not a node"));

        assertEquals(List.of("Node 1: missing class_type",
                "Node 2: expected an object with class_type and inputs"), errors(result));
    }

    @Test
    void shouldReportMissingRequiredInput() {
        ToolResult result = validate(workflow(
                "1", node(CHECKPOINT, Map.of("ckpt_name", "sd15.safetensors")),
                "2", node(ENCODE, Map.of("clip", List.of("1", 1)))));

        assertEquals(List.of("Node 2 (CLIPTextEncode): missing required input 'text'"), errors(result));
    }

    @Test
    void shouldReportLinkToMissingNode() {
        ToolResult result = validate(workflow(
                "2", node(ENCODE, Map.of("text", "a cat", "clip", List.of("9", 1)))));

        assertEquals(List.of("Node 2 (CLIPTextEncode): input 'clip' links to missing node 9"), errors(result));
    }

    @Test
    void shouldReportLinkToMissingOutputSlot() {
        ToolResult result = validate(workflow(
                "1", node(CHECKPOINT, Map.of("ckpt_name", "sd15.safetensors")),
                "2", node(ENCODE, Map.of("text", "a cat", "clip", List.of("1", 3)))));

        assertEquals(List.of("Node 2 (CLIPTextEncode): input 'clip' links to output 3 of node 1 "
                + "(CheckpointLoaderSimple), which has 3 outputs"), errors(result));
    }

    // ==================== Warnings ====================

    @Test
    void shouldWarnAboutUndeclaredInputWithoutFailing() {
        ToolResult result = validate(workflow(
                "1", node(CHECKPOINT, Map.of("ckpt_name", "sd15.safetensors", "strength", 1.0))));

        assertTrue(errors(result).isEmpty());
        assertEquals(Boolean.TRUE, result.getData().get("valid"));
        assertEquals("Warnings (1):\n  - Node 1 (CheckpointLoaderSimple): unknown input 'strength'",
                result.getOutput());
    }

    // ==================== Preconditions ====================

    @Test
    void shouldFailWhenNodeIndexIsNotBuilt() {
        when(catalog.isBuilt()).thenReturn(false);

        ToolResult result = validate(workflow("1", node(CHECKPOINT, Map.of())));

        assertFalse(result.isSuccess());
        assertEquals("Node index not available: cannot validate without ComfyUI.", result.getError());
    }

    @Test
    void shouldRejectEmptyWorkflow() {
        ToolResult result = validate(Map.of());

        assertFalse(result.isSuccess());
        assertEquals("workflow must contain at least one node", result.getError());
        verifyNoInteractions(catalog);
    }
}
