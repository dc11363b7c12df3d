package me.golemcore.comfyagent.adapter.outbound.comfyui;

import feign.FeignException;
import feign.Request;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ComfyUiAdapterTest {

    private static final Map<String, Object> WORKFLOW = Map.of(
            "1", Map.of("class_type", "EmptyLatentImage", "inputs", Map.of("width", 512)));

    private ComfyUiApi api;
    private AgentProperties properties;
    private ComfyUiAdapter adapter;

    @BeforeEach
    void setUp() {
        api = mock(ComfyUiApi.class);
        properties = new AgentProperties();
        properties.getComfyui().setClientId("agent-1");
        adapter = new ComfyUiAdapter(api, properties);
    }

    private static FeignException feignException(int status, String body) {
        Request request = Request.create(Request.HttpMethod.POST, "http://127.0.0.1:8188/prompt",
                Collections.emptyMap(), null, null, null);
        return FeignException.errorStatus("queuePrompt", feign.Response.builder()
                .status(status)
                .reason("Error")
                .request(request)
                .headers(Collections.emptyMap())
                .body(body, StandardCharsets.UTF_8)
                .build());
    }

    // ==================== Submit ====================

    @Test
    void shouldWrapWorkflowWithClientId() {
        when(api.queuePrompt(anyMap())).thenReturn(Map.of("prompt_id", "p-1", "number", 3));

        String promptId = adapter.submit(WORKFLOW);

        assertEquals("p-1", promptId);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(api).queuePrompt(captor.capture());
        assertSame(WORKFLOW, captor.getValue().get("prompt"));
        assertEquals("agent-1", captor.getValue().get("client_id"));
    }

    @Test
    void shouldFailWhenPromptIdMissing() {
        when(api.queuePrompt(anyMap())).thenReturn(Map.of("error", "weird"));

        WorkflowBackendPort.WorkflowBackendException error = assertThrows(
                WorkflowBackendPort.WorkflowBackendException.class, () -> adapter.submit(WORKFLOW));

        assertTrue(error.getMessage().startsWith("ComfyUI accepted the workflow but returned no prompt_id"));
    }

    @Test
    void shouldReportHttpStatusAndBody() {
        when(api.queuePrompt(anyMap()))
                .thenThrow(feignException(400, "{\"error\":\"prompt_outputs_failed_validation\"}"));

        WorkflowBackendPort.WorkflowBackendException error = assertThrows(
                WorkflowBackendPort.WorkflowBackendException.class, () -> adapter.submit(WORKFLOW));

        assertEquals("ComfyUI queue prompt failed with HTTP 400: {\"error\":\"prompt_outputs_failed_validation\"}",
                error.getMessage());
        assertInstanceOf(FeignException.class, error.getCause());
    }

    @Test
    void shouldTruncateLongErrorBody() {
        when(api.queuePrompt(anyMap())).thenThrow(feignException(500, "x".repeat(1000)));

        WorkflowBackendPort.WorkflowBackendException error = assertThrows(
                WorkflowBackendPort.WorkflowBackendException.class, () -> adapter.submit(WORKFLOW));

        assertTrue(error.getMessage().endsWith("x".repeat(300) + "..."));
    }

    @Test
    void shouldReportUnreachableBackend() {
        FeignException refused = mock(FeignException.class);
        when(refused.status()).thenReturn(-1);
        when(refused.getMessage()).thenReturn("Connection refused");
        when(api.systemStats()).thenThrow(refused);

        WorkflowBackendPort.WorkflowBackendException error = assertThrows(
                WorkflowBackendPort.WorkflowBackendException.class, () -> adapter.systemStats());

        assertEquals("ComfyUI unreachable (system_stats): Connection refused", error.getMessage());
    }

    // ==================== Queries ====================

    @Test
    void shouldQueryRecentHistoryWithoutPromptId() {
        when(api.history(properties.getComfyui().getHistoryMaxItems())).thenReturn(Map.of("p-1", Map.of()));

        assertEquals(Map.of("p-1", Map.of()), adapter.queryHistory(null));
        verify(api, never()).history(anyString());
    }

    @Test
    void shouldQuerySingleHistoryEntry() {
        when(api.history("p-1")).thenReturn(Map.of("p-1", Map.of("outputs", Map.of())));

        assertTrue(adapter.queryHistory("p-1").containsKey("p-1"));
    }

    @Test
    void shouldTreatNullBodiesAsEmpty() {
        when(api.objectInfo()).thenReturn(null);
        when(api.models("loras")).thenReturn(null);

        assertEquals(Map.of(), adapter.queryObjectInfo());
        assertEquals(List.of(), adapter.listModels("loras"));
    }

    @Test
    void shouldInterruptExecution() {
        adapter.interrupt();

        verify(api).interrupt();
    }
}
