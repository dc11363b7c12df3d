package me.golemcore.comfyagent.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Execution history: status and output image URLs of one prompt, or the most
 * recent prompts with their status.
 */
@Component
public class GetHistoryTool implements ToolComponent {

    private static final String PARAM_PROMPT_ID = "prompt_id";
    private static final int RECENT_ENTRIES = 10;

    private final WorkflowBackendPort backend;
    private final String baseUrl;

    public GetHistoryTool(WorkflowBackendPort backend, AgentProperties properties) {
        this.backend = backend;
        this.baseUrl = properties.getComfyui().getBaseUrl();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_history")
                .description("Get ComfyUI execution history. With prompt_id, returns that execution's status "
                        + "and output image URLs. Otherwise lists recent executions.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PROMPT_ID, Map.of(
                                        "type", "string",
                                        "description", "prompt_id returned by submit_workflow"))))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object raw = parameters.get(PARAM_PROMPT_ID);
            String promptId = raw instanceof String text && !text.isBlank() ? text.trim() : null;
            try {
                Map<String, Object> history = backend.queryHistory(promptId);
                if (promptId != null) {
                    return describeExecution(promptId, history);
                }
                return describeRecent(history);
            } catch (WorkflowBackendPort.WorkflowBackendException e) {
                return ToolResult.failure("Failed to get history: " + e.getMessage());
            }
        });
    }

    private ToolResult describeExecution(String promptId, Map<String, Object> history) {
        if (!(history.get(promptId) instanceof Map<?, ?> entry)) {
            return ToolResult.success("No history for " + promptId + " yet. It may still be queued or running.");
        }

        List<String> lines = new ArrayList<>();
        lines.add("Execution " + promptId + ":");
        lines.add("  Status: " + statusOf(entry));
        List<String> images = new ArrayList<>();
        if (entry.get("outputs") instanceof Map<?, ?> outputs && !outputs.isEmpty()) {
            lines.add("  Outputs:");
            outputs.forEach((nodeId, output) -> {
                if (output instanceof Map<?, ?> nodeOutput && nodeOutput.get("images") instanceof List<?> list) {
                    for (Object image : list) {
                        if (image instanceof Map<?, ?> img) {
                            String url = imageUrl(img);
                            images.add(url);
                            lines.add("    Node " + nodeId + ": " + url);
                        }
                    }
                }
            });
        }
        return ToolResult.success(String.join("\n", lines), Map.of(PARAM_PROMPT_ID, promptId, "images", images));
    }

    private static ToolResult describeRecent(Map<String, Object> history) {
        List<String> ids = new ArrayList<>(history.keySet());
        List<String> shown = ids.subList(Math.max(0, ids.size() - RECENT_ENTRIES), ids.size());
        List<String> lines = new ArrayList<>();
        lines.add("Recent executions (" + ids.size() + " total, showing last " + shown.size() + "):");
        for (String id : shown) {
            Object entry = history.get(id);
            lines.add("  - " + id + " [" + (entry instanceof Map<?, ?> map ? statusOf(map) : "unknown") + "]");
        }
        return ToolResult.success(String.join("\n", lines));
    }

    private static String statusOf(Map<?, ?> entry) {
        if (entry.get("status") instanceof Map<?, ?> status && status.get("status_str") != null) {
            return String.valueOf(status.get("status_str"));
        }
        return "unknown";
    }

    private String imageUrl(Map<?, ?> image) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/api/view")
                .queryParam("filename", image.get("filename"))
                .queryParam("subfolder", image.get("subfolder") != null ? image.get("subfolder") : "")
                .queryParam("type", image.get("type") != null ? image.get("type") : "output")
                .encode()
                .toUriString();
    }
}
