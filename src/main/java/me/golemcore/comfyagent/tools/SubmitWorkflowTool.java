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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Queues a workflow graph in API format. On success the result data carries
 * {@code workflow} and {@code prompt_id}, which the loop republishes as a
 * {@code workflow.submitted} event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubmitWorkflowTool implements ToolComponent {

    static final String PARAM_WORKFLOW = "workflow";

    private final WorkflowBackendPort backend;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("submit_workflow")
                .description("Submit a ComfyUI workflow for execution. The workflow must be in API format: "
                        + "an object mapping node ids to {class_type, inputs}. Links are [source_node_id, "
                        + "output_index]. Returns the prompt_id for tracking with get_history.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_WORKFLOW, Map.of(
                                        "type", "object",
                                        "description", "Workflow in API format (node_id -> {class_type, inputs})")),
                        "required", List.of(PARAM_WORKFLOW)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Object> workflow = (Map<String, Object>) parameters.get(PARAM_WORKFLOW);
            if (workflow.isEmpty()) {
                return ToolResult.failure("workflow must contain at least one node");
            }

            try {
                String promptId = backend.submit(workflow);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put(PARAM_WORKFLOW, workflow);
                data.put("prompt_id", promptId);
                return ToolResult.success("Workflow submitted successfully. prompt_id: " + promptId, data);
            } catch (WorkflowBackendPort.WorkflowBackendException e) {
                log.debug("[Tools] submit_workflow rejected: {}", e.getMessage());
                return ToolResult.failure("Failed to queue prompt: " + e.getMessage());
            }
        });
    }
}
