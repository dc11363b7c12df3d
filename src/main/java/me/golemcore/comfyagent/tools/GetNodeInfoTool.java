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
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.NodeCatalog;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Describes one node class: inputs with their types and constraints, and
 * outputs. Served from the catalog, falling back to a direct backend query for
 * nodes installed after the last refresh.
 */
@Component
@RequiredArgsConstructor
public class GetNodeInfoTool implements ToolComponent {

    private static final String PARAM_NODE_CLASS = "node_class";

    private final NodeCatalog catalog;
    private final WorkflowBackendPort backend;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_node_info")
                .description("Get the inputs, outputs and parameter constraints of a ComfyUI node class "
                        + "(e.g. 'KSampler', 'CheckpointLoaderSimple'). Use before wiring a node into a workflow.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_NODE_CLASS, Map.of(
                                        "type", "string",
                                        "description", "Exact node class name")),
                        "required", List.of(PARAM_NODE_CLASS)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String nodeClass = String.valueOf(parameters.get(PARAM_NODE_CLASS)).trim();

            var cached = catalog.find(nodeClass);
            if (cached.isPresent()) {
                return ToolResult.success(NodeFormatter.detail(cached.get().className(), cached.get().info()));
            }

            try {
                Map<String, Object> response = backend.queryNodeInfo(nodeClass);
                if (response.get(nodeClass) instanceof Map<?, ?> info) {
                    return ToolResult.success(NodeFormatter.detail(nodeClass, (Map<String, Object>) info));
                }
                return ToolResult.failure("Node '" + nodeClass + "' not found. Use list_nodes to search.");
            } catch (WorkflowBackendPort.WorkflowBackendException e) {
                return ToolResult.failure("Failed to get node info: " + e.getMessage());
            }
        });
    }
}
