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
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists model files of one folder (checkpoints, loras, vae and so on).
 */
@Component
@RequiredArgsConstructor
public class ListModelsTool implements ToolComponent {

    private static final String PARAM_FOLDER = "folder";
    private static final String DEFAULT_FOLDER = "checkpoints";

    private final WorkflowBackendPort backend;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("list_models")
                .description("List model files installed in ComfyUI. Folder can be: checkpoints, loras, vae, "
                        + "controlnet, upscale_models, embeddings, clip and similar.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_FOLDER, Map.of(
                                        "type", "string",
                                        "description", "Model folder (default: checkpoints)"))))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object raw = parameters.get(PARAM_FOLDER);
            String folder = raw instanceof String text && !text.isBlank() ? text.trim() : DEFAULT_FOLDER;
            try {
                List<String> models = backend.listModels(folder);
                if (models.isEmpty()) {
                    return ToolResult.success("No models found in '" + folder + "' folder.");
                }
                StringBuilder sb = new StringBuilder();
                sb.append("Models in '").append(folder).append("' (").append(models.size()).append("):\n");
                models.forEach(model -> sb.append("  - ").append(model).append('\n'));
                return ToolResult.success(sb.toString(), Map.of(PARAM_FOLDER, folder, "models", models));
            } catch (WorkflowBackendPort.WorkflowBackendException e) {
                return ToolResult.failure("Failed to list models: " + e.getMessage());
            }
        });
    }
}
