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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class InterruptTool implements ToolComponent {

    private final WorkflowBackendPort backend;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("interrupt")
                .description("Interrupt the workflow currently executing in ComfyUI. Pending prompts stay queued.")
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                backend.interrupt();
                return ToolResult.success("Execution interrupted.");
            } catch (WorkflowBackendPort.WorkflowBackendException e) {
                return ToolResult.failure("Failed to interrupt: " + e.getMessage());
            }
        });
    }
}
