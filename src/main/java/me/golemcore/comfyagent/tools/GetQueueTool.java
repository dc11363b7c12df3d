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
 * Running and pending queue entries.
 */
@Component
@RequiredArgsConstructor
public class GetQueueTool implements ToolComponent {

    private static final int MAX_PENDING_SHOWN = 10;

    private final WorkflowBackendPort backend;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_queue")
                .description("Get the current ComfyUI execution queue (running and pending prompts).")
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Object> queue;
            try {
                queue = backend.queryQueue();
            } catch (WorkflowBackendPort.WorkflowBackendException e) {
                return ToolResult.failure("Failed to get queue: " + e.getMessage());
            }

            List<?> running = queue.get("queue_running") instanceof List<?> list ? list : List.of();
            List<?> pending = queue.get("queue_pending") instanceof List<?> list ? list : List.of();

            StringBuilder sb = new StringBuilder();
            sb.append("Queue status:\n  Running: ").append(running.size())
                    .append("\n  Pending: ").append(pending.size()).append('\n');
            for (Object item : running) {
                sb.append("  [running] prompt_id: ").append(promptIdOf(item)).append('\n');
            }
            for (Object item : pending.subList(0, Math.min(MAX_PENDING_SHOWN, pending.size()))) {
                sb.append("  [pending] prompt_id: ").append(promptIdOf(item)).append('\n');
            }
            if (pending.size() > MAX_PENDING_SHOWN) {
                sb.append("  ... and ").append(pending.size() - MAX_PENDING_SHOWN).append(" more\n");
            }
            return ToolResult.success(sb.toString(),
                    Map.of("running", running.size(), "pending", pending.size()));
        });
    }

    // Queue entries are [number, prompt_id, prompt, extra_data, outputs]
    private static Object promptIdOf(Object item) {
        if (item instanceof List<?> entry && entry.size() > 1) {
            return entry.get(1);
        }
        return "unknown";
    }
}
