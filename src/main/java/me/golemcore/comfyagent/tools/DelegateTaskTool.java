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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.model.CancellationToken;
import me.golemcore.comfyagent.domain.model.SubagentResult;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolFailureKind;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.SubagentDelegator;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.domain.tools.ToolInvocationContext;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Hands a self-contained research task to a sub-agent running in a child
 * session with the read-only tool set.
 *
 * <p>
 * The nested loop observes a child of the calling turn's cancellation token, so
 * cancelling the parent turn (or timing out this tool call) stops it too.
 */
@Component
@Slf4j
public class DelegateTaskTool implements ToolComponent {

    private static final String PARAM_TASK = "task";

    private final SubagentDelegator delegator;
    private final ExecutorService executor;
    private final AgentProperties.SubagentProperties settings;

    public DelegateTaskTool(SubagentDelegator delegator, @Qualifier("agentExecutor") ExecutorService executor,
            AgentProperties properties) {
        this.delegator = delegator;
        this.executor = executor;
        this.settings = properties.getSubagent();
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(settings.getTimeoutSeconds());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("delegate_task")
                .description("Delegate a focused, self-contained research task to a sub-agent (for example: "
                        + "'find which installed nodes can upscale an image and what inputs they need'). "
                        + "The sub-agent can browse nodes, models, queue, history and the web, but cannot "
                        + "submit workflows. Returns its final answer.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_TASK, Map.of(
                                        "type", "string",
                                        "description", "Complete task description with all needed context")),
                        "required", List.of(PARAM_TASK)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.completedFuture(
                ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "delegate_task requires a calling session"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolInvocationContext context) {
        String task = String.valueOf(parameters.get(PARAM_TASK)).trim();
        if (task.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "task must not be empty"));
        }

        CancellationToken childToken = context.cancellationToken().child();
        CompletableFuture<ToolResult> future = CompletableFuture.supplyAsync(
                () -> toToolResult(delegator.delegate(context.sessionId(), task, childToken)), executor);
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                log.debug("[Subagent] delegate_task abandoned in session {}, cancelling child", context.sessionId());
                childToken.cancel();
            }
        });
        return future;
    }

    private static ToolResult toToolResult(SubagentResult result) {
        Map<String, Object> data = Map.of(SubagentResult.DATA_KEY, result);
        if (!result.failed()) {
            return ToolResult.success(result.content(), data);
        }
        return ToolResult.builder()
                .success(false)
                .error("Sub-agent failed: " + result.content())
                .failureKind(ToolFailureKind.EXECUTION_FAILED)
                .data(data)
                .build();
    }
}
