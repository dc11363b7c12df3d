package me.golemcore.comfyagent.domain.tools;

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
import me.golemcore.comfyagent.domain.model.ToolCall;
import me.golemcore.comfyagent.domain.model.ToolFailureKind;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves, validates and runs one tool call.
 *
 * <p>
 * Never throws: unknown tools, schema violations, timeouts and exceptions all
 * come back as failed {@link ToolResult}s so the model can see the failure and
 * adjust. Output longer than {@code agent.tools.max-result-chars} is cut in the
 * middle, keeping its head and tail.
 */
@Component
@Slf4j
public class ToolExecutor {

    private final Duration defaultTimeout;
    private final int maxResultChars;

    @Autowired
    public ToolExecutor(AgentProperties properties) {
        this(Duration.ofSeconds(properties.getTools().getTimeoutSeconds()),
                properties.getTools().getMaxResultChars());
    }

    public ToolExecutor(Duration defaultTimeout, int maxResultChars) {
        this.defaultTimeout = defaultTimeout;
        this.maxResultChars = maxResultChars;
    }

    public ToolResult execute(ToolRegistry registry, ToolCall call, ToolInvocationContext context) {
        String toolName = sanitizeToolName(call.getName());
        ToolComponent tool = registry.get(toolName).orElse(null);
        if (tool == null) {
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolName + ". Available tools: " + String.join(", ", registry.getToolNames()));
        }

        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        List<String> violations = ToolSchemaValidator.validate(tool.getDefinition().getInputSchema(), arguments);
        if (!violations.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments for '" + toolName + "': " + String.join("; ", violations));
        }

        Duration timeout = tool.getTimeout() != null ? tool.getTimeout() : defaultTimeout;
        log.debug("[Tools] Executing '{}' (timeout {}s)", toolName, timeout.toSeconds());
        ToolResult result = invoke(tool, toolName, arguments, context, timeout);
        return truncate(result, toolName);
    }

    private ToolResult invoke(ToolComponent tool, String toolName, Map<String, Object> arguments,
            ToolInvocationContext context, Duration timeout) {
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(arguments, context);
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("Tool '" + toolName + "' failed: no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] '{}' timed out after {}s", toolName, timeout.toSeconds());
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool '" + toolName + "' timed out after " + timeout.toSeconds() + " seconds");
        } catch (ExecutionException e) {
            log.error("[Tools] '{}' failed", toolName, e.getCause());
            return ToolResult.failure("Tool '" + toolName + "' failed: " + safeCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure("Tool '" + toolName + "' failed: interrupted");
        } catch (RuntimeException e) { // NOSONAR - tool bodies may throw before returning a future
            log.error("[Tools] '{}' failed", toolName, e);
            return ToolResult.failure("Tool '" + toolName + "' failed: " + safeCauseMessage(e));
        }
    }

    ToolResult truncate(ToolResult result, String toolName) {
        if (result.isSuccess() && result.getOutput() != null && result.getOutput().length() > maxResultChars) {
            log.warn("[Tools] Truncating '{}' result: {} chars", toolName, result.getOutput().length());
            return result.toBuilder().output(truncateMiddle(result.getOutput(), maxResultChars)).build();
        }
        if (!result.isSuccess() && result.getError() != null && result.getError().length() > maxResultChars) {
            return result.toBuilder().error(truncateMiddle(result.getError(), maxResultChars)).build();
        }
        return result;
    }

    /**
     * Keeps the first and last {@code maxChars / 2} characters and reports how
     * many lines were dropped between them.
     */
    public static String truncateMiddle(String text, int maxChars) {
        if (text == null || maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        int half = maxChars / 2;
        String middle = text.substring(half, text.length() - half);
        long droppedLines = middle.chars().filter(c -> c == '\n').count();
        return text.substring(0, half)
                + "\n\n... [" + droppedLines + " lines truncated] ...\n\n"
                + text.substring(text.length() - half);
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
