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

import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executable tool that the model can invoke by name.
 *
 * <p>
 * Tools expose their JSON Schema definition to the model via function calling
 * and implement the execution logic. Arguments are validated against
 * {@link #getDefinition()} before {@link #execute} is called, so
 * implementations may rely on required parameters being present with the
 * declared JSON types.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with validated parameters.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Executes the tool with access to the calling turn. Tools that need the
     * session or the cancellation token override this variant.
     */
    default CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolInvocationContext context) {
        return execute(parameters);
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Per-tool timeout, or {@code null} to use the executor default.
     */
    default Duration getTimeout() {
        return null;
    }

    default boolean isEnabled() {
        return true;
    }
}
