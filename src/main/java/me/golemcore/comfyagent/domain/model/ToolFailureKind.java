package me.golemcore.comfyagent.domain.model;

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

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The model asked for a tool that is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * Arguments did not satisfy the tool's declared input schema.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, upstream errors).
     */
    EXECUTION_FAILED,

    /**
     * Tool did not finish within its time bound.
     */
    TIMEOUT,

    /**
     * Non-recoverable failure. The running turn is terminated.
     */
    FATAL
}
