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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Result of tool execution containing success status, output text, optional
 * structured data, and error information. Tool results are sent back to the
 * model as {@code tool_result} content blocks.
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Map<String, Object> data;
    private String error;
    private ToolFailureKind failureKind;

    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult success(String output, Map<String, Object> data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }

    /**
     * Text that goes into the conversation: output on success, error otherwise.
     */
    public String toConversationText() {
        if (success) {
            return output != null ? output : "";
        }
        return error != null ? error : "Tool failed";
    }

    public boolean isFatal() {
        return !success && failureKind == ToolFailureKind.FATAL;
    }
}
