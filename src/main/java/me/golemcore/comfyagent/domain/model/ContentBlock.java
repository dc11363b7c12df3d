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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Ordered, tagged unit of a message.
 *
 * <p>
 * Which fields are populated depends on {@link #type}:
 * <ul>
 * <li>{@code text} - {@link #text}</li>
 * <li>{@code tool_call} - {@link #toolCallId}, {@link #toolName},
 * {@link #arguments}</li>
 * <li>{@code tool_result} - {@link #toolCallId}, {@link #toolName},
 * {@link #result}, {@link #error}</li>
 * <li>{@code subagent} - {@link #task}, {@link #result},
 * {@link #childSessionId}, {@link #error}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentBlock {

    private ContentBlockType type;
    private String text;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    private String result;
    private Boolean error;
    private String task;
    private String childSessionId;

    public static ContentBlock text(String text) {
        return ContentBlock.builder()
                .type(ContentBlockType.TEXT)
                .text(text)
                .build();
    }

    public static ContentBlock toolCall(ToolCall call) {
        return ContentBlock.builder()
                .type(ContentBlockType.TOOL_CALL)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .arguments(call.getArguments())
                .build();
    }

    public static ContentBlock toolResult(String toolCallId, String toolName, String result, boolean error) {
        return ContentBlock.builder()
                .type(ContentBlockType.TOOL_RESULT)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .result(result)
                .error(error)
                .build();
    }

    public static ContentBlock subagent(String task, String result, String childSessionId, boolean error) {
        return ContentBlock.builder()
                .type(ContentBlockType.SUBAGENT)
                .task(task)
                .result(result)
                .childSessionId(childSessionId)
                .error(error)
                .build();
    }

    public boolean isType(ContentBlockType candidate) {
        return type == candidate;
    }

    @JsonIgnore
    public boolean hasError() {
        return Boolean.TRUE.equals(error);
    }
}
