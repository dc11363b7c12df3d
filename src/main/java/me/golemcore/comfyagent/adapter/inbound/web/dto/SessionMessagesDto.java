package me.golemcore.comfyagent.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Ordered history of one session, block by block.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMessagesDto {

    @JsonProperty("session_id")
    private String sessionId;
    private List<MessageDto> messages;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MessageDto {
        private String id;
        private String role;
        private String timestamp;
        private Boolean cancelled;
        private List<BlockDto> blocks;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BlockDto {
        private String type;
        private String text;
        @JsonProperty("tool_call_id")
        private String toolCallId;
        @JsonProperty("tool_name")
        private String toolName;
        private Map<String, Object> arguments;
        private String result;
        @JsonProperty("is_error")
        private Boolean error;
        private String task;
        @JsonProperty("child_session_id")
        private String childSessionId;
    }
}
