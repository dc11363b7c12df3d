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

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A persisted conversation message made of ordered content blocks.
 *
 * <p>
 * The block list is replayed verbatim to the model on every call, so its order
 * is part of the contract: blocks are stored in the order they were emitted and
 * Jackson reproduces that order on reload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Message {

    public static final String META_CANCELLED = "cancelled";

    private String id;
    private MessageRole role;

    @Builder.Default
    private List<ContentBlock> blocks = new ArrayList<>();

    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static Message userText(String text, Instant timestamp) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.USER)
                .blocks(new ArrayList<>(List.of(ContentBlock.text(text))))
                .timestamp(timestamp)
                .build();
    }

    public static Message assistant(String text, List<ToolCall> toolCalls, Instant timestamp) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (text != null && !text.isBlank()) {
            blocks.add(ContentBlock.text(text));
        }
        if (toolCalls != null) {
            for (ToolCall call : toolCalls) {
                blocks.add(ContentBlock.toolCall(call));
            }
        }
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.ASSISTANT)
                .blocks(blocks)
                .timestamp(timestamp)
                .build();
    }

    public static Message toolResults(List<ContentBlock> blocks, Instant timestamp) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.TOOL_RESULT)
                .blocks(new ArrayList<>(blocks))
                .timestamp(timestamp)
                .build();
    }

    /**
     * Concatenated text of all text blocks, or an empty string.
     */
    @JsonIgnore
    public String getTextContent() {
        if (blocks == null) {
            return "";
        }
        return blocks.stream()
                .filter(b -> b.isType(ContentBlockType.TEXT) && b.getText() != null)
                .map(ContentBlock::getText)
                .collect(Collectors.joining("\n"));
    }

    @JsonIgnore
    public List<ContentBlock> getBlocksOfType(ContentBlockType type) {
        if (blocks == null) {
            return List.of();
        }
        return blocks.stream().filter(b -> b.isType(type)).toList();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return !getBlocksOfType(ContentBlockType.TOOL_CALL).isEmpty();
    }

    /**
     * A user message carrying operator text opens a new turn. Tool result
     * messages never do.
     */
    @JsonIgnore
    public boolean isTurnStart() {
        return role == MessageRole.USER && !getBlocksOfType(ContentBlockType.TEXT).isEmpty();
    }
}
