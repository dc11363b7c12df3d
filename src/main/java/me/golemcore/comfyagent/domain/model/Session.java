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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable record of one conversation. Owned by the session store; the agent
 * loop only appends messages, the gateway creates, renames and deletes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String id;
    private String title;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    private String parentSessionId;
    private long totalInputTokens;
    private long totalOutputTokens;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isChild() {
        return parentSessionId != null && !parentSessionId.isBlank();
    }
}
