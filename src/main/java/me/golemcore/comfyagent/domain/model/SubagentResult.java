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
 * Outcome of a delegated task. Travels in {@link ToolResult#getData()} under
 * {@link #DATA_KEY} so the parent loop can record a {@code subagent} block next
 * to the tool result.
 */
public record SubagentResult(String task, String childSessionId, String content, boolean failed) {

    public static final String DATA_KEY = "subagent";

    public ContentBlock toContentBlock() {
        return ContentBlock.subagent(task, content, childSessionId, failed);
    }
}
