package me.golemcore.comfyagent.domain.context;

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

import me.golemcore.comfyagent.domain.model.Message;

import java.util.List;

/**
 * Shrinks the history sent to the model when it no longer fits the context
 * budget.
 *
 * <p>
 * Implementations return a new view and never modify the persisted history. A
 * {@code tool_call} block and its {@code tool_result} are either both kept or
 * both dropped.
 */
public interface ContextCompressor {

    List<Message> compress(String sessionId, List<Message> history);

    /**
     * Drops whatever the compressor keeps for a session that no longer exists.
     */
    default void forget(String sessionId) {
    }
}
