package me.golemcore.comfyagent.port.outbound;

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

import me.golemcore.comfyagent.domain.model.ModelRequest;
import me.golemcore.comfyagent.domain.model.ModelResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Port for a single language-model call. Implementations perform exactly one
 * attempt and report failures as
 * {@link me.golemcore.comfyagent.domain.exception.ModelCallException}; retry
 * and backoff belong to the caller.
 */
public interface ModelPort {

    /**
     * Sends the conversation and tool schema and waits for the complete response.
     */
    CompletableFuture<ModelResponse> chat(ModelRequest request);

    /**
     * Streams text increments to {@code onDelta} while the response is produced.
     * The completed future carries the assembled response, tool calls included.
     * Adapters without streaming support fall back to {@link #chat}.
     */
    default CompletableFuture<ModelResponse> chatStream(ModelRequest request, Consumer<String> onDelta) {
        return chat(request);
    }

    default boolean supportsStreaming() {
        return false;
    }

    String getModelName();

    boolean isAvailable();
}
