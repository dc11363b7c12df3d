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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of everything that can end or disturb a turn.
 *
 * <p>
 * Tool failures and timeouts are fed back to the model as conversation content.
 * Budget exhaustion and cancellation are clean terminal states. Upstream and
 * persistence failures end the turn with an error event.
 */
public enum ErrorKind {

    /**
     * Retryable model or network failure (rate limits, 5xx, timeouts).
     */
    TRANSIENT_UPSTREAM,

    /**
     * Non-retryable model failure: bad request, authentication, exhausted
     * retries.
     */
    FATAL_UPSTREAM,

    /**
     * Tool-local failure, isolated and returned to the model.
     */
    TOOL_FAILURE,

    /**
     * Tool exceeded its time bound. A special case of {@link #TOOL_FAILURE}.
     */
    TOOL_TIMEOUT,

    /**
     * Iteration or context-size budget hit.
     */
    BUDGET_EXCEEDED,

    /**
     * Operator requested cancellation.
     */
    CANCELLED,

    /**
     * Session store unavailable. Fatal to the turn, not to the process.
     */
    PERSISTENCE_FAILURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
