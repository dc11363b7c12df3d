package me.golemcore.comfyagent.domain.exception;

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

import lombok.Getter;

/**
 * Failure of a single model provider call, classified for the retry policy.
 */
@Getter
public class ModelCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * How the retry policy treats the failure.
     */
    public enum Kind {
        RATE_LIMITED, TRANSIENT, FATAL;

        public boolean isRetryable() {
            return this != FATAL;
        }
    }

    private final Kind kind;
    private final Long retryAfterMs;

    public ModelCallException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ModelCallException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ModelCallException(Kind kind, String message, Long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfterMs = retryAfterMs;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
