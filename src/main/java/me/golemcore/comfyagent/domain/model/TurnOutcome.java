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

import java.time.Duration;

/**
 * Result of a finished turn. Exactly one outcome exists per turn and it mirrors
 * the terminal event that was emitted for it.
 */
@Builder
public record TurnOutcome(String sessionId, TurnStatus status, String content, ErrorKind errorKind, String error,
        int iterations, ModelUsage usage, Duration duration) {

    public boolean isCompleted() {
        return status == TurnStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == TurnStatus.FAILED;
    }
}
