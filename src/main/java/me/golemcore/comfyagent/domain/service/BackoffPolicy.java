package me.golemcore.comfyagent.domain.service;

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

import me.golemcore.comfyagent.infrastructure.config.AgentProperties;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * <p>
 * {@code delay(n) = min(max, base * 2^(n-1) * U(1 - jitter, 1 + jitter))}. A
 * provider supplied retry-after hint replaces the computed value and is capped
 * at the same maximum.
 */
public final class BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, double jitter, DoubleSupplier random) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("Jitter must be in [0, 1): " + jitter);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
        this.random = random;
    }

    public static BackoffPolicy from(AgentProperties.RetryProperties retry) {
        return new BackoffPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitter(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param attempt
     *            1-based number of the attempt that just failed
     * @param retryAfterMs
     *            provider hint, or {@code null}
     */
    public long delayFor(int attempt, Long retryAfterMs) {
        if (retryAfterMs != null && retryAfterMs >= 0) {
            return Math.min(retryAfterMs, maxDelayMs);
        }
        double exponential = baseDelayMs * Math.pow(2, Math.max(0, attempt - 1));
        double factor = 1 - jitter + random.getAsDouble() * 2 * jitter;
        return (long) Math.min(maxDelayMs, exponential * factor);
    }
}
