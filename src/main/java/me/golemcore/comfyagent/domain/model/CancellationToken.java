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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed into a turn.
 *
 * <p>
 * Checked by the agent loop between iterations and before starting each tool
 * call. Nothing is interrupted forcibly. A child token also reports cancellation
 * when any ancestor is cancelled, which lets a nested sub-agent stop together
 * with its parent turn.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CancellationToken parent;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /**
     * @return {@code true} if this call changed the state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
