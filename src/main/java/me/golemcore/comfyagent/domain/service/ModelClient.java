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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.events.AgentEventType;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.exception.ModelCallException;
import me.golemcore.comfyagent.domain.model.ModelRequest;
import me.golemcore.comfyagent.domain.model.ModelResponse;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Model call with retry and exponential backoff.
 *
 * <p>
 * Rate limits and transient upstream failures are retried up to
 * {@code agent.llm.retry.max-attempts} times in total. Before each wait an
 * {@code llm.retry} event is emitted on the session stream so the operator sees
 * why the turn is stalled. Fatal failures propagate immediately, and the last
 * retryable failure is escalated to {@link ModelCallException.Kind#FATAL}.
 */
@Component
@Slf4j
public class ModelClient {

    private final ModelPort modelPort;
    private final EventBus eventBus;
    private final BackoffPolicy backoffPolicy;
    private final int maxAttempts;
    private final boolean streaming;
    private final Sleeper sleeper;

    /**
     * Receives streamed text. {@link #onRetry()} tells the receiver to drop what
     * it accumulated for the failed attempt.
     */
    public interface StreamListener {

        void onDelta(String text);

        default void onRetry() {
        }
    }

    @FunctionalInterface
    public interface Sleeper {

        void sleep(long millis) throws InterruptedException;
    }

    @Autowired
    public ModelClient(ModelPort modelPort, EventBus eventBus, AgentProperties properties) {
        this(modelPort, eventBus, BackoffPolicy.from(properties.getLlm().getRetry()),
                properties.getLlm().getRetry().getMaxAttempts(), properties.getLlm().isStreaming(), Thread::sleep);
    }

    // Visible for testing
    public ModelClient(ModelPort modelPort, EventBus eventBus, BackoffPolicy backoffPolicy, int maxAttempts,
            boolean streaming, Sleeper sleeper) {
        this.modelPort = modelPort;
        this.eventBus = eventBus;
        this.backoffPolicy = backoffPolicy;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.streaming = streaming;
        this.sleeper = sleeper;
    }

    public ModelResponse send(String sessionId, ModelRequest request) {
        return send(sessionId, request, null);
    }

    /**
     * Sends the request, streaming text to {@code listener} when streaming is
     * enabled and supported.
     *
     * @throws ModelCallException
     *             with kind {@code FATAL} when the call cannot succeed
     */
    public ModelResponse send(String sessionId, ModelRequest request, StreamListener listener) {
        for (int attempt = 1;; attempt++) {
            try {
                return callOnce(request, listener);
            } catch (ModelCallException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("[ModelClient] Giving up after {} attempts: {}", attempt, e.getMessage());
                    throw new ModelCallException(ModelCallException.Kind.FATAL,
                            "Model call failed, retries exhausted after " + attempt + " attempts: " + e.getMessage(),
                            e);
                }
                long delayMs = backoffPolicy.delayFor(attempt, e.getRetryAfterMs());
                log.warn("[ModelClient] {} (attempt {}/{}), retrying in {}ms", e.getMessage(), attempt, maxAttempts,
                        delayMs);
                emitRetry(sessionId, attempt, delayMs, e);
                pause(delayMs);
                if (listener != null) {
                    listener.onRetry();
                }
            }
        }
    }

    public boolean isAvailable() {
        return modelPort.isAvailable();
    }

    public String getModelName() {
        return modelPort.getModelName();
    }

    private ModelResponse callOnce(ModelRequest request, StreamListener listener) {
        try {
            if (listener != null && streaming && modelPort.supportsStreaming()) {
                return modelPort.chatStream(request, listener::onDelta).get();
            }
            return modelPort.chat(request).get();
        } catch (ExecutionException | CompletionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelCallException(ModelCallException.Kind.FATAL, "Model call interrupted", e);
        }
    }

    private ModelCallException unwrap(Exception wrapper) {
        Throwable cause = wrapper.getCause() != null ? wrapper.getCause() : wrapper;
        if (cause instanceof ModelCallException modelCallException) {
            return modelCallException;
        }
        return new ModelCallException(ModelCallException.Kind.FATAL,
                "Unexpected model failure: " + cause.getMessage(), cause);
    }

    private void emitRetry(String sessionId, int attempt, long delayMs, ModelCallException error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attempt", attempt);
        data.put("max_retries", maxAttempts);
        data.put("delay_ms", delayMs);
        data.put("error", error.getMessage());
        eventBus.emit(sessionId, AgentEventType.LLM_RETRY, data);
    }

    private void pause(long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelCallException(ModelCallException.Kind.FATAL, "Interrupted while waiting to retry", e);
        }
    }
}
