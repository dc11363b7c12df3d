package me.golemcore.comfyagent.adapter.outbound.llm;

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

import me.golemcore.comfyagent.domain.exception.ModelCallException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps LangChain4j and transport failures onto {@link ModelCallException}
 * kinds by walking the cause chain.
 *
 * <p>
 * LangChain4j exceptions are matched by class name so the classifier does not
 * depend on which provider module raised them.
 */
public final class Langchain4jErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";

    private static final Pattern RETRY_AFTER_PATTERN = Pattern
            .compile("(?i)(?:retry-after|\"reset_seconds\")\"?\\s*[:=]\\s*\"?(\\d+(?:\\.\\d+)?)");
    private static final Pattern TRANSIENT_STATUS_PATTERN = Pattern.compile("\\b(?:500|502|503|504|529)\\b");

    private Langchain4jErrorClassifier() {
    }

    public static ModelCallException classify(Throwable throwable) {
        if (throwable == null) {
            return new ModelCallException(ModelCallException.Kind.FATAL, "Unknown model failure");
        }
        if (throwable instanceof ModelCallException modelCallException) {
            return modelCallException;
        }
        String message = describe(throwable);

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            ModelCallException.Kind kind = classifyKnown(current);
            if (kind != null) {
                Long retryAfterMs = kind == ModelCallException.Kind.RATE_LIMITED ? extractRetryAfterMs(current)
                        : null;
                return new ModelCallException(kind, message, retryAfterMs, throwable);
            }
            current = current.getCause();
        }

        ModelCallException.Kind byMessage = classifyMessage(message);
        Long retryAfterMs = byMessage == ModelCallException.Kind.RATE_LIMITED ? extractRetryAfterMs(throwable) : null;
        return new ModelCallException(byMessage, message, retryAfterMs, throwable);
    }

    static Long extractRetryAfterMs(Throwable throwable) {
        Throwable current = throwable;
        Set<Throwable> visited = new HashSet<>();
        while (current != null && visited.add(current)) {
            String msg = current.getMessage();
            if (msg != null) {
                Matcher matcher = RETRY_AFTER_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return (long) (Double.parseDouble(matcher.group(1)) * 1000);
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static ModelCallException.Kind classifyKnown(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ModelCallException.Kind.TRANSIENT;
        }
        String className = throwable.getClass().getName();
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return ModelCallException.Kind.RATE_LIMITED;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)
                || CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)
                || CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return ModelCallException.Kind.TRANSIENT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)
                || CLASS_INVALID_REQUEST_EXCEPTION.equals(className)
                || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)
                || CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)
                || CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return ModelCallException.Kind.FATAL;
        }
        if (throwable instanceof IOException) {
            return ModelCallException.Kind.TRANSIENT;
        }
        return null;
    }

    private static ModelCallException.Kind classifyMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate_limit") || lower.contains("too many requests") || lower.contains("429")) {
            return ModelCallException.Kind.RATE_LIMITED;
        }
        if (lower.contains("overloaded") || lower.contains("timed out") || lower.contains("connection reset")
                || TRANSIENT_STATUS_PATTERN.matcher(lower).find()) {
            return ModelCallException.Kind.TRANSIENT;
        }
        return ModelCallException.Kind.FATAL;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }
}
