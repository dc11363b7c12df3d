package me.golemcore.comfyagent.adapter.outbound.llm;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import me.golemcore.comfyagent.domain.exception.ModelCallException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jErrorClassifierTest {

    @Test
    void shouldClassifyRateLimitFromCauseChain() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        ModelCallException result = Langchain4jErrorClassifier.classify(throwable);

        assertEquals(ModelCallException.Kind.RATE_LIMITED, result.getKind());
        assertSame(throwable, result.getCause());
    }

    @Test
    void shouldExtractRetryAfterHint() {
        Throwable throwable = new RateLimitException("{\"error\":\"rate_limit\",\"retry-after\": \"2.5\"}");

        ModelCallException result = Langchain4jErrorClassifier.classify(throwable);

        assertEquals(2500L, result.getRetryAfterMs());
    }

    @Test
    void shouldNotInventRetryAfterHint() {
        assertNull(Langchain4jErrorClassifier.extractRetryAfterMs(new RateLimitException("slow down")));
    }

    @Test
    void shouldClassifyServerErrorsAsTransient() {
        assertEquals(ModelCallException.Kind.TRANSIENT,
                Langchain4jErrorClassifier.classify(new InternalServerException("boom")).getKind());
        assertEquals(ModelCallException.Kind.TRANSIENT,
                Langchain4jErrorClassifier.classify(new SocketTimeoutException("read timed out")).getKind());
        assertEquals(ModelCallException.Kind.TRANSIENT,
                Langchain4jErrorClassifier.classify(new RuntimeException(new IOException("reset"))).getKind());
    }

    @Test
    void shouldClassifyClientErrorsAsFatal() {
        ModelCallException auth = Langchain4jErrorClassifier.classify(new AuthenticationException("invalid x-api-key"));
        ModelCallException invalid = Langchain4jErrorClassifier.classify(new InvalidRequestException("bad schema"));

        assertEquals(ModelCallException.Kind.FATAL, auth.getKind());
        assertFalse(auth.isRetryable());
        assertEquals("invalid x-api-key", auth.getMessage());
        assertEquals(ModelCallException.Kind.FATAL, invalid.getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = { "Anthropic API is overloaded", "HTTP 503 Service Unavailable", "529 overloaded_error",
            "upstream connection reset" })
    void shouldClassifyTransientMessages(String message) {
        assertEquals(ModelCallException.Kind.TRANSIENT,
                Langchain4jErrorClassifier.classify(new RuntimeException(message)).getKind());
    }

    @Test
    void shouldClassifyRateLimitMessages() {
        ModelCallException result = Langchain4jErrorClassifier
                .classify(new RuntimeException("HTTP 429: rate_limit_error, retry-after: 3"));

        assertEquals(ModelCallException.Kind.RATE_LIMITED, result.getKind());
        assertEquals(3000L, result.getRetryAfterMs());
    }

    @Test
    void shouldTreatUnknownFailureAsFatal() {
        ModelCallException result = Langchain4jErrorClassifier.classify(new IllegalStateException());

        assertEquals(ModelCallException.Kind.FATAL, result.getKind());
        assertEquals("IllegalStateException", result.getMessage());
    }

    @Test
    void shouldPassThroughClassifiedException() {
        ModelCallException original = new ModelCallException(ModelCallException.Kind.TRANSIENT, "already");

        assertSame(original, Langchain4jErrorClassifier.classify(original));
    }
}
