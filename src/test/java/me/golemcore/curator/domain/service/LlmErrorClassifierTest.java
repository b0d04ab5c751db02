package me.golemcore.curator.domain.service;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class LlmErrorClassifierTest {

    // ===== langchain4j exceptions =====

    @Test
    void classifiesLangchain4jExceptionsByType() {
        assertEquals(ErrorKind.RATE_LIMITED, LlmErrorClassifier.classify(new RateLimitException("slow down")));
        assertEquals(ErrorKind.AUTH_ERROR, LlmErrorClassifier.classify(new AuthenticationException("bad key")));
        assertEquals(ErrorKind.INVALID_REQUEST, LlmErrorClassifier.classify(new InvalidRequestException("bad")));
        assertEquals(ErrorKind.TRANSIENT_NETWORK_ERROR, LlmErrorClassifier.classify(new TimeoutException("slow")));
        assertEquals(ErrorKind.TRANSIENT_NETWORK_ERROR,
                LlmErrorClassifier.classify(new InternalServerException("oops")));
    }

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMITED",
            "401, AUTH_ERROR",
            "403, AUTH_ERROR",
            "400, INVALID_REQUEST",
            "404, INVALID_REQUEST",
            "408, TRANSIENT_NETWORK_ERROR",
            "500, TRANSIENT_NETWORK_ERROR",
            "502, TRANSIENT_NETWORK_ERROR",
            "504, TRANSIENT_NETWORK_ERROR",
            "503, PROVIDER_UNAVAILABLE",
            "529, PROVIDER_UNAVAILABLE"
    })
    void classifiesHttpExceptionByStatus(int status, ErrorKind expected) {
        assertEquals(expected, LlmErrorClassifier.classify(new HttpException(status, "status " + status)));
    }

    @Test
    void classifiesWrappedCause() {
        RuntimeException wrapped = new RuntimeException("call failed", new RateLimitException("429"));

        assertEquals(ErrorKind.RATE_LIMITED, LlmErrorClassifier.classify(wrapped));
    }

    // ===== JDK exceptions =====

    @Test
    void classifiesNetworkFailures() {
        assertEquals(ErrorKind.TRANSIENT_NETWORK_ERROR,
                LlmErrorClassifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ErrorKind.TRANSIENT_NETWORK_ERROR, LlmErrorClassifier.classify(new IOException("reset")));
        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE,
                LlmErrorClassifier.classify(new RuntimeException(new ConnectException("Connection refused"))));
        assertEquals(ErrorKind.CANCELLED, LlmErrorClassifier.classify(new CancellationException()));
    }

    @Test
    void classifiesByMessageWhenTypeIsUnknown() {
        assertEquals(ErrorKind.INVALID_REQUEST,
                LlmErrorClassifier.classify(new IllegalStateException("This model's maximum context length is")));
        assertEquals(ErrorKind.RATE_LIMITED,
                LlmErrorClassifier.classify(new IllegalStateException("Too Many Requests")));
    }

    @Test
    void rejectedArgumentIsInvalidRequest() {
        assertEquals(ErrorKind.INVALID_REQUEST,
                LlmErrorClassifier.classify(new IllegalArgumentException("text cannot be null or blank")));
        assertEquals(ErrorKind.INVALID_REQUEST,
                LlmErrorClassifier.classify(new RuntimeException(new IllegalArgumentException("bad stop"))));
    }

    @Test
    void unknownFailureMeansProviderUnavailable() {
        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, LlmErrorClassifier.classify(new IllegalStateException()));
    }

    @Test
    void readsStatusAccessorOfOtherClients() {
        assertEquals(ErrorKind.RATE_LIMITED, LlmErrorClassifier.classify(new StatusException(429)));
        assertEquals(ErrorKind.AUTH_ERROR, LlmErrorClassifier.classify(new StatusException(401)));
    }

    // ===== Retry-after =====

    @Test
    void extractsRetryAfterFromResponseHeaders() {
        StatusException error = new StatusException(429);

        assertEquals(Duration.ofSeconds(7), LlmErrorClassifier.extractRetryAfter(error));
    }

    @Test
    void extractsRetryAfterFromMessage() {
        assertEquals(Duration.ofSeconds(12),
                LlmErrorClassifier.extractRetryAfter(new RateLimitException("{\"reset_seconds\": 12}")));
        assertEquals(Duration.ofMillis(1500),
                LlmErrorClassifier.extractRetryAfter(new RateLimitException("Please try again in 1.5s")));
        assertEquals(Duration.ofMillis(250),
                LlmErrorClassifier.extractRetryAfter(new RateLimitException("retry after 250ms")));
        assertNull(LlmErrorClassifier.extractRetryAfter(new RateLimitException("slow down")));
    }

    @Test
    void buildsClassifiedProviderException() {
        ProviderException error = LlmErrorClassifier.toProviderException("openai",
                new RateLimitException("Rate limit reached. Please try again in 2s"));

        assertEquals(ErrorKind.RATE_LIMITED, error.getKind());
        assertEquals("openai", error.getProvider());
        assertEquals(Duration.ofSeconds(2), error.getRetryAfter());
    }

    @Test
    void keepsExistingProviderException() {
        ProviderException original = new ProviderException(ErrorKind.AUTH_ERROR, "openai", "bad key");

        assertSame(original, LlmErrorClassifier.toProviderException("openai", original));
    }

    public static class StatusException extends RuntimeException {

        private final int status;

        StatusException(int status) {
            super("HTTP " + status);
            this.status = status;
        }

        public int status() {
            return status;
        }

        public Map<String, Collection<String>> responseHeaders() {
            return Map.of("Retry-After", List.of("7"));
        }
    }
}
