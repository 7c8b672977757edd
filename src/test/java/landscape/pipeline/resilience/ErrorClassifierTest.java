package landscape.pipeline.resilience;

import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = ErrorClassifier.fromConfig(PipelineConfig.defaults()
            .withRetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0)
            .withRateLimitBaseDelay(Duration.ofSeconds(60)));

    @Test
    @DisplayName("Rate limit status is recoverable with the long backoff")
    void rateLimitIsRecoverableWithLongBackoff() {
        ClassifiedError error = classifier.classify(new ExternalServiceException(429, "slow down"));

        assertEquals(ErrorCategory.RECOVERABLE, error.category());
        assertEquals("RATE_LIMIT", error.errorCode());
        assertEquals(Duration.ofSeconds(60), error.backoff().delayFor(1));
    }

    @Test
    void clientErrorsAreNonRecoverable() {
        assertEquals(ErrorCategory.NON_RECOVERABLE,
                classifier.classify(new ExternalServiceException(401, "bad key")).category());
        assertEquals(ErrorCategory.NON_RECOVERABLE,
                classifier.classify(new ExternalServiceException(404, "gone")).category());
        assertEquals("CLIENT_ERROR", classifier.classify(new ExternalServiceException(418, "teapot")).errorCode());
    }

    @Test
    void serverErrorsAreRecoverable() {
        assertTrue(classifier.classify(new ExternalServiceException(500, "boom")).isRecoverable());
        assertEquals("GATEWAY_ERROR", classifier.classify(new ExternalServiceException(502, "bad gw")).errorCode());
        assertEquals("SERVER_ERROR", classifier.classify(new ExternalServiceException(599, "odd")).errorCode());
    }

    @Test
    void partialContentIsDegraded() {
        assertEquals(ErrorCategory.DEGRADED,
                classifier.classify(new ExternalServiceException(206, "some rows")).category());
        assertEquals(ErrorCategory.DEGRADED,
                classifier.classify(new ExternalServiceException(500, "cut short", "rows")).category());
    }

    @Test
    void exceptionTypesAreClassified() {
        assertEquals("TIMEOUT", classifier.classify(new SocketTimeoutException("read")).errorCode());
        assertEquals("NETWORK_ERROR", classifier.classify(new IOException("reset")).errorCode());
        assertEquals(ErrorCategory.NON_RECOVERABLE,
                classifier.classify(new IllegalArgumentException("bad keyword")).category());
    }

    @Test
    void wrappedFailuresAreUnwrapped() {
        ClassifiedError error = classifier.classify(
                new ExecutionException(new ExternalServiceException(403, "forbidden")));

        assertEquals("FORBIDDEN", error.errorCode());
    }

    @Test
    void messageTextIsUsedWhenNothingElseMatches() {
        assertEquals("TIMEOUT", classifier.classify(new RuntimeException("Request timed out")).errorCode());
        assertEquals("RATE_LIMIT", classifier.classify(new RuntimeException("Too Many Requests")).errorCode());
        assertEquals(ErrorCategory.DEGRADED,
                classifier.classify(new RuntimeException("incomplete response")).category());
    }

    @Test
    void unknownFailuresDefaultToRecoverable() {
        ClassifiedError error = classifier.classify(new RuntimeException("something odd"));

        assertEquals(ErrorCategory.RECOVERABLE, error.category());
        assertEquals("UNKNOWN", error.errorCode());
        assertEquals("UNKNOWN: something odd", error.describe());
    }

    @Test
    void openCircuitIsServiceUnavailable() {
        ClassifiedError error = classifier.classify(new CircuitOpenException("serp-api"));

        assertEquals(ErrorCategory.SERVICE_UNAVAILABLE, error.category());
        assertEquals("CIRCUIT_OPEN", error.errorCode());
    }

    @Test
    void backoffGrowsAndCaps() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(5), policy.delayFor(4));
    }
}
