package landscape.pipeline.resilience;

import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.ErrorCategory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failure to an error category, a stable error code and a backoff policy.
 *
 * Rules are applied in order: explicit partial result, HTTP status, exception type,
 * then message text. Anything unmatched is recoverable UNKNOWN.
 */
public final class ErrorClassifier {

    private final BackoffPolicy defaultBackoff;
    private final BackoffPolicy rateLimitBackoff;

    public ErrorClassifier(BackoffPolicy defaultBackoff, BackoffPolicy rateLimitBackoff) {
        this.defaultBackoff = defaultBackoff;
        this.rateLimitBackoff = rateLimitBackoff;
    }

    public static ErrorClassifier fromConfig(PipelineConfig config) {
        BackoffPolicy standard = new BackoffPolicy(config.retryBaseDelay(), config.retryMultiplier(),
                config.retryMaxDelay());
        Duration rateMax = config.rateLimitBaseDelay().multipliedBy(5);
        if (rateMax.compareTo(config.retryMaxDelay()) < 0) {
            rateMax = config.retryMaxDelay();
        }
        BackoffPolicy rateLimit = new BackoffPolicy(config.rateLimitBaseDelay(), config.retryMultiplier(), rateMax);
        return new ErrorClassifier(standard, rateLimit);
    }

    public ClassifiedError classify(Throwable error) {
        Throwable failure = unwrap(error);
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();

        if (failure instanceof CircuitOpenException) {
            return new ClassifiedError(ErrorCategory.SERVICE_UNAVAILABLE, "CIRCUIT_OPEN", message, defaultBackoff);
        }

        if (failure instanceof ExternalServiceException) {
            ExternalServiceException external = (ExternalServiceException) failure;
            if (external.partialResult() != null) {
                return degraded("INCOMPLETE_DATA", message);
            }
            if (external.statusCode() > 0) {
                ClassifiedError byStatus = classifyStatus(external.statusCode(), message);
                if (byStatus != null) {
                    return byStatus;
                }
            }
        }

        ClassifiedError byType = classifyType(failure, message);
        if (byType != null) {
            return byType;
        }

        ClassifiedError byMessage = classifyMessage(message);
        if (byMessage != null) {
            return byMessage;
        }

        return recoverable("UNKNOWN", message);
    }

    /**
     * Classification of a bare HTTP status, or null when the status is not an error.
     */
    public ClassifiedError classifyStatus(int statusCode, String message) {
        switch (statusCode) {
            case 206:
                return degraded("PARTIAL_CONTENT", message);
            case 400:
                return nonRecoverable("BAD_REQUEST", message);
            case 401:
                return nonRecoverable("UNAUTHORIZED", message);
            case 403:
                return nonRecoverable("FORBIDDEN", message);
            case 404:
                return nonRecoverable("NOT_FOUND", message);
            case 408:
                return recoverable("TIMEOUT", message);
            case 422:
                return nonRecoverable("UNPROCESSABLE", message);
            case 429:
                return new ClassifiedError(ErrorCategory.RECOVERABLE, "RATE_LIMIT", message, rateLimitBackoff);
            case 500:
                return recoverable("SERVER_ERROR", message);
            case 502:
            case 504:
                return recoverable("GATEWAY_ERROR", message);
            case 503:
                return recoverable("SERVICE_UNAVAILABLE_HTTP", message);
            default:
                if (statusCode >= 500) {
                    return recoverable("SERVER_ERROR", message);
                }
                if (statusCode >= 400) {
                    return nonRecoverable("CLIENT_ERROR", message);
                }
                return null;
        }
    }

    private ClassifiedError classifyType(Throwable failure, String message) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return recoverable("TIMEOUT", message);
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return recoverable("NETWORK_ERROR", message);
            }
            if (t instanceof IOException && !(t instanceof InterruptedIOException)) {
                return recoverable("NETWORK_ERROR", message);
            }
            if (t == failure && t instanceof IllegalArgumentException) {
                return nonRecoverable("INVALID_INPUT", message);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private ClassifiedError classifyMessage(String message) {
        String text = message.toLowerCase(Locale.ROOT);
        if (text.contains("timeout") || text.contains("timed out")) {
            return recoverable("TIMEOUT", message);
        }
        if (text.contains("rate limit") || text.contains("too many requests")) {
            return new ClassifiedError(ErrorCategory.RECOVERABLE, "RATE_LIMIT", message, rateLimitBackoff);
        }
        if (text.contains("connection") || text.contains("network")) {
            return recoverable("NETWORK_ERROR", message);
        }
        if (text.contains("partial") || text.contains("incomplete")) {
            return degraded("INCOMPLETE_DATA", message);
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private ClassifiedError recoverable(String code, String message) {
        return new ClassifiedError(ErrorCategory.RECOVERABLE, code, message, defaultBackoff);
    }

    private ClassifiedError nonRecoverable(String code, String message) {
        return new ClassifiedError(ErrorCategory.NON_RECOVERABLE, code, message, defaultBackoff);
    }

    private ClassifiedError degraded(String code, String message) {
        return new ClassifiedError(ErrorCategory.DEGRADED, code, message, defaultBackoff);
    }
}
