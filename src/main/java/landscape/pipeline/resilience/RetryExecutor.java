package landscape.pipeline.resilience;

import landscape.pipeline.model.RetryAttempt;
import landscape.pipeline.repository.RetryHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Runs an operation against a named dependency with bounded retries.
 *
 * Each attempt first asks the dependency's circuit breaker; an open breaker ends the call
 * with SERVICE_UNAVAILABLE without invoking the operation. Failures are classified:
 * non-recoverable errors fail after one attempt, degraded responses are accepted as
 * partial success, recoverable errors back off and retry up to {@code maxAttempts}.
 * Every attempt is written to the retry history.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ErrorClassifier classifier;
    private final CircuitBreakerRegistry breakers;
    private final RetryHistoryRepository history;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(ErrorClassifier classifier, CircuitBreakerRegistry breakers, RetryHistoryRepository history,
            Sleeper sleeper, Clock clock) {
        this.classifier = classifier;
        this.breakers = breakers;
        this.history = history;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @param service     circuit breaker name of the dependency
     * @param entityType  what is being processed, for retry history
     * @param entityId    which one, for retry history
     * @param maxAttempts ceiling on operation invocations
     * @throws CallInterruptedException if the thread is interrupted; nothing is recorded
     */
    public <T> CallOutcome<T> execute(String service, Callable<T> operation, String entityType, String entityId,
            int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        CircuitBreaker breaker = breakers.get(service);

        for (int attempt = 1;; attempt++) {
            checkInterrupted(service);

            if (!breaker.allow()) {
                ClassifiedError error = classifier.classify(new CircuitOpenException(service));
                append(entityType, entityId, service, attempt, false, error, 0, null);
                log.debug("{} {} refused: circuit {} open", entityType, entityId, service);
                return CallOutcome.unavailable(error, attempt - 1);
            }

            T value;
            try {
                value = operation.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CallInterruptedException("Interrupted calling " + service, e);
            } catch (CallInterruptedException e) {
                throw e;
            } catch (Exception e) {
                checkInterrupted(service);

                ClassifiedError error = classifier.classify(e);
                breaker.recordError(error);

                switch (error.category()) {
                    case DEGRADED:
                        append(entityType, entityId, service, attempt, true, error, 0, null);
                        return CallOutcome.degraded(partialResult(e), error, attempt);
                    case NON_RECOVERABLE:
                        append(entityType, entityId, service, attempt, false, error, 0, null);
                        log.debug("{} {} failed permanently: {}", entityType, entityId, error.describe());
                        return CallOutcome.failed(error, attempt);
                    case SERVICE_UNAVAILABLE:
                        append(entityType, entityId, service, attempt, false, error, 0, null);
                        return CallOutcome.unavailable(error, attempt);
                    default:
                        break;
                }

                if (attempt >= maxAttempts) {
                    append(entityType, entityId, service, attempt, false, error, 0, null);
                    log.debug("{} {} failed after {} attempts: {}", entityType, entityId, attempt,
                            error.describe());
                    return CallOutcome.failed(error, attempt);
                }

                Duration delay = error.backoff().delayFor(attempt);
                append(entityType, entityId, service, attempt, false, error, delay.toMillis(),
                        clock.instant().plus(delay));
                log.debug("{} {} attempt {}/{} failed ({}), retrying in {} ms",
                        entityType, entityId, attempt, maxAttempts, error.errorCode(), delay.toMillis());
                backOff(service, delay);
                continue;
            }

            breaker.recordSuccess();
            append(entityType, entityId, service, attempt, true, null, 0, null);
            return CallOutcome.success(value, attempt);
        }
    }

    private static Object partialResult(Exception e) {
        if (e instanceof ExternalServiceException) {
            return ((ExternalServiceException) e).partialResult();
        }
        return null;
    }

    private void backOff(String service, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallInterruptedException("Interrupted backing off from " + service, e);
        }
    }

    private static void checkInterrupted(String service) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CallInterruptedException("Interrupted before calling " + service, null);
        }
    }

    private void append(String entityType, String entityId, String service, int attempt, boolean success,
            ClassifiedError error, long delayMs, Instant nextRetryAt) {
        history.append(new RetryAttempt(
                entityType,
                entityId,
                service,
                attempt,
                success,
                error != null ? error.errorCode() : null,
                error != null ? error.message() : null,
                delayMs,
                nextRetryAt,
                clock.instant()));
    }
}
