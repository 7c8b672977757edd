package landscape.pipeline.resilience;

import landscape.pipeline.model.ErrorCategory;

/**
 * Result of classifying a failure.
 *
 * @param errorCode stable code such as RATE_LIMIT or TIMEOUT, stored with the item
 * @param backoff   suggested delay schedule when the error is retried
 */
public record ClassifiedError(ErrorCategory category, String errorCode, String message, BackoffPolicy backoff) {

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    /** Text stored in item error fields: "CODE: message" */
    public String describe() {
        return message == null || message.isBlank() ? errorCode : errorCode + ": " + message;
    }
}
