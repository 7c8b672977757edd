package landscape.pipeline.resilience;

import landscape.pipeline.model.ErrorCategory;

/**
 * Value result of a protected call. Item-level failures travel as outcomes, never as exceptions.
 */
public final class CallOutcome<T> {

    public enum Status {
        /** Operation returned normally */
        SUCCESS,
        /** Partial result accepted as best effort */
        DEGRADED,
        /** Non-recoverable error, or recoverable with attempts exhausted */
        FAILED,
        /** Circuit open, operation not invoked */
        SERVICE_UNAVAILABLE
    }

    private final Status status;
    private final T value;
    private final Object partial;
    private final ClassifiedError error;
    private final int attempts;

    private CallOutcome(Status status, T value, Object partial, ClassifiedError error, int attempts) {
        this.status = status;
        this.value = value;
        this.partial = partial;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> CallOutcome<T> success(T value, int attempts) {
        return new CallOutcome<>(Status.SUCCESS, value, null, null, attempts);
    }

    /**
     * @param partial whatever the failing call handed back with its error; may be null
     */
    public static <T> CallOutcome<T> degraded(Object partial, ClassifiedError error, int attempts) {
        return new CallOutcome<>(Status.DEGRADED, null, partial, error, attempts);
    }

    public static <T> CallOutcome<T> failed(ClassifiedError error, int attempts) {
        return new CallOutcome<>(Status.FAILED, null, null, error, attempts);
    }

    public static <T> CallOutcome<T> unavailable(ClassifiedError error, int attempts) {
        return new CallOutcome<>(Status.SERVICE_UNAVAILABLE, null, null, error, attempts);
    }

    public Status status() {
        return status;
    }

    /** Return value of the operation; only set on SUCCESS */
    public T value() {
        return value;
    }

    /** Partial payload of a DEGRADED call, not of the operation's return type */
    public Object partial() {
        return partial;
    }

    public ClassifiedError error() {
        return error;
    }

    /** Number of times the operation was actually invoked */
    public int attempts() {
        return attempts;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS || status == Status.DEGRADED;
    }

    public ErrorCategory errorCategory() {
        return error != null ? error.category() : null;
    }

    @Override
    public String toString() {
        return "CallOutcome{" + status + ", attempts=" + attempts + (error != null ? ", " + error.errorCode() : "")
                + "}";
    }
}
