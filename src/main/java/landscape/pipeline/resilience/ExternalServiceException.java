package landscape.pipeline.resilience;

/**
 * Failure reported by an external data provider, optionally carrying an HTTP status
 * and whatever partial result the provider returned.
 */
public class ExternalServiceException extends RuntimeException {

    private final int statusCode;
    private final transient Object partialResult;

    public ExternalServiceException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public ExternalServiceException(int statusCode, String message, Object partialResult) {
        super(message);
        this.statusCode = statusCode;
        this.partialResult = partialResult;
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.partialResult = null;
    }

    /** HTTP status, or 0 when the failure did not come with one */
    public int statusCode() {
        return statusCode;
    }

    public Object partialResult() {
        return partialResult;
    }
}
