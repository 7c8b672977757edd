package landscape.pipeline.resilience;

/**
 * The calling thread was interrupted while a call was in progress or backing off.
 * The interrupt flag is restored before this is thrown.
 */
public class CallInterruptedException extends RuntimeException {

    public CallInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
