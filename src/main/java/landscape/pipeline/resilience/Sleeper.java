package landscape.pipeline.resilience;

import java.time.Duration;

/**
 * Waits between retry attempts. Tests swap in a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = delay -> {
        if (!delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    };

    void sleep(Duration delay) throws InterruptedException;
}
