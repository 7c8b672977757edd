package landscape.pipeline.resilience;

import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.CircuitBreakerState;
import landscape.pipeline.repository.CircuitBreakerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out circuit breakers by dependency name.
 * Breakers not configured explicitly use the defaults from PipelineConfig.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerRepository repository;
    private final Clock clock;
    private final int defaultFailureThreshold;
    private final int defaultSuccessThreshold;
    private final Duration defaultTimeout;
    private final int defaultHalfOpenCalls;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerRepository repository, PipelineConfig config, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.defaultFailureThreshold = config.breakerFailureThreshold();
        this.defaultSuccessThreshold = config.breakerSuccessThreshold();
        this.defaultTimeout = config.breakerTimeout();
        this.defaultHalfOpenCalls = config.breakerHalfOpenCalls();
    }

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(
                CircuitBreakerState.initial(n, defaultFailureThreshold, defaultSuccessThreshold, defaultTimeout,
                        defaultHalfOpenCalls),
                repository, clock));
    }

    /**
     * Register a breaker with its own thresholds. Applies when the breaker row is first created.
     */
    public CircuitBreaker configure(String name, int failureThreshold, int successThreshold, Duration timeout) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("breaker thresholds must be >= 1");
        }
        CircuitBreaker breaker = new CircuitBreaker(
                CircuitBreakerState.initial(name, failureThreshold, successThreshold, timeout, defaultHalfOpenCalls),
                repository, clock);
        breakers.put(name, breaker);
        log.debug("Circuit breaker {} configured: failures={}, successes={}, timeout={}",
                name, failureThreshold, successThreshold, timeout);
        return breaker;
    }

    /** Every breaker that has durable state */
    public List<CircuitBreakerState> all() {
        return repository.findAll();
    }

    /**
     * Durable state with lifetime totals, or empty if the breaker has never been used.
     */
    public Optional<CircuitBreakerState> metrics(String name) {
        return repository.find(name);
    }

    /**
     * Force a breaker closed.
     *
     * @return false if no breaker of that name has ever been used
     */
    public boolean reset(String name) {
        if (repository.find(name).isEmpty()) {
            return false;
        }
        get(name).reset();
        log.info("Circuit breaker {} reset manually", name);
        return true;
    }
}
