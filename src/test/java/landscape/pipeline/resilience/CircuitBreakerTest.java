package landscape.pipeline.resilience;

import landscape.pipeline.TestClock;
import landscape.pipeline.TestDatabases;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.CircuitBreakerState;
import landscape.pipeline.model.CircuitState;
import landscape.pipeline.model.ErrorCategory;
import landscape.pipeline.store.Database;
import landscape.pipeline.store.JdbcCircuitBreakerRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Durable breaker behaviour against H2.
 */
class CircuitBreakerTest {

    private static Database db;
    private static JdbcCircuitBreakerRepository repo;
    private TestClock clock;
    private CircuitBreakerRegistry registry;

    @BeforeAll
    static void setup() {
        db = new Database(PipelineConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("breakers")));
        repo = new JdbcCircuitBreakerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanBreakers() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM circuit_breakers");
            conn.commit();
        }
        clock = new TestClock();
        registry = new CircuitBreakerRegistry(repo,
                PipelineConfig.defaults().withBreakerDefaults(3, 1, Duration.ofSeconds(30)), clock);
    }

    @Test
    @DisplayName("Failures open the breaker and the timeout lets one trial through")
    void opensAndRecovers() {
        CircuitBreaker breaker = registry.get("serp-api");

        for (int i = 0; i < 3; i++) {
            assertTrue(breaker.allow());
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.state().state());
        assertFalse(breaker.allow());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.allow());
        assertEquals(CircuitState.HALF_OPEN, breaker.state().state());
        assertFalse(breaker.allow(), "only one trial call while half-open");

        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.state().state());
    }

    @Test
    void stateIsSharedBetweenRegistries() {
        CircuitBreakerRegistry other = new CircuitBreakerRegistry(repo,
                PipelineConfig.defaults().withBreakerDefaults(3, 1, Duration.ofSeconds(30)), clock);

        for (int i = 0; i < 3; i++) {
            registry.get("llm-api").recordFailure();
        }

        assertFalse(other.get("llm-api").allow());
    }

    @Test
    void nonRecoverableErrorsDoNotCount() {
        CircuitBreaker breaker = registry.get("company-api");
        ClassifiedError badRequest = new ClassifiedError(ErrorCategory.NON_RECOVERABLE, "BAD_REQUEST", "bad",
                new BackoffPolicy(Duration.ZERO, 1.0, Duration.ZERO));

        for (int i = 0; i < 5; i++) {
            breaker.allow();
            breaker.recordError(badRequest);
        }

        assertEquals(CircuitState.CLOSED, breaker.state().state());
        assertEquals(0, breaker.state().failureCount());
    }

    @Test
    void configuredThresholdsApply() {
        CircuitBreaker breaker = registry.configure("scraper", 1, 1, Duration.ofSeconds(5));

        breaker.recordFailure();

        CircuitBreakerState state = breaker.state();
        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(Duration.ofSeconds(5), state.timeout());
    }

    @Test
    void manualResetAndMetrics() {
        assertFalse(registry.reset("unknown"));
        assertTrue(registry.metrics("unknown").isEmpty());

        CircuitBreaker breaker = registry.get("video-api");
        for (int i = 0; i < 3; i++) {
            breaker.allow();
            breaker.recordFailure();
        }

        assertTrue(registry.reset("video-api"));
        CircuitBreakerState state = registry.metrics("video-api").orElseThrow();
        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(3, state.totalRequests());
        assertEquals(3, state.totalFailures());
        assertEquals(1, registry.all().size());
    }

    @Test
    @DisplayName("Concurrent half-open requests get exactly one trial permit")
    void concurrentHalfOpenGrantsOnePermit() throws Exception {
        CircuitBreaker breaker = registry.get("keyword-api");
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(31));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    start.await();
                    if (breaker.allow()) {
                        granted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(1, granted.get());
    }
}
