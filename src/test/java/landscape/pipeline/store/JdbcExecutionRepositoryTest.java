package landscape.pipeline.store;

import landscape.pipeline.TestDatabases;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PipelineExecution;
import landscape.pipeline.model.TriggerMode;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcExecutionRepositoryTest {

    private static final Duration STALE_AFTER = Duration.ofMinutes(2);

    private static Database db;
    private static JdbcExecutionRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(PipelineConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("executions")));
        repo = new JdbcExecutionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanExecutions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM pipeline_executions");
            conn.commit();
        }
    }

    private static void savePending(String id) {
        repo.save(PipelineExecution.builder()
                .id(id)
                .triggerMode(TriggerMode.API)
                .status(ExecutionStatus.PENDING)
                .configJson("{}")
                .build());
    }

    private static Instant staleBefore() {
        return Instant.now().minus(STALE_AFTER);
    }

    /** A threshold that makes the heartbeats written so far stale but not the next one */
    private static Instant afterLastHeartbeat() throws InterruptedException {
        TimeUnit.MILLISECONDS.sleep(100);
        return Instant.now().minusMillis(50);
    }

    @Test
    void claimSetsDriverAndStart() {
        savePending("e1");

        assertTrue(repo.markRunning("e1", "orchestrator-a", staleBefore()));

        PipelineExecution execution = repo.findById("e1").orElseThrow();
        assertEquals(ExecutionStatus.RUNNING, execution.status());
        assertEquals("orchestrator-a", execution.driverId());
        assertNotNull(execution.heartbeatAt());
        assertNotNull(execution.startedAt());
    }

    @Test
    @DisplayName("A live driver cannot be displaced")
    void liveDriverKeepsTheClaim() {
        savePending("e2");
        assertTrue(repo.markRunning("e2", "orchestrator-a", staleBefore()));

        assertFalse(repo.markRunning("e2", "orchestrator-b", staleBefore()));

        assertEquals("orchestrator-a", repo.findById("e2").orElseThrow().driverId());
        assertTrue(repo.heartbeat("e2", "orchestrator-a"));
    }

    @Test
    @DisplayName("A stale driver is replaced and its heartbeats are refused")
    void staleDriverIsReplaced() throws Exception {
        savePending("e3");
        assertTrue(repo.markRunning("e3", "orchestrator-a", staleBefore()));
        Instant firstStart = repo.findById("e3").orElseThrow().startedAt();

        assertTrue(repo.markRunning("e3", "orchestrator-b", afterLastHeartbeat()));

        PipelineExecution execution = repo.findById("e3").orElseThrow();
        assertEquals("orchestrator-b", execution.driverId());
        assertEquals(firstStart, execution.startedAt());
        assertFalse(repo.heartbeat("e3", "orchestrator-a"));
        assertTrue(repo.heartbeat("e3", "orchestrator-b"));
    }

    @Test
    void releasedExecutionCanBeClaimedAgain() {
        savePending("e4");
        repo.markRunning("e4", "orchestrator-a", staleBefore());

        repo.releaseDriver("e4", "orchestrator-b");
        assertEquals("orchestrator-a", repo.findById("e4").orElseThrow().driverId(), "only the holder releases");

        repo.releaseDriver("e4", "orchestrator-a");
        assertTrue(repo.markRunning("e4", "orchestrator-b", staleBefore()));
    }

    @Test
    void cancelledOrFinishedExecutionsAreNotClaimed() {
        savePending("e5");
        assertTrue(repo.requestCancel("e5"));
        assertFalse(repo.markRunning("e5", "orchestrator-a", staleBefore()));

        savePending("e6");
        assertTrue(repo.finish("e6", ExecutionStatus.COMPLETED, null));
        assertFalse(repo.markRunning("e6", "orchestrator-a", staleBefore()));
        assertFalse(repo.finish("e6", ExecutionStatus.FAILED, "late"));
        assertEquals(ExecutionStatus.COMPLETED, repo.findById("e6").orElseThrow().status());
    }

    @Test
    @DisplayName("Concurrent claims of a stale execution have one winner")
    void concurrentClaimsHaveOneWinner() throws Exception {
        savePending("e7");
        repo.markRunning("e7", "orchestrator-dead", staleBefore());
        Instant staleBefore = afterLastHeartbeat();

        int claimants = 8;
        ExecutorService executor = Executors.newFixedThreadPool(claimants);
        CountDownLatch ready = new CountDownLatch(claimants);
        CountDownLatch go = new CountDownLatch(1);
        ConcurrentHashMap<String, Boolean> winners = new ConcurrentHashMap<>();

        for (int i = 0; i < claimants; i++) {
            String driverId = "orchestrator-" + i;
            executor.submit(() -> {
                ready.countDown();
                go.await();
                if (repo.markRunning("e7", driverId, staleBefore)) {
                    winners.put(driverId, true);
                }
                return null;
            });
        }
        ready.await();
        go.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1, winners.size(), "winners: " + winners.keySet());
        String winner = winners.keySet().iterator().next();
        assertEquals(winner, repo.findById("e7").orElseThrow().driverId());
    }
}
