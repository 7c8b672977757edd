package landscape.pipeline.store;

import landscape.pipeline.TestDatabases;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.JobResult;
import landscape.pipeline.model.QueueJob;
import landscape.pipeline.model.QueueJobStatus;
import landscape.pipeline.model.QueueStats;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobQueueRepositoryTest {

    private static final Duration LEASE = Duration.ofMinutes(5);
    private static final Duration REQUEUE_BASE = Duration.ofSeconds(2);

    private static Database db;
    private static JdbcJobQueueRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(PipelineConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("queue")));
        repo = new JdbcJobQueueRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanQueue() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_queue");
            conn.commit();
        }
    }

    private static QueueJob job(String id, String queue) {
        return QueueJob.builder()
                .id(id)
                .queueName(queue)
                .jobType("item")
                .payload("{\"itemId\":\"" + id + "\"}")
                .build();
    }

    @Test
    void insertAndFind() {
        repo.insert(QueueJob.builder().id("j1").queueName("serp").jobType("item").priority(5)
                .groupKey("e1:SERP_COLLECTION").maxAttempts(4).build());

        QueueJob found = repo.findById("j1").orElseThrow();
        assertEquals("serp", found.queueName());
        assertEquals(QueueJobStatus.PENDING, found.status());
        assertEquals(5, found.priority());
        assertEquals(4, found.maxAttempts());
        assertEquals(0, found.attempts());
        assertEquals("e1:SERP_COLLECTION", found.groupKey());
    }

    @Test
    @DisplayName("A dedupe key with an active job yields the existing id")
    void dedupeKeyCollapsesActiveDuplicates() {
        String first = repo.insert(QueueJob.builder().id("a").queueName("serp").jobType("item")
                .dedupeKey("e1:serp:k1").build());
        String second = repo.insert(QueueJob.builder().id("b").queueName("serp").jobType("item")
                .dedupeKey("e1:serp:k1").build());

        assertEquals("a", first);
        assertEquals("a", second);
        assertTrue(repo.findById("b").isEmpty());
    }

    @Test
    void dedupeKeyIsFreeAgainOnceJobFinished() {
        repo.insert(QueueJob.builder().id("a").queueName("serp").jobType("item").dedupeKey("k").build());
        QueueJob leased = repo.lease("serp", null, "w1", LEASE, Instant.now()).orElseThrow();
        assertEquals(JobResult.OK, repo.complete(leased.id(), "w1"));

        String id = repo.insert(QueueJob.builder().id("b").queueName("serp").jobType("item").dedupeKey("k").build());

        assertEquals("b", id);
    }

    @Test
    void insertAllCountsOnlyNewJobs() {
        repo.insert(QueueJob.builder().id("x").queueName("q").jobType("item").dedupeKey("d1").build());

        int inserted = repo.insertAll(List.of(
                QueueJob.builder().id("y").queueName("q").jobType("item").dedupeKey("d1").build(),
                QueueJob.builder().id("z").queueName("q").jobType("item").dedupeKey("d2").build()));

        assertEquals(1, inserted);
    }

    @Test
    void leaseRespectsPriorityThenAge() {
        repo.insert(QueueJob.builder().id("low").queueName("q").jobType("item").priority(QueueJob.PRIORITY_LOW)
                .build());
        repo.insert(QueueJob.builder().id("high").queueName("q").jobType("item").priority(QueueJob.PRIORITY_HIGH)
                .build());

        QueueJob leased = repo.lease("q", null, "w1", LEASE, Instant.now()).orElseThrow();

        assertEquals("high", leased.id());
        assertEquals(QueueJobStatus.PROCESSING, leased.status());
        assertEquals("w1", leased.leaseOwner());
        assertEquals(1, leased.attempts());
    }

    @Test
    void leaseFiltersByGroup() {
        repo.insert(QueueJob.builder().id("g1").queueName("q").jobType("item").groupKey("e1:A").build());
        repo.insert(QueueJob.builder().id("g2").queueName("q").jobType("item").groupKey("e2:A").build());

        QueueJob leased = repo.lease("q", "e2:A", "w1", LEASE, Instant.now()).orElseThrow();

        assertEquals("g2", leased.id());
        assertTrue(repo.lease("q", "e2:A", "w1", LEASE, Instant.now()).isEmpty());
    }

    @Test
    void onlyTheLeaseOwnerMayFinish() {
        repo.insert(job("j", "q"));
        repo.lease("q", null, "w1", LEASE, Instant.now()).orElseThrow();

        assertEquals(JobResult.NOT_OWNER, repo.complete("j", "w2"));
        assertEquals(JobResult.NOT_OWNER, repo.fail("j", "w2", "nope", true, REQUEUE_BASE));
        assertEquals(JobResult.NOT_FOUND, repo.complete("missing", "w1"));
        assertEquals(JobResult.OK, repo.complete("j", "w1"));
    }

    @Test
    @DisplayName("Retriable failure requeues with exponential delay, then dead-letters")
    void retriableFailureRequeuesThenDeadLetters() {
        repo.insert(QueueJob.builder().id("r").queueName("q").jobType("item").maxAttempts(2).build());

        repo.lease("q", null, "w1", LEASE, Instant.now()).orElseThrow();
        Instant beforeFail = Instant.now();
        assertEquals(JobResult.REQUEUED, repo.fail("r", "w1", "503", true, REQUEUE_BASE));

        QueueJob requeued = repo.findById("r").orElseThrow();
        assertEquals(QueueJobStatus.PENDING, requeued.status());
        assertTrue(!requeued.scheduledFor().isBefore(beforeFail.plus(REQUEUE_BASE).minusMillis(50)));
        assertTrue(repo.lease("q", null, "w1", LEASE, Instant.now()).isEmpty(), "not due yet");

        repo.lease("q", null, "w1", LEASE, Instant.now().plusSeconds(10)).orElseThrow();
        assertEquals(JobResult.DEAD_LETTERED, repo.fail("r", "w1", "503 again", true, REQUEUE_BASE));
        assertEquals(QueueJobStatus.DEAD_LETTER, repo.findById("r").orElseThrow().status());
        assertTrue(repo.lease("q", null, "w1", LEASE, Instant.now().plusSeconds(3600)).isEmpty());
    }

    @Test
    void nonRetriableFailureIsFinal() {
        repo.insert(job("n", "q"));
        repo.lease("q", null, "w1", LEASE, Instant.now()).orElseThrow();

        assertEquals(JobResult.FAILED, repo.fail("n", "w1", "bad request", false, REQUEUE_BASE));

        QueueJob failed = repo.findById("n").orElseThrow();
        assertEquals(QueueJobStatus.FAILED, failed.status());
        assertEquals("bad request", failed.lastError());
    }

    @Test
    void requeueDelayDoublesAndCaps() {
        assertEquals(Duration.ofSeconds(2), JdbcJobQueueRepository.requeueDelay(REQUEUE_BASE, 1));
        assertEquals(Duration.ofSeconds(8), JdbcJobQueueRepository.requeueDelay(REQUEUE_BASE, 3));
        assertEquals(Duration.ofHours(1), JdbcJobQueueRepository.requeueDelay(REQUEUE_BASE, 30));
    }

    @Test
    @DisplayName("Expired leases go back to pending or dead letter")
    void reaperHandlesExpiredLeases() {
        repo.insert(QueueJob.builder().id("retry").queueName("q").jobType("item").maxAttempts(3).build());
        repo.insert(QueueJob.builder().id("last").queueName("q").jobType("item").maxAttempts(1).build());
        Instant now = Instant.now();
        repo.lease("q", null, "w1", Duration.ofSeconds(1), now).orElseThrow();
        repo.lease("q", null, "w2", Duration.ofSeconds(1), now).orElseThrow();

        assertEquals(0, repo.reapExpired(now));
        assertEquals(2, repo.reapExpired(now.plusSeconds(5)));

        assertEquals(QueueJobStatus.PENDING, repo.findById("retry").orElseThrow().status());
        assertEquals(QueueJobStatus.DEAD_LETTER, repo.findById("last").orElseThrow().status());
    }

    @Test
    void expiredLeaseCanBeReclaimedDirectly() {
        repo.insert(job("e", "q"));
        Instant now = Instant.now();
        repo.lease("q", null, "dead-worker", Duration.ofSeconds(1), now).orElseThrow();

        QueueJob reclaimed = repo.lease("q", null, "w2", LEASE, now.plusSeconds(5)).orElseThrow();

        assertEquals("w2", reclaimed.leaseOwner());
        assertEquals(2, reclaimed.attempts());
        assertEquals(JobResult.NOT_OWNER, repo.complete("e", "dead-worker"));
    }

    @Test
    void groupCancelAndRelease() {
        for (int i = 0; i < 3; i++) {
            repo.insert(QueueJob.builder().id("c" + i).queueName("q").jobType("item").groupKey("e1:P").build());
        }
        repo.lease("q", "e1:P", "w1", LEASE, Instant.now()).orElseThrow();
        assertEquals(3, repo.countActive("e1:P"));

        assertEquals(1, repo.releaseGroup("e1:P"));
        assertEquals(0, repo.findByGroup("e1:P").stream()
                .filter(j -> j.status() == QueueJobStatus.PROCESSING).count());

        assertEquals(3, repo.cancelGroup("e1:P", "cancelled"));
        assertEquals(0, repo.countActive("e1:P"));
        assertEquals("cancelled", repo.findById("c0").orElseThrow().lastError());
    }

    @Test
    void statsAndDeadLetterRetry() {
        repo.insert(QueueJob.builder().id("d").queueName("stats").jobType("item").maxAttempts(1).build());
        repo.insert(job("p", "stats"));
        repo.lease("stats", null, "w1", LEASE, Instant.now()).orElseThrow();
        repo.fail("d", "w1", "boom", true, REQUEUE_BASE);

        QueueStats stats = repo.stats("stats");
        assertEquals(1, stats.pending());
        assertEquals(1, stats.deadLetter());
        assertNotNull(stats.oldestPendingAt());

        assertEquals(1, repo.retryDeadLetters("stats"));
        QueueJob retried = repo.findById("d").orElseThrow();
        assertEquals(QueueJobStatus.PENDING, retried.status());
        assertEquals(0, retried.attempts());
    }

    @Test
    @DisplayName("Concurrent workers never lease the same job twice")
    void concurrentLeasesAreExclusive() throws Exception {
        int jobs = 30;
        for (int i = 0; i < jobs; i++) {
            repo.insert(job("c-" + i, "conc"));
        }

        int workers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> leased = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new java.util.concurrent.CopyOnWriteArrayList<>();
        try {
            for (int w = 0; w < workers; w++) {
                String workerId = "w" + w;
                pool.submit(() -> {
                    start.await();
                    while (true) {
                        Optional<QueueJob> next = repo.lease("conc", null, workerId, LEASE, Instant.now());
                        if (next.isEmpty()) {
                            return null;
                        }
                        if (!leased.add(next.get().id())) {
                            duplicates.add(next.get().id());
                        }
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }

        assertTrue(duplicates.isEmpty(), "duplicates: " + duplicates);
        assertEquals(jobs, new HashSet<>(leased).size());
    }
}
