package landscape.pipeline.service;

import landscape.pipeline.TestClock;
import landscape.pipeline.TestDatabases;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.Checkpoint;
import landscape.pipeline.model.ErrorCategory;
import landscape.pipeline.model.ItemState;
import landscape.pipeline.model.ItemStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;
import landscape.pipeline.store.Database;
import landscape.pipeline.store.JdbcCheckpointRepository;
import landscape.pipeline.store.JdbcItemStateRepository;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StateTrackerTest {

    private static final PhaseName SERP = PhaseName.SERP_COLLECTION;

    private static Database db;
    private StateTracker tracker;
    private String executionId;

    @BeforeAll
    static void setup() {
        db = new Database(PipelineConfig.defaults().withDatabaseUrl(TestDatabases.memUrl("tracker")));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() {
        tracker = new StateTracker(new JdbcItemStateRepository(db), new JdbcCheckpointRepository(db),
                new TestClock());
        executionId = "exec-" + System.nanoTime();
    }

    private void registerItems(String... ids) {
        Map<String, String> payloads = new LinkedHashMap<>();
        for (String id : ids) {
            payloads.put(id, "{\"keyword\":\"" + id + "\"}");
        }
        tracker.register(executionId, SERP, payloads, 3);
    }

    @Test
    void registrationIsIdempotent() {
        registerItems("a", "b");
        tracker.recordCompleted(executionId, SERP, "a", "{\"rows\":10}", false, null);

        Map<String, String> again = new LinkedHashMap<>();
        again.put("a", "{}");
        again.put("b", "{}");
        again.put("c", "{}");
        int inserted = tracker.register(executionId, SERP, again, 3);

        assertEquals(1, inserted);
        assertEquals(ItemStatus.COMPLETED, tracker.item(executionId, SERP, "a").orElseThrow().status());
        assertEquals(3, tracker.items(executionId, SERP).size());
    }

    @Test
    @DisplayName("Attempts stop at the ceiling and finished items are not restarted")
    void attemptCeiling() {
        registerItems("k");

        for (int i = 0; i < 3; i++) {
            assertTrue(tracker.beginAttempt(executionId, SERP, "k"));
            tracker.recordFailed(executionId, SERP, "k", "TIMEOUT", ErrorCategory.RECOVERABLE);
        }

        assertFalse(tracker.beginAttempt(executionId, SERP, "k"));
        ItemState item = tracker.item(executionId, SERP, "k").orElseThrow();
        assertEquals(3, item.attemptCount());
        assertEquals(ItemStatus.FAILED, item.status());
    }

    @Test
    void completedItemIsNeverDowngraded() {
        registerItems("done");
        tracker.beginAttempt(executionId, SERP, "done");
        tracker.recordCompleted(executionId, SERP, "done", "{\"ok\":true}", false, null);

        tracker.recordFailed(executionId, SERP, "done", "late failure", ErrorCategory.RECOVERABLE);
        tracker.record(executionId, SERP, "done", ItemStatus.PENDING, null);

        assertEquals(ItemStatus.COMPLETED, tracker.item(executionId, SERP, "done").orElseThrow().status());
        assertFalse(tracker.beginAttempt(executionId, SERP, "done"));
    }

    @Test
    @DisplayName("Remaining work is in-flight items plus retryable failures")
    void pendingItemsAfterInterruption() {
        registerItems("ok", "retry", "fatal", "exhausted", "inflight", "untouched");

        tracker.beginAttempt(executionId, SERP, "ok");
        tracker.recordCompleted(executionId, SERP, "ok", null, false, null);

        tracker.beginAttempt(executionId, SERP, "retry");
        tracker.recordFailed(executionId, SERP, "retry", "503", ErrorCategory.RECOVERABLE);

        tracker.beginAttempt(executionId, SERP, "fatal");
        tracker.recordFailed(executionId, SERP, "fatal", "401", ErrorCategory.NON_RECOVERABLE);

        for (int i = 0; i < 3; i++) {
            tracker.beginAttempt(executionId, SERP, "exhausted");
            tracker.recordFailed(executionId, SERP, "exhausted", "503", ErrorCategory.RECOVERABLE);
        }

        tracker.beginAttempt(executionId, SERP, "inflight");

        Set<String> remaining = tracker.pendingItems(executionId, SERP).stream()
                .map(ItemState::itemId)
                .collect(Collectors.toSet());

        assertEquals(Set.of("retry", "inflight", "untouched"), remaining);
    }

    @Test
    void progressCounts() {
        registerItems("a", "b", "c", "d", "e");
        tracker.recordCompleted(executionId, SERP, "a", null, false, null);
        tracker.recordCompleted(executionId, SERP, "b", "{\"partial\":true}", true, "PARTIAL_CONTENT");
        tracker.recordFailed(executionId, SERP, "c", "401", ErrorCategory.NON_RECOVERABLE);
        tracker.recordFailed(executionId, SERP, "d", "503", ErrorCategory.RECOVERABLE);
        tracker.record(executionId, SERP, "e", ItemStatus.SKIPPED, "abandoned");

        PhaseProgress progress = tracker.progress(executionId, SERP);

        assertEquals(5, progress.total());
        assertEquals(2, progress.completed());
        assertEquals(1, progress.degraded());
        assertEquals(2, progress.failed());
        assertEquals(1, progress.retryable());
        assertEquals(1, progress.skipped());
        assertEquals(4, progress.terminal());
        assertFalse(progress.allTerminal());
        assertEquals(0.5, progress.successRatio(), 1e-9);
        assertEquals(80.0, tracker.overallProgress(executionId), 1e-9);
    }

    @Test
    void markQueuedMovesPendingItems() {
        registerItems("q1", "q2");

        assertEquals(2, tracker.markQueued(executionId, SERP, List.of("q1", "q2")));
        assertEquals(2, tracker.progress(executionId, SERP).queued());
    }

    @Test
    void finalCheckpointWinsOverProgress() {
        tracker.saveCheckpoint(executionId, SERP, Checkpoint.PROGRESS, 3, 10, null);
        assertEquals(3, tracker.latestCheckpoint(executionId, SERP).orElseThrow().itemsProcessed());

        tracker.saveCheckpoint(executionId, SERP, Checkpoint.PROGRESS, 7, 10, null);
        tracker.saveCheckpoint(executionId, SERP, Checkpoint.FINAL, 10, 10, "{\"status\":\"COMPLETED\"}");

        Checkpoint latest = tracker.latestCheckpoint(executionId, SERP).orElseThrow();
        assertEquals(Checkpoint.FINAL, latest.name());
        assertEquals(2, tracker.checkpoints(executionId).size());
    }

    @Test
    void itemIdentifiers() {
        assertEquals("crm software:us:organic", StateTracker.keywordItemId(" CRM Software ", "US", "Organic"));
        assertEquals("crm:any:any", StateTracker.keywordItemId("crm", null, ""));
        assertEquals("example.com", StateTracker.domainItemId("https://www.Example.com/pricing"));
        assertEquals("example.com", StateTracker.domainItemId("www.example.com/about"));
        assertEquals("https://example.com/a", StateTracker.urlItemId("https://example.com/a#section"));
        assertThrows(IllegalArgumentException.class, () -> StateTracker.keywordItemId(" ", "us", "organic"));
    }
}
