package landscape.pipeline.orchestrator;

import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;
import landscape.pipeline.orchestrator.CompletionPolicy.Decision;
import landscape.pipeline.orchestrator.CompletionPolicy.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CompletionPolicyTest {

    private static final PhaseName PHASE = PhaseName.SERP_COLLECTION;

    // timeout 60 min, budget 30 min, 80% success, at least 2 successes
    private final PhaseSettings settings = PhaseSettings.defaultsFor(PHASE)
            .withTimeout(Duration.ofMinutes(60), Duration.ofMinutes(30))
            .withCompletion(0.8, 2);

    private static PhaseProgress progress(int total, int inFlight, int completed, int failed, int retryable) {
        return new PhaseProgress(PHASE, total, inFlight, 0, 0, completed, failed, retryable, 0, 0);
    }

    private Decision evaluate(PhaseProgress progress, Duration elapsed) {
        return CompletionPolicy.evaluate(progress, settings, elapsed, false);
    }

    @Test
    void emptyPhaseCompletes() {
        Decision decision = evaluate(progress(0, 0, 0, 0, 0), Duration.ZERO);

        assertEquals(Verdict.COMPLETE, decision.verdict());
        assertEquals("no items", decision.reason());
    }

    @Test
    void allDoneCompletes() {
        assertEquals(Verdict.COMPLETE, evaluate(progress(10, 0, 10, 0, 0), Duration.ofMinutes(1)).verdict());
    }

    @Test
    @DisplayName("Success ratio at the threshold completes once nothing is in flight")
    void thresholdMet() {
        // 8 of 10 done, 2 permanently failed
        assertEquals(Verdict.COMPLETE, evaluate(progress(10, 0, 8, 2, 0), Duration.ofMinutes(1)).verdict());
    }

    @Test
    void thresholdMetButWorkInFlightContinues() {
        assertEquals(Verdict.CONTINUE, evaluate(progress(12, 2, 8, 2, 0), Duration.ofMinutes(1)).verdict());
    }

    @Test
    void minimumSuccessCountRequired() {
        // ratio 1.0 but only one success
        Decision decision = evaluate(progress(1, 0, 1, 0, 0), Duration.ofMinutes(1));
        assertEquals(Verdict.COMPLETE, decision.verdict(), "all items done needs no minimum");

        // ratio 0.5 is met but the count of 3 is not, and one failure can still be retried
        PhaseSettings strict = settings.withCompletion(0.5, 3);
        Decision notEnough = CompletionPolicy.evaluate(progress(4, 0, 2, 2, 1), strict, Duration.ofMinutes(1), false);
        assertEquals(Verdict.CONTINUE, notEnough.verdict());
    }

    @Test
    @DisplayName("Every item settled with some successes completes below the threshold")
    void allSettledBelowThresholdCompletes() {
        Decision decision = evaluate(progress(10, 0, 5, 5, 0), Duration.ofMinutes(1));

        assertEquals(Verdict.COMPLETE, decision.verdict());
        assertEquals("all items settled, 5 of 10 failed", decision.reason());
    }

    @Test
    void serpDefaultsToleratePermanentFailures() {
        PhaseSettings serp = PhaseSettings.defaultsFor(PHASE);

        Decision decision = CompletionPolicy.evaluate(progress(100, 0, 85, 15, 0), serp, Duration.ofMinutes(1),
                false);

        assertEquals(Verdict.COMPLETE, decision.verdict());
    }

    @Test
    @DisplayName("Below threshold with items still open keeps running while budget remains")
    void belowThresholdWithOpenItemsContinues() {
        Decision decision = evaluate(progress(10, 3, 3, 4, 0), Duration.ofMinutes(10));

        assertEquals(Verdict.CONTINUE, decision.verdict());
        assertFalse(decision.isFinal());
    }

    @Test
    void noSuccessAfterEveryItemSettledFails() {
        Decision decision = evaluate(progress(4, 0, 0, 4, 0), Duration.ofMinutes(1));

        assertEquals(Verdict.FAIL, decision.verdict());
        assertEquals("all 4 items settled with no successful item", decision.reason());
    }

    @Test
    void allSkippedCompletes() {
        PhaseProgress skipped = new PhaseProgress(PHASE, 3, 0, 0, 0, 0, 0, 0, 3, 0);

        assertEquals(Verdict.COMPLETE, evaluate(skipped, Duration.ofMinutes(1)).verdict());
    }

    @Test
    void retryableFailuresKeepThePhaseOpen() {
        assertEquals(Verdict.CONTINUE, evaluate(progress(10, 0, 5, 5, 3), Duration.ofMinutes(1)).verdict());
    }

    @Test
    @DisplayName("An exhausted budget completes with partial results")
    void budgetExhaustedWithSomeSuccess() {
        Decision decision = evaluate(progress(100, 60, 30, 10, 5), Duration.ofMinutes(30));

        assertEquals(Verdict.COMPLETE, decision.verdict());
        assertTrue(decision.reason().startsWith("time budget reached with 30 of 100"));
    }

    @Test
    void budgetExhaustedWithoutSuccessFails() {
        assertEquals(Verdict.FAIL, evaluate(progress(10, 8, 0, 2, 2), Duration.ofMinutes(45)).verdict());
    }

    @Test
    void hardTimeoutEndsThePhase() {
        Decision decision = CompletionPolicy.evaluate(progress(10, 5, 5, 0, 0), settings, Duration.ofMinutes(5),
                true);

        assertEquals(Verdict.COMPLETE, decision.verdict());
        assertTrue(decision.reason().startsWith("timeout reached"));
    }

    @Test
    void inProgressContinues() {
        Decision decision = evaluate(progress(10, 5, 5, 0, 0), Duration.ofMinutes(5));

        assertEquals(Verdict.CONTINUE, decision.verdict());
        assertFalse(decision.isFinal());
    }
}
