package landscape.pipeline.model;

/**
 * Aggregate item counts for one phase of one execution.
 *
 * @param failed    every item whose status is FAILED
 * @param retryable the subset of {@code failed} with a retryable error still under the attempt ceiling
 */
public record PhaseProgress(
        PhaseName phase,
        int total,
        int pending,
        int queued,
        int processing,
        int completed,
        int failed,
        int retryable,
        int skipped,
        int degraded) {

    public static PhaseProgress empty(PhaseName phase) {
        return new PhaseProgress(phase, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public int inFlight() {
        return pending + queued + processing;
    }

    public int terminalFailed() {
        return failed - retryable;
    }

    /** Items that will not be touched again */
    public int terminal() {
        return completed + skipped + terminalFailed();
    }

    public boolean allTerminal() {
        return terminal() == total;
    }

    /** completed / (completed + failed), or 0 before any outcome */
    public double successRatio() {
        int decided = completed + failed;
        return decided == 0 ? 0.0 : (double) completed / decided;
    }

    public double percentComplete() {
        return total == 0 ? 100.0 : (terminal() * 100.0) / total;
    }
}
