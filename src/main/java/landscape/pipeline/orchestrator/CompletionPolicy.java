package landscape.pipeline.orchestrator;

import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.model.PhaseProgress;

import java.time.Duration;

/**
 * Flexible phase completion.
 *
 * A phase completes when any of these holds:
 * <ol>
 *   <li>every item is terminal with none failed or at least one succeeded, or the phase has no items</li>
 *   <li>nothing is in flight and the success ratio and count reach the thresholds</li>
 *   <li>the time budget (or the hard timeout) is exhausted and at least one item succeeded</li>
 * </ol>
 * A phase below its thresholds with items still open keeps running until the budget decides.
 * It fails only once nothing can succeed any more: every item terminal, or the budget gone,
 * with no successful item.
 */
public final class CompletionPolicy {

    public enum Verdict {
        CONTINUE,
        COMPLETE,
        FAIL
    }

    public record Decision(Verdict verdict, String reason) {

        public boolean isFinal() {
            return verdict != Verdict.CONTINUE;
        }
    }

    private static final Decision CONTINUE = new Decision(Verdict.CONTINUE, null);

    private CompletionPolicy() {
    }

    /**
     * @param elapsed     time since the phase started running
     * @param hardTimeout true once the phase timeout has elapsed
     */
    public static Decision evaluate(PhaseProgress progress, PhaseSettings settings, Duration elapsed,
            boolean hardTimeout) {
        if (progress.total() == 0) {
            return new Decision(Verdict.COMPLETE, "no items");
        }
        if (progress.allTerminal() && progress.terminalFailed() == 0) {
            return new Decision(Verdict.COMPLETE, "all items done");
        }
        if (progress.allTerminal() && progress.completed() >= 1) {
            return new Decision(Verdict.COMPLETE, String.format("all items settled, %d of %d failed",
                    progress.terminalFailed(), progress.total()));
        }
        if (progress.inFlight() == 0
                && progress.successRatio() >= settings.successThreshold()
                && progress.completed() >= settings.minSuccessCount()) {
            return new Decision(Verdict.COMPLETE, String.format("success ratio %.2f >= %.2f",
                    progress.successRatio(), settings.successThreshold()));
        }

        boolean budgetExhausted = hardTimeout || elapsed.compareTo(settings.timeBudget()) >= 0;
        if (budgetExhausted) {
            String limit = hardTimeout ? "timeout" : "time budget";
            if (progress.completed() >= 1) {
                return new Decision(Verdict.COMPLETE, limit + " reached with " + progress.completed() + " of "
                        + progress.total() + " items done");
            }
            return new Decision(Verdict.FAIL, limit + " reached with no successful items");
        }

        if (progress.allTerminal()) {
            return new Decision(Verdict.FAIL, String.format("all %d items settled with no successful item",
                    progress.total()));
        }
        return CONTINUE;
    }
}
