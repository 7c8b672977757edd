package landscape.pipeline.service;

import landscape.pipeline.model.Checkpoint;
import landscape.pipeline.model.ExecutionMessage;
import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.model.PipelineExecution;
import landscape.pipeline.model.TriggerMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read model of one execution, built from phase rows and checkpoints without scanning items.
 *
 * @param errors representative errors keyed by phase key, or {@code "execution"} for execution level ones
 */
public record ExecutionStatusView(
        String executionId,
        ExecutionStatus status,
        TriggerMode triggerMode,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        boolean cancelRequested,
        String errorMessage,
        double progressPercent,
        List<PhaseView> phases,
        List<String> warnings,
        Map<String, List<String>> errors) {

    public record PhaseView(
            PhaseName phase,
            PhaseStatus status,
            int attempts,
            int itemsTotal,
            int itemsProcessed,
            int itemsSucceeded,
            int itemsFailed,
            double percent,
            String lastError,
            String blockedReason,
            Instant startedAt,
            Instant completedAt) {
    }

    static ExecutionStatusView of(PipelineExecution execution, List<PhaseState> phaseRows,
            List<Checkpoint> checkpoints, List<ExecutionMessage> messages) {
        Map<PhaseName, Checkpoint> latest = new EnumMap<>(PhaseName.class);
        for (Checkpoint checkpoint : checkpoints) {
            Checkpoint current = latest.get(checkpoint.phase());
            if (current == null || Checkpoint.FINAL.equals(checkpoint.name())) {
                latest.put(checkpoint.phase(), checkpoint);
            }
        }

        int processed = 0;
        int total = 0;
        List<PhaseView> phases = new ArrayList<>(phaseRows.size());
        for (PhaseState row : phaseRows) {
            Checkpoint checkpoint = latest.get(row.phase());
            int phaseProcessed = checkpoint != null ? checkpoint.itemsProcessed() : 0;
            int phaseTotal = checkpoint != null ? checkpoint.itemsTotal() : row.itemsTotal();
            processed += phaseProcessed;
            total += phaseTotal;
            double percent = checkpoint != null ? checkpoint.percent()
                    : (row.status() == PhaseStatus.COMPLETED ? 100.0 : 0.0);
            phases.add(new PhaseView(row.phase(), row.status(), row.attempts(), phaseTotal, phaseProcessed,
                    row.itemsSucceeded(), row.itemsFailed(), percent, row.lastError(), row.blockedReason(),
                    row.startedAt(), row.completedAt()));
        }

        double progress;
        if (total > 0) {
            progress = (processed * 100.0) / total;
        } else {
            progress = execution.status() == ExecutionStatus.COMPLETED ? 100.0 : 0.0;
        }

        List<String> warnings = new ArrayList<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (ExecutionMessage message : messages) {
            String scope = message.phase() != null ? message.phase().key() : "execution";
            if (message.level() == ExecutionMessage.Level.WARNING) {
                warnings.add(scope + ": " + message.message());
            } else {
                errors.computeIfAbsent(scope, k -> new ArrayList<>()).add(message.message());
            }
        }

        return new ExecutionStatusView(
                execution.id(),
                execution.status(),
                execution.triggerMode(),
                execution.createdAt(),
                execution.startedAt(),
                execution.finishedAt(),
                execution.cancelRequested(),
                execution.errorMessage(),
                progress,
                phases,
                warnings,
                errors);
    }

    public PhaseView phase(PhaseName phase) {
        for (PhaseView view : phases) {
            if (view.phase() == phase) {
                return view;
            }
        }
        return null;
    }
}
