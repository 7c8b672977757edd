package landscape.pipeline.orchestrator;

import landscape.pipeline.config.Json;
import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.events.NotificationSink;
import landscape.pipeline.events.PipelineEvent;
import landscape.pipeline.model.Checkpoint;
import landscape.pipeline.model.ErrorCategory;
import landscape.pipeline.model.ExecutionMessage;
import landscape.pipeline.model.ItemState;
import landscape.pipeline.model.ItemStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.model.QueueJob;
import landscape.pipeline.repository.ExecutionMessageRepository;
import landscape.pipeline.repository.PhaseStateRepository;
import landscape.pipeline.resilience.CallInterruptedException;
import landscape.pipeline.resilience.CallOutcome;
import landscape.pipeline.resilience.RetryExecutor;
import landscape.pipeline.service.JobQueueService;
import landscape.pipeline.service.StateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one phase of one execution to a final status.
 *
 * Work items are registered with the state tracker, pushed through the phase lane of the
 * job queue and processed by a fixed pool of workers. The calling thread polls progress,
 * writes checkpoints and applies the completion policy until the phase is decided.
 */
public class PhaseRunner {

    private static final Logger log = LoggerFactory.getLogger(PhaseRunner.class);

    static final String ABANDONED = "abandoned";
    static final String CANCELLED = "cancelled";
    static final String ATTEMPT_CEILING = "attempt ceiling reached";

    private static final Duration IDLE_WAIT = Duration.ofMillis(50);
    private static final Duration WORKER_STOP_WAIT = Duration.ofSeconds(10);

    public enum Result {
        /** Phase reached COMPLETED, FAILED or SKIPPED */
        FINISHED,
        /** Stopped on a restart request; the phase is still RUNNING */
        RESTART,
        /** Stopped because another driver took the execution over; nothing written */
        RELINQUISHED,
        /** Thread interrupted; nothing written after the interrupt */
        INTERRUPTED
    }

    private final PhaseHandlerRegistry handlers;
    private final StateTracker tracker;
    private final JobQueueService queue;
    private final RetryExecutor retries;
    private final PhaseStateRepository phases;
    private final ExecutionMessageRepository messages;
    private final NotificationSink events;
    private final PipelineConfig config;
    private final Clock clock;

    private final AtomicInteger workerSeq = new AtomicInteger();

    public PhaseRunner(PhaseHandlerRegistry handlers, StateTracker tracker, JobQueueService queue,
            RetryExecutor retries, PhaseStateRepository phases, ExecutionMessageRepository messages,
            NotificationSink events, PipelineConfig config, Clock clock) {
        this.handlers = handlers;
        this.tracker = tracker;
        this.queue = queue;
        this.retries = retries;
        this.phases = phases;
        this.messages = messages;
        this.events = events;
        this.config = config;
        this.clock = clock;
    }

    public static String groupKey(String executionId, PhaseName phase) {
        return executionId + ":" + phase.name();
    }

    /**
     * Drive a phase that is already RUNNING.
     */
    public Result run(ExecutionContext context, PhaseName phase) {
        MDC.put("executionId", context.executionId());
        MDC.put("phase", phase.key());
        try {
            return runPhase(context, phase);
        } catch (InterruptedException | CallInterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Phase {} interrupted", phase.key());
            return Result.INTERRUPTED;
        } finally {
            MDC.clear();
        }
    }

    private Result runPhase(ExecutionContext context, PhaseName phase) throws InterruptedException {
        String executionId = context.executionId();
        PhaseSettings settings = context.config().settingsFor(phase);

        Optional<PhaseHandler> found = handlers.find(phase);
        if (found.isEmpty()) {
            finish(context, phase, PhaseStatus.FAILED, "no handler registered for " + phase.key());
            return Result.FINISHED;
        }
        PhaseHandler handler = found.get();

        PhaseState state = phases.find(executionId, phase)
                .orElseThrow(() -> new IllegalStateException("No phase row for " + phase.key()));

        if (!state.enumerated()) {
            List<WorkItem> work;
            try {
                work = handler.enumerate(context);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Enumeration of {} failed", phase.key(), e);
                finish(context, phase, PhaseStatus.FAILED, "enumeration failed: " + e.getMessage());
                return Result.FINISHED;
            }
            Map<String, String> payloads = new LinkedHashMap<>();
            for (WorkItem item : work) {
                payloads.put(item.itemId(), Json.write(item.payload()));
            }
            tracker.register(executionId, phase, payloads, settings.itemMaxAttempts());
            phases.markEnumerated(executionId, phase, payloads.size());
            log.info("Phase {} enumerated {} items", phase.key(), payloads.size());
        }

        enqueue(context, phase, settings, tracker.pendingItems(executionId, phase));

        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(settings.timeout());
        String group = groupKey(executionId, phase);

        ExecutorService workers = Executors.newFixedThreadPool(settings.concurrency(), r -> {
            Thread t = new Thread(r, "phase-" + phase.key() + "-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < settings.concurrency(); i++) {
            workers.submit(new Worker(context, phase, handler, settings, phase.key() + "-" + i));
        }

        PhaseStatus finalStatus;
        String reason;
        boolean stopped = false;
        try {
            PhaseProgress last = null;
            while (true) {
                PhaseProgress progress = tracker.progress(executionId, phase);
                if (!progress.equals(last)) {
                    tracker.saveCheckpoint(executionId, phase, Checkpoint.PROGRESS, progress.terminal(),
                            progress.total(), null);
                    phases.updateCounters(executionId, phase, progress.total(), progress.completed(),
                            progress.failed());
                    events.publish(PipelineEvent.phaseProgress(executionId, progress));
                    last = progress;
                }

                if (context.isRelinquished()) {
                    stopWorkers(workers);
                    stopped = true;
                    log.info("Phase {} handed over to another driver", phase.key());
                    return Result.RELINQUISHED;
                }
                if (context.isCancelRequested()) {
                    finalStatus = PhaseStatus.SKIPPED;
                    reason = CANCELLED;
                    break;
                }
                if (context.isRestartRequested(phase)) {
                    stopWorkers(workers);
                    stopped = true;
                    int released = queue.releaseGroup(group);
                    log.info("Phase {} stopped for restart, {} jobs released", phase.key(), released);
                    return Result.RESTART;
                }
                Optional<String> failRequest = context.failRequest(phase);
                if (failRequest.isPresent()) {
                    finalStatus = PhaseStatus.FAILED;
                    reason = failRequest.get();
                    break;
                }

                reconcile(context, phase, settings, group);

                Instant now = clock.instant();
                CompletionPolicy.Decision decision = CompletionPolicy.evaluate(progress, settings,
                        Duration.between(startedAt, now), !now.isBefore(deadline));
                if (decision.isFinal()) {
                    finalStatus = decision.verdict() == CompletionPolicy.Verdict.COMPLETE
                            ? PhaseStatus.COMPLETED
                            : PhaseStatus.FAILED;
                    reason = decision.reason();
                    break;
                }

                Thread.sleep(config.pollInterval().toMillis());
            }
        } finally {
            if (!stopped) {
                stopWorkers(workers);
            }
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted while stopping workers of " + phase.key());
        }

        abandonInFlight(executionId, phase);
        queue.cancelGroup(group, finalStatus == PhaseStatus.SKIPPED ? CANCELLED : "phase " + finalStatus);
        finish(context, phase, finalStatus, reason);
        return Result.FINISHED;
    }

    private void enqueue(ExecutionContext context, PhaseName phase, PhaseSettings settings, List<ItemState> items) {
        if (items.isEmpty()) {
            return;
        }
        String executionId = context.executionId();
        List<QueueJob> batch = new ArrayList<>(settings.batchSize());
        List<String> ids = new ArrayList<>(items.size());
        int inserted = 0;
        for (ItemState item : items) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("executionId", executionId);
            payload.put("phase", phase.key());
            payload.put("itemId", item.itemId());
            payload.put("item", Json.readMap(item.progressData()));

            batch.add(QueueJob.builder()
                    .id(JobQueueService.newJobId())
                    .queueName(settings.lane())
                    .jobType(phase.key())
                    .payload(Json.write(payload))
                    .priority(settings.priority())
                    .maxAttempts(settings.itemMaxAttempts())
                    .dedupeKey(executionId + ":" + phase.key() + ":" + item.itemId())
                    .groupKey(groupKey(executionId, phase))
                    .build());
            ids.add(item.itemId());

            if (batch.size() >= settings.batchSize()) {
                inserted += queue.bulkEnqueue(batch);
                batch = new ArrayList<>(settings.batchSize());
            }
        }
        if (!batch.isEmpty()) {
            inserted += queue.bulkEnqueue(batch);
        }
        tracker.markQueued(executionId, phase, ids);
        log.debug("Phase {}: {} items submitted, {} new jobs", phase.key(), ids.size(), inserted);
    }

    /**
     * Put remaining items back on the queue once nothing of the phase is queued any more,
     * e.g. after dead-lettered jobs or jobs lost with a previous driver.
     */
    private void reconcile(ExecutionContext context, PhaseName phase, PhaseSettings settings, String group) {
        if (queue.countActive(group) > 0) {
            return;
        }
        List<ItemState> remaining = tracker.pendingItems(context.executionId(), phase);
        if (remaining.isEmpty()) {
            return;
        }
        List<ItemState> requeue = new ArrayList<>();
        for (ItemState item : remaining) {
            if (item.attemptCount() >= item.maxAttempts()) {
                tracker.recordFailed(context.executionId(), phase, item.itemId(), ATTEMPT_CEILING,
                        ErrorCategory.NON_RECOVERABLE);
            } else {
                requeue.add(item);
            }
        }
        if (!requeue.isEmpty()) {
            log.debug("Phase {}: re-submitting {} items with no active job", phase.key(), requeue.size());
            enqueue(context, phase, settings, requeue);
        }
    }

    private void abandonInFlight(String executionId, PhaseName phase) {
        int abandoned = 0;
        for (ItemState item : tracker.pendingItems(executionId, phase)) {
            if (item.status().isInFlight()) {
                tracker.record(executionId, phase, item.itemId(), ItemStatus.SKIPPED, ABANDONED);
                abandoned++;
            }
        }
        if (abandoned > 0) {
            log.info("Phase {}: {} in-flight items abandoned", phase.key(), abandoned);
        }
    }

    private void finish(ExecutionContext context, PhaseName phase, PhaseStatus status, String reason) {
        String executionId = context.executionId();
        PhaseProgress progress = tracker.progress(executionId, phase);
        phases.updateCounters(executionId, phase, progress.total(), progress.completed(), progress.failed());
        tracker.saveCheckpoint(executionId, phase, Checkpoint.FINAL, progress.terminal(), progress.total(),
                Json.write(Map.of("status", status.name(), "reason", reason != null ? reason : "")));

        int limit = config.messageLimitPerPhase();
        if (status == PhaseStatus.FAILED && reason != null) {
            messages.appendBounded(new ExecutionMessage(executionId, phase, ExecutionMessage.Level.ERROR,
                    reason, clock.instant()), limit);
        }
        for (ItemState failed : tracker.failedItems(executionId, phase, limit)) {
            if (failed.lastError() == null) {
                continue;
            }
            boolean stored = messages.appendBounded(new ExecutionMessage(executionId, phase,
                    ExecutionMessage.Level.ERROR, failed.itemId() + ": " + failed.lastError(), clock.instant()),
                    limit);
            if (!stored) {
                break;
            }
        }

        String lastError = status == PhaseStatus.COMPLETED ? null : reason;
        if (phases.transition(executionId, phase, Set.of(PhaseStatus.RUNNING), status, lastError, null)) {
            log.info("Phase {} {} ({}): {}/{} done, {} failed", phase.key(), status, reason,
                    progress.completed(), progress.total(), progress.terminalFailed());
            events.publish(PipelineEvent.phaseChanged(executionId, phase, status, reason));
        } else {
            log.warn("Phase {} was no longer RUNNING, {} not applied", phase.key(), status);
        }
    }

    private static void stopWorkers(ExecutorService workers) throws InterruptedException {
        workers.shutdownNow();
        if (!workers.awaitTermination(WORKER_STOP_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Phase workers did not stop within {}", WORKER_STOP_WAIT);
        }
    }

    /**
     * Leases jobs of one phase and runs them through the handler until interrupted.
     */
    private final class Worker implements Runnable {

        private final ExecutionContext context;
        private final PhaseName phase;
        private final PhaseHandler handler;
        private final PhaseSettings settings;
        private final String workerId;
        private final String group;

        Worker(ExecutionContext context, PhaseName phase, PhaseHandler handler, PhaseSettings settings,
                String workerId) {
            this.context = context;
            this.phase = phase;
            this.handler = handler;
            this.settings = settings;
            this.workerId = context.driverId() + ":" + workerId;
            this.group = groupKey(context.executionId(), phase);
        }

        @Override
        public void run() {
            MDC.put("executionId", context.executionId());
            MDC.put("phase", phase.key());
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    try {
                        Optional<QueueJob> job = queue.lease(settings.lane(), group, workerId);
                        if (job.isEmpty()) {
                            Thread.sleep(IDLE_WAIT.toMillis());
                            continue;
                        }
                        process(job.get());
                    } catch (RuntimeException e) {
                        if (e instanceof CallInterruptedException || Thread.currentThread().isInterrupted()) {
                            break;
                        }
                        log.error("Worker {} failed to process a job", workerId, e);
                        Thread.sleep(IDLE_WAIT.toMillis());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                MDC.clear();
            }
        }

        private void process(QueueJob job) {
            String executionId = context.executionId();
            Object itemIdValue = Json.readMap(job.payload()).get("itemId");
            if (itemIdValue == null) {
                queue.fail(job.id(), workerId, "job payload has no itemId", false);
                return;
            }
            String itemId = itemIdValue.toString();

            Optional<ItemState> item = tracker.item(executionId, phase, itemId);
            if (item.isEmpty()) {
                queue.fail(job.id(), workerId, "unknown item " + itemId, false);
                return;
            }
            if (item.get().status() == ItemStatus.COMPLETED || item.get().status() == ItemStatus.SKIPPED) {
                queue.complete(job.id(), workerId);
                return;
            }
            if (!tracker.beginAttempt(executionId, phase, itemId)) {
                tracker.recordFailed(executionId, phase, itemId, ATTEMPT_CEILING, ErrorCategory.NON_RECOVERABLE);
                queue.fail(job.id(), workerId, ATTEMPT_CEILING, false);
                return;
            }

            WorkItem work = new WorkItem(itemId, Json.readMap(item.get().progressData()));
            CallOutcome<ItemOutcome> outcome = retries.execute(handler.serviceName(),
                    () -> handler.execute(work, context),
                    "item:" + phase.key(), executionId + ":" + itemId, settings.retryMaxAttempts());

            apply(job, itemId, outcome);
        }

        private void apply(QueueJob job, String itemId, CallOutcome<ItemOutcome> outcome) {
            String executionId = context.executionId();
            switch (outcome.status()) {
                case SUCCESS:
                    applyItemOutcome(job, itemId, outcome.value());
                    break;
                case DEGRADED: {
                    Object partial = outcome.partial();
                    String warning = outcome.error().describe();
                    tracker.recordCompleted(executionId, phase, itemId, partial != null ? Json.write(partial) : null,
                            true, warning);
                    warn(itemId, warning);
                    queue.complete(job.id(), workerId);
                    break;
                }
                case SERVICE_UNAVAILABLE:
                    tracker.recordFailed(executionId, phase, itemId, outcome.error().describe(),
                            ErrorCategory.SERVICE_UNAVAILABLE);
                    queue.fail(job.id(), workerId, outcome.error().describe(), true);
                    break;
                default:
                    ErrorCategory category = outcome.errorCategory();
                    tracker.recordFailed(executionId, phase, itemId, outcome.error().describe(), category);
                    queue.fail(job.id(), workerId, outcome.error().describe(),
                            category == ErrorCategory.RECOVERABLE);
                    break;
            }
        }

        private void applyItemOutcome(QueueJob job, String itemId, ItemOutcome result) {
            String executionId = context.executionId();
            if (result == null) {
                result = ItemOutcome.completed(null);
            }
            switch (result.status()) {
                case COMPLETED:
                    tracker.recordCompleted(executionId, phase, itemId, Json.write(result.output()), false, null);
                    queue.complete(job.id(), workerId);
                    break;
                case DEGRADED:
                    tracker.recordCompleted(executionId, phase, itemId, Json.write(result.output()), true,
                            result.error());
                    warn(itemId, result.error());
                    queue.complete(job.id(), workerId);
                    break;
                case SKIPPED:
                    tracker.record(executionId, phase, itemId, ItemStatus.SKIPPED, result.error());
                    queue.complete(job.id(), workerId);
                    break;
                default:
                    ErrorCategory category = result.category() != null ? result.category()
                            : ErrorCategory.NON_RECOVERABLE;
                    tracker.recordFailed(executionId, phase, itemId, result.error(), category);
                    boolean retriable = category == ErrorCategory.RECOVERABLE
                            || category == ErrorCategory.SERVICE_UNAVAILABLE;
                    queue.fail(job.id(), workerId, result.error(), retriable);
                    break;
            }
        }

        private void warn(String itemId, String warning) {
            if (warning == null) {
                return;
            }
            messages.appendBounded(new ExecutionMessage(context.executionId(), phase, ExecutionMessage.Level.WARNING,
                    itemId + ": " + warning, clock.instant()), config.messageLimitPerPhase());
        }
    }
}
