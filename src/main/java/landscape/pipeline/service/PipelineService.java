package landscape.pipeline.service;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.config.Json;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.events.NotificationSink;
import landscape.pipeline.events.PipelineEvent;
import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.model.PipelineExecution;
import landscape.pipeline.orchestrator.ExecutionContext;
import landscape.pipeline.orchestrator.PhaseOrchestrator;
import landscape.pipeline.orchestrator.PhaseRunner;
import landscape.pipeline.repository.ExecutionMessageRepository;
import landscape.pipeline.repository.ExecutionRepository;
import landscape.pipeline.repository.PhaseStateRepository;
import landscape.pipeline.scheduler.PipelineRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for starting, inspecting, cancelling and resuming pipeline executions.
 *
 * Each execution driven by this process runs on its own driver thread. Everything an
 * execution needs to continue lives in the store, so any instance can resume it.
 */
public class PipelineService implements PipelineRecovery {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private static final int MAX_RECENT = 500;

    private final ExecutionRepository executions;
    private final PhaseStateRepository phases;
    private final ExecutionMessageRepository messages;
    private final StateTracker tracker;
    private final JobQueueService queue;
    private final PhaseOrchestrator orchestrator;
    private final NotificationSink events;
    private final PipelineConfig config;
    private final Clock clock;

    private final String instanceId = "orchestrator-" + UUID.randomUUID().toString().substring(0, 8);
    private final Map<String, Driver> active = new ConcurrentHashMap<>();
    private final AtomicInteger driverSeq = new AtomicInteger();
    private final ExecutorService drivers;

    public PipelineService(ExecutionRepository executions, PhaseStateRepository phases,
            ExecutionMessageRepository messages, StateTracker tracker, JobQueueService queue,
            PhaseOrchestrator orchestrator, NotificationSink events, PipelineConfig config, Clock clock) {
        this.executions = executions;
        this.phases = phases;
        this.messages = messages;
        this.tracker = tracker;
        this.queue = queue;
        this.orchestrator = orchestrator;
        this.events = events;
        this.config = config;
        this.clock = clock;
        this.drivers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pipeline-driver-" + driverSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Persist a new execution and start driving it in the background.
     *
     * @return the execution id
     */
    public String start(ExecutionConfig executionConfig) {
        if (executionConfig == null) {
            throw new IllegalArgumentException("execution config is required");
        }
        orchestrator.validate(executionConfig);
        String executionId = UUID.randomUUID().toString();
        executions.save(PipelineExecution.builder()
                .id(executionId)
                .triggerMode(executionConfig.triggerMode())
                .status(ExecutionStatus.PENDING)
                .configJson(Json.write(executionConfig))
                .createdAt(clock.instant())
                .build());
        log.info("Created execution {} ({} phases, trigger {})", executionId,
                executionConfig.enabledPhases().size(), executionConfig.triggerMode());
        drive(executionId, executionConfig, false);
        return executionId;
    }

    public ExecutionStatusView status(String executionId) {
        PipelineExecution execution = find(executionId);
        return ExecutionStatusView.of(execution, phases.findByExecution(executionId),
                tracker.checkpoints(executionId), messages.findByExecution(executionId));
    }

    public List<PipelineExecution> recent(int limit) {
        if (limit < 1 || limit > MAX_RECENT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_RECENT);
        }
        return executions.findRecent(limit);
    }

    /**
     * Request cooperative cancellation.
     *
     * A locally driven execution stops its running phases and finishes CANCELLED on its own.
     * One with no live driver anywhere is cancelled directly in the store.
     *
     * @return false if the execution was already terminal
     */
    public boolean cancel(String executionId) {
        PipelineExecution execution = find(executionId);
        if (execution.isTerminal() || !executions.requestCancel(executionId)) {
            return false;
        }

        Driver driver = active.get(executionId);
        if (driver != null) {
            driver.context.requestCancel();
            log.info("Cancellation requested for {}", executionId);
            return true;
        }
        if (execution.hasLiveDriver(staleBefore())) {
            log.info("Cancellation flagged for {}, driven by {}", executionId, execution.driverId());
            return true;
        }

        for (PhaseName phase : PhaseName.values()) {
            queue.cancelGroup(PhaseRunner.groupKey(executionId, phase), "cancelled");
            if (phases.transition(executionId, phase,
                    Set.of(PhaseStatus.PENDING, PhaseStatus.BLOCKED, PhaseStatus.RUNNING),
                    PhaseStatus.SKIPPED, "cancelled", null)) {
                events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.SKIPPED, "cancelled"));
            }
        }
        if (executions.finish(executionId, ExecutionStatus.CANCELLED, "cancelled")) {
            events.publish(PipelineEvent.executionFinished(executionId, ExecutionStatus.CANCELLED, "cancelled"));
        }
        log.info("Execution {} cancelled with no active driver", executionId);
        return true;
    }

    /**
     * Drive a non-terminal execution again. Once the driver has claimed it, RUNNING phases
     * restart from their remaining items and BLOCKED phases get their gates re-evaluated.
     *
     * @throws IllegalStateException if the execution is terminal or still driven somewhere
     */
    public void resume(String executionId) {
        PipelineExecution execution = find(executionId);
        if (execution.isTerminal()) {
            throw new IllegalStateException("Execution " + executionId + " is already " + execution.status());
        }
        if (active.containsKey(executionId)) {
            throw new IllegalStateException("Execution " + executionId + " is already running here");
        }
        if (execution.hasLiveDriver(staleBefore())) {
            throw new IllegalStateException("Execution " + executionId + " is driven by " + execution.driverId());
        }

        ExecutionConfig executionConfig = Json.read(execution.configJson(), ExecutionConfig.class);
        log.info("Resuming execution {}", executionId);
        drive(executionId, executionConfig, true);
    }

    /**
     * Resume every non-terminal execution that no live orchestrator is driving.
     *
     * @return number of executions resumed
     */
    public int resumeInterrupted() {
        List<PipelineExecution> candidates = new ArrayList<>(executions.findByStatus(ExecutionStatus.RUNNING));
        candidates.addAll(executions.findByStatus(ExecutionStatus.PENDING));
        int resumed = 0;
        for (PipelineExecution execution : candidates) {
            if (active.containsKey(execution.id()) || execution.hasLiveDriver(staleBefore())) {
                continue;
            }
            try {
                resume(execution.id());
                resumed++;
            } catch (IllegalStateException e) {
                log.info("Execution {} not resumed: {}", execution.id(), e.getMessage());
            }
        }
        if (resumed > 0) {
            log.info("Resumed {} interrupted executions", resumed);
        }
        return resumed;
    }

    public List<PhaseName> nextExecutablePhases(String executionId) {
        PipelineExecution execution = find(executionId);
        return orchestrator.nextExecutablePhases(executionId,
                Json.read(execution.configJson(), ExecutionConfig.class));
    }

    /**
     * Wait until this process stops driving the execution.
     *
     * @return true if no local driver is left
     */
    public boolean awaitTermination(String executionId, Duration timeout) throws InterruptedException {
        Driver driver = active.get(executionId);
        if (driver == null) {
            return true;
        }
        return driver.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isDrivenLocally(String executionId) {
        return active.containsKey(executionId);
    }

    public String instanceId() {
        return instanceId;
    }

    // Recovery actions

    @Override
    public void restartPhase(String executionId, PhaseName phase) {
        Driver driver = active.get(executionId);
        if (driver != null) {
            driver.context.requestRestart(phase);
            log.info("Restart of {} requested for {}", phase.key(), executionId);
            return;
        }
        orchestrator.resetPhase(executionId, phase);
        resumeIfUndriven(executionId);
    }

    @Override
    public void failPhase(String executionId, PhaseName phase, String reason) {
        Driver driver = active.get(executionId);
        if (driver != null) {
            driver.context.requestFail(phase, reason);
            log.info("Failure of {} requested for {}: {}", phase.key(), executionId, reason);
            return;
        }
        queue.cancelGroup(PhaseRunner.groupKey(executionId, phase), reason);
        if (phases.transition(executionId, phase, Set.of(PhaseStatus.RUNNING), PhaseStatus.FAILED, reason, null)) {
            events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.FAILED, reason));
        }
        resumeIfUndriven(executionId);
    }

    @Override
    public void resumeExecution(String executionId) {
        try {
            resume(executionId);
        } catch (IllegalStateException e) {
            log.info("Execution {} not resumed: {}", executionId, e.getMessage());
        }
    }

    @Override
    public void failExecution(String executionId, String reason) {
        if (!executions.finish(executionId, ExecutionStatus.FAILED, reason)) {
            return;
        }
        log.warn("Execution {} failed: {}", executionId, reason);
        events.publish(PipelineEvent.executionFinished(executionId, ExecutionStatus.FAILED, reason));
        Driver driver = active.get(executionId);
        if (driver != null) {
            driver.context.requestCancel();
        } else {
            for (PhaseName phase : PhaseName.values()) {
                queue.cancelGroup(PhaseRunner.groupKey(executionId, phase), reason);
            }
        }
    }

    /**
     * Interrupt every local driver. Executions keep their durable state for a later resume.
     */
    public void shutdown() {
        drivers.shutdownNow();
        try {
            if (!drivers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Pipeline drivers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void resumeIfUndriven(String executionId) {
        PipelineExecution execution = find(executionId);
        if (!execution.isTerminal() && !execution.hasLiveDriver(staleBefore())) {
            resumeExecution(executionId);
        }
    }

    private void drive(String executionId, ExecutionConfig executionConfig, boolean resumed) {
        Driver driver = new Driver(new ExecutionContext(executionId, executionConfig, instanceId), resumed);
        if (active.putIfAbsent(executionId, driver) != null) {
            throw new IllegalStateException("Execution " + executionId + " is already running here");
        }
        try {
            drivers.submit(() -> runDriver(driver));
        } catch (RuntimeException e) {
            active.remove(executionId, driver);
            driver.done.countDown();
            throw e;
        }
    }

    private void runDriver(Driver driver) {
        String executionId = driver.context.executionId();
        MDC.put("executionId", executionId);
        try {
            if (!executions.markRunning(executionId, instanceId, staleBefore())) {
                log.warn("Execution {} could not be claimed", executionId);
                return;
            }
            if (driver.resumed) {
                reopenPhases(executionId);
            }
            events.publish(PipelineEvent.executionStarted(executionId));
            orchestrator.run(driver.context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Driver of {} interrupted, state kept for resume", executionId);
        } catch (RuntimeException e) {
            log.error("Driver of {} crashed", executionId, e);
            failAfterCrash(executionId, e);
        } finally {
            active.remove(executionId, driver);
            driver.done.countDown();
            MDC.clear();
        }
    }

    /**
     * RUNNING phases restart from their remaining items, BLOCKED ones get their gates
     * re-evaluated. Only called by the driver that won the claim.
     */
    private void reopenPhases(String executionId) {
        for (PhaseState state : phases.findByExecution(executionId)) {
            if (state.status() == PhaseStatus.RUNNING) {
                orchestrator.resetPhase(executionId, state.phase());
            } else if (state.status() == PhaseStatus.BLOCKED) {
                phases.transition(executionId, state.phase(), Set.of(PhaseStatus.BLOCKED), PhaseStatus.PENDING,
                        null, null);
            }
        }
    }

    private void failAfterCrash(String executionId, RuntimeException cause) {
        String reason = "orchestrator error: " + cause.getMessage();
        try {
            if (executions.finish(executionId, ExecutionStatus.FAILED, reason)) {
                events.publish(PipelineEvent.executionFinished(executionId, ExecutionStatus.FAILED, reason));
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of {}; the monitor will resume it", executionId, e);
        }
    }

    private PipelineExecution find(String executionId) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId is required");
        }
        return executions.findById(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    private Instant staleBefore() {
        return clock.instant().minus(config.driverStaleAfter());
    }

    private static final class Driver {
        final ExecutionContext context;
        final boolean resumed;
        final CountDownLatch done = new CountDownLatch(1);

        Driver(ExecutionContext context, boolean resumed) {
            this.context = context;
            this.resumed = resumed;
        }
    }
}
