package landscape.pipeline.orchestrator;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.events.NotificationSink;
import landscape.pipeline.events.PipelineEvent;
import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.model.PipelineExecution;
import landscape.pipeline.repository.ExecutionRepository;
import landscape.pipeline.repository.PhaseStateRepository;
import landscape.pipeline.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives an execution through the phase graph.
 *
 * Phases whose entry gate is open start in parallel on the phase executor; the calling
 * thread re-evaluates gates, refreshes the driver heartbeat and watches for cancellation
 * until nothing is running or ready, then writes the execution's final status.
 */
public class PhaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PhaseOrchestrator.class);

    private static final Set<PhaseStatus> NEVER_RAN = Set.of(PhaseStatus.PENDING, PhaseStatus.BLOCKED);

    private final ExecutionRepository executions;
    private final PhaseStateRepository phases;
    private final PhaseRunner runner;
    private final PhaseGraph graph;
    private final DataAvailabilityQuery data;
    private final JobQueueService queue;
    private final NotificationSink events;
    private final PipelineConfig config;
    private final Clock clock;

    private final AtomicInteger threadSeq = new AtomicInteger();
    private final ExecutorService phaseExecutor;

    public PhaseOrchestrator(ExecutionRepository executions, PhaseStateRepository phases, PhaseRunner runner,
            PhaseGraph graph, DataAvailabilityQuery data, JobQueueService queue, NotificationSink events,
            PipelineConfig config, Clock clock) {
        this.executions = executions;
        this.phases = phases;
        this.runner = runner;
        this.graph = graph;
        this.data = data;
        this.queue = queue;
        this.events = events;
        this.config = config;
        this.clock = clock;
        this.phaseExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "phase-runner-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run the execution until every enabled phase is settled.
     *
     * @return the final status written, or empty if another party finished the execution first
     * @throws InterruptedException if the driver thread is interrupted; durable state is left as is
     */
    public Optional<ExecutionStatus> run(ExecutionContext context) throws InterruptedException {
        String executionId = context.executionId();
        ExecutionConfig executionConfig = context.config();
        PhaseGraph executionGraph = graph.withOverrides(executionConfig.dependencyOverrides());

        MDC.put("executionId", executionId);
        Map<PhaseName, Future<PhaseRunner.Result>> running = new EnumMap<>(PhaseName.class);
        try {
            initPhases(executionId, executionConfig);
            Instant lastHeartbeat = Instant.EPOCH;

            while (true) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Driver of " + executionId + " interrupted");
                }

                Optional<PipelineExecution> execution = executions.findById(executionId);
                if (execution.isEmpty() || execution.get().isTerminal()) {
                    log.warn("Execution {} finished elsewhere, stopping its phases", executionId);
                    context.requestCancel();
                    awaitPhases(running);
                    return Optional.empty();
                }
                if (execution.get().cancelRequested()) {
                    context.requestCancel();
                }

                Instant now = clock.instant();
                if (Duration.between(lastHeartbeat, now).compareTo(config.heartbeatInterval()) >= 0) {
                    if (!executions.heartbeat(executionId, context.driverId()) && lostDriver(executionId)) {
                        log.warn("Execution {} was taken over by another driver, stopping here", executionId);
                        context.relinquish();
                        awaitPhases(running);
                        return Optional.empty();
                    }
                    lastHeartbeat = now;
                }

                collectFinished(context, running);

                if (context.isCancelRequested()) {
                    if (running.isEmpty()) {
                        skipUnstarted(executionId, PhaseRunner.CANCELLED);
                        break;
                    }
                    Thread.sleep(config.pollInterval().toMillis());
                    continue;
                }

                Map<PhaseName, PhaseState> states = stateMap(executionId);
                int ready = 0;
                for (PhaseName phase : PhaseName.values()) {
                    PhaseState state = states.get(phase);
                    if (state == null || state.status() != PhaseStatus.PENDING || running.containsKey(phase)) {
                        continue;
                    }
                    PhaseGraph.GateDecision decision = executionGraph.evaluate(phase, states, executionConfig,
                            data, executionId);
                    switch (decision.gate()) {
                        case READY:
                            ready++;
                            if (running.size() < config.maxParallelPhases() && start(context, phase, running)) {
                                states.put(phase, state.toBuilder().status(PhaseStatus.RUNNING).build());
                            }
                            break;
                        case BLOCKED:
                            if (block(executionId, phase, decision.reason())) {
                                states.put(phase, state.toBuilder().status(PhaseStatus.BLOCKED)
                                        .blockedReason(decision.reason()).build());
                            }
                            break;
                        default:
                            break;
                    }
                }

                if (running.isEmpty() && ready == 0) {
                    blockLeftovers(executionId);
                    break;
                }
                Thread.sleep(config.pollInterval().toMillis());
            }

            return Optional.of(finish(context, executionGraph));
        } catch (InterruptedException e) {
            running.values().forEach(f -> f.cancel(true));
            throw e;
        } finally {
            MDC.remove("executionId");
        }
    }

    /**
     * Check that the execution's dependency overrides name existing edges.
     *
     * @throws IllegalArgumentException on an override of a missing edge
     */
    public void validate(ExecutionConfig executionConfig) {
        graph.withOverrides(executionConfig.dependencyOverrides());
    }

    /**
     * Phases whose entry gate is open right now.
     */
    public List<PhaseName> nextExecutablePhases(String executionId, ExecutionConfig executionConfig) {
        PhaseGraph executionGraph = graph.withOverrides(executionConfig.dependencyOverrides());
        Map<PhaseName, PhaseState> states = stateMap(executionId);
        List<PhaseName> next = new ArrayList<>();
        for (PhaseName phase : PhaseName.values()) {
            PhaseState state = states.get(phase);
            boolean pending = state != null ? state.status() == PhaseStatus.PENDING
                    : executionConfig.isEnabled(phase);
            if (pending && executionGraph.evaluate(phase, states, executionConfig, data, executionId)
                    .gate() == PhaseGraph.Gate.READY) {
                next.add(phase);
            }
        }
        return next;
    }

    /**
     * Return a RUNNING phase to PENDING and put its leased jobs back on the queue.
     * Used when no driver is around to honour a restart request.
     *
     * @return true if the phase was RUNNING
     */
    public boolean resetPhase(String executionId, PhaseName phase) {
        int released = queue.releaseGroup(PhaseRunner.groupKey(executionId, phase));
        boolean reset = phases.transition(executionId, phase, Set.of(PhaseStatus.RUNNING), PhaseStatus.PENDING,
                null, null);
        if (reset) {
            log.info("Phase {} of {} reset to PENDING, {} jobs released", phase.key(), executionId, released);
            events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.PENDING, "restart"));
        }
        return reset;
    }

    /**
     * Final status from settled phase rows.
     */
    public static ExecutionStatus finalStatus(boolean cancelled, ExecutionConfig executionConfig, PhaseGraph graph,
            Map<PhaseName, PhaseState> states) {
        if (cancelled) {
            return ExecutionStatus.CANCELLED;
        }
        boolean partial = false;
        for (PhaseState state : states.values()) {
            if (state.status() == PhaseStatus.BLOCKED) {
                partial = true;
            }
            if (state.status() != PhaseStatus.FAILED) {
                continue;
            }
            partial = true;
            if (executionConfig.isCritical(state.phase())) {
                return ExecutionStatus.FAILED;
            }
            for (PhaseName dependent : graph.hardDependents(state.phase())) {
                PhaseState dependentState = states.get(dependent);
                if (executionConfig.isEnabled(dependent) && dependentState != null
                        && NEVER_RAN.contains(dependentState.status())) {
                    return ExecutionStatus.FAILED;
                }
            }
        }
        return partial ? ExecutionStatus.PARTIALLY_COMPLETED : ExecutionStatus.COMPLETED;
    }

    /**
     * Stop accepting phases and interrupt those still running.
     */
    public void shutdown() {
        phaseExecutor.shutdownNow();
        try {
            if (!phaseExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Phase runners did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void initPhases(String executionId, ExecutionConfig executionConfig) {
        List<PhaseState> rows = new ArrayList<>();
        for (PhaseName phase : PhaseName.values()) {
            boolean enabled = executionConfig.isEnabled(phase);
            rows.add(PhaseState.builder()
                    .executionId(executionId)
                    .phase(phase)
                    .status(enabled ? PhaseStatus.PENDING : PhaseStatus.SKIPPED)
                    .blockedReason(enabled ? null : "disabled")
                    .build());
        }
        int inserted = phases.insertMissing(rows);
        if (inserted > 0) {
            log.debug("Initialised {} phase rows for {}", inserted, executionId);
        }
    }

    private boolean start(ExecutionContext context, PhaseName phase,
            Map<PhaseName, Future<PhaseRunner.Result>> running) {
        String executionId = context.executionId();
        if (!phases.transition(executionId, phase, Set.of(PhaseStatus.PENDING), PhaseStatus.RUNNING, null, null)) {
            log.warn("Phase {} left PENDING before it could start", phase.key());
            return false;
        }
        log.info("Starting phase {}", phase.key());
        events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.RUNNING, null));
        running.put(phase, phaseExecutor.submit(() -> runner.run(context, phase)));
        return true;
    }

    private boolean block(String executionId, PhaseName phase, String reason) {
        if (!phases.transition(executionId, phase, Set.of(PhaseStatus.PENDING), PhaseStatus.BLOCKED, null,
                reason)) {
            return false;
        }
        log.info("Phase {} blocked: {}", phase.key(), reason);
        events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.BLOCKED, reason));
        return true;
    }

    private void collectFinished(ExecutionContext context, Map<PhaseName, Future<PhaseRunner.Result>> running)
            throws InterruptedException {
        String executionId = context.executionId();
        Iterator<Map.Entry<PhaseName, Future<PhaseRunner.Result>>> it = running.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<PhaseName, Future<PhaseRunner.Result>> entry = it.next();
            PhaseName phase = entry.getKey();
            Future<PhaseRunner.Result> future = entry.getValue();
            if (!future.isDone()) {
                continue;
            }
            // EnumMap entries are invalid once removed
            it.remove();
            try {
                PhaseRunner.Result result = future.get();
                if (result == PhaseRunner.Result.RESTART) {
                    context.clearRestart(phase);
                    phases.transition(executionId, phase, Set.of(PhaseStatus.RUNNING), PhaseStatus.PENDING, null,
                            null);
                    log.info("Phase {} restarting", phase.key());
                    events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.PENDING, "restart"));
                } else if (result == PhaseRunner.Result.INTERRUPTED) {
                    throw new InterruptedException("Phase " + phase.key() + " interrupted");
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Phase {} crashed", phase.key(), cause);
                String error = "phase error: " + cause.getMessage();
                if (phases.transition(executionId, phase, Set.of(PhaseStatus.RUNNING), PhaseStatus.FAILED, error,
                        null)) {
                    events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.FAILED, error));
                }
            }
        }
    }

    private void awaitPhases(Map<PhaseName, Future<PhaseRunner.Result>> running) throws InterruptedException {
        for (Future<PhaseRunner.Result> future : running.values()) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.warn("Phase stopped with error", e.getCause());
            }
        }
        running.clear();
    }

    /** A refused heartbeat on a live execution means someone else claimed it */
    private boolean lostDriver(String executionId) {
        return executions.findById(executionId).map(e -> !e.isTerminal()).orElse(false);
    }

    private void skipUnstarted(String executionId, String reason) {
        for (PhaseName phase : PhaseName.values()) {
            if (phases.transition(executionId, phase, NEVER_RAN, PhaseStatus.SKIPPED, reason, null)) {
                events.publish(PipelineEvent.phaseChanged(executionId, phase, PhaseStatus.SKIPPED, reason));
            }
        }
    }

    private void blockLeftovers(String executionId) {
        for (PhaseState state : phases.findByExecution(executionId)) {
            if (state.status() == PhaseStatus.PENDING) {
                block(executionId, state.phase(), "dependencies never settled");
            }
        }
    }

    private ExecutionStatus finish(ExecutionContext context, PhaseGraph executionGraph) {
        String executionId = context.executionId();
        Map<PhaseName, PhaseState> states = stateMap(executionId);
        ExecutionStatus status = finalStatus(context.isCancelRequested(), context.config(), executionGraph, states);

        String error = null;
        if (status == ExecutionStatus.FAILED || status == ExecutionStatus.PARTIALLY_COMPLETED) {
            StringJoiner summary = new StringJoiner("; ");
            for (PhaseState state : states.values()) {
                if (state.status() == PhaseStatus.FAILED) {
                    summary.add(state.phase().key() + " failed: " + state.lastError());
                } else if (state.status() == PhaseStatus.BLOCKED) {
                    summary.add(state.phase().key() + " blocked: " + state.blockedReason());
                }
            }
            error = summary.toString();
        } else if (status == ExecutionStatus.CANCELLED) {
            error = PhaseRunner.CANCELLED;
        }

        if (executions.finish(executionId, status, error)) {
            log.info("Execution {} finished: {}", executionId, status);
            events.publish(PipelineEvent.executionFinished(executionId, status, error));
        } else {
            log.warn("Execution {} was already terminal, {} not applied", executionId, status);
        }
        executions.releaseDriver(executionId, context.driverId());
        return status;
    }

    private Map<PhaseName, PhaseState> stateMap(String executionId) {
        Map<PhaseName, PhaseState> states = new EnumMap<>(PhaseName.class);
        for (PhaseState state : phases.findByExecution(executionId)) {
            states.put(state.phase(), state);
        }
        return states;
    }
}
