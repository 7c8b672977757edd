package landscape.pipeline.scheduler;

import landscape.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - PipelineMonitor: restarts, fails or resumes unhealthy executions
 * - QueueReaper: recovers queue entries with expired leases
 *
 * Uses a single-threaded executor so the tasks never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final PipelineMonitor monitor;
    private final QueueReaper queueReaper;
    private final PipelineConfig config;

    private volatile boolean running = false;

    public Scheduler(PipelineMonitor monitor, QueueReaper queueReaper, PipelineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "landscape-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.monitor = monitor;
        this.queueReaper = queueReaper;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long monitorIntervalMs = config.monitorInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("pipeline-monitor", monitor),
                monitorIntervalMs,
                monitorIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Pipeline monitor scheduled every {}ms", monitorIntervalMs);

        long reaperIntervalMs = config.queueReaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("queue-reaper", queueReaper),
                reaperIntervalMs,
                reaperIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Queue reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public PipelineMonitor monitor() {
        return monitor;
    }

    public QueueReaper queueReaper() {
        return queueReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
