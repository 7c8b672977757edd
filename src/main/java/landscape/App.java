package landscape;

import landscape.pipeline.config.Dependencies;
import landscape.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Pipeline engine entry point.
 *
 * Starts the HTTP API and the background monitor, optionally resumes executions
 * left unfinished by a previous process, and runs until the JVM is stopped.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        PipelineConfig config = PipelineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down pipeline engine...");
            deps.close();
            stopped.countDown();
        }, "landscape-shutdown"));

        try {
            deps.httpServer().start(config.serverPort());
        } catch (IllegalStateException e) {
            log.error("Server startup failed", e);
            deps.close();
            System.exit(1);
            return;
        }

        deps.startScheduler();

        if (config.autoResume()) {
            int resumed = deps.pipelineService().resumeInterrupted();
            log.info("Auto-resume: {} interrupted executions picked up", resumed);
        }
        if (config.simulation()) {
            log.info("Simulation handlers active; POST /api/v1/pipelines to start a run");
        }

        log.info("Pipeline engine {} ready on port {}", deps.pipelineService().instanceId(), config.serverPort());
        stopped.await();
    }
}
