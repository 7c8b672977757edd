package landscape.pipeline.config;

import landscape.pipeline.api.v1.CircuitBreakerController;
import landscape.pipeline.api.v1.HealthController;
import landscape.pipeline.api.v1.PipelineController;
import landscape.pipeline.api.v1.QueueController;
import landscape.pipeline.events.PipelineEventBus;
import landscape.pipeline.orchestrator.DataAvailabilityQuery;
import landscape.pipeline.orchestrator.PhaseGraph;
import landscape.pipeline.orchestrator.PhaseHandlerRegistry;
import landscape.pipeline.orchestrator.PhaseOrchestrator;
import landscape.pipeline.orchestrator.PhaseRunner;
import landscape.pipeline.repository.CheckpointRepository;
import landscape.pipeline.repository.CircuitBreakerRepository;
import landscape.pipeline.repository.ExecutionMessageRepository;
import landscape.pipeline.repository.ExecutionRepository;
import landscape.pipeline.repository.ItemStateRepository;
import landscape.pipeline.repository.JobQueueRepository;
import landscape.pipeline.repository.PhaseStateRepository;
import landscape.pipeline.repository.RetryHistoryRepository;
import landscape.pipeline.resilience.CircuitBreakerRegistry;
import landscape.pipeline.resilience.ErrorClassifier;
import landscape.pipeline.resilience.RetryExecutor;
import landscape.pipeline.resilience.Sleeper;
import landscape.pipeline.scheduler.PipelineMonitor;
import landscape.pipeline.scheduler.QueueReaper;
import landscape.pipeline.scheduler.Scheduler;
import landscape.pipeline.server.PipelineHttpServer;
import landscape.pipeline.server.RouterHandler;
import landscape.pipeline.service.JobQueueService;
import landscape.pipeline.service.PipelineService;
import landscape.pipeline.service.StateTracker;
import landscape.pipeline.simulation.SimulationHandlers;
import landscape.pipeline.store.Database;
import landscape.pipeline.store.JdbcCheckpointRepository;
import landscape.pipeline.store.JdbcCircuitBreakerRepository;
import landscape.pipeline.store.JdbcExecutionMessageRepository;
import landscape.pipeline.store.JdbcExecutionRepository;
import landscape.pipeline.store.JdbcItemStateRepository;
import landscape.pipeline.store.JdbcJobQueueRepository;
import landscape.pipeline.store.JdbcPhaseStateRepository;
import landscape.pipeline.store.JdbcRetryHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(PipelineConfig.fromEnv());
 * deps.handlers().register(new MyPhaseHandler());
 * deps.startScheduler(); // start the monitor and queue reaper
 * String executionId = deps.pipelineService().start(config);
 * // ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final PipelineConfig config;
    private final Clock clock;
    private final Database database;

    // Repositories
    private final ExecutionRepository executionRepository;
    private final PhaseStateRepository phaseStateRepository;
    private final ItemStateRepository itemStateRepository;
    private final CheckpointRepository checkpointRepository;
    private final ExecutionMessageRepository messageRepository;
    private final JobQueueRepository jobQueueRepository;
    private final CircuitBreakerRepository circuitBreakerRepository;
    private final RetryHistoryRepository retryHistoryRepository;

    // Services
    private final StateTracker stateTracker;
    private final JobQueueService jobQueueService;
    private final ErrorClassifier errorClassifier;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryExecutor retryExecutor;
    private final PipelineEventBus eventBus;
    private final PhaseHandlerRegistry handlers;
    private final PhaseOrchestrator orchestrator;
    private final PipelineService pipelineService;

    // Controllers
    private final HealthController healthController;
    private final PipelineController pipelineController;
    private final CircuitBreakerController circuitBreakerController;
    private final QueueController queueController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private PipelineHttpServer httpServer;

    private Dependencies(PipelineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.executionRepository = new JdbcExecutionRepository(database);
        this.phaseStateRepository = new JdbcPhaseStateRepository(database);
        this.itemStateRepository = new JdbcItemStateRepository(database);
        this.checkpointRepository = new JdbcCheckpointRepository(database);
        this.messageRepository = new JdbcExecutionMessageRepository(database);
        this.jobQueueRepository = new JdbcJobQueueRepository(database);
        this.circuitBreakerRepository = new JdbcCircuitBreakerRepository(database);
        this.retryHistoryRepository = new JdbcRetryHistoryRepository(database);

        // Resilience
        this.errorClassifier = ErrorClassifier.fromConfig(config);
        this.circuitBreakers = new CircuitBreakerRegistry(circuitBreakerRepository, config, clock);
        this.retryExecutor = new RetryExecutor(errorClassifier, circuitBreakers, retryHistoryRepository,
                Sleeper.SYSTEM, clock);

        // Services
        this.stateTracker = new StateTracker(itemStateRepository, checkpointRepository, clock);
        this.jobQueueService = new JobQueueService(jobQueueRepository, config, clock);
        this.eventBus = new PipelineEventBus();
        this.handlers = new PhaseHandlerRegistry();
        if (config.simulation()) {
            SimulationHandlers.registerAll(handlers);
        }

        PhaseRunner runner = new PhaseRunner(handlers, stateTracker, jobQueueService, retryExecutor,
                phaseStateRepository, messageRepository, eventBus, config, clock);
        this.orchestrator = new PhaseOrchestrator(executionRepository, phaseStateRepository, runner,
                PhaseGraph.standard(), DataAvailabilityQuery.completedItems(stateTracker), jobQueueService,
                eventBus, config, clock);
        this.pipelineService = new PipelineService(executionRepository, phaseStateRepository, messageRepository,
                stateTracker, jobQueueService, orchestrator, eventBus, config, clock);

        // Controllers (public API)
        this.healthController = new HealthController(database, executionRepository, circuitBreakers);
        this.pipelineController = new PipelineController(pipelineService);
        this.circuitBreakerController = new CircuitBreakerController(circuitBreakers);
        this.queueController = new QueueController(jobQueueService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(PipelineConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with the given config and clock.
     */
    public static Dependencies create(PipelineConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(PipelineConfig.fromEnv());
    }

    // Getters
    public PipelineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public PhaseStateRepository phaseStateRepository() {
        return phaseStateRepository;
    }

    public ItemStateRepository itemStateRepository() {
        return itemStateRepository;
    }

    public ExecutionMessageRepository messageRepository() {
        return messageRepository;
    }

    public RetryHistoryRepository retryHistoryRepository() {
        return retryHistoryRepository;
    }

    public StateTracker stateTracker() {
        return stateTracker;
    }

    public JobQueueService jobQueueService() {
        return jobQueueService;
    }

    public CircuitBreakerRegistry circuitBreakers() {
        return circuitBreakers;
    }

    public RetryExecutor retryExecutor() {
        return retryExecutor;
    }

    public PipelineEventBus eventBus() {
        return eventBus;
    }

    public PhaseHandlerRegistry handlers() {
        return handlers;
    }

    public PhaseOrchestrator orchestrator() {
        return orchestrator;
    }

    public PipelineService pipelineService() {
        return pipelineService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(pipelineController)
                    .registerController(circuitBreakerController)
                    .registerController(queueController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server (creates it if not yet created).
     */
    public PipelineHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new PipelineHttpServer(routerHandler(), config.serverHost());
        }
        return httpServer;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            PipelineMonitor monitor = new PipelineMonitor(executionRepository, phaseStateRepository, stateTracker,
                    pipelineService, config, clock);
            scheduler = new Scheduler(monitor, new QueueReaper(jobQueueService), config);
        }
        return scheduler;
    }

    /**
     * Start the pipeline monitor and queue reaper.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first so it does not resume what we are stopping
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            pipelineService.shutdown();
            orchestrator.shutdown();
        } catch (Exception e) {
            log.warn("Error stopping pipeline drivers: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
