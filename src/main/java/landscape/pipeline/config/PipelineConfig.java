package landscape.pipeline.config;

import java.time.Duration;

/**
 * Configuration holder for the pipeline engine.
 * All settings have sensible defaults.
 */
public final class PipelineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/landscape;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    private int databasePoolSize = 20;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Orchestrator settings
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private int messageLimitPerPhase = 5;
    private int maxParallelPhases = 4;

    // Monitor settings
    private Duration monitorInterval = Duration.ofSeconds(60);
    private Duration stuckWindow = Duration.ofMinutes(15);
    private Duration timeoutGrace = Duration.ofMinutes(5);
    private Duration driverStaleAfter = Duration.ofMinutes(2);
    private Duration maxPipelineRuntime = Duration.ofHours(48);
    private int maxPhaseAttempts = 3;
    private boolean autoResume = false;

    // Queue settings
    private Duration leaseDuration = Duration.ofMinutes(5);
    private Duration requeueBaseDelay = Duration.ofSeconds(2);
    private Duration queueReaperInterval = Duration.ofSeconds(30);

    // Retry settings
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration retryMaxDelay = Duration.ofSeconds(60);
    private double retryMultiplier = 2.0;
    private Duration rateLimitBaseDelay = Duration.ofSeconds(60);

    // Circuit breaker defaults
    private int breakerFailureThreshold = 10;
    private int breakerSuccessThreshold = 5;
    private Duration breakerTimeout = Duration.ofSeconds(300);
    private int breakerHalfOpenCalls = 1;

    // Simulation
    private boolean simulation = false;

    private PipelineConfig() {
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    public static PipelineConfig fromEnv() {
        PipelineConfig config = new PipelineConfig();

        // Override from environment variables
        String dbUrl = System.getenv("LANDSCAPE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("LANDSCAPE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String monitorSeconds = System.getenv("LANDSCAPE_MONITOR_INTERVAL_SECONDS");
        if (monitorSeconds != null && !monitorSeconds.isBlank()) {
            config.monitorInterval = Duration.ofSeconds(Long.parseLong(monitorSeconds));
        }

        String leaseSeconds = System.getenv("LANDSCAPE_LEASE_SECONDS");
        if (leaseSeconds != null && !leaseSeconds.isBlank()) {
            config.leaseDuration = Duration.ofSeconds(Long.parseLong(leaseSeconds));
        }

        String maxPhaseAttempts = System.getenv("LANDSCAPE_MAX_PHASE_ATTEMPTS");
        if (maxPhaseAttempts != null && !maxPhaseAttempts.isBlank()) {
            config.maxPhaseAttempts = Integer.parseInt(maxPhaseAttempts);
        }

        config.autoResume = Boolean.parseBoolean(System.getenv("LANDSCAPE_AUTO_RESUME"));
        config.simulation = Boolean.parseBoolean(System.getenv("LANDSCAPE_SIMULATION"));

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public int messageLimitPerPhase() {
        return messageLimitPerPhase;
    }

    public int maxParallelPhases() {
        return maxParallelPhases;
    }

    public Duration monitorInterval() {
        return monitorInterval;
    }

    public Duration stuckWindow() {
        return stuckWindow;
    }

    public Duration timeoutGrace() {
        return timeoutGrace;
    }

    public Duration driverStaleAfter() {
        return driverStaleAfter;
    }

    public Duration maxPipelineRuntime() {
        return maxPipelineRuntime;
    }

    public int maxPhaseAttempts() {
        return maxPhaseAttempts;
    }

    public boolean autoResume() {
        return autoResume;
    }

    public Duration leaseDuration() {
        return leaseDuration;
    }

    public Duration requeueBaseDelay() {
        return requeueBaseDelay;
    }

    public Duration queueReaperInterval() {
        return queueReaperInterval;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public double retryMultiplier() {
        return retryMultiplier;
    }

    public Duration rateLimitBaseDelay() {
        return rateLimitBaseDelay;
    }

    public int breakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public int breakerSuccessThreshold() {
        return breakerSuccessThreshold;
    }

    public Duration breakerTimeout() {
        return breakerTimeout;
    }

    public int breakerHalfOpenCalls() {
        return breakerHalfOpenCalls;
    }

    public boolean simulation() {
        return simulation;
    }

    // Fluent setters for testing/customization
    public PipelineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public PipelineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public PipelineConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public PipelineConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public PipelineConfig withMaxParallelPhases(int phases) {
        this.maxParallelPhases = phases;
        return this;
    }

    public PipelineConfig withMonitorInterval(Duration interval) {
        this.monitorInterval = interval;
        return this;
    }

    public PipelineConfig withStuckWindow(Duration window) {
        this.stuckWindow = window;
        return this;
    }

    public PipelineConfig withTimeoutGrace(Duration grace) {
        this.timeoutGrace = grace;
        return this;
    }

    public PipelineConfig withDriverStaleAfter(Duration staleAfter) {
        this.driverStaleAfter = staleAfter;
        return this;
    }

    public PipelineConfig withMaxPipelineRuntime(Duration runtime) {
        this.maxPipelineRuntime = runtime;
        return this;
    }

    public PipelineConfig withMaxPhaseAttempts(int attempts) {
        this.maxPhaseAttempts = attempts;
        return this;
    }

    public PipelineConfig withAutoResume(boolean autoResume) {
        this.autoResume = autoResume;
        return this;
    }

    public PipelineConfig withLeaseDuration(Duration duration) {
        this.leaseDuration = duration;
        return this;
    }

    public PipelineConfig withRequeueBaseDelay(Duration delay) {
        this.requeueBaseDelay = delay;
        return this;
    }

    public PipelineConfig withQueueReaperInterval(Duration interval) {
        this.queueReaperInterval = interval;
        return this;
    }

    public PipelineConfig withRetryBackoff(Duration base, Duration max, double multiplier) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        this.retryMultiplier = multiplier;
        return this;
    }

    public PipelineConfig withRateLimitBaseDelay(Duration delay) {
        this.rateLimitBaseDelay = delay;
        return this;
    }

    public PipelineConfig withBreakerDefaults(int failureThreshold, int successThreshold, Duration timeout) {
        this.breakerFailureThreshold = failureThreshold;
        this.breakerSuccessThreshold = successThreshold;
        this.breakerTimeout = timeout;
        return this;
    }

    public PipelineConfig withSimulation(boolean simulation) {
        this.simulation = simulation;
        return this;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", monitorInterval=" + monitorInterval +
                ", leaseDuration=" + leaseDuration +
                ", maxPhaseAttempts=" + maxPhaseAttempts +
                ", autoResume=" + autoResume +
                ", simulation=" + simulation +
                '}';
    }
}
