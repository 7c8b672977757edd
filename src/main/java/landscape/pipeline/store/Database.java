package landscape.pipeline.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import landscape.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(PipelineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("landscape-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pipeline_executions (
                            id               VARCHAR(64) PRIMARY KEY,
                            trigger_mode     VARCHAR(20) NOT NULL,
                            status           VARCHAR(32) NOT NULL,
                            config           CLOB NOT NULL,
                            cancel_requested BOOLEAN DEFAULT FALSE,
                            driver_id        VARCHAR(128),
                            heartbeat_at     TIMESTAMP,
                            error_message    VARCHAR(2048),
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at       TIMESTAMP,
                            finished_at      TIMESTAMP
                        );
                    """);

            // ---------- PHASES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS phase_status (
                            execution_id    VARCHAR(64) NOT NULL,
                            phase           VARCHAR(40) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            attempts        INT DEFAULT 0,
                            enumerated      BOOLEAN DEFAULT FALSE,
                            items_total     INT DEFAULT 0,
                            items_succeeded INT DEFAULT 0,
                            items_failed    INT DEFAULT 0,
                            last_error      VARCHAR(2048),
                            blocked_reason  VARCHAR(1024),
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (execution_id, phase)
                        );
                    """);

            // ---------- ITEM STATE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pipeline_state (
                            execution_id    VARCHAR(64) NOT NULL,
                            phase           VARCHAR(40) NOT NULL,
                            item_id         VARCHAR(512) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            attempt_count   INT DEFAULT 0,
                            max_attempts    INT DEFAULT 3,
                            degraded        BOOLEAN DEFAULT FALSE,
                            last_error      VARCHAR(2048),
                            error_category  VARCHAR(32),
                            progress_data   CLOB,
                            last_attempt_at TIMESTAMP,
                            completed_at    TIMESTAMP,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (execution_id, phase, item_id)
                        );
                    """);

            // ---------- JOB QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_queue (
                            id               VARCHAR(64) PRIMARY KEY,
                            queue_name       VARCHAR(64) NOT NULL,
                            job_type         VARCHAR(64) NOT NULL,
                            payload          CLOB NOT NULL,
                            priority         INT DEFAULT 0,
                            status           VARCHAR(20) NOT NULL,
                            attempts         INT DEFAULT 0,
                            max_attempts     INT DEFAULT 3,
                            dedupe_key       VARCHAR(640),
                            group_key        VARCHAR(128),
                            lease_owner      VARCHAR(128),
                            lease_expires_at TIMESTAMP,
                            scheduled_for    TIMESTAMP,
                            last_error       VARCHAR(2048),
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at       TIMESTAMP,
                            completed_at     TIMESTAMP
                        );
                    """);

            // ---------- CIRCUIT BREAKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS circuit_breakers (
                            name                VARCHAR(128) PRIMARY KEY,
                            state               VARCHAR(20) NOT NULL,
                            failure_count       INT DEFAULT 0,
                            success_count       INT DEFAULT 0,
                            failure_threshold   INT NOT NULL,
                            success_threshold   INT NOT NULL,
                            timeout_ms          BIGINT NOT NULL,
                            half_open_max_calls INT DEFAULT 1,
                            half_open_in_flight INT DEFAULT 0,
                            last_failure_at     TIMESTAMP,
                            last_success_at     TIMESTAMP,
                            opened_at           TIMESTAMP,
                            total_requests      BIGINT DEFAULT 0,
                            total_failures      BIGINT DEFAULT 0,
                            total_successes     BIGINT DEFAULT 0,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- CHECKPOINTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pipeline_checkpoints (
                            execution_id    VARCHAR(64) NOT NULL,
                            phase           VARCHAR(40) NOT NULL,
                            name            VARCHAR(64) NOT NULL,
                            items_processed INT DEFAULT 0,
                            items_total     INT DEFAULT 0,
                            state_data      CLOB,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (execution_id, phase, name)
                        );
                    """);

            // ---------- RETRY HISTORY ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS retry_history (
                            id             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            entity_type    VARCHAR(64) NOT NULL,
                            entity_id      VARCHAR(512) NOT NULL,
                            service        VARCHAR(128),
                            attempt_number INT NOT NULL,
                            success        BOOLEAN NOT NULL,
                            error_code     VARCHAR(64),
                            error_message  VARCHAR(2048),
                            delay_ms       BIGINT DEFAULT 0,
                            next_retry_at  TIMESTAMP,
                            created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- EXECUTION MESSAGES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS execution_messages (
                            id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            execution_id VARCHAR(64) NOT NULL,
                            phase        VARCHAR(40),
                            severity     VARCHAR(10) NOT NULL,
                            message      VARCHAR(2048) NOT NULL,
                            created_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_status ON pipeline_executions(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_state_phase_status ON pipeline_state(execution_id, phase, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_lease ON job_queue(queue_name, status, priority DESC, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_dedupe ON job_queue(dedupe_key, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_group ON job_queue(group_key, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_retry_entity ON retry_history(entity_type, entity_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_messages_execution ON execution_messages(execution_id, phase);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
