package landscape.pipeline.store;

import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PipelineExecution;
import landscape.pipeline.model.TriggerMode;
import landscape.pipeline.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static landscape.pipeline.store.JdbcSupport.setTimestamp;
import static landscape.pipeline.store.JdbcSupport.toInstant;
import static landscape.pipeline.store.JdbcSupport.truncate;

/**
 * JDBC implementation of ExecutionRepository.
 * Terminal rows are guarded in every UPDATE's WHERE clause.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private static final String NON_TERMINAL = "status IN ('PENDING', 'RUNNING')";

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(PipelineExecution execution) {
        String sql = """
                    INSERT INTO pipeline_executions (id, trigger_mode, status, config, cancel_requested, driver_id,
                                                     heartbeat_at, error_message, created_at, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, execution.id());
            ps.setString(2, execution.triggerMode().name());
            ps.setString(3, execution.status().name());
            ps.setString(4, execution.configJson());
            ps.setBoolean(5, execution.cancelRequested());
            ps.setString(6, execution.driverId());
            setTimestamp(ps, 7, execution.heartbeatAt());
            ps.setString(8, execution.errorMessage());
            setTimestamp(ps, 9, execution.createdAt() != null ? execution.createdAt() : Instant.now());
            setTimestamp(ps, 10, execution.startedAt());
            setTimestamp(ps, 11, execution.finishedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save execution: " + execution.id(), e);
        }
    }

    @Override
    public Optional<PipelineExecution> findById(String executionId) {
        String sql = "SELECT * FROM pipeline_executions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find execution: " + executionId, e);
        }
    }

    @Override
    public List<PipelineExecution> findByStatus(ExecutionStatus status) {
        String sql = "SELECT * FROM pipeline_executions WHERE status = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find executions by status: " + status, e);
        }
    }

    @Override
    public List<PipelineExecution> findRecent(int limit) {
        String sql = "SELECT * FROM pipeline_executions ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent executions", e);
        }
    }

    @Override
    public boolean markRunning(String executionId, String driverId, Instant staleBefore) {
        String sql = """
                    UPDATE pipeline_executions
                    SET status = 'RUNNING', driver_id = ?, heartbeat_at = ?, started_at = COALESCE(started_at, ?)
                    WHERE id = ? AND cancel_requested = FALSE
                      AND (driver_id IS NULL OR heartbeat_at IS NULL OR heartbeat_at < ?) AND
                """ + NON_TERMINAL;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, driverId);
            ps.setTimestamp(2, now);
            ps.setTimestamp(3, now);
            ps.setString(4, executionId);
            ps.setTimestamp(5, Timestamp.from(staleBefore));

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Execution {} claimed by driver {}", executionId, driverId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark execution running: " + executionId, e);
        }
    }

    @Override
    public boolean heartbeat(String executionId, String driverId) {
        String sql = "UPDATE pipeline_executions SET heartbeat_at = ? WHERE id = ? AND driver_id = ? AND "
                + NON_TERMINAL;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, executionId);
            ps.setString(3, driverId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to heartbeat execution: " + executionId, e);
        }
    }

    @Override
    public void releaseDriver(String executionId, String driverId) {
        String sql = "UPDATE pipeline_executions SET driver_id = NULL, heartbeat_at = NULL WHERE id = ? AND driver_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            ps.setString(2, driverId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release driver of execution: " + executionId, e);
        }
    }

    @Override
    public boolean requestCancel(String executionId) {
        String sql = "UPDATE pipeline_executions SET cancel_requested = TRUE WHERE id = ? AND " + NON_TERMINAL;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to request cancel of execution: " + executionId, e);
        }
    }

    @Override
    public boolean finish(String executionId, ExecutionStatus status, String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("finish requires a terminal status, got " + status);
        }

        String sql = """
                    UPDATE pipeline_executions
                    SET status = ?, error_message = ?, finished_at = ?, driver_id = NULL, heartbeat_at = NULL
                    WHERE id = ? AND
                """ + NON_TERMINAL;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, truncate(errorMessage));
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setString(4, executionId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Execution {} finished with status {}", executionId, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish execution: " + executionId, e);
        }
    }

    // Helper methods

    private List<PipelineExecution> executeQuery(PreparedStatement ps) throws SQLException {
        List<PipelineExecution> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private PipelineExecution mapRow(ResultSet rs) throws SQLException {
        return PipelineExecution.builder()
                .id(rs.getString("id"))
                .triggerMode(TriggerMode.valueOf(rs.getString("trigger_mode")))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .configJson(rs.getString("config"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .driverId(rs.getString("driver_id"))
                .heartbeatAt(toInstant(rs.getTimestamp("heartbeat_at")))
                .errorMessage(rs.getString("error_message"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }
}
