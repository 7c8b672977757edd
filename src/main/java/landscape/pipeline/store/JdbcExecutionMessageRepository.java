package landscape.pipeline.store;

import landscape.pipeline.model.ExecutionMessage;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.repository.ExecutionMessageRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static landscape.pipeline.store.JdbcSupport.setTimestamp;
import static landscape.pipeline.store.JdbcSupport.toInstant;
import static landscape.pipeline.store.JdbcSupport.truncate;

/**
 * JDBC implementation of ExecutionMessageRepository.
 */
public class JdbcExecutionMessageRepository implements ExecutionMessageRepository {

    private final Database db;

    public JdbcExecutionMessageRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean appendBounded(ExecutionMessage message, int limit) {
        String phaseFilter = message.phase() != null ? "phase = ?" : "phase IS NULL";
        String countSql = "SELECT COUNT(*) FROM execution_messages WHERE execution_id = ? AND severity = ? AND "
                + phaseFilter;
        String insertSql = """
                    INSERT INTO execution_messages (execution_id, phase, severity, message, created_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int existing;
                try (PreparedStatement ps = conn.prepareStatement(countSql)) {
                    ps.setString(1, message.executionId());
                    ps.setString(2, message.level().name());
                    if (message.phase() != null) {
                        ps.setString(3, message.phase().name());
                    }
                    try (ResultSet rs = ps.executeQuery()) {
                        existing = rs.next() ? rs.getInt(1) : 0;
                    }
                }
                if (existing >= limit) {
                    conn.commit();
                    return false;
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, message.executionId());
                    ps.setString(2, message.phase() != null ? message.phase().name() : null);
                    ps.setString(3, message.level().name());
                    ps.setString(4, truncate(message.message()));
                    setTimestamp(ps, 5, message.createdAt() != null ? message.createdAt() : Instant.now());
                    ps.executeUpdate();
                }
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record message of execution: " + message.executionId(), e);
        }
    }

    @Override
    public List<ExecutionMessage> findByExecution(String executionId) {
        String sql = "SELECT * FROM execution_messages WHERE execution_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            List<ExecutionMessage> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String phase = rs.getString("phase");
                    results.add(new ExecutionMessage(
                            rs.getString("execution_id"),
                            phase != null ? PhaseName.valueOf(phase) : null,
                            ExecutionMessage.Level.valueOf(rs.getString("severity")),
                            rs.getString("message"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list messages of execution: " + executionId, e);
        }
    }
}
