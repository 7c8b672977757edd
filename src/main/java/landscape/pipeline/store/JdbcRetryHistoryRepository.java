package landscape.pipeline.store;

import landscape.pipeline.model.RetryAttempt;
import landscape.pipeline.repository.RetryHistoryRepository;

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
 * JDBC implementation of RetryHistoryRepository.
 */
public class JdbcRetryHistoryRepository implements RetryHistoryRepository {

    private final Database db;

    public JdbcRetryHistoryRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(RetryAttempt attempt) {
        String sql = """
                    INSERT INTO retry_history (entity_type, entity_id, service, attempt_number, success, error_code,
                                               error_message, delay_ms, next_retry_at, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, attempt.entityType());
            ps.setString(2, attempt.entityId());
            ps.setString(3, attempt.service());
            ps.setInt(4, attempt.attemptNumber());
            ps.setBoolean(5, attempt.success());
            ps.setString(6, attempt.errorCode());
            ps.setString(7, truncate(attempt.errorMessage()));
            ps.setLong(8, attempt.delayMs());
            setTimestamp(ps, 9, attempt.nextRetryAt());
            setTimestamp(ps, 10, attempt.createdAt() != null ? attempt.createdAt() : Instant.now());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record retry attempt of " + attempt.entityId(), e);
        }
    }

    @Override
    public List<RetryAttempt> findByEntity(String entityType, String entityId) {
        String sql = """
                    SELECT * FROM retry_history
                    WHERE entity_type = ? AND entity_id = ?
                    ORDER BY created_at, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entityType);
            ps.setString(2, entityId);
            List<RetryAttempt> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new RetryAttempt(
                            rs.getString("entity_type"),
                            rs.getString("entity_id"),
                            rs.getString("service"),
                            rs.getInt("attempt_number"),
                            rs.getBoolean("success"),
                            rs.getString("error_code"),
                            rs.getString("error_message"),
                            rs.getLong("delay_ms"),
                            toInstant(rs.getTimestamp("next_retry_at")),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read retry history of " + entityId, e);
        }
    }
}
