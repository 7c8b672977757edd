package landscape.pipeline.store;

import landscape.pipeline.model.Checkpoint;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.repository.CheckpointRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static landscape.pipeline.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of CheckpointRepository.
 */
public class JdbcCheckpointRepository implements CheckpointRepository {

    private final Database db;

    public JdbcCheckpointRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Checkpoint checkpoint) {
        String updateSql = """
                    UPDATE pipeline_checkpoints
                    SET items_processed = ?, items_total = ?, state_data = ?, updated_at = ?
                    WHERE execution_id = ? AND phase = ? AND name = ?
                """;
        String insertSql = """
                    INSERT INTO pipeline_checkpoints (items_processed, items_total, state_data, updated_at,
                                                      execution_id, phase, name)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                Instant now = checkpoint.updatedAt() != null ? checkpoint.updatedAt() : Instant.now();
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    bind(ps, checkpoint, now);
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        bind(ps, checkpoint, now);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save checkpoint " + checkpoint.name() + " of "
                    + checkpoint.phase(), e);
        }
    }

    private void bind(PreparedStatement ps, Checkpoint checkpoint, Instant now) throws SQLException {
        ps.setInt(1, checkpoint.itemsProcessed());
        ps.setInt(2, checkpoint.itemsTotal());
        ps.setString(3, checkpoint.stateData());
        ps.setTimestamp(4, Timestamp.from(now));
        ps.setString(5, checkpoint.executionId());
        ps.setString(6, checkpoint.phase().name());
        ps.setString(7, checkpoint.name());
    }

    @Override
    public Optional<Checkpoint> find(String executionId, PhaseName phase, String name) {
        String sql = "SELECT * FROM pipeline_checkpoints WHERE execution_id = ? AND phase = ? AND name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            ps.setString(2, phase.name());
            ps.setString(3, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find checkpoint " + name + " of " + phase, e);
        }
    }

    @Override
    public List<Checkpoint> findByExecution(String executionId) {
        String sql = "SELECT * FROM pipeline_checkpoints WHERE execution_id = ? ORDER BY phase, name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            List<Checkpoint> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list checkpoints of execution: " + executionId, e);
        }
    }

    private Checkpoint mapRow(ResultSet rs) throws SQLException {
        return new Checkpoint(
                rs.getString("execution_id"),
                PhaseName.valueOf(rs.getString("phase")),
                rs.getString("name"),
                rs.getInt("items_processed"),
                rs.getInt("items_total"),
                rs.getString("state_data"),
                toInstant(rs.getTimestamp("updated_at")));
    }
}
