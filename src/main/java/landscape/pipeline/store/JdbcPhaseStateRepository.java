package landscape.pipeline.store;

import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.repository.PhaseStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static landscape.pipeline.store.JdbcSupport.toInstant;
import static landscape.pipeline.store.JdbcSupport.truncate;

/**
 * JDBC implementation of PhaseStateRepository.
 */
public class JdbcPhaseStateRepository implements PhaseStateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPhaseStateRepository.class);

    private final Database db;

    public JdbcPhaseStateRepository(Database db) {
        this.db = db;
    }

    @Override
    public int insertMissing(List<PhaseState> states) {
        if (states.isEmpty())
            return 0;

        String existsSql = "SELECT 1 FROM phase_status WHERE execution_id = ? AND phase = ?";
        String insertSql = """
                    INSERT INTO phase_status (execution_id, phase, status, blocked_reason, completed_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement exists = conn.prepareStatement(existsSql);
                PreparedStatement insert = conn.prepareStatement(insertSql)) {

            Timestamp now = Timestamp.from(Instant.now());
            int inserted = 0;
            for (PhaseState state : states) {
                exists.setString(1, state.executionId());
                exists.setString(2, state.phase().name());
                try (ResultSet rs = exists.executeQuery()) {
                    if (rs.next()) {
                        continue;
                    }
                }
                insert.setString(1, state.executionId());
                insert.setString(2, state.phase().name());
                insert.setString(3, state.status().name());
                insert.setString(4, state.blockedReason());
                insert.setTimestamp(5, state.status().isTerminal() ? now : null);
                insert.setTimestamp(6, now);
                insert.addBatch();
                inserted++;
            }
            if (inserted > 0) {
                insert.executeBatch();
            }
            conn.commit();
            return inserted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize phase rows", e);
        }
    }

    @Override
    public Optional<PhaseState> find(String executionId, PhaseName phase) {
        String sql = "SELECT * FROM phase_status WHERE execution_id = ? AND phase = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            ps.setString(2, phase.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find phase " + phase + " of execution " + executionId, e);
        }
    }

    @Override
    public List<PhaseState> findByExecution(String executionId) {
        String sql = "SELECT * FROM phase_status WHERE execution_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            List<PhaseState> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            results.sort(Comparator.comparing(PhaseState::phase));
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find phases of execution " + executionId, e);
        }
    }

    @Override
    public boolean transition(String executionId, PhaseName phase, Set<PhaseStatus> from, PhaseStatus to,
            String lastError, String blockedReason) {
        if (from.isEmpty()) {
            throw new IllegalArgumentException("from statuses are required");
        }

        String placeholders = from.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql;
        if (to == PhaseStatus.RUNNING) {
            sql = """
                        UPDATE phase_status
                        SET status = ?, last_error = ?, blocked_reason = ?, attempts = attempts + 1,
                            started_at = ?, completed_at = NULL, updated_at = ?
                        WHERE execution_id = ? AND phase = ? AND status IN (%s)
                    """.formatted(placeholders);
        } else if (to.isTerminal()) {
            sql = """
                        UPDATE phase_status
                        SET status = ?, last_error = ?, blocked_reason = ?, completed_at = ?, updated_at = ?
                        WHERE execution_id = ? AND phase = ? AND status IN (%s)
                    """.formatted(placeholders);
        } else {
            sql = """
                        UPDATE phase_status
                        SET status = ?, last_error = ?, blocked_reason = ?, completed_at = NULL, updated_at = ?
                        WHERE execution_id = ? AND phase = ? AND status IN (%s)
                    """.formatted(placeholders);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            int i = 1;
            ps.setString(i++, to.name());
            ps.setString(i++, truncate(lastError));
            ps.setString(i++, truncate(blockedReason));
            if (to == PhaseStatus.RUNNING || to.isTerminal()) {
                ps.setTimestamp(i++, now);
            }
            ps.setTimestamp(i++, now);
            ps.setString(i++, executionId);
            ps.setString(i++, phase.name());
            for (PhaseStatus status : from) {
                ps.setString(i++, status.name());
            }

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Phase {} of {} -> {}", phase, executionId, to);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to move phase " + phase + " of " + executionId + " to " + to, e);
        }
    }

    @Override
    public void markEnumerated(String executionId, PhaseName phase, int itemsTotal) {
        String sql = """
                    UPDATE phase_status SET enumerated = TRUE, items_total = ?, updated_at = ?
                    WHERE execution_id = ? AND phase = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, itemsTotal);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, executionId);
            ps.setString(4, phase.name());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark phase enumerated: " + phase, e);
        }
    }

    @Override
    public void updateCounters(String executionId, PhaseName phase, int itemsTotal, int itemsSucceeded,
            int itemsFailed) {
        String sql = """
                    UPDATE phase_status
                    SET items_total = ?, items_succeeded = ?, items_failed = ?, updated_at = ?
                    WHERE execution_id = ? AND phase = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, itemsTotal);
            ps.setInt(2, itemsSucceeded);
            ps.setInt(3, itemsFailed);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            ps.setString(5, executionId);
            ps.setString(6, phase.name());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update counters of phase " + phase, e);
        }
    }

    private PhaseState mapRow(ResultSet rs) throws SQLException {
        return PhaseState.builder()
                .executionId(rs.getString("execution_id"))
                .phase(PhaseName.valueOf(rs.getString("phase")))
                .status(PhaseStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .enumerated(rs.getBoolean("enumerated"))
                .itemsTotal(rs.getInt("items_total"))
                .itemsSucceeded(rs.getInt("items_succeeded"))
                .itemsFailed(rs.getInt("items_failed"))
                .lastError(rs.getString("last_error"))
                .blockedReason(rs.getString("blocked_reason"))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
