package landscape.pipeline.store;

import landscape.pipeline.model.ErrorCategory;
import landscape.pipeline.model.ItemState;
import landscape.pipeline.model.ItemStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;
import landscape.pipeline.repository.ItemStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static landscape.pipeline.store.JdbcSupport.setTimestamp;
import static landscape.pipeline.store.JdbcSupport.toInstant;
import static landscape.pipeline.store.JdbcSupport.truncate;

/**
 * JDBC implementation of ItemStateRepository.
 * All writes are keyed by (execution_id, phase, item_id); there are no cross-item locks.
 */
public class JdbcItemStateRepository implements ItemStateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcItemStateRepository.class);

    private static final String KEY = "execution_id = ? AND phase = ? AND item_id = ?";

    private final Database db;

    public JdbcItemStateRepository(Database db) {
        this.db = db;
    }

    @Override
    public int insertMissing(List<ItemState> items) {
        if (items.isEmpty())
            return 0;

        String existsSql = "SELECT 1 FROM pipeline_state WHERE " + KEY;
        String insertSql = """
                    INSERT INTO pipeline_state (execution_id, phase, item_id, status, attempt_count, max_attempts,
                                                progress_data, created_at, updated_at)
                    VALUES (?, ?, ?, ?, 0, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement exists = conn.prepareStatement(existsSql);
                PreparedStatement insert = conn.prepareStatement(insertSql)) {

            Timestamp now = Timestamp.from(Instant.now());
            int inserted = 0;
            for (ItemState item : items) {
                bindKey(exists, 1, item.executionId(), item.phase(), item.itemId());
                try (ResultSet rs = exists.executeQuery()) {
                    if (rs.next()) {
                        continue;
                    }
                }
                insert.setString(1, item.executionId());
                insert.setString(2, item.phase().name());
                insert.setString(3, item.itemId());
                insert.setString(4, item.status().name());
                insert.setInt(5, item.maxAttempts());
                insert.setString(6, item.progressData());
                insert.setTimestamp(7, now);
                insert.setTimestamp(8, now);
                insert.addBatch();
                inserted++;
            }
            if (inserted > 0) {
                insert.executeBatch();
            }
            conn.commit();

            log.debug("Registered {} new items ({} offered)", inserted, items.size());
            return inserted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register items", e);
        }
    }

    @Override
    public void upsert(ItemState item) {
        // a completed item is only ever overwritten by another completion
        String updateSql = """
                    UPDATE pipeline_state
                    SET status = ?, degraded = ?, last_error = ?, error_category = ?,
                        progress_data = COALESCE(?, progress_data),
                        completed_at = CASE WHEN ? = 'COMPLETED' THEN ? ELSE completed_at END,
                        updated_at = ?
                    WHERE execution_id = ? AND phase = ? AND item_id = ?
                      AND (status <> 'COMPLETED' OR ? = 'COMPLETED')
                """;
        String existsSql = "SELECT 1 FROM pipeline_state WHERE " + KEY;
        String insertSql = """
                    INSERT INTO pipeline_state (execution_id, phase, item_id, status, attempt_count, max_attempts,
                                                degraded, last_error, error_category, progress_data,
                                                last_attempt_at, completed_at, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                Timestamp now = Timestamp.from(Instant.now());
                String status = item.status().name();

                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, status);
                    ps.setBoolean(2, item.degraded());
                    ps.setString(3, truncate(item.lastError()));
                    ps.setString(4, item.errorCategory() != null ? item.errorCategory().name() : null);
                    ps.setString(5, item.progressData());
                    ps.setString(6, status);
                    ps.setTimestamp(7, now);
                    ps.setTimestamp(8, now);
                    bindKey(ps, 9, item.executionId(), item.phase(), item.itemId());
                    ps.setString(12, status);
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    boolean exists;
                    try (PreparedStatement ps = conn.prepareStatement(existsSql)) {
                        bindKey(ps, 1, item.executionId(), item.phase(), item.itemId());
                        try (ResultSet rs = ps.executeQuery()) {
                            exists = rs.next();
                        }
                    }
                    if (!exists) {
                        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                            ps.setString(1, item.executionId());
                            ps.setString(2, item.phase().name());
                            ps.setString(3, item.itemId());
                            ps.setString(4, status);
                            ps.setInt(5, item.attemptCount());
                            ps.setInt(6, item.maxAttempts());
                            ps.setBoolean(7, item.degraded());
                            ps.setString(8, truncate(item.lastError()));
                            ps.setString(9, item.errorCategory() != null ? item.errorCategory().name() : null);
                            ps.setString(10, item.progressData());
                            setTimestamp(ps, 11, item.lastAttemptAt());
                            ps.setTimestamp(12, item.status() == ItemStatus.COMPLETED ? now : null);
                            ps.setTimestamp(13, now);
                            ps.setTimestamp(14, now);
                            ps.executeUpdate();
                        }
                    } else {
                        log.debug("Ignoring {} for already completed item {}", status, item.itemId());
                    }
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record item " + item.itemId(), e);
        }
    }

    @Override
    public boolean markProcessing(String executionId, PhaseName phase, String itemId, Instant now) {
        String sql = """
                    UPDATE pipeline_state
                    SET status = 'PROCESSING', attempt_count = attempt_count + 1, last_attempt_at = ?, updated_at = ?
                    WHERE execution_id = ? AND phase = ? AND item_id = ?
                      AND status NOT IN ('COMPLETED', 'SKIPPED') AND attempt_count < max_attempts
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            bindKey(ps, 3, executionId, phase, itemId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to start attempt of item " + itemId, e);
        }
    }

    @Override
    public int markQueued(String executionId, PhaseName phase, List<String> itemIds) {
        if (itemIds.isEmpty())
            return 0;

        String sql = """
                    UPDATE pipeline_state SET status = 'QUEUED', updated_at = ?
                    WHERE execution_id = ? AND phase = ? AND item_id = ? AND status IN ('PENDING', 'FAILED')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            for (String itemId : itemIds) {
                ps.setTimestamp(1, now);
                bindKey(ps, 2, executionId, phase, itemId);
                ps.addBatch();
            }
            int total = 0;
            for (int count : ps.executeBatch()) {
                total += Math.max(count, 0);
            }
            conn.commit();
            return total;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark items queued", e);
        }
    }

    @Override
    public Optional<ItemState> find(String executionId, PhaseName phase, String itemId) {
        String sql = "SELECT * FROM pipeline_state WHERE " + KEY;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindKey(ps, 1, executionId, phase, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find item " + itemId, e);
        }
    }

    @Override
    public List<ItemState> findByPhase(String executionId, PhaseName phase) {
        String sql = "SELECT * FROM pipeline_state WHERE execution_id = ? AND phase = ? ORDER BY item_id";
        return query(sql, "Failed to list items of " + phase, executionId, phase.name());
    }

    @Override
    public List<ItemState> findRemaining(String executionId, PhaseName phase) {
        String sql = """
                    SELECT * FROM pipeline_state
                    WHERE execution_id = ? AND phase = ?
                      AND (status IN ('PENDING', 'QUEUED', 'PROCESSING')
                           OR (status = 'FAILED' AND attempt_count < max_attempts
                               AND (error_category IS NULL OR error_category <> 'NON_RECOVERABLE')))
                    ORDER BY created_at, item_id
                """;
        return query(sql, "Failed to list remaining items of " + phase, executionId, phase.name());
    }

    @Override
    public List<ItemState> findFailed(String executionId, PhaseName phase, int limit) {
        String sql = """
                    SELECT * FROM pipeline_state
                    WHERE execution_id = ? AND phase = ? AND status = 'FAILED'
                    ORDER BY updated_at DESC
                    LIMIT ?
                """;
        return query(sql, "Failed to list failed items of " + phase, executionId, phase.name(), limit);
    }

    @Override
    public PhaseProgress progress(String executionId, PhaseName phase) {
        return progressByExecution(executionId, phase).getOrDefault(phase, PhaseProgress.empty(phase));
    }

    @Override
    public Map<PhaseName, PhaseProgress> progressByExecution(String executionId) {
        return progressByExecution(executionId, null);
    }

    private Map<PhaseName, PhaseProgress> progressByExecution(String executionId, PhaseName only) {
        String sql = """
                    SELECT phase, status, COUNT(*) AS cnt,
                           SUM(CASE WHEN status = 'FAILED' AND attempt_count < max_attempts
                                    AND (error_category IS NULL OR error_category <> 'NON_RECOVERABLE')
                               THEN 1 ELSE 0 END) AS retryable,
                           SUM(CASE WHEN degraded THEN 1 ELSE 0 END) AS degraded
                    FROM pipeline_state
                    WHERE execution_id = ?
                """ + (only != null ? " AND phase = ?" : "") + " GROUP BY phase, status";

        Map<PhaseName, int[]> counts = new EnumMap<>(PhaseName.class);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            if (only != null) {
                ps.setString(2, only.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    PhaseName phase = PhaseName.valueOf(rs.getString("phase"));
                    ItemStatus status = ItemStatus.valueOf(rs.getString("status"));
                    int[] c = counts.computeIfAbsent(phase, p -> new int[ItemStatus.values().length + 2]);
                    c[status.ordinal()] += rs.getInt("cnt");
                    c[ItemStatus.values().length] += rs.getInt("retryable");
                    c[ItemStatus.values().length + 1] += rs.getInt("degraded");
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute progress of execution " + executionId, e);
        }

        Map<PhaseName, PhaseProgress> result = new EnumMap<>(PhaseName.class);
        counts.forEach((phase, c) -> {
            int total = 0;
            for (ItemStatus status : ItemStatus.values()) {
                total += c[status.ordinal()];
            }
            result.put(phase, new PhaseProgress(
                    phase,
                    total,
                    c[ItemStatus.PENDING.ordinal()],
                    c[ItemStatus.QUEUED.ordinal()],
                    c[ItemStatus.PROCESSING.ordinal()],
                    c[ItemStatus.COMPLETED.ordinal()],
                    c[ItemStatus.FAILED.ordinal()],
                    c[ItemStatus.values().length],
                    c[ItemStatus.SKIPPED.ordinal()],
                    c[ItemStatus.values().length + 1]));
        });
        return result;
    }

    @Override
    public int countByStatus(String executionId, PhaseName phase, ItemStatus status) {
        String sql = "SELECT COUNT(*) FROM pipeline_state WHERE execution_id = ? AND phase = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            ps.setString(2, phase.name());
            ps.setString(3, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count items", e);
        }
    }

    @Override
    public Optional<Instant> lastActivity(String executionId, PhaseName phase) {
        String sql = "SELECT MAX(updated_at) FROM pipeline_state WHERE execution_id = ? AND phase = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            ps.setString(2, phase.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(toInstant(rs.getTimestamp(1)));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read last activity of " + phase, e);
        }
    }

    // Helper methods

    private List<ItemState> query(String sql, String errorMessage, Object... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            List<ItemState> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException(errorMessage, e);
        }
    }

    private static void bindKey(PreparedStatement ps, int start, String executionId, PhaseName phase,
            String itemId) throws SQLException {
        ps.setString(start, executionId);
        ps.setString(start + 1, phase.name());
        ps.setString(start + 2, itemId);
    }

    private ItemState mapRow(ResultSet rs) throws SQLException {
        String category = rs.getString("error_category");
        return ItemState.builder()
                .executionId(rs.getString("execution_id"))
                .phase(PhaseName.valueOf(rs.getString("phase")))
                .itemId(rs.getString("item_id"))
                .status(ItemStatus.valueOf(rs.getString("status")))
                .attemptCount(rs.getInt("attempt_count"))
                .maxAttempts(rs.getInt("max_attempts"))
                .degraded(rs.getBoolean("degraded"))
                .lastError(rs.getString("last_error"))
                .errorCategory(category != null ? ErrorCategory.valueOf(category) : null)
                .progressData(rs.getString("progress_data"))
                .lastAttemptAt(toInstant(rs.getTimestamp("last_attempt_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
