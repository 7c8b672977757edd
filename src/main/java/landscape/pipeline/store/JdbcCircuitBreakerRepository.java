package landscape.pipeline.store;

import landscape.pipeline.model.CircuitBreakerState;
import landscape.pipeline.model.CircuitState;
import landscape.pipeline.repository.CircuitBreakerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static landscape.pipeline.store.JdbcSupport.setTimestamp;
import static landscape.pipeline.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of CircuitBreakerRepository.
 * Every state change is a read-modify-write under a row lock, so concurrent
 * callers in any process see one consistent breaker.
 */
public class JdbcCircuitBreakerRepository implements CircuitBreakerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCircuitBreakerRepository.class);

    private static final String DUPLICATE_KEY = "23505";

    private final Database db;

    public JdbcCircuitBreakerRepository(Database db) {
        this.db = db;
    }

    @Override
    public <T> T update(CircuitBreakerState initial, Function<CircuitBreakerState, Mutation<T>> mutation) {
        ensureExists(initial);

        String selectSql = "SELECT * FROM circuit_breakers WHERE name = ? FOR UPDATE";
        String updateSql = """
                    UPDATE circuit_breakers
                    SET state = ?, failure_count = ?, success_count = ?, failure_threshold = ?, success_threshold = ?,
                        timeout_ms = ?, half_open_max_calls = ?, half_open_in_flight = ?, last_failure_at = ?,
                        last_success_at = ?, opened_at = ?, total_requests = ?, total_failures = ?,
                        total_successes = ?, updated_at = ?
                    WHERE name = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                CircuitBreakerState current;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, initial.name());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new IllegalStateException("Circuit breaker vanished: " + initial.name());
                        }
                        current = mapRow(rs);
                    }
                }

                Mutation<T> result = mutation.apply(current);
                CircuitBreakerState next = result.next();

                if (next != current) {
                    try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                        ps.setString(1, next.state().name());
                        ps.setInt(2, next.failureCount());
                        ps.setInt(3, next.successCount());
                        ps.setInt(4, next.failureThreshold());
                        ps.setInt(5, next.successThreshold());
                        ps.setLong(6, next.timeout().toMillis());
                        ps.setInt(7, next.halfOpenMaxCalls());
                        ps.setInt(8, next.halfOpenInFlight());
                        setTimestamp(ps, 9, next.lastFailureAt());
                        setTimestamp(ps, 10, next.lastSuccessAt());
                        setTimestamp(ps, 11, next.openedAt());
                        ps.setLong(12, next.totalRequests());
                        ps.setLong(13, next.totalFailures());
                        ps.setLong(14, next.totalSuccesses());
                        ps.setTimestamp(15, Timestamp.from(Instant.now()));
                        ps.setString(16, next.name());
                        ps.executeUpdate();
                    }
                    if (next.state() != current.state()) {
                        log.info("Circuit breaker {} {} -> {}", next.name(), current.state(), next.state());
                    }
                }

                conn.commit();
                return result.result();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update circuit breaker: " + initial.name(), e);
        }
    }

    private void ensureExists(CircuitBreakerState initial) {
        String existsSql = "SELECT 1 FROM circuit_breakers WHERE name = ?";
        String insertSql = """
                    INSERT INTO circuit_breakers (name, state, failure_count, success_count, failure_threshold,
                                                  success_threshold, timeout_ms, half_open_max_calls,
                                                  half_open_in_flight, updated_at)
                    VALUES (?, ?, 0, 0, ?, ?, ?, ?, 0, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(existsSql)) {
                ps.setString(1, initial.name());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        conn.commit();
                        return;
                    }
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, initial.name());
                ps.setString(2, CircuitState.CLOSED.name());
                ps.setInt(3, initial.failureThreshold());
                ps.setInt(4, initial.successThreshold());
                ps.setLong(5, initial.timeout().toMillis());
                ps.setInt(6, initial.halfOpenMaxCalls());
                ps.setTimestamp(7, Timestamp.from(Instant.now()));
                ps.executeUpdate();
                conn.commit();
                log.debug("Circuit breaker {} created", initial.name());
            } catch (SQLException e) {
                conn.rollback();
                if (!DUPLICATE_KEY.equals(e.getSQLState())) {
                    throw e;
                }
                log.debug("Circuit breaker {} created concurrently", initial.name());
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create circuit breaker: " + initial.name(), e);
        }
    }

    @Override
    public Optional<CircuitBreakerState> find(String name) {
        String sql = "SELECT * FROM circuit_breakers WHERE name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find circuit breaker: " + name, e);
        }
    }

    @Override
    public List<CircuitBreakerState> findAll() {
        String sql = "SELECT * FROM circuit_breakers ORDER BY name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<CircuitBreakerState> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list circuit breakers", e);
        }
    }

    private CircuitBreakerState mapRow(ResultSet rs) throws SQLException {
        return CircuitBreakerState.builder()
                .name(rs.getString("name"))
                .state(CircuitState.valueOf(rs.getString("state")))
                .failureCount(rs.getInt("failure_count"))
                .successCount(rs.getInt("success_count"))
                .failureThreshold(rs.getInt("failure_threshold"))
                .successThreshold(rs.getInt("success_threshold"))
                .timeout(Duration.ofMillis(rs.getLong("timeout_ms")))
                .halfOpenMaxCalls(rs.getInt("half_open_max_calls"))
                .halfOpenInFlight(rs.getInt("half_open_in_flight"))
                .lastFailureAt(toInstant(rs.getTimestamp("last_failure_at")))
                .lastSuccessAt(toInstant(rs.getTimestamp("last_success_at")))
                .openedAt(toInstant(rs.getTimestamp("opened_at")))
                .totalRequests(rs.getLong("total_requests"))
                .totalFailures(rs.getLong("total_failures"))
                .totalSuccesses(rs.getLong("total_successes"))
                .build();
    }
}
