package taskline.coordinator.store;

import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.repository.PositionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.OptionalInt;

/**
 * JDBC implementation of PositionLedger backed by the {@code pending_tasks} table.
 * <p>
 * Add is a single INSERT guarded by a unique key on task_id; remove is a single
 * DELETE. A position is one SELECT that counts the entries ordered before the
 * task's own (enqueued_at, enqueue_seq) key, so every read sees one consistent
 * membership snapshot.
 */
public class JdbcPositionLedger implements PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcPositionLedger.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcPositionLedger(Database db) {
        this.db = db;
    }

    @Override
    public boolean add(String taskId, Instant enqueuedAt) {
        String sql = "INSERT INTO pending_tasks (task_id, enqueued_at) VALUES (?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, taskId);
                ps.setTimestamp(2, Timestamp.from(enqueuedAt));
                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    log.debug("Task {} already in pending set", taskId);
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to add task to pending set: " + taskId, e);
        }
    }

    @Override
    public boolean remove(String taskId) {
        String sql = "DELETE FROM pending_tasks WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int removed = ps.executeUpdate();
            conn.commit();

            if (removed > 0) {
                log.debug("Task {} left the pending set", taskId);
            }
            return removed > 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to remove task from pending set: " + taskId, e);
        }
    }

    @Override
    public OptionalInt positionOf(String taskId) {
        String sql = """
                    SELECT (
                        SELECT COUNT(*) FROM pending_tasks o
                        WHERE o.enqueued_at < p.enqueued_at
                           OR (o.enqueued_at = p.enqueued_at AND o.enqueue_seq < p.enqueue_seq)
                    ) AS ahead
                    FROM pending_tasks p
                    WHERE p.task_id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return OptionalInt.of(rs.getInt("ahead"));
                }
            }
            return OptionalInt.empty();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to compute position of task: " + taskId, e);
        }
    }

    @Override
    public boolean contains(String taskId) {
        String sql = "SELECT 1 FROM pending_tasks WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to look up pending task: " + taskId, e);
        }
    }

    @Override
    public int size() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM pending_tasks")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count pending tasks", e);
        }
    }

    @Override
    public int removeNotPending() {
        String sql = """
                    DELETE FROM pending_tasks p
                    WHERE NOT EXISTS (
                        SELECT 1 FROM tasks t WHERE t.id = p.task_id AND t.state = 'PENDING'
                    )
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int removed = ps.executeUpdate();
            conn.commit();

            if (removed > 0) {
                log.info("Removed {} stale entries from the pending set", removed);
            }
            return removed;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to reconcile pending set", e);
        }
    }
}
