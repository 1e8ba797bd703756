package taskline.coordinator.store;

import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.model.Task;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.model.TransitionResult;
import taskline.coordinator.repository.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of StatusStore.
 * Every transition is a single conditional UPDATE whose WHERE clause lists the
 * allowed predecessor states, so concurrent writers cannot regress a task.
 */
public class JdbcStatusStore implements StatusStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStatusStore.class);

    private final Database db;

    public JdbcStatusStore(Database db) {
        this.db = db;
    }

    @Override
    public void create(Task task) {
        String sql = """
                    INSERT INTO tasks (id, payload, state, result, enqueued_at, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.payload());
            ps.setString(3, task.state().name());
            ps.setString(4, task.result());
            setTimestamp(ps, 5, task.enqueuedAt());
            setTimestamp(ps, 6, task.startedAt());
            setTimestamp(ps, 7, task.finishedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public TransitionResult transition(String taskId, TaskState target, String result, Instant occurredAt) {
        List<TaskState> allowedFrom = TaskState.predecessorsOf(target);
        if (allowedFrom.isEmpty()) {
            log.warn("Rejected transition of task {} to {}: no state may precede it", taskId, target);
            return TransitionResult.INVALID_TRANSITION;
        }

        String placeholders = allowedFrom.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = target.isTerminal()
                ? """
                    UPDATE tasks
                    SET state = ?, result = ?, started_at = COALESCE(started_at, ?), finished_at = ?
                    WHERE id = ? AND state IN (%s)
                """.formatted(placeholders)
                : """
                    UPDATE tasks
                    SET state = ?, started_at = ?
                    WHERE id = ? AND state IN (%s)
                """.formatted(placeholders);

        Timestamp at = Timestamp.from(occurredAt != null ? occurredAt : Instant.now());

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, target.name());
            if (target.isTerminal()) {
                ps.setString(i++, result);
                ps.setTimestamp(i++, at);
                ps.setTimestamp(i++, at);
            } else {
                ps.setTimestamp(i++, at);
            }
            ps.setString(i++, taskId);
            for (TaskState from : allowedFrom) {
                ps.setString(i++, from.name());
            }

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} moved to {}", taskId, target);
                return TransitionResult.APPLIED;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to move task " + taskId + " to " + target, e);
        }

        // Nothing matched: classify against the current record
        Optional<Task> current = findById(taskId);
        if (current.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }

        TaskState state = current.get().state();
        if (state == target) {
            log.debug("Task {} already {}", taskId, target);
            return TransitionResult.ALREADY_APPLIED;
        }
        if (state.isBehind(target)) {
            log.info("Ignored stale transition of task {} from {} back to {}", taskId, state, target);
        } else {
            log.warn("Rejected transition of task {} from {} to {}", taskId, state, target);
        }
        return TransitionResult.INVALID_TRANSITION;
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public int countByState(TaskState state) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE state = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, state.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count tasks in state " + state, e);
        }
    }

    // Helper methods

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .payload(rs.getString("payload"))
                .state(TaskState.valueOf(rs.getString("state")))
                .result(rs.getString("result"))
                .enqueuedAt(toInstant(rs.getTimestamp("enqueued_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
