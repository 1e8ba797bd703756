package taskline.coordinator.repository;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Membership of the pending set, ordered by enqueue time.
 * <p>
 * Positions are computed on read from current membership; nothing is kept as a
 * per-task counter. Insert and remove are single atomic operations keyed by task id
 * so concurrent submitters and workers never lose updates.
 * <p>
 * The ledger is derived data. It is never authoritative for task state.
 */
public interface PositionLedger {

    /**
     * Append a task to the pending set.
     *
     * @return true if added, false if the task was already present
     */
    boolean add(String taskId, Instant enqueuedAt);

    /**
     * Remove a task from the pending set if present.
     *
     * @return true if an entry was removed
     */
    boolean remove(String taskId);

    /**
     * Zero-based number of pending tasks queued strictly ahead of this one.
     *
     * @return the position, or empty if the task is not pending
     */
    OptionalInt positionOf(String taskId);

    boolean contains(String taskId);

    /** Number of pending tasks. */
    int size();

    /**
     * Drop entries whose task is no longer PENDING (or no longer exists).
     *
     * @return number of entries removed
     */
    int removeNotPending();
}
