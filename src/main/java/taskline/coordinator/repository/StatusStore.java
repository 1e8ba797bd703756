package taskline.coordinator.repository;

import taskline.coordinator.model.Task;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.model.TransitionResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Canonical per-task lifecycle state and result.
 * Implementations must apply transitions atomically; a transition that would
 * move a task backward or sideways is rejected, never applied.
 */
public interface StatusStore {

    /**
     * Insert the initial record for a freshly submitted task.
     *
     * @param task task in state PENDING
     */
    void create(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task, or empty if no record exists
     */
    Optional<Task> findById(String taskId);

    /**
     * Move a task forward to {@code target}.
     * A terminal target may be entered straight from PENDING.
     *
     * @param taskId     the task ID
     * @param target     the new state
     * @param result     result value or error message for terminal states, ignored otherwise
     * @param occurredAt when the transition was observed
     * @return outcome of the attempt
     */
    TransitionResult transition(String taskId, TaskState target, String result, Instant occurredAt);

    /**
     * Remove a record. Only used to roll back a submission that never reached the broker.
     *
     * @param taskId the task ID
     * @return true if a record was removed
     */
    boolean delete(String taskId);

    /**
     * Count tasks currently in the given state.
     */
    int countByState(TaskState state);
}
