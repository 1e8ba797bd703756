package taskline.coordinator.service;

import taskline.coordinator.error.TaskNotFoundException;
import taskline.coordinator.model.Task;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.model.TaskView;
import taskline.coordinator.repository.PositionLedger;
import taskline.coordinator.repository.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Serves the merged task view: state and result from the status store, queue
 * position from the ledger while the task is still pending.
 */
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final StatusStore statusStore;
    private final PositionLedger positionLedger;

    public QueryService(StatusStore statusStore, PositionLedger positionLedger) {
        this.statusStore = statusStore;
        this.positionLedger = positionLedger;
    }

    /**
     * @throws TaskNotFoundException if no record exists for the id
     */
    public TaskView query(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }

        Task task = statusStore.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        if (!task.isPending()) {
            return TaskView.of(task);
        }

        OptionalInt position = positionLedger.positionOf(taskId);
        if (position.isPresent()) {
            log.debug("Task {} is PENDING at position {}", taskId, position.getAsInt());
            return TaskView.pending(task, position.getAsInt());
        }

        // Left the pending set between the two reads: report the fresher state
        Task fresh = statusStore.findById(taskId).orElse(task);
        log.debug("Task {} left the pending set while being queried, now {}", taskId, fresh.state());
        return fresh.state() == TaskState.PENDING ? TaskView.pending(fresh, null) : TaskView.of(fresh);
    }

    /** Number of tasks waiting for a worker. */
    public int pendingCount() {
        return positionLedger.size();
    }

    /** Number of tasks currently being executed. */
    public int startedCount() {
        return statusStore.countByState(TaskState.STARTED);
    }
}
