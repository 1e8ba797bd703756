package taskline.coordinator.model;

/**
 * Merged view served to polling clients: canonical state from the status
 * store plus the queue position derived from the ledger.
 *
 * @param taskId        task identifier
 * @param status        current state
 * @param result        result or error message once terminal, otherwise null
 * @param queuePosition zero-based count of pending tasks ahead, only while PENDING
 */
public record TaskView(
        String taskId,
        TaskState status,
        String result,
        Integer queuePosition) {

    public static TaskView pending(Task task, Integer queuePosition) {
        return new TaskView(task.id(), task.state(), null, queuePosition);
    }

    public static TaskView of(Task task) {
        return new TaskView(task.id(), task.state(), task.isTerminal() ? task.result() : null, null);
    }
}
