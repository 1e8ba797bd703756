package taskline.coordinator.error;

/**
 * No status record exists for the requested task id.
 */
public class TaskNotFoundException extends TasklineException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
