package taskline.coordinator.model;

/**
 * Kind of lifecycle signal a worker emits.
 */
public enum LifecycleEventType {
    STARTED(TaskState.STARTED),
    SUCCEEDED(TaskState.SUCCESS),
    FAILED(TaskState.FAILURE);

    private final TaskState targetState;

    LifecycleEventType(TaskState targetState) {
        this.targetState = targetState;
    }

    /** State the task moves to when this event is applied. */
    public TaskState targetState() {
        return targetState;
    }
}
