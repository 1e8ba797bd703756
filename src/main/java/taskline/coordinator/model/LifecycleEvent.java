package taskline.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A fact emitted when a worker moves a task through its lifecycle.
 * Events may arrive more than once and out of order.
 *
 * @param taskId    task the event refers to
 * @param type      started, succeeded or failed
 * @param result    returned value, only for SUCCEEDED
 * @param error     error message, only for FAILED
 * @param timestamp when the worker observed the transition
 */
public record LifecycleEvent(
        String taskId,
        LifecycleEventType type,
        String result,
        String error,
        Instant timestamp) {

    public LifecycleEvent {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        Objects.requireNonNull(type, "type is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static LifecycleEvent started(String taskId) {
        return new LifecycleEvent(taskId, LifecycleEventType.STARTED, null, null, Instant.now());
    }

    public static LifecycleEvent succeeded(String taskId, String result) {
        return new LifecycleEvent(taskId, LifecycleEventType.SUCCEEDED, result, null, Instant.now());
    }

    public static LifecycleEvent failed(String taskId, String error) {
        return new LifecycleEvent(taskId, LifecycleEventType.FAILED, null, error, Instant.now());
    }

    /** Value written to the task's result column when this event is applied. */
    public String outcome() {
        return switch (type) {
            case STARTED -> null;
            case SUCCEEDED -> result;
            case FAILED -> error;
        };
    }
}
