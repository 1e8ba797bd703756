package taskline.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskline.coordinator.model.TaskView;

/**
 * Response DTO for a task status poll.
 * GET /api/v1/tasks/{taskId}
 * <p>
 * Null fields are always written so clients can rely on the shape.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TaskStatusResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("result") String result,
        @JsonProperty("queue_position") Integer queuePosition) {

    public static TaskStatusResponse from(TaskView view) {
        return new TaskStatusResponse(
                view.taskId(),
                view.status().name(),
                view.result(),
                view.queuePosition());
    }
}
