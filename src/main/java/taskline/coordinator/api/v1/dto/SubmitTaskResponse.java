package taskline.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for an accepted submission.
 */
public record SubmitTaskResponse(
        @JsonProperty("message") String message,
        @JsonProperty("task_id") String taskId) {

    public static SubmitTaskResponse dispatched(String taskId) {
        return new SubmitTaskResponse("Task dispatched successfully", taskId);
    }
}
