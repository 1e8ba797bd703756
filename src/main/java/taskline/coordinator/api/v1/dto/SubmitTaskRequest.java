package taskline.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 */
public record SubmitTaskRequest(
        @JsonProperty("text") @JsonAlias("payload") String text) {

    public void validate() {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
    }
}
