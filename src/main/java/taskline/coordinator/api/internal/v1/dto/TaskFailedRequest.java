package taskline.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request DTO for reporting task failure.
 * POST /internal/v1/tasks/{taskId}/failed
 */
public record TaskFailedRequest(
        @JsonProperty("error") String error,
        @JsonProperty("occurredAt") Instant occurredAt) {

    public void validate() {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
    }
}
