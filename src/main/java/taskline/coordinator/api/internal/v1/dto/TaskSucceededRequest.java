package taskline.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request DTO for reporting task success.
 * POST /internal/v1/tasks/{taskId}/succeeded
 */
public record TaskSucceededRequest(
        @JsonProperty("result") String result,
        @JsonProperty("occurredAt") Instant occurredAt) {
}
