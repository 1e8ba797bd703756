package taskline.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskline.coordinator.model.TransitionResult;

/**
 * Response for lifecycle event intake.
 * {@code ok} is true when the event was applied or had already been applied.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("error") String error) {

    public static EventResponse from(TransitionResult result) {
        return switch (result) {
            case APPLIED, ALREADY_APPLIED -> new EventResponse(true, result.name(), null);
            case INVALID_TRANSITION -> new EventResponse(true, result.name(), "event absorbed: task already past this state");
            case NOT_FOUND -> new EventResponse(false, result.name(), "task_not_found");
        };
    }
}
