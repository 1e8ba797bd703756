package taskline.coordinator.broker;

import java.time.Instant;

/**
 * Unit of work as carried by the broker. The task id travels with the payload
 * so workers can report lifecycle events against it.
 */
public record TaskMessage(
        String taskId,
        String payload,
        Instant enqueuedAt) {
}
