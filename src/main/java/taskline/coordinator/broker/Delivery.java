package taskline.coordinator.broker;

/**
 * A message handed to one consumer. Must be acked once processed, or released
 * to make it available again.
 *
 * @param seq        broker-assigned sequence number
 * @param message    the task message
 * @param consumerId consumer holding the delivery
 * @param attempt    1 on first delivery, higher on redelivery
 */
public record Delivery(
        long seq,
        TaskMessage message,
        String consumerId,
        int attempt) {

    public String taskId() {
        return message.taskId();
    }

    public boolean isRedelivery() {
        return attempt > 1;
    }
}
