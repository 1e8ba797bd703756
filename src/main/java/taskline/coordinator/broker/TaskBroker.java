package taskline.coordinator.broker;

import java.time.Instant;
import java.util.Optional;

/**
 * Message transport between the submission gateway and workers.
 * At-least-once: each message is delivered to one consumer at a time, and
 * redelivered if that consumer never acknowledges it.
 * <p>
 * All operations throw {@link taskline.coordinator.error.BrokerUnavailableException}
 * when the broker cannot be reached.
 */
public interface TaskBroker {

    /**
     * Publish a task for execution.
     */
    void publish(TaskMessage message);

    /**
     * Take the oldest available message for a consumer.
     *
     * @param consumerId the consumer claiming the message
     * @return the delivery, or empty if nothing is waiting
     */
    Optional<Delivery> poll(String consumerId);

    /**
     * Acknowledge a processed delivery, removing the message.
     *
     * @return false if the delivery had already expired and moved to another consumer
     */
    boolean ack(Delivery delivery);

    /**
     * Return a delivery to the queue without processing it.
     *
     * @return true if the message was made available again
     */
    boolean release(Delivery delivery);

    /**
     * Make deliveries handed out before {@code deliveredBefore} available again.
     *
     * @return number of messages requeued
     */
    int requeueExpired(Instant deliveredBefore);

    /** Messages waiting or in flight. */
    int depth();
}
