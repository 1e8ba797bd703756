package taskline.coordinator.worker;

import taskline.coordinator.broker.TaskMessage;

import java.time.Duration;

/**
 * Waits for the configured delay and returns the payload unchanged.
 */
public final class EchoTaskExecutor implements TaskExecutor {

    private final Duration delay;

    public EchoTaskExecutor(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be zero or positive");
        }
        this.delay = delay;
    }

    @Override
    public String execute(TaskMessage message) throws InterruptedException {
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
        return message.payload();
    }

    public Duration delay() {
        return delay;
    }
}
