package taskline.coordinator.worker;

import taskline.coordinator.broker.Delivery;
import taskline.coordinator.broker.TaskBroker;
import taskline.coordinator.error.BrokerUnavailableException;
import taskline.coordinator.model.LifecycleEvent;
import taskline.coordinator.signal.LifecycleSignalBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * A single in-process worker.
 * Loops: poll → emit started → execute → apply succeeded/failed → ack.
 * The terminal event is applied on the worker thread before the ack, so a
 * delivery is only removed from the broker once its outcome is stored.
 * Stops cleanly on Thread.interrupt(); a delivery in flight is released back to
 * the broker.
 */
public final class TaskWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private static final long ERROR_BACKOFF_MS = 1000;

    private final String workerId;
    private final TaskBroker broker;
    private final LifecycleSignalBus signalBus;
    private final TaskExecutor executor;
    private final Duration pollInterval;

    public TaskWorker(String workerId,
            TaskBroker broker,
            LifecycleSignalBus signalBus,
            TaskExecutor executor,
            Duration pollInterval) {
        this.workerId = workerId;
        this.broker = broker;
        this.signalBus = signalBus;
        this.executor = executor;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        log.info("Worker {} started", workerId);

        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (!processNext()) {
                    Thread.sleep(pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.warn("Worker {} error: {}", workerId, e.getMessage());
                try {
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Worker {} stopped", workerId);
    }

    /**
     * Take at most one task from the broker and run it to completion.
     *
     * @return false if the queue was empty
     */
    public boolean processNext() throws InterruptedException {
        Optional<Delivery> polled = broker.poll(workerId);
        if (polled.isEmpty()) {
            return false;
        }

        Delivery delivery = polled.get();
        String taskId = delivery.taskId();
        signalBus.started(taskId);

        String result;
        try {
            result = executor.execute(delivery.message());
        } catch (InterruptedException e) {
            log.info("Worker {} interrupted while running task {}, releasing it", workerId, taskId);
            releaseQuietly(delivery);
            throw e;
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Worker {} failed task {}: {}", workerId, taskId, error);
            finish(delivery, LifecycleEvent.failed(taskId, error));
            return true;
        }

        finish(delivery, LifecycleEvent.succeeded(taskId, result));
        log.debug("Worker {} completed task {}", workerId, taskId);
        return true;
    }

    public String workerId() {
        return workerId;
    }

    private void finish(Delivery delivery, LifecycleEvent outcome) throws InterruptedException {
        try {
            signalBus.applyWithRetry(outcome);
        } catch (InterruptedException e) {
            log.info("Worker {} interrupted before storing the outcome of task {}, releasing it",
                    workerId, delivery.taskId());
            releaseQuietly(delivery);
            throw e;
        }
        broker.ack(delivery);
    }

    private void releaseQuietly(Delivery delivery) {
        try {
            broker.release(delivery);
        } catch (BrokerUnavailableException e) {
            log.warn("Worker {} could not release task {}, it will be redelivered after the visibility timeout",
                    workerId, delivery.taskId());
        }
    }
}
