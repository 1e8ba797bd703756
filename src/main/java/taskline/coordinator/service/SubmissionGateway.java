package taskline.coordinator.service;

import taskline.coordinator.broker.TaskBroker;
import taskline.coordinator.broker.TaskMessage;
import taskline.coordinator.config.CoordinatorConfig;
import taskline.coordinator.error.BrokerUnavailableException;
import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.error.SubmissionException;
import taskline.coordinator.model.Task;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.repository.PositionLedger;
import taskline.coordinator.repository.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Accepts new units of work.
 * <p>
 * The PENDING record and the pending-set entry are written before the task is
 * published, so a worker can never report on a task the engine does not know.
 * If the broker rejects the publish both are removed again and the caller gets a
 * {@link SubmissionException}.
 */
public class SubmissionGateway {

    private static final Logger log = LoggerFactory.getLogger(SubmissionGateway.class);

    private final StatusStore statusStore;
    private final PositionLedger positionLedger;
    private final TaskBroker broker;
    private final CoordinatorConfig config;

    public SubmissionGateway(StatusStore statusStore, PositionLedger positionLedger, TaskBroker broker,
            CoordinatorConfig config) {
        this.statusStore = statusStore;
        this.positionLedger = positionLedger;
        this.broker = broker;
        this.config = config;
    }

    /**
     * Submit a payload for execution.
     *
     * @return the new task id
     * @throws IllegalArgumentException   if the payload is blank or too large
     * @throws StoreUnavailableException  if the task could not be registered
     * @throws SubmissionException        if the broker did not accept the task
     */
    public String submit(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload is required");
        }
        if (payload.getBytes(StandardCharsets.UTF_8).length > config.maxPayloadBytes()) {
            throw new IllegalArgumentException("payload exceeds " + config.maxPayloadBytes() + " bytes");
        }

        String taskId = generateTaskId();
        Instant enqueuedAt = Instant.now();

        statusStore.create(Task.builder()
                .id(taskId)
                .payload(payload)
                .state(TaskState.PENDING)
                .enqueuedAt(enqueuedAt)
                .build());

        try {
            positionLedger.add(taskId, enqueuedAt);
        } catch (StoreUnavailableException e) {
            discard(taskId);
            throw e;
        }

        try {
            broker.publish(new TaskMessage(taskId, payload, enqueuedAt));
        } catch (BrokerUnavailableException e) {
            log.warn("Broker rejected task {}: {}", taskId, e.getMessage());
            discard(taskId);
            throw new SubmissionException("Broker unavailable, task not submitted", e);
        }

        log.info("Task {} dispatched and added to the pending set", taskId);
        return taskId;
    }

    /**
     * Generate a new task ID (random 128-bit UUID).
     */
    public String generateTaskId() {
        return UUID.randomUUID().toString();
    }

    /**
     * The status record goes first: a ledger entry without a PENDING record is
     * swept by the ledger reconciler, a PENDING record without a message is not.
     */
    private void discard(String taskId) {
        try {
            statusStore.delete(taskId);
        } catch (StoreUnavailableException e) {
            log.error("Could not roll back task {}; record left PENDING without a published message", taskId, e);
        }
        try {
            positionLedger.remove(taskId);
        } catch (StoreUnavailableException e) {
            log.warn("Could not remove task {} from the pending set, the ledger reconciler will drop it", taskId);
        }
    }
}
