package taskline.coordinator.signal;

import taskline.coordinator.model.LifecycleEvent;
import taskline.coordinator.model.TransitionResult;
import taskline.coordinator.repository.PositionLedger;
import taskline.coordinator.repository.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies one lifecycle event to the status store and the position ledger.
 * <p>
 * The ledger entry is dropped first so that once any event for a task has been
 * handled, the task never again reports a queue position. The state transition
 * follows; a terminal event on a task never seen as STARTED collapses straight
 * to the terminal state. Both steps are idempotent, so a redelivered or retried
 * event converges to the same result.
 * <p>
 * Throws {@link taskline.coordinator.error.StoreUnavailableException} when the
 * store cannot be reached; the caller decides whether to retry.
 */
public class LifecycleEventHandler {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventHandler.class);

    private final StatusStore statusStore;
    private final PositionLedger positionLedger;

    public LifecycleEventHandler(StatusStore statusStore, PositionLedger positionLedger) {
        this.statusStore = statusStore;
        this.positionLedger = positionLedger;
    }

    public TransitionResult handle(LifecycleEvent event) {
        String taskId = event.taskId();

        positionLedger.remove(taskId);

        TransitionResult result = statusStore.transition(
                taskId, event.type().targetState(), event.outcome(), event.timestamp());

        switch (result) {
            case APPLIED -> {
                if (event.type().targetState().isTerminal()) {
                    log.info("Task {} finished: {}", taskId, event.type().targetState());
                } else {
                    log.info("Task {} started", taskId);
                }
            }
            case ALREADY_APPLIED -> log.debug("Duplicate {} event for task {} ignored", event.type(), taskId);
            case INVALID_TRANSITION -> log.debug("Out-of-order {} event for task {} absorbed", event.type(), taskId);
            case NOT_FOUND -> log.warn("Dropping {} event for unknown task {}", event.type(), taskId);
        }

        return result;
    }
}
