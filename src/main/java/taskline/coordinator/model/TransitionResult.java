package taskline.coordinator.model;

/**
 * Outcome of a state transition attempt against the status store.
 */
public enum TransitionResult {
    /** The transition was applied */
    APPLIED,

    /** The task was already in (or past) the requested state - idempotent no-op */
    ALREADY_APPLIED,

    /** Backward or lateral move, rejected and not applied */
    INVALID_TRANSITION,

    /** No record for the task id */
    NOT_FOUND
}
