package taskline.coordinator.model;

import java.util.Arrays;
import java.util.List;

/**
 * Task lifecycle state.
 * Transitions only move forward: PENDING -> STARTED -> SUCCESS | FAILURE.
 * A terminal state may also be reached straight from PENDING when the
 * start signal was never observed.
 */
public enum TaskState {
    /** Submitted, waiting for a worker */
    PENDING(0),
    /** Picked up by a worker */
    STARTED(1),
    /** Finished, result holds the returned value */
    SUCCESS(2),
    /** Finished, result holds the error message */
    FAILURE(2);

    private final int rank;

    TaskState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }

    /** True if moving from this state to {@code target} goes strictly forward. */
    public boolean canTransitionTo(TaskState target) {
        return target.rank > this.rank;
    }

    /** True if {@code target} sits behind this state, e.g. STARTED after SUCCESS. */
    public boolean isBehind(TaskState target) {
        return target.rank < this.rank;
    }

    /** States from which {@code target} may be entered. */
    public static List<TaskState> predecessorsOf(TaskState target) {
        return Arrays.stream(values())
                .filter(s -> s.canTransitionTo(target))
                .toList();
    }
}
