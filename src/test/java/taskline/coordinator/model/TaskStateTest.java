package taskline.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void forwardTransitionsAllowed() {
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.STARTED));
        assertTrue(TaskState.STARTED.canTransitionTo(TaskState.SUCCESS));
        assertTrue(TaskState.STARTED.canTransitionTo(TaskState.FAILURE));
        // collapse when the start signal was missed
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.SUCCESS));
    }

    @Test
    void backwardAndLateralTransitionsRejected() {
        assertFalse(TaskState.SUCCESS.canTransitionTo(TaskState.STARTED));
        assertFalse(TaskState.STARTED.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.SUCCESS.canTransitionTo(TaskState.FAILURE));
        assertFalse(TaskState.FAILURE.canTransitionTo(TaskState.SUCCESS));
        assertFalse(TaskState.STARTED.canTransitionTo(TaskState.STARTED));
    }

    @Test
    void predecessors() {
        assertEquals(List.of(), TaskState.predecessorsOf(TaskState.PENDING));
        assertEquals(List.of(TaskState.PENDING), TaskState.predecessorsOf(TaskState.STARTED));
        assertEquals(List.of(TaskState.PENDING, TaskState.STARTED), TaskState.predecessorsOf(TaskState.SUCCESS));
        assertEquals(List.of(TaskState.PENDING, TaskState.STARTED), TaskState.predecessorsOf(TaskState.FAILURE));
    }

    @Test
    void isBehindDistinguishesStaleFromLateral() {
        assertTrue(TaskState.SUCCESS.isBehind(TaskState.STARTED));
        assertFalse(TaskState.SUCCESS.isBehind(TaskState.FAILURE));
        assertTrue(TaskState.SUCCESS.isTerminal());
        assertFalse(TaskState.STARTED.isTerminal());
    }
}
