package taskline.coordinator.signal;

import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.model.LifecycleEvent;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.model.TransitionResult;
import taskline.coordinator.repository.PositionLedger;
import taskline.coordinator.repository.StatusStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LifecycleSignalBusTest {

    @Mock
    private StatusStore statusStore;

    @Mock
    private PositionLedger positionLedger;

    private LifecycleSignalBus bus;

    @BeforeEach
    void setUp() {
        LifecycleEventHandler handler = new LifecycleEventHandler(statusStore, positionLedger);
        bus = new LifecycleSignalBus(handler,
                new ExponentialBackoff(Duration.ofMillis(5), 2.0, Duration.ofMillis(20), false));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void emitAppliesEventOnDispatcherThread() throws Exception {
        when(statusStore.transition(eq("t1"), eq(TaskState.STARTED), any(), any()))
                .thenReturn(TransitionResult.APPLIED);
        List<TransitionResult> seen = new CopyOnWriteArrayList<>();
        bus.subscribe((event, result) -> seen.add(result));
        bus.start();

        bus.started("t1");

        assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(List.of(TransitionResult.APPLIED), seen);
        verify(positionLedger).remove("t1");
    }

    @Test
    void storeOutageIsRetriedUntilApplied() throws Exception {
        StoreUnavailableException outage = new StoreUnavailableException("down", new SQLException("down"));
        when(statusStore.transition(eq("t1"), eq(TaskState.SUCCESS), eq("hi"), any()))
                .thenThrow(outage)
                .thenThrow(outage)
                .thenReturn(TransitionResult.APPLIED);
        bus.start();

        bus.emit(LifecycleEvent.succeeded("t1", "hi"));

        assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));
        verify(statusStore, times(3)).transition(eq("t1"), eq(TaskState.SUCCESS), eq("hi"), any());
        assertEquals(0, bus.backlog());
    }

    @Test
    void emitRequiresRunningBus() {
        assertThrows(IllegalStateException.class, () -> bus.started("t1"));
    }

    @Test
    void emitAfterCloseIsRejectedAndLeavesNoBacklog() {
        bus.start();
        bus.close();

        assertThrows(IllegalStateException.class, () -> bus.started("t1"));
        assertEquals(0, bus.backlog());
    }

    @Test
    void applyWithRetryBlocksCallerUntilStoreRecovers() throws Exception {
        StoreUnavailableException outage = new StoreUnavailableException("down", new SQLException("down"));
        when(statusStore.transition(eq("t1"), eq(TaskState.SUCCESS), eq("hi"), any()))
                .thenThrow(outage)
                .thenThrow(outage)
                .thenReturn(TransitionResult.APPLIED);

        assertEquals(TransitionResult.APPLIED, bus.applyWithRetry(LifecycleEvent.succeeded("t1", "hi")));
        verify(statusStore, times(3)).transition(eq("t1"), eq(TaskState.SUCCESS), eq("hi"), any());
    }

    @Test
    void applyWithRetryStopsOnInterrupt() {
        when(statusStore.transition(any(), any(), any(), any()))
                .thenThrow(new StoreUnavailableException("down", new SQLException("down")));

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class,
                    () -> bus.applyWithRetry(LifecycleEvent.succeeded("t1", "hi")));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void applyNowReturnsOutcomeAndNotifiesListeners() {
        when(statusStore.transition(eq("t1"), eq(TaskState.FAILURE), eq("boom"), any()))
                .thenReturn(TransitionResult.APPLIED);
        List<LifecycleEvent> seen = new CopyOnWriteArrayList<>();
        LifecycleSignalBus.Subscription subscription = bus.subscribe((event, result) -> seen.add(event));

        assertEquals(TransitionResult.APPLIED, bus.applyNow(LifecycleEvent.failed("t1", "boom")));
        assertEquals(1, seen.size());

        subscription.unsubscribe();
        bus.applyNow(LifecycleEvent.failed("t1", "boom"));
        assertEquals(1, seen.size());
    }

    @Test
    void closeDrainsQueuedEvents() {
        when(statusStore.transition(any(), any(), any(), any())).thenReturn(TransitionResult.APPLIED);
        bus.start();

        for (int i = 0; i < 20; i++) {
            bus.started("t" + i);
        }
        bus.close();

        assertFalse(bus.isRunning());
        assertEquals(0, bus.backlog());
        verify(statusStore, times(20)).transition(any(), eq(TaskState.STARTED), any(), any());
    }
}
