package taskline.coordinator.signal;

import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.model.LifecycleEvent;
import taskline.coordinator.model.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event channel between workers and the ledger/status store.
 * <p>
 * Workers {@link #emit} events and return immediately; a dedicated dispatcher
 * thread applies them one at a time through the {@link LifecycleEventHandler}.
 * When the store is unavailable the event is retried with exponential backoff
 * until it applies or the bus is closed. Events left in the queue on close are
 * drained before the dispatcher exits.
 */
public class LifecycleSignalBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleSignalBus.class);

    private static final long POLL_MS = 200;

    private final LifecycleEventHandler handler;
    private final ExponentialBackoff backoff;
    private final BlockingQueue<LifecycleEvent> queue = new LinkedBlockingQueue<>();
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger unprocessed = new AtomicInteger();

    private final Object intake = new Object();

    private volatile boolean running = false;
    private Thread dispatcher;

    public LifecycleSignalBus(LifecycleEventHandler handler, ExponentialBackoff backoff) {
        this.handler = handler;
        this.backoff = backoff;
    }

    /**
     * Start the dispatcher thread.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Signal bus already running");
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "taskline-signals");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Lifecycle signal bus started");
    }

    /**
     * Queue an event for application. Never blocks on the store.
     */
    public void emit(LifecycleEvent event) {
        synchronized (intake) {
            if (!running) {
                throw new IllegalStateException("Signal bus is not running");
            }
            unprocessed.incrementAndGet();
            queue.add(event);
        }
        log.debug("Queued {} event for task {}", event.type(), event.taskId());
    }

    public void started(String taskId) {
        emit(LifecycleEvent.started(taskId));
    }

    /**
     * Apply an event on the calling thread, bypassing the queue.
     * Store failures propagate to the caller.
     */
    public TransitionResult applyNow(LifecycleEvent event) {
        TransitionResult result = handler.handle(event);
        notifyListeners(event, result);
        return result;
    }

    /**
     * Apply an event on the calling thread, retrying with backoff while the
     * store is unavailable. Returns only once the event has been applied.
     *
     * @throws InterruptedException if interrupted before the event could be applied
     */
    public TransitionResult applyWithRetry(LifecycleEvent event) throws InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                return applyNow(event);
            } catch (StoreUnavailableException e) {
                Duration delay = backoff.delayFor(attempt++);
                log.warn("Store unavailable applying {} for task {} (attempt {}), retrying in {}ms: {}",
                        event.type(), event.taskId(), attempt, delay.toMillis(), e.getMessage());
                Thread.sleep(delay.toMillis());
            }
        }
    }

    /**
     * Register a listener invoked after each event is applied.
     */
    public Subscription subscribe(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Number of emitted events not yet applied. */
    public int backlog() {
        return unprocessed.get();
    }

    /**
     * Wait until every emitted event has been applied.
     *
     * @return true if the backlog drained within the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (unprocessed.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    private void dispatchLoop() {
        while (running || !queue.isEmpty()) {
            LifecycleEvent event;
            try {
                event = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                continue;
            }
            try {
                if (!dispatch(event)) {
                    break;
                }
            } finally {
                unprocessed.decrementAndGet();
            }
        }

        int lost = queue.size();
        if (lost > 0) {
            log.error("Signal bus stopped with {} unapplied events", lost);
        }
        log.info("Lifecycle signal bus stopped");
    }

    /**
     * @return false if interrupted before the event could be applied
     */
    private boolean dispatch(LifecycleEvent event) {
        try {
            applyWithRetry(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted before applying {} for task {}", event.type(), event.taskId());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to apply {} event for task {}", event.type(), event.taskId(), e);
        }
        return true;
    }

    private void notifyListeners(LifecycleEvent event, TransitionResult result) {
        for (Listener listener : listeners) {
            try {
                listener.onApplied(event, result);
            } catch (Exception e) {
                log.warn("Listener threw processing {} for task {}: {}",
                        event.type(), event.taskId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Stop accepting events, drain the queue and stop the dispatcher.
     */
    @Override
    public synchronized void close() {
        synchronized (intake) {
            if (!running) {
                return;
            }
            running = false;
        }
        try {
            dispatcher.join(TimeUnit.SECONDS.toMillis(10));
            if (dispatcher.isAlive()) {
                dispatcher.interrupt();
                log.warn("Signal bus dispatcher forcefully stopped");
            }
        } catch (InterruptedException e) {
            dispatcher.interrupt();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Callback after an event has been applied.
     */
    @FunctionalInterface
    public interface Listener {
        void onApplied(LifecycleEvent event, TransitionResult result);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
