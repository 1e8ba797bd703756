package taskline.coordinator.scheduler;

import taskline.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background maintenance:
 * - DeliveryReaper: redelivers broker messages whose consumer went silent
 * - LedgerReconciler: removes pending-set entries for tasks that left PENDING
 *
 * Uses a single-threaded executor so the two never run concurrently.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final DeliveryReaper deliveryReaper;
    private final LedgerReconciler ledgerReconciler;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(DeliveryReaper deliveryReaper, LedgerReconciler ledgerReconciler, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskline-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.deliveryReaper = deliveryReaper;
        this.ledgerReconciler = ledgerReconciler;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.maintenanceInterval().toMillis();
        executor.scheduleAtFixedRate(deliveryReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(ledgerReconciler, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("Scheduler started, maintenance every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public DeliveryReaper deliveryReaper() {
        return deliveryReaper;
    }

    public LedgerReconciler ledgerReconciler() {
        return ledgerReconciler;
    }
}
