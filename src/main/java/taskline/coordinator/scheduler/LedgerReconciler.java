package taskline.coordinator.scheduler;

import taskline.coordinator.repository.PositionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops pending-set entries whose task is no longer PENDING, or no longer exists.
 * Such entries can only be left behind by a crash between the two writes of a
 * submission rollback.
 */
public class LedgerReconciler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LedgerReconciler.class);

    private final PositionLedger positionLedger;

    public LedgerReconciler(PositionLedger positionLedger) {
        this.positionLedger = positionLedger;
    }

    @Override
    public void run() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Ledger reconciler error", e);
        }
    }

    /**
     * @return number of stale entries removed
     */
    public int reconcile() {
        int removed = positionLedger.removeNotPending();
        if (removed > 0) {
            log.warn("Ledger reconciler removed {} entries for tasks no longer pending", removed);
        }
        return removed;
    }
}
