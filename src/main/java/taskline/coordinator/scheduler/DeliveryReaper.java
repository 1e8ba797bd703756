package taskline.coordinator.scheduler;

import taskline.coordinator.broker.TaskBroker;
import taskline.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Background task that puts stuck deliveries back on the queue.
 *
 * Deliveries get stuck if:
 * - A worker crashes while processing
 * - A worker process is killed before it acks
 *
 * Any delivery not acked within the visibility timeout becomes READY again and
 * is handed to the next polling worker. Duplicate lifecycle events caused by the
 * redelivery are absorbed by the signal handler.
 */
public class DeliveryReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DeliveryReaper.class);

    private final TaskBroker broker;
    private final CoordinatorConfig config;

    public DeliveryReaper(TaskBroker broker, CoordinatorConfig config) {
        this.broker = broker;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapExpiredDeliveries();
        } catch (Exception e) {
            log.error("Delivery reaper error", e);
        }
    }

    /**
     * @return number of deliveries returned to the queue
     */
    public int reapExpiredDeliveries() {
        Instant cutoff = Instant.now().minus(config.brokerVisibilityTimeout());
        int requeued = broker.requeueExpired(cutoff);
        if (requeued == 0) {
            log.debug("No expired deliveries found");
        } else {
            log.info("Delivery reaper: {} deliveries returned to the queue", requeued);
        }
        return requeued;
    }
}
