package taskline.coordinator.broker;

import taskline.coordinator.error.BrokerUnavailableException;
import taskline.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.Optional;

/**
 * Broker backed by a {@code broker_messages} table.
 * Consumers compete for the oldest READY row with SELECT ... FOR UPDATE and a
 * conditional update, so a message is held by exactly one consumer at a time.
 */
public class JdbcTaskBroker implements TaskBroker {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskBroker.class);

    private static final int CLAIM_ATTEMPTS = 3;

    private final Database db;
    private final String queue;

    public JdbcTaskBroker(Database db, String queue) {
        this.db = db;
        this.queue = queue;
    }

    @Override
    public void publish(TaskMessage message) {
        String sql = """
                    INSERT INTO broker_messages (queue, task_id, payload, enqueued_at, status, deliveries)
                    VALUES (?, ?, ?, ?, 'READY', 0)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue);
            ps.setString(2, message.taskId());
            ps.setString(3, message.payload());
            ps.setTimestamp(4, Timestamp.from(message.enqueuedAt()));
            ps.executeUpdate();
            conn.commit();

            log.debug("Published task {} to queue {}", message.taskId(), queue);
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to publish task: " + message.taskId(), e);
        }
    }

    @Override
    public Optional<Delivery> poll(String consumerId) {
        String selectSql = """
                    SELECT seq, task_id, payload, enqueued_at, deliveries FROM broker_messages
                    WHERE queue = ? AND status = 'READY'
                    ORDER BY seq
                    LIMIT 1
                    FOR UPDATE
                """;

        String claimSql = """
                    UPDATE broker_messages
                    SET status = 'DELIVERED', consumer = ?, delivered_at = ?, deliveries = deliveries + 1
                    WHERE seq = ? AND status = 'READY'
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement claimPs = conn.prepareStatement(claimSql)) {

                // A competing consumer may take the row between select and update
                for (int attempt = 0; attempt < CLAIM_ATTEMPTS; attempt++) {
                    selectPs.setString(1, queue);

                    long seq;
                    TaskMessage message;
                    int deliveries;
                    try (ResultSet rs = selectPs.executeQuery()) {
                        if (!rs.next()) {
                            conn.commit();
                            return Optional.empty();
                        }
                        seq = rs.getLong("seq");
                        message = new TaskMessage(
                                rs.getString("task_id"),
                                rs.getString("payload"),
                                rs.getTimestamp("enqueued_at").toInstant());
                        deliveries = rs.getInt("deliveries");
                    }

                    claimPs.setString(1, consumerId);
                    claimPs.setTimestamp(2, Timestamp.from(Instant.now()));
                    claimPs.setLong(3, seq);
                    int claimed = claimPs.executeUpdate();
                    conn.commit();

                    if (claimed > 0) {
                        Delivery delivery = new Delivery(seq, message, consumerId, deliveries + 1);
                        if (delivery.isRedelivery()) {
                            log.info("Redelivering task {} to {} (attempt {})",
                                    message.taskId(), consumerId, delivery.attempt());
                        } else {
                            log.debug("Delivered task {} to {}", message.taskId(), consumerId);
                        }
                        return Optional.of(delivery);
                    }
                }
                return Optional.empty();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to poll queue " + queue + " for " + consumerId, e);
        }
    }

    @Override
    public boolean ack(Delivery delivery) {
        String sql = "DELETE FROM broker_messages WHERE seq = ? AND consumer = ? AND status = 'DELIVERED'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, delivery.seq());
            ps.setString(2, delivery.consumerId());
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted == 0) {
                log.debug("Ack for task {} by {} found no live delivery", delivery.taskId(), delivery.consumerId());
            }
            return deleted > 0;
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to ack task: " + delivery.taskId(), e);
        }
    }

    @Override
    public boolean release(Delivery delivery) {
        String sql = """
                    UPDATE broker_messages
                    SET status = 'READY', consumer = NULL, delivered_at = NULL
                    WHERE seq = ? AND consumer = ? AND status = 'DELIVERED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, delivery.seq());
            ps.setString(2, delivery.consumerId());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to release task: " + delivery.taskId(), e);
        }
    }

    @Override
    public int requeueExpired(Instant deliveredBefore) {
        String sql = """
                    UPDATE broker_messages
                    SET status = 'READY', consumer = NULL, delivered_at = NULL
                    WHERE queue = ? AND status = 'DELIVERED' AND delivered_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue);
            ps.setTimestamp(2, Timestamp.from(deliveredBefore));
            int requeued = ps.executeUpdate();
            conn.commit();

            if (requeued > 0) {
                log.info("Requeued {} expired deliveries on queue {}", requeued, queue);
            }
            return requeued;
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to requeue expired deliveries", e);
        }
    }

    @Override
    public int depth() {
        String sql = "SELECT COUNT(*) FROM broker_messages WHERE queue = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("Failed to read depth of queue " + queue, e);
        }
    }

    public String queue() {
        return queue;
    }
}
