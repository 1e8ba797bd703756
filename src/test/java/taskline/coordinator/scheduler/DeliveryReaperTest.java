package taskline.coordinator.scheduler;

import taskline.coordinator.broker.JdbcTaskBroker;
import taskline.coordinator.broker.TaskMessage;
import taskline.coordinator.config.CoordinatorConfig;
import taskline.coordinator.store.Database;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DeliveryReaper functionality.
 */
class DeliveryReaperTest {

    private static Database db;
    private static JdbcTaskBroker broker;

    @BeforeAll
    static void setup() {
        db = Database.forBroker(
                "jdbc:h2:mem:test-reaper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        broker = new JdbcTaskBroker(db, "default");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanQueue() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM broker_messages");
            conn.commit();
        }
    }

    @Test
    void requeuesDeliveryPastVisibilityTimeout() throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withBrokerVisibilityTimeout(Duration.ofMillis(100)); // 100ms threshold for fast tests
        DeliveryReaper reaper = new DeliveryReaper(broker, config);

        broker.publish(new TaskMessage("t1", "p", Instant.now()));
        broker.poll("crashed").orElseThrow();
        assertTrue(broker.poll("other").isEmpty());

        Thread.sleep(250);

        assertEquals(1, reaper.reapExpiredDeliveries());
        assertEquals("t1", broker.poll("other").orElseThrow().taskId());
    }

    @Test
    void leavesFreshDeliveriesAlone() {
        DeliveryReaper reaper = new DeliveryReaper(broker, CoordinatorConfig.defaults());

        broker.publish(new TaskMessage("t2", "p", Instant.now()));
        broker.poll("busy").orElseThrow();

        assertEquals(0, reaper.reapExpiredDeliveries());
        assertTrue(broker.poll("other").isEmpty());
    }
}
