package taskline.coordinator.worker;

import taskline.coordinator.broker.JdbcTaskBroker;
import taskline.coordinator.broker.TaskMessage;
import taskline.coordinator.config.CoordinatorConfig;
import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.model.LifecycleEventType;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.model.TaskView;
import taskline.coordinator.service.QueryService;
import taskline.coordinator.service.SubmissionGateway;
import taskline.coordinator.signal.ExponentialBackoff;
import taskline.coordinator.signal.LifecycleEventHandler;
import taskline.coordinator.signal.LifecycleSignalBus;
import taskline.coordinator.store.Database;
import taskline.coordinator.store.JdbcPositionLedger;
import taskline.coordinator.store.JdbcStatusStore;
import org.junit.jupiter.api.*;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class TaskWorkerTest {

    private static final Duration POLL = Duration.ofMillis(20);

    private Database storeDb;
    private JdbcStatusStore store;
    private JdbcPositionLedger ledger;
    private Database brokerDb;
    private JdbcTaskBroker broker;
    private LifecycleSignalBus bus;
    private SubmissionGateway gateway;
    private QueryService queryService;

    @BeforeEach
    void setUp() {
        long n = System.nanoTime();
        storeDb = Database.forStore(
                "jdbc:h2:mem:test-worker-" + n + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        brokerDb = Database.forBroker(
                "jdbc:h2:mem:test-worker-broker-" + n + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        store = new JdbcStatusStore(storeDb);
        ledger = new JdbcPositionLedger(storeDb);
        broker = new JdbcTaskBroker(brokerDb, "default");
        bus = new LifecycleSignalBus(new LifecycleEventHandler(store, ledger), new ExponentialBackoff());
        bus.start();
        gateway = new SubmissionGateway(store, ledger, broker, CoordinatorConfig.defaults());
        queryService = new QueryService(store, ledger);
    }

    @AfterEach
    void tearDown() {
        bus.close();
        brokerDb.close();
        storeDb.close();
    }

    @Test
    void echoTaskSucceeds() throws Exception {
        String taskId = gateway.submit("hi");
        TaskWorker worker = new TaskWorker("w1", broker, bus, new EchoTaskExecutor(Duration.ZERO), POLL);

        assertTrue(worker.processNext());
        assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(new TaskView(taskId, TaskState.SUCCESS, "hi", null), queryService.query(taskId));
        assertEquals(0, broker.depth());
        assertFalse(worker.processNext());
    }

    @Test
    void executorExceptionFailsTask() throws Exception {
        String taskId = gateway.submit("hi");
        TaskWorker worker = new TaskWorker("w1", broker, bus, message -> {
            throw new IllegalStateException("cannot echo " + message.payload());
        }, POLL);

        assertTrue(worker.processNext());
        assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));

        TaskView view = queryService.query(taskId);
        assertEquals(TaskState.FAILURE, view.status());
        assertEquals("cannot echo hi", view.result());
        assertEquals(0, broker.depth());
    }

    @Test
    void outcomeIsStoredBeforeAckWhenStoreRecovers() throws Exception {
        String taskId = gateway.submit("hi");
        LifecycleEventHandler flaky = spy(new LifecycleEventHandler(store, ledger));
        doThrow(outage()).doThrow(outage()).doCallRealMethod()
                .when(flaky).handle(argThat(e -> e.type() == LifecycleEventType.SUCCEEDED));
        LifecycleSignalBus flakyBus = new LifecycleSignalBus(flaky, fastBackoff());
        flakyBus.start();
        try {
            TaskWorker worker = new TaskWorker("w1", broker, flakyBus, new EchoTaskExecutor(Duration.ZERO), POLL);

            assertTrue(worker.processNext());

            assertEquals(TaskState.SUCCESS, queryService.query(taskId).status());
            assertEquals(0, broker.depth());
        } finally {
            flakyBus.close();
        }
    }

    @Test
    void deliveryStaysRedeliverableWhileOutcomeCannotBeStored() throws Exception {
        String taskId = gateway.submit("hi");
        LifecycleEventHandler down = spy(new LifecycleEventHandler(store, ledger));
        doThrow(outage()).when(down).handle(argThat(e -> e.type() == LifecycleEventType.SUCCEEDED));
        LifecycleSignalBus downBus = new LifecycleSignalBus(down, fastBackoff());
        downBus.start();

        TaskWorker stuck = new TaskWorker("w1", broker, downBus, new EchoTaskExecutor(Duration.ZERO), POLL);
        Thread t = new Thread(() -> {
            try {
                stuck.processNext();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        t.start();
        try {
            verify(down, timeout(5000).atLeast(2))
                    .handle(argThat(e -> e.type() == LifecycleEventType.SUCCEEDED));
            assertEquals(1, broker.depth());
            assertNotEquals(TaskState.SUCCESS, queryService.query(taskId).status());

            // visibility timeout elapses: another worker picks the task up
            assertEquals(1, broker.requeueExpired(Instant.now().plusSeconds(1)));
            TaskWorker other = new TaskWorker("w2", broker, bus, new EchoTaskExecutor(Duration.ZERO), POLL);
            assertTrue(other.processNext());
            assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));

            assertEquals(new TaskView(taskId, TaskState.SUCCESS, "hi", null), queryService.query(taskId));
            assertEquals(0, broker.depth());
        } finally {
            t.interrupt();
            t.join(5000);
            downBus.close();
        }
        assertFalse(t.isAlive());
    }

    @Test
    void interruptReleasesDelivery() throws Exception {
        String taskId = gateway.submit("hi");
        CountDownLatch running = new CountDownLatch(1);
        TaskWorker worker = new TaskWorker("w1", broker, bus, message -> {
            running.countDown();
            Thread.sleep(TimeUnit.MINUTES.toMillis(1));
            return message.payload();
        }, POLL);

        Thread t = new Thread(worker);
        t.start();
        assertTrue(running.await(5, TimeUnit.SECONDS));
        t.interrupt();
        t.join(5000);
        assertFalse(t.isAlive());

        // back on the queue for another worker
        assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(TaskState.STARTED, queryService.query(taskId).status());
        TaskWorker other = new TaskWorker("w2", broker, bus, new EchoTaskExecutor(Duration.ZERO), POLL);
        assertTrue(other.processNext());
        assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(TaskState.SUCCESS, queryService.query(taskId).status());
    }

    @Test
    void poolDrainsQueue() throws Exception {
        String a = gateway.submit("a");
        String b = gateway.submit("b");
        String c = gateway.submit("c");

        try (WorkerPool pool = new WorkerPool(2, broker, bus, new EchoTaskExecutor(Duration.ZERO), POLL)) {
            pool.start();
            long deadline = System.currentTimeMillis() + 10_000;
            while (System.currentTimeMillis() < deadline
                    && !(isDone(a) && isDone(b) && isDone(c))) {
                Thread.sleep(20);
            }
        }

        assertEquals("a", queryService.query(a).result());
        assertEquals("b", queryService.query(b).result());
        assertEquals("c", queryService.query(c).result());
    }

    @Test
    void echoExecutorReturnsPayload() throws Exception {
        EchoTaskExecutor executor = new EchoTaskExecutor(Duration.ofMillis(10));
        assertEquals("x", executor.execute(new TaskMessage("t", "x", Instant.now())));
        assertThrows(IllegalArgumentException.class, () -> new EchoTaskExecutor(Duration.ofMillis(-1)));
    }

    private static StoreUnavailableException outage() {
        return new StoreUnavailableException("store down", new SQLException("down"));
    }

    private static ExponentialBackoff fastBackoff() {
        return new ExponentialBackoff(Duration.ofMillis(5), 2.0, Duration.ofMillis(20), false);
    }

    private boolean isDone(String taskId) {
        return queryService.query(taskId).status() == TaskState.SUCCESS;
    }
}
