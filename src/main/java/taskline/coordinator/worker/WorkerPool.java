package taskline.coordinator.worker;

import taskline.coordinator.broker.TaskBroker;
import taskline.coordinator.signal.LifecycleSignalBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed number of {@link TaskWorker}s, each on its own thread, competing
 * on the same broker queue.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int size;
    private final TaskBroker broker;
    private final LifecycleSignalBus signalBus;
    private final TaskExecutor executor;
    private final Duration pollInterval;
    private final List<Thread> threads = new ArrayList<>();

    private volatile boolean running = false;

    public WorkerPool(int size, TaskBroker broker, LifecycleSignalBus signalBus,
            TaskExecutor executor, Duration pollInterval) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.size = size;
        this.broker = broker;
        this.signalBus = signalBus;
        this.executor = executor;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        running = true;

        for (int i = 1; i <= size; i++) {
            String name = "taskline-worker-" + i;
            TaskWorker worker = new TaskWorker(name, broker, signalBus, executor, pollInterval);
            Thread t = new Thread(worker, name);
            t.setDaemon(true);
            t.start();
            threads.add(t);
        }
        log.info("Worker pool started with {} workers", size);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        threads.forEach(Thread::interrupt);
        for (Thread t : threads) {
            try {
                t.join(TimeUnit.SECONDS.toMillis(5));
                if (t.isAlive()) {
                    log.warn("Worker {} did not stop in time", t.getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        threads.clear();
        log.info("Worker pool stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public int size() {
        return size;
    }
}
