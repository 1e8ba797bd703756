package taskline.coordinator.config;

import taskline.coordinator.api.internal.v1.LifecycleController;
import taskline.coordinator.api.v1.HealthController;
import taskline.coordinator.api.v1.RootController;
import taskline.coordinator.api.v1.TaskController;
import taskline.coordinator.broker.JdbcTaskBroker;
import taskline.coordinator.broker.TaskBroker;
import taskline.coordinator.repository.PositionLedger;
import taskline.coordinator.repository.StatusStore;
import taskline.coordinator.scheduler.DeliveryReaper;
import taskline.coordinator.scheduler.LedgerReconciler;
import taskline.coordinator.scheduler.Scheduler;
import taskline.coordinator.server.RouterHandler;
import taskline.coordinator.service.QueryService;
import taskline.coordinator.service.SubmissionGateway;
import taskline.coordinator.signal.ExponentialBackoff;
import taskline.coordinator.signal.LifecycleEventHandler;
import taskline.coordinator.signal.LifecycleSignalBus;
import taskline.coordinator.store.Database;
import taskline.coordinator.store.JdbcPositionLedger;
import taskline.coordinator.store.JdbcStatusStore;
import taskline.coordinator.worker.EchoTaskExecutor;
import taskline.coordinator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.start(); // signal bus, workers, maintenance
 * String taskId = deps.submissionGateway().submit("hello");
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final Database brokerDatabase;
    private final StatusStore statusStore;
    private final PositionLedger positionLedger;
    private final TaskBroker broker;
    private final LifecycleEventHandler eventHandler;
    private final LifecycleSignalBus signalBus;
    private final SubmissionGateway submissionGateway;
    private final QueryService queryService;
    private final WorkerPool workerPool;
    private final Scheduler scheduler;

    // Controllers
    private final RootController rootController;
    private final TaskController taskController;
    private final HealthController healthController;
    private final LifecycleController lifecycleController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = Database.forStore(config);
        try {
            this.brokerDatabase = Database.forBroker(config);
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }

        // Stores
        this.statusStore = new JdbcStatusStore(database);
        this.positionLedger = new JdbcPositionLedger(database);
        this.broker = new JdbcTaskBroker(brokerDatabase, config.queueName());

        // Lifecycle signals
        this.eventHandler = new LifecycleEventHandler(statusStore, positionLedger);
        this.signalBus = new LifecycleSignalBus(eventHandler, new ExponentialBackoff(
                config.signalRetryInitialDelay(),
                config.signalRetryMultiplier(),
                config.signalRetryMaxDelay(),
                true));

        // Services
        this.submissionGateway = new SubmissionGateway(statusStore, positionLedger, broker, config);
        this.queryService = new QueryService(statusStore, positionLedger);

        // Workers and maintenance
        this.workerPool = new WorkerPool(config.workerCount(), broker, signalBus,
                new EchoTaskExecutor(config.taskDelay()), config.workerPollInterval());
        this.scheduler = new Scheduler(
                new DeliveryReaper(broker, config),
                new LedgerReconciler(positionLedger),
                config);

        // Controllers
        this.rootController = new RootController();
        this.taskController = new TaskController(submissionGateway, queryService);
        this.healthController = new HealthController(database, queryService, broker);
        this.lifecycleController = new LifecycleController(signalBus);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    /**
     * Start the signal bus, then the workers that emit into it, then the
     * maintenance scheduler.
     */
    public void start() {
        signalBus.start();
        workerPool.start();
        scheduler.start();
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public Database brokerDatabase() {
        return brokerDatabase;
    }

    public StatusStore statusStore() {
        return statusStore;
    }

    public PositionLedger positionLedger() {
        return positionLedger;
    }

    public TaskBroker broker() {
        return broker;
    }

    public LifecycleEventHandler eventHandler() {
        return eventHandler;
    }

    public LifecycleSignalBus signalBus() {
        return signalBus;
    }

    public SubmissionGateway submissionGateway() {
        return submissionGateway;
    }

    public QueryService queryService() {
        return queryService;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(rootController)
                    .registerController(taskController)
                    .registerController(healthController)
                    .registerController(lifecycleController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop producers of events before the bus that applies them
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            workerPool.stop();
        } catch (Exception e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        try {
            signalBus.close();
        } catch (Exception e) {
            log.warn("Error stopping signal bus: {}", e.getMessage());
        }

        try {
            brokerDatabase.close();
        } catch (Exception e) {
            log.warn("Error closing broker database: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
