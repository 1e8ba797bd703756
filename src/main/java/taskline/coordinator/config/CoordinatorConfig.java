package taskline.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Configuration holder for Taskline settings.
 * All settings have sensible defaults; values can come from an INI file, the
 * environment, or the fluent setters.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskline;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Broker settings
    private String brokerUrl = "jdbc:h2:file:./data/taskline-broker;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int brokerPoolSize = 5;
    private String queueName = "default";
    private Duration brokerVisibilityTimeout = Duration.ofMinutes(5);

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private int maxPayloadBytes = 64 * 1024;

    // Worker settings
    private int workerCount = 2;
    private Duration workerPollInterval = Duration.ofMillis(500);
    private Duration taskDelay = Duration.ofSeconds(20);

    // Lifecycle signal retry
    private Duration signalRetryInitialDelay = Duration.ofMillis(100);
    private Duration signalRetryMaxDelay = Duration.ofSeconds(10);
    private double signalRetryMultiplier = 2.0;

    // Background maintenance
    private Duration maintenanceInterval = Duration.ofSeconds(30);

    // Auth settings (optional)
    private String agentKey = null; // If set, remote workers must provide X-Taskline-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return new CoordinatorConfig().withEnvOverrides();
    }

    /**
     * Load settings from an INI file. Missing sections and keys keep their defaults.
     *
     * @throws IOException if the file cannot be read or is not valid INI
     * @throws IllegalArgumentException if a numeric value cannot be parsed
     */
    public static CoordinatorConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        CoordinatorConfig config = new CoordinatorConfig();

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = optInt(database, "pool_size", config.databasePoolSize);
        }

        Profile.Section broker = ini.get("broker");
        if (broker != null) {
            config.brokerUrl = opt(broker, "url", config.brokerUrl);
            config.brokerPoolSize = optInt(broker, "pool_size", config.brokerPoolSize);
            config.queueName = opt(broker, "queue", config.queueName);
            config.brokerVisibilityTimeout = optMillis(broker, "visibility_timeout_ms", config.brokerVisibilityTimeout);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = optInt(server, "port", config.serverPort);
            config.agentKey = opt(server, "agent_key", config.agentKey);
            config.maxPayloadBytes = optInt(server, "max_payload_bytes", config.maxPayloadBytes);
        }

        Profile.Section worker = ini.get("worker");
        if (worker != null) {
            config.workerCount = optInt(worker, "count", config.workerCount);
            config.workerPollInterval = optMillis(worker, "poll_interval_ms", config.workerPollInterval);
            config.taskDelay = optMillis(worker, "task_delay_ms", config.taskDelay);
        }

        Profile.Section signals = ini.get("signals");
        if (signals != null) {
            config.signalRetryInitialDelay = optMillis(signals, "retry_initial_ms", config.signalRetryInitialDelay);
            config.signalRetryMaxDelay = optMillis(signals, "retry_max_ms", config.signalRetryMaxDelay);
            String multiplier = opt(signals, "retry_multiplier", null);
            if (multiplier != null) {
                config.signalRetryMultiplier = parseDouble("retry_multiplier", multiplier);
            }
        }

        Profile.Section maintenance = ini.get("maintenance");
        if (maintenance != null) {
            config.maintenanceInterval = optMillis(maintenance, "interval_ms", config.maintenanceInterval);
        }

        return config;
    }

    /**
     * Apply TASKLINE_* environment variables on top of the current values.
     */
    public CoordinatorConfig withEnvOverrides() {
        String dbUrl = System.getenv("TASKLINE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String dbPool = System.getenv("TASKLINE_DB_POOL");
        if (dbPool != null && !dbPool.isBlank()) {
            databasePoolSize = parseInt("TASKLINE_DB_POOL", dbPool);
        }

        String brokerUrlEnv = System.getenv("TASKLINE_BROKER_URL");
        if (brokerUrlEnv != null && !brokerUrlEnv.isBlank()) {
            brokerUrl = brokerUrlEnv;
        }

        String queue = System.getenv("TASKLINE_QUEUE");
        if (queue != null && !queue.isBlank()) {
            queueName = queue;
        }

        String port = System.getenv("TASKLINE_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = parseInt("TASKLINE_PORT", port);
        }

        String key = System.getenv("TASKLINE_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String workers = System.getenv("TASKLINE_WORKERS");
        if (workers != null && !workers.isBlank()) {
            workerCount = parseInt("TASKLINE_WORKERS", workers);
        }

        String delay = System.getenv("TASKLINE_TASK_DELAY_MS");
        if (delay != null && !delay.isBlank()) {
            taskDelay = Duration.ofMillis(parseInt("TASKLINE_TASK_DELAY_MS", delay));
        }

        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String brokerUrl() {
        return brokerUrl;
    }

    public int brokerPoolSize() {
        return brokerPoolSize;
    }

    public String queueName() {
        return queueName;
    }

    public Duration brokerVisibilityTimeout() {
        return brokerVisibilityTimeout;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxPayloadBytes() {
        return maxPayloadBytes;
    }

    public int workerCount() {
        return workerCount;
    }

    public Duration workerPollInterval() {
        return workerPollInterval;
    }

    public Duration taskDelay() {
        return taskDelay;
    }

    public Duration signalRetryInitialDelay() {
        return signalRetryInitialDelay;
    }

    public Duration signalRetryMaxDelay() {
        return signalRetryMaxDelay;
    }

    public double signalRetryMultiplier() {
        return signalRetryMultiplier;
    }

    public Duration maintenanceInterval() {
        return maintenanceInterval;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withBrokerUrl(String url) {
        this.brokerUrl = url;
        return this;
    }

    public CoordinatorConfig withQueueName(String queue) {
        this.queueName = queue;
        return this;
    }

    public CoordinatorConfig withBrokerVisibilityTimeout(Duration timeout) {
        this.brokerVisibilityTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public CoordinatorConfig withMaxPayloadBytes(int bytes) {
        this.maxPayloadBytes = bytes;
        return this;
    }

    public CoordinatorConfig withWorkerCount(int count) {
        this.workerCount = count;
        return this;
    }

    public CoordinatorConfig withWorkerPollInterval(Duration interval) {
        this.workerPollInterval = interval;
        return this;
    }

    public CoordinatorConfig withTaskDelay(Duration delay) {
        this.taskDelay = delay;
        return this;
    }

    public CoordinatorConfig withSignalRetry(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.signalRetryInitialDelay = initialDelay;
        this.signalRetryMaxDelay = maxDelay;
        this.signalRetryMultiplier = multiplier;
        return this;
    }

    public CoordinatorConfig withMaintenanceInterval(Duration interval) {
        this.maintenanceInterval = interval;
        return this;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int optInt(Profile.Section s, String key, int def) {
        String v = opt(s, key, null);
        return v == null ? def : parseInt(key, v);
    }

    private static Duration optMillis(Profile.Section s, String key, Duration def) {
        String v = opt(s, key, null);
        return v == null ? def : Duration.ofMillis(parseInt(key, v));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", brokerUrl='" + brokerUrl + '\'' +
                ", queue=" + queueName +
                ", serverPort=" + serverPort +
                ", workers=" + workerCount +
                ", taskDelay=" + taskDelay.toMillis() + "ms" +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
