package taskline.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskline.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 * <p>
 * Two schemas exist: the shared status store (tasks + pending set) and the
 * broker queue. They may live in the same database or in separate ones.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    static final List<String> STORE_SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS tasks (
                        id              VARCHAR(64) PRIMARY KEY,
                        payload         CLOB NOT NULL,
                        state           VARCHAR(16) NOT NULL,
                        result          CLOB,
                        enqueued_at     TIMESTAMP NOT NULL,
                        started_at      TIMESTAMP,
                        finished_at     TIMESTAMP
                    );
                    """,
            // enqueue_seq breaks ties between equal timestamps
            """
                    CREATE TABLE IF NOT EXISTS pending_tasks (
                        enqueue_seq     BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                        task_id         VARCHAR(64) NOT NULL UNIQUE,
                        enqueued_at     TIMESTAMP NOT NULL
                    );
                    """,
            "CREATE INDEX IF NOT EXISTS idx_tasks_state ON tasks(state);",
            "CREATE INDEX IF NOT EXISTS idx_pending_order ON pending_tasks(enqueued_at, enqueue_seq);");

    static final List<String> BROKER_SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS broker_messages (
                        seq             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                        queue           VARCHAR(128) NOT NULL,
                        task_id         VARCHAR(64) NOT NULL,
                        payload         CLOB NOT NULL,
                        enqueued_at     TIMESTAMP NOT NULL,
                        status          VARCHAR(16) NOT NULL,
                        consumer        VARCHAR(128),
                        delivered_at    TIMESTAMP,
                        deliveries      INT DEFAULT 0
                    );
                    """,
            "CREATE INDEX IF NOT EXISTS idx_broker_ready ON broker_messages(queue, status, seq);",
            "CREATE INDEX IF NOT EXISTS idx_broker_delivered ON broker_messages(status, delivered_at);");

    private final HikariDataSource dataSource;

    public Database(String jdbcUrl, int poolSize, String poolName, List<String> schema) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName(poolName);
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool {} initialized: {}", poolName, jdbcUrl);

        initSchema(schema);
    }

    /** Status store + position ledger database. */
    public static Database forStore(CoordinatorConfig config) {
        return forStore(config.databaseUrl(), config.databasePoolSize());
    }

    public static Database forStore(String jdbcUrl, int poolSize) {
        return new Database(jdbcUrl, poolSize, "taskline-store-pool", STORE_SCHEMA);
    }

    /** Broker queue database. */
    public static Database forBroker(CoordinatorConfig config) {
        return forBroker(config.brokerUrl(), config.brokerPoolSize());
    }

    public static Database forBroker(String jdbcUrl, int poolSize) {
        return new Database(jdbcUrl, poolSize, "taskline-broker-pool", BROKER_SCHEMA);
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema(List<String> schema) {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            for (String ddl : schema) {
                st.addBatch(ddl);
            }
            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized ({} statements)", schema.size());
        } catch (SQLException e) {
            close();
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
