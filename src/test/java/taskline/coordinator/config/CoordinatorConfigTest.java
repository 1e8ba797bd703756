package taskline.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @TempDir
    Path tempDir;

    private File writeIni(String content) throws IOException {
        Path file = tempDir.resolve("taskline.ini");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertEquals("default", config.queueName());
        assertEquals(2, config.workerCount());
        assertEquals(Duration.ofSeconds(20), config.taskDelay());
        assertEquals(64 * 1024, config.maxPayloadBytes());
        assertEquals(Duration.ofMinutes(5), config.brokerVisibilityTimeout());
        assertFalse(config.hasAgentKey());
    }

    @Test
    void loadsAllSectionsFromIni() throws IOException {
        File ini = writeIni("""
                [database]
                url = jdbc:h2:mem:ini-test
                pool_size = 3

                [broker]
                url = jdbc:h2:mem:ini-broker
                queue = echo
                visibility_timeout_ms = 60000

                [server]
                host = 127.0.0.1
                port = 9090
                agent_key = secret
                max_payload_bytes = 1024

                [worker]
                count = 4
                poll_interval_ms = 250
                task_delay_ms = 1500

                [signals]
                retry_initial_ms = 50
                retry_max_ms = 5000
                retry_multiplier = 3.0

                [maintenance]
                interval_ms = 10000
                """);

        CoordinatorConfig config = CoordinatorConfig.fromIni(ini);

        assertEquals("jdbc:h2:mem:ini-test", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals("jdbc:h2:mem:ini-broker", config.brokerUrl());
        assertEquals("echo", config.queueName());
        assertEquals(Duration.ofMinutes(1), config.brokerVisibilityTimeout());
        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(9090, config.serverPort());
        assertEquals("secret", config.agentKey());
        assertTrue(config.hasAgentKey());
        assertEquals(1024, config.maxPayloadBytes());
        assertEquals(4, config.workerCount());
        assertEquals(Duration.ofMillis(250), config.workerPollInterval());
        assertEquals(Duration.ofMillis(1500), config.taskDelay());
        assertEquals(Duration.ofMillis(50), config.signalRetryInitialDelay());
        assertEquals(Duration.ofSeconds(5), config.signalRetryMaxDelay());
        assertEquals(3.0, config.signalRetryMultiplier());
        assertEquals(Duration.ofSeconds(10), config.maintenanceInterval());
    }

    @Test
    void missingSectionsKeepDefaults() throws IOException {
        File ini = writeIni("""
                [worker]
                count = 0
                """);

        CoordinatorConfig config = CoordinatorConfig.fromIni(ini);

        assertEquals(0, config.workerCount());
        assertEquals(8080, config.serverPort());
        assertEquals(CoordinatorConfig.defaults().databaseUrl(), config.databaseUrl());
    }

    @Test
    void invalidNumberRejected() throws IOException {
        File ini = writeIni("""
                [server]
                port = eighty
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CoordinatorConfig.fromIni(ini));
        assertTrue(e.getMessage().contains("port"));
    }

    @Test
    void fluentSetters() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withServerPort(1234)
                .withWorkerCount(0)
                .withAgentKey("k")
                .withSignalRetry(Duration.ofMillis(1), Duration.ofMillis(2), 1.5);

        assertEquals(1234, config.serverPort());
        assertEquals(0, config.workerCount());
        assertEquals("k", config.agentKey());
        assertEquals(1.5, config.signalRetryMultiplier());
    }
}
