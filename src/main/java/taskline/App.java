package taskline;

import taskline.coordinator.config.CoordinatorConfig;
import taskline.coordinator.server.TasklineServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Command-line entry point.
 *
 * Usage: {@code java taskline.App [config.ini]}. Without an argument the
 * configuration comes from defaults and TASKLINE_* environment variables;
 * with one, the INI file is read first and the environment applied on top.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config;
        try {
            config = args.length > 0
                    ? CoordinatorConfig.fromIni(new File(args[0])).withEnvOverrides()
                    : CoordinatorConfig.fromEnv();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot load configuration from {}", configSource(args), e);
            System.exit(2);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping server...");
            TasklineServer.stop();
        }, "taskline-shutdown"));

        log.info("Starting Taskline server on port {}...", config.serverPort());
        if (!TasklineServer.start(config.serverPort(), config)) {
            log.error("Taskline server did not start");
            System.exit(1);
        }

        TasklineServer.awaitShutdown();
    }

    static String configSource(String[] args) {
        return args.length > 0 ? args[0] : "environment";
    }
}
