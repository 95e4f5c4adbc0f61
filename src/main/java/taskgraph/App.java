package taskgraph;

import taskgraph.coordinator.config.CoordinatorConfig;
import taskgraph.coordinator.error.InvalidConfigurationException;
import taskgraph.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * Creates the output directory if needed, starts the HTTP server and blocks
 * until the JVM is asked to stop. Scheduled tasks do not survive a restart.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();

        try {
            Files.createDirectories(config.outputDirectory());
        } catch (IOException e) {
            log.error("Cannot create output directory {}", config.outputDirectory(), e);
            System.exit(2);
        }

        boolean started;
        try {
            started = CoordinatorNettyServer.start(config);
        } catch (InvalidConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        if (!started) {
            log.error("Coordinator server did not start");
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping server...");
            CoordinatorNettyServer.stop();
            stopped.countDown();
        }, "taskgraph-shutdown"));

        stopped.await();
    }
}
