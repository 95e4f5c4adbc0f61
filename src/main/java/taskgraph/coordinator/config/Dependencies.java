package taskgraph.coordinator.config;

import taskgraph.coordinator.api.v1.HealthController;
import taskgraph.coordinator.api.v1.TaskController;
import taskgraph.coordinator.exec.DirectoryOutputSinks;
import taskgraph.coordinator.exec.ExecutorHook;
import taskgraph.coordinator.exec.ProcessExecutorHook;
import taskgraph.coordinator.scheduler.Orchestrator;
import taskgraph.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * Orchestrator orchestrator = deps.orchestrator();
 * // ... schedule / cancel ...
 * deps.close(); // drops everything still scheduled
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final DirectoryOutputSinks outputSinks;
    private final ExecutorHook executorHook;
    private final Orchestrator orchestrator;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, ExecutorHook executorHook) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Throws InvalidConfigurationException before anything starts
        this.outputSinks = new DirectoryOutputSinks(config.outputDirectory());
        this.executorHook = executorHook != null ? executorHook : new ProcessExecutorHook(config.interpreter());
        this.orchestrator = new Orchestrator(this.executorHook, outputSinks, Clock.systemUTC(),
                config.shutdownTimeout());

        this.healthController = new HealthController(orchestrator);
        this.taskController = new TaskController(orchestrator);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     *
     * @throws taskgraph.coordinator.error.InvalidConfigurationException if the output directory is unusable
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies with a custom executor (tests, embedding).
     */
    public static Dependencies create(CoordinatorConfig config, ExecutorHook executorHook) {
        return new Dependencies(config, executorHook);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public DirectoryOutputSinks outputSinks() {
        return outputSinks;
    }

    public ExecutorHook executorHook() {
        return executorHook;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public HealthController healthController() {
        return healthController;
    }

    public TaskController taskController() {
        return taskController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        orchestrator.close();
        log.info("Dependencies closed");
    }
}
