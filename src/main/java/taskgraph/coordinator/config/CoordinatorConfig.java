package taskgraph.coordinator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Execution settings
    private Path outputDirectory = Path.of("output");
    private String interpreter = null; // e.g. "python3"; null runs programs directly

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Lifecycle
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String outputDir = System.getenv("TASKGRAPH_OUTPUT_DIR");
        if (outputDir != null && !outputDir.isBlank()) {
            config.outputDirectory = Path.of(outputDir.trim());
        }

        String interpreter = System.getenv("TASKGRAPH_INTERPRETER");
        if (interpreter != null && !interpreter.isBlank()) {
            config.interpreter = interpreter.trim();
        }

        String host = System.getenv("TASKGRAPH_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.trim();
        }

        String port = System.getenv("TASKGRAPH_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = parsePort(port.trim());
        }

        String shutdown = System.getenv("TASKGRAPH_SHUTDOWN_TIMEOUT_MS");
        if (shutdown != null && !shutdown.isBlank()) {
            config.shutdownTimeout = Duration.ofMillis(Long.parseLong(shutdown.trim()));
        }

        return config;
    }

    private static int parsePort(String value) {
        int port = Integer.parseInt(value);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + value);
        }
        return port;
    }

    // Getters
    public Path outputDirectory() {
        return outputDirectory;
    }

    public String interpreter() {
        return interpreter;
    }

    public boolean hasInterpreter() {
        return interpreter != null && !interpreter.isBlank();
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withOutputDirectory(Path directory) {
        this.outputDirectory = directory;
        return this;
    }

    public CoordinatorConfig withInterpreter(String interpreter) {
        this.interpreter = interpreter;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "outputDirectory='" + outputDirectory + '\'' +
                ", interpreter=" + (hasInterpreter() ? "'" + interpreter + "'" : "none") +
                ", serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }
}
