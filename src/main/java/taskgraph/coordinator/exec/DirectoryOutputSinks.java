package taskgraph.coordinator.exec;

import taskgraph.coordinator.error.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * One uniquely named output file per task inside a fixed directory.
 * The directory is checked once, at construction; files are created by the
 * executor when the program starts.
 */
public final class DirectoryOutputSinks implements OutputSinkProvider {

    private static final Logger log = LoggerFactory.getLogger(DirectoryOutputSinks.class);

    private final Path directory;

    /**
     * @throws InvalidConfigurationException if the directory is missing, not a directory or not writable
     */
    public DirectoryOutputSinks(Path directory) {
        if (directory == null) {
            throw new InvalidConfigurationException("output directory is not set");
        }
        Path dir = directory.toAbsolutePath().normalize();
        if (!Files.exists(dir)) {
            throw new InvalidConfigurationException("output directory does not exist: " + dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new InvalidConfigurationException("output path is not a directory: " + dir);
        }
        if (!Files.isWritable(dir)) {
            throw new InvalidConfigurationException("output directory is not writable: " + dir);
        }
        this.directory = dir;
        log.info("Task output will be written to {}", dir);
    }

    @Override
    public Path allocate(String taskName) {
        String fileName = sanitize(taskName) + "-" + UUID.randomUUID().toString().substring(0, 8) + ".out";
        return directory.resolve(fileName);
    }

    public Path directory() {
        return directory;
    }

    static String sanitize(String taskName) {
        String cleaned = taskName.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.length() > 64) {
            cleaned = cleaned.substring(0, 64);
        }
        // never produce hidden or relative-looking names
        return cleaned.startsWith(".") ? "_" + cleaned.substring(1) : cleaned;
    }
}
