package taskgraph.coordinator.exec;

import java.nio.file.Path;

/**
 * Allocates the write destination for a task's combined output.
 * Called once per admitted task, before the task can be armed.
 */
@FunctionalInterface
public interface OutputSinkProvider {

    Path allocate(String taskName);
}
