package taskgraph.coordinator.exec;

import taskgraph.coordinator.model.Task;

import java.io.IOException;

/**
 * Runs a task's external program.
 *
 * Called on a runner thread once the task's timer fires, never while the
 * graph is being mutated. Implementations block until the program exits;
 * the orchestrator then removes the task and frees its dependents.
 * Exit codes are reported but never treated as scheduling failures.
 */
@FunctionalInterface
public interface ExecutorHook {

    /**
     * Run the program and wait for it.
     *
     * @param task snapshot of the task, status RUNNING
     * @return how the program ended
     * @throws IOException          if the program could not be started or its output written
     * @throws InterruptedException if the runner thread was interrupted while waiting
     */
    ExecutionOutcome execute(Task task) throws IOException, InterruptedException;
}
