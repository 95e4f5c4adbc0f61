package taskgraph.coordinator.scheduler;

import taskgraph.coordinator.exec.ExecutionOutcome;
import taskgraph.coordinator.model.Task;

/**
 * Observer of task lifecycle transitions.
 *
 * Callbacks run on the scheduler thread while it holds the graph, so they
 * must be quick and must not block. Snapshots passed in are immutable.
 */
public interface TaskListener {

    default void onAdmitted(Task task) {
    }

    /** Timer set; fires {@code delayMs} from now */
    default void onArmed(Task task, long delayMs) {
    }

    /** Timer fired and the task was handed to the executor */
    default void onDispatched(Task task) {
    }

    default void onCompleted(Task task, ExecutionOutcome outcome) {
    }

    default void onCancelled(Task task) {
    }
}
