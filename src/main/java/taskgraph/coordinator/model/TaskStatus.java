package taskgraph.coordinator.model;

/**
 * Task lifecycle status.
 */
public enum TaskStatus {
    /** Admitted, waiting on at least one dependency */
    PENDING,
    /** No outstanding dependencies, timer set */
    ARMED,
    /** Timer fired, program handed to the executor */
    RUNNING,
    /** Program exited and the task was removed from the graph */
    DONE,
    /** Removed from the graph by a caller */
    CANCELLED;

    /** Check if the task has left the graph */
    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }
}
