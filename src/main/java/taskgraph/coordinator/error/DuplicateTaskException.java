package taskgraph.coordinator.error;

/**
 * Admission rejected because a task with the same name is still in the graph.
 */
public class DuplicateTaskException extends OrchestratorException {

    private final String taskName;

    public DuplicateTaskException(String taskName) {
        super("task already scheduled: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
