package taskgraph.coordinator.error;

/**
 * No task with the given name is in the graph (never scheduled, finished, or cancelled).
 */
public class UnknownTaskException extends OrchestratorException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("no such task: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
