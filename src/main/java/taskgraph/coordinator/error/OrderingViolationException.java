package taskgraph.coordinator.error;

/**
 * Admission rejected because the task would run before one of its dependencies.
 */
public class OrderingViolationException extends OrchestratorException {

    private final String taskName;
    private final long scheduledTime;
    private final String dependencyName;
    private final long dependencyTime;

    public OrderingViolationException(String taskName, long scheduledTime, String dependencyName,
            long dependencyTime) {
        super("task " + taskName + " scheduled at " + scheduledTime + " precedes dependency "
                + dependencyName + " scheduled at " + dependencyTime);
        this.taskName = taskName;
        this.scheduledTime = scheduledTime;
        this.dependencyName = dependencyName;
        this.dependencyTime = dependencyTime;
    }

    public String taskName() {
        return taskName;
    }

    public long scheduledTime() {
        return scheduledTime;
    }

    public String dependencyName() {
        return dependencyName;
    }

    public long dependencyTime() {
        return dependencyTime;
    }
}
