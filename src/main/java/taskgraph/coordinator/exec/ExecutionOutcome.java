package taskgraph.coordinator.exec;

/**
 * Result of running a task's program.
 *
 * @param exitCode  process exit status, or -1 when the program never ran to completion
 * @param runtimeMs wall-clock time spent in the hook
 * @param error     launch/IO error message, null when the program ran
 */
public record ExecutionOutcome(int exitCode, long runtimeMs, String error) {

    public static ExecutionOutcome exited(int exitCode, long runtimeMs) {
        return new ExecutionOutcome(exitCode, runtimeMs, null);
    }

    public static ExecutionOutcome failed(String error, long runtimeMs) {
        return new ExecutionOutcome(-1, runtimeMs, error);
    }

    public boolean succeeded() {
        return error == null && exitCode == 0;
    }
}
