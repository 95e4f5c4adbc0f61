package taskgraph.coordinator.error;

/**
 * Base type for failures the orchestrator reports to its callers.
 * All of them are detected synchronously and never retried internally.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
