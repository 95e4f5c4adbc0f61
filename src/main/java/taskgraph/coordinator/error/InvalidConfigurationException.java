package taskgraph.coordinator.error;

/**
 * The orchestrator cannot be constructed with the given settings,
 * typically because the output directory is missing or not writable.
 */
public class InvalidConfigurationException extends OrchestratorException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
