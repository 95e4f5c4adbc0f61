package taskgraph.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskgraph.coordinator.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Response DTO for a task snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("programPath") String programPath,
        @JsonProperty("parameters") List<String> parameters,
        @JsonProperty("scheduledTime") long scheduledTime,
        @JsonProperty("dependsOn") Set<String> dependsOn,
        @JsonProperty("dependents") Set<String> dependents,
        @JsonProperty("outputFile") String outputFile,
        @JsonProperty("admittedAt") Instant admittedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.name(),
                task.status().name(),
                task.programPath(),
                task.parameters(),
                task.scheduledTime(),
                task.dependsOn(),
                task.dependents(),
                task.outputSink() != null ? task.outputSink().toString() : null,
                task.admittedAt());
    }
}
