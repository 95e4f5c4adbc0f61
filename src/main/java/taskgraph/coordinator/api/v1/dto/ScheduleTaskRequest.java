package taskgraph.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for scheduling a task.
 * POST /api/v1/tasks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleTaskRequest(
        @JsonProperty("name") String name,
        @JsonProperty("programPath") String programPath,
        @JsonProperty("scheduledTime") Long scheduledTime,
        @JsonProperty("dependsOn") List<String> dependsOn,
        @JsonProperty("parameters") List<String> parameters) {

    /** Validate the request */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (name.contains("/")) {
            throw new IllegalArgumentException("name must not contain '/'");
        }
        if (programPath == null || programPath.isBlank()) {
            throw new IllegalArgumentException("programPath is required");
        }
        if (scheduledTime != null && scheduledTime < 0) {
            throw new IllegalArgumentException("scheduledTime must not be negative");
        }
        if (dependsOn != null && dependsOn.contains(null)) {
            throw new IllegalArgumentException("dependsOn must not contain null");
        }
        if (parameters != null && parameters.contains(null)) {
            throw new IllegalArgumentException("parameters must not contain null");
        }
    }
}
