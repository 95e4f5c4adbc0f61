package taskgraph.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a scheduled task.
 * {@code waitMs} is advisory: time until the task's scheduled run time.
 */
public record ScheduleTaskResponse(
        @JsonProperty("name") String name,
        @JsonProperty("waitMs") long waitMs) {
}
