package taskgraph.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pendingTasks") Integer pendingTasks,
        @JsonProperty("armedTasks") Integer armedTasks,
        @JsonProperty("runningTasks") Integer runningTasks) {

    public static HealthResponse healthy(String uptime, String version, int pendingTasks, int armedTasks,
            int runningTasks) {
        return new HealthResponse("healthy", uptime, version, pendingTasks, armedTasks, runningTasks);
    }

    public static HealthResponse unhealthy(String version) {
        return new HealthResponse("unhealthy", null, version, null, null, null);
    }
}
