package docintel.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 *
 * {@code degraded} is true when a configured shared store could not be reached
 * and task state is only visible to this process.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("taskStore") String taskStore,
        @JsonProperty("sharedState") Boolean sharedState,
        @JsonProperty("degraded") Boolean degraded,
        @JsonProperty("cache") String cache,
        @JsonProperty("cacheEnabled") Boolean cacheEnabled,
        @JsonProperty("maxWorkers") Integer maxWorkers,
        @JsonProperty("activeWorkers") Integer activeWorkers,
        @JsonProperty("queuedTasks") Integer queuedTasks) {

    public static HealthResponse healthy(String uptime, String version, String taskStore, boolean sharedState,
            boolean degraded, String cache, boolean cacheEnabled, int maxWorkers, int activeWorkers,
            int queuedTasks) {
        return new HealthResponse(degraded ? "degraded" : "healthy", uptime, version, taskStore, sharedState,
                degraded, cache, cacheEnabled, maxWorkers, activeWorkers, queuedTasks);
    }

    public static HealthResponse unhealthy(String taskStore) {
        return new HealthResponse("unhealthy", null, null, taskStore, null, null, null, null, null, null, null);
    }
}
