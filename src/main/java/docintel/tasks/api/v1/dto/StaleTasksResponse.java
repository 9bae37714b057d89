package docintel.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import docintel.tasks.model.TaskRecord;

import java.time.Duration;
import java.util.List;

/**
 * PROCESSING tasks that stopped updating.
 * GET /api/v1/tasks/stale
 */
public record StaleTasksResponse(
        @JsonProperty("threshold_seconds") long thresholdSeconds,
        @JsonProperty("count") int count,
        @JsonProperty("tasks") List<TaskStatusResponse> tasks) {

    public static StaleTasksResponse from(Duration threshold, List<TaskRecord> stale) {
        List<TaskStatusResponse> tasks = stale.stream().map(TaskStatusResponse::from).toList();
        return new StaleTasksResponse(threshold.toSeconds(), tasks.size(), tasks);
    }
}
