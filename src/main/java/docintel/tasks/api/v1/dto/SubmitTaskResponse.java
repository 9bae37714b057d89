package docintel.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO returned as soon as a task is queued.
 */
public record SubmitTaskResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message) {
}
