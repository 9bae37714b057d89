package docintel.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import docintel.tasks.model.TaskRecord;

/**
 * Response DTO for a task status lookup.
 * GET /api/v1/tasks/{taskId}
 *
 * Timestamps are seconds since the epoch with a fractional part.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") double createdAt,
        @JsonProperty("updated_at") double updatedAt,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error) {

    public static TaskStatusResponse from(TaskRecord record) {
        return new TaskStatusResponse(
                record.id(),
                record.status().name(),
                record.createdAt().toEpochMilli() / 1000.0,
                record.updatedAt().toEpochMilli() / 1000.0,
                record.result(),
                record.error());
    }
}
