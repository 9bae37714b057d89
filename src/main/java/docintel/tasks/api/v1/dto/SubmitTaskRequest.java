package docintel.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for submitting a registered unit of work.
 * POST /api/v1/tasks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitTaskRequest(
        @JsonProperty("work") String work,
        @JsonProperty("args") List<Object> args) {

    /** Arguments as passed to the work, never null */
    public Object[] argsArray() {
        return args == null ? new Object[0] : args.toArray();
    }

    public void validate() {
        if (work == null || work.isBlank()) {
            throw new IllegalArgumentException("work is required");
        }
    }
}
