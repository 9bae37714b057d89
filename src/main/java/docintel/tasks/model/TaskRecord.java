package docintel.tasks.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable state of one submitted unit of work.
 * Transitions return new records; the store swaps them in atomically.
 */
public final class TaskRecord {
    private final String id;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final JsonNode result; // only when COMPLETED
    private final String error; // only when FAILED

    private TaskRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.result = builder.result;
        this.error = builder.error;

        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("updatedAt " + updatedAt + " is before createdAt " + createdAt);
        }
        if (status == TaskStatus.COMPLETED) {
            if (result == null || error != null) {
                throw new IllegalArgumentException("COMPLETED task needs a result and no error");
            }
        } else if (status == TaskStatus.FAILED) {
            if (error == null || error.isBlank() || result != null) {
                throw new IllegalArgumentException("FAILED task needs a non-empty error and no result");
            }
        } else if (result != null || error != null) {
            throw new IllegalArgumentException(status + " task cannot carry a result or error");
        }
    }

    /** New PENDING record created at {@code now} */
    public static TaskRecord pending(String id, Instant now) {
        return builder().id(id).status(TaskStatus.PENDING).createdAt(now).updatedAt(now).build();
    }

    public String id() {
        return id;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public JsonNode result() {
        return result;
    }

    public String error() {
        return error;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** A worker picked the task up */
    public TaskRecord toProcessing(Instant now) {
        return transition(TaskStatus.PROCESSING, now).build();
    }

    /** The work returned {@code result} */
    public TaskRecord toCompleted(JsonNode result, Instant now) {
        return transition(TaskStatus.COMPLETED, now)
                .result(Objects.requireNonNull(result, "result is required"))
                .build();
    }

    /** The work raised a failure described by {@code error} */
    public TaskRecord toFailed(String error, Instant now) {
        return transition(TaskStatus.FAILED, now).error(error).build();
    }

    /**
     * PROCESSING records whose last update is older than {@code threshold}
     * usually mean the owning worker died. Recovery is up to the caller.
     */
    public boolean isStale(Instant now, Duration threshold) {
        return status == TaskStatus.PROCESSING && updatedAt.isBefore(now.minus(threshold));
    }

    private Builder transition(TaskStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        // updatedAt never moves backwards, even if the clock does
        Instant stamp = now.isBefore(updatedAt) ? updatedAt : now;
        return toBuilder().status(next).updatedAt(stamp).result(null).error(null);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .result(result)
                .error(error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant createdAt;
        private Instant updatedAt;
        private JsonNode result;
        private String error;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRecord other))
            return false;
        return id.equals(other.id)
                && status == other.status
                && createdAt.equals(other.createdAt)
                && updatedAt.equals(other.updatedAt)
                && Objects.equals(result, other.result)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "TaskRecord{id='" + id + "', status=" + status + ", updatedAt=" + updatedAt + "}";
    }
}
