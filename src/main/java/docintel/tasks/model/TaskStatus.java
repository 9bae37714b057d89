package docintel.tasks.model;

import java.util.Locale;

/**
 * Task lifecycle status.
 * PENDING -> PROCESSING -> COMPLETED | FAILED, never backwards.
 */
public enum TaskStatus {
    /** Task submitted, no worker has started it yet */
    PENDING,
    /** A worker is executing the task */
    PROCESSING,
    /** Task returned normally, result is set */
    COMPLETED,
    /** Task raised a failure, error is set */
    FAILED;

    /** Check if status is terminal (no further transitions) */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if a record in this status may move to {@code next}.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * Parse a stored status name.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
