package docintel.tasks.store;

import docintel.tasks.model.TaskRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for task records.
 * Implementations keep records in process memory or in a shared key-value store.
 */
public interface TaskStore extends AutoCloseable {

    /**
     * Store a new record.
     *
     * @param record the initial record, normally PENDING
     * @throws IllegalStateException if a record with the same id exists
     * @throws TaskStoreException    if the backend cannot be reached
     */
    void create(TaskRecord record);

    /**
     * Atomically replace a record with {@code mutator.apply(current)}.
     *
     * @param taskId  the task id
     * @param mutator state change, may throw {@link IllegalStateException} on an invalid transition
     * @return the updated record, or empty if the task is unknown
     */
    Optional<TaskRecord> update(String taskId, UnaryOperator<TaskRecord> mutator);

    /**
     * Find a record by id.
     *
     * @param taskId the task id
     * @return the record, or empty if never stored or already removed
     */
    Optional<TaskRecord> get(String taskId);

    /**
     * Explicitly evict one record.
     *
     * @return true if a record was removed
     */
    boolean delete(String taskId);

    /**
     * Remove every record created at or before {@code cutoff}, whatever its status.
     *
     * @return number of records removed
     */
    int removeCreatedBefore(Instant cutoff);

    /**
     * Find PROCESSING records not updated since {@code updatedBefore}.
     */
    List<TaskRecord> findStale(Instant updatedBefore);

    /** Short backend name for logs and health output */
    String backend();

    /** True if other processes see the same records */
    boolean isShared();

    @Override
    default void close() {
    }
}
