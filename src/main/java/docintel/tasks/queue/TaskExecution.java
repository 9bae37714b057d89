package docintel.tasks.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.store.TaskStore;
import docintel.tasks.store.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Runs one submitted unit of work on a pool thread and records its lifecycle:
 * PROCESSING on start, then COMPLETED with the result or FAILED with the error.
 *
 * The outcome is only visible through the task record. Nothing thrown by the work
 * leaves this runnable, except a {@link VirtualMachineError} other than a stack
 * overflow, which is rethrown after the task is marked FAILED.
 */
final class TaskExecution implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecution.class);

    private final String taskId;
    private final TaskWork work;
    private final Object[] args;
    private final TaskStore store;
    private final ObjectMapper mapper;
    private final Supplier<Instant> clock;

    TaskExecution(String taskId, TaskWork work, Object[] args, TaskStore store, ObjectMapper mapper,
            Supplier<Instant> clock) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.work = Objects.requireNonNull(work, "work cannot be null");
        this.args = args != null ? args : new Object[0];
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public void run() {
        if (!transition(record -> record.toProcessing(clock.get()))) {
            return;
        }
        log.debug("Task {} processing", taskId);

        Object value;
        try {
            value = work.execute(args);
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String error = describe(t);
            log.error("Task failed: {} - {}", taskId, error, t);
            transition(record -> record.toFailed(error, clock.get()));
            if (t instanceof VirtualMachineError vmError && !(t instanceof StackOverflowError)) {
                // already recorded as FAILED; the stack has unwound for an overflow
                throw vmError;
            }
            return;
        }

        JsonNode result;
        try {
            result = value == null ? NullNode.getInstance() : mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            String error = "Result is not serializable: " + describe(e);
            log.error("Task failed: {} - {}", taskId, error);
            transition(record -> record.toFailed(error, clock.get()));
            return;
        }

        if (transition(record -> record.toCompleted(result, clock.get()))) {
            log.info("Task completed: {}", taskId);
        }
    }

    /**
     * Apply one state change, logging instead of throwing.
     *
     * @return true if the record was updated
     */
    private boolean transition(UnaryOperator<TaskRecord> change) {
        try {
            if (store.update(taskId, change).isPresent()) {
                return true;
            }
            log.warn("Task {} no longer exists (swept or evicted), dropping its run", taskId);
        } catch (TaskStoreException e) {
            log.error("Could not record state of task {}: {}", taskId, e.getMessage(), e);
        } catch (IllegalStateException e) {
            log.error("Invalid transition for task {}: {}", taskId, e.getMessage());
        }
        return false;
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            return t.getClass().getName();
        }
        return message;
    }
}
