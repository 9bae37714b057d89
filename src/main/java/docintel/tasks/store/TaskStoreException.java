package docintel.tasks.store;

/**
 * Raised when the task store backend fails after construction.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
