package docintel.tasks.kv;

/**
 * Failure talking to the key-value store.
 */
public class KeyValueException extends RuntimeException {

    public KeyValueException(String message) {
        super(message);
    }

    public KeyValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
