package docintel.tasks.kv;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal view of an external key-value store.
 * Every method throws {@link KeyValueException} when the backend fails.
 */
public interface KeyValueClient extends AutoCloseable {

    /** Liveness check; throws if the store cannot be reached */
    void ping();

    /** Set the given fields of a hash, leaving other fields untouched */
    void putHash(String key, Map<String, String> fields);

    /**
     * Atomically replace all fields of an existing hash.
     *
     * @return false, writing nothing, if the key does not exist
     */
    boolean replaceHash(String key, Map<String, String> fields);

    /** All fields of a hash; empty if the key does not exist */
    Map<String, String> getHash(String key);

    Optional<String> get(String key);

    /** Set a plain value that expires after {@code ttl} */
    void set(String key, String value, Duration ttl);

    /** @return true if the key existed */
    boolean delete(String key);

    /** Keys matching a glob pattern, walked incrementally */
    List<String> scan(String pattern);

    /** Human-readable endpoint, never including credentials */
    String endpoint();

    @Override
    void close();
}
