package docintel.tasks.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache for JSON results with per-entry expiry.
 */
public interface CacheBackend extends AutoCloseable {

    /**
     * @return the cached value, or empty on a miss or an expired entry
     */
    Optional<JsonNode> get(String key);

    void set(String key, JsonNode value, Duration ttl);

    void delete(String key);

    /** Drop every entry owned by this cache */
    void clear();

    /** Short backend name for logs and health output */
    String backend();

    @Override
    default void close() {
    }
}
