package docintel.tasks.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.kv.KeyValueClient;
import docintel.tasks.kv.KeyValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache kept in Redis under the {@code cache:} prefix, values stored as JSON text.
 *
 * Falls back to an {@link InMemoryCache} if Redis does not answer at construction.
 * Later Redis failures degrade to a miss (or a skipped write); each one is logged
 * and counted in {@link #errorCount()}.
 */
public class RedisCache implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisCache.class);

    static final String KEY_PREFIX = "cache:";

    private final KeyValueClient client; // null once degraded
    private final InMemoryCache fallback; // null while connected
    private final ObjectMapper mapper;
    private final AtomicLong errors = new AtomicLong();

    public RedisCache(KeyValueClient client, ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        KeyValueClient connected = Objects.requireNonNull(client, "client is required");
        InMemoryCache local = null;
        try {
            client.ping();
            log.info("Redis cache connected to {}", client.endpoint());
        } catch (KeyValueException e) {
            log.warn("Redis cache {} unavailable, falling back to in-memory: {}", client.endpoint(), e.getMessage());
            client.close();
            connected = null;
            local = new InMemoryCache();
        }
        this.client = connected;
        this.fallback = local;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        if (fallback != null) {
            return fallback.get(key);
        }
        try {
            Optional<String> raw = client.get(KEY_PREFIX + key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(mapper.readTree(raw.get()));
        } catch (KeyValueException e) {
            recordError("get", key, e);
        } catch (JsonProcessingException e) {
            recordError("get", key, e);
            delete(key);
        }
        return Optional.empty();
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        if (fallback != null) {
            fallback.set(key, value, ttl);
            return;
        }
        try {
            client.set(KEY_PREFIX + key, mapper.writeValueAsString(value), ttl);
        } catch (KeyValueException | JsonProcessingException e) {
            recordError("set", key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (fallback != null) {
            fallback.delete(key);
            return;
        }
        try {
            client.delete(KEY_PREFIX + key);
        } catch (KeyValueException e) {
            recordError("delete", key, e);
        }
    }

    /** Removes only {@code cache:*} keys; task records in the same database are kept. */
    @Override
    public void clear() {
        if (fallback != null) {
            fallback.clear();
            return;
        }
        try {
            for (String key : client.scan(KEY_PREFIX + "*")) {
                client.delete(key);
            }
        } catch (KeyValueException e) {
            recordError("clear", "*", e);
        }
    }

    /** Number of Redis operations that failed since construction */
    public long errorCount() {
        return errors.get();
    }

    public boolean isDegraded() {
        return fallback != null;
    }

    @Override
    public String backend() {
        return fallback != null ? "memory-fallback" : "redis";
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }

    private void recordError(String operation, String key, Exception e) {
        errors.incrementAndGet();
        log.warn("Cache {} error - key: {}, error: {}", operation, key, e.getMessage());
    }
}
