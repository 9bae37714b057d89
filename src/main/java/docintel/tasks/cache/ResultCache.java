package docintel.tasks.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import docintel.tasks.queue.TaskWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Memoizes expensive calls (answers, extraction results) in a {@link CacheBackend}.
 *
 * <pre>
 * JsonNode answer = resultCache.getOrCompute("qa", "answer", () -> qa.answer(question), question);
 * </pre>
 */
public class ResultCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final CacheBackend backend;
    private final ObjectMapper mapper;
    private final Duration ttl;
    private final boolean enabled;

    public ResultCache(CacheBackend backend, ObjectMapper mapper, Duration ttl, boolean enabled) {
        this.backend = backend;
        this.mapper = mapper;
        this.ttl = ttl;
        this.enabled = enabled;
    }

    /**
     * Return the cached value for {@code prefix:name:args}, or run {@code compute},
     * cache its result and return it. Disabled caches always compute.
     *
     * @throws Exception whatever {@code compute} throws; failures are never cached
     */
    public JsonNode getOrCompute(String prefix, String name, Callable<?> compute, Object... args) throws Exception {
        if (!enabled) {
            return toTree(compute.call());
        }

        String key = CacheKeys.of(prefix, name, args);
        Optional<JsonNode> cached = backend.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            return cached.get();
        }

        JsonNode value = toTree(compute.call());
        backend.set(key, value, ttl);
        log.debug("Cache set: {}", key);
        return value;
    }

    /**
     * Wrap a unit of work so repeated calls with equal arguments are served from the cache.
     * Keys are {@code prefix:name:md5(args)}.
     */
    public TaskWork memoize(String prefix, String name, TaskWork work) {
        return args -> getOrCompute(prefix, name, () -> work.execute(args), args);
    }

    /**
     * Drop every cached entry.
     *
     * @throws IllegalStateException if caching is disabled
     */
    public void clear() {
        if (!enabled) {
            throw new IllegalStateException("Caching is not enabled");
        }
        backend.clear();
        log.info("Cache cleared ({})", backend.backend());
    }

    private JsonNode toTree(Object value) {
        return value == null ? NullNode.getInstance() : mapper.valueToTree(value);
    }

    public CacheBackend backend() {
        return backend;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void close() {
        backend.close();
    }
}
