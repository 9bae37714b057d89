package docintel.tasks.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.config.TaskQueueConfig;
import docintel.tasks.kv.RedisKeyValueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the cache backend from configuration.
 */
public final class Caches {

    private static final Logger log = LoggerFactory.getLogger(Caches.class);

    private Caches() {
    }

    public static ResultCache fromConfig(TaskQueueConfig config, ObjectMapper mapper) {
        CacheBackend backend;
        if (config.cacheEnabled() && config.hasRedisUrl()) {
            backend = new RedisCache(new RedisKeyValueClient(config.redisUrl(), config.redisTimeout()), mapper);
        } else {
            backend = new InMemoryCache();
            log.info("Using in-memory cache (enabled={})", config.cacheEnabled());
        }
        return new ResultCache(backend, mapper, config.cacheTtl(), config.cacheEnabled());
    }
}
