package docintel.tasks.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.config.TaskQueueConfig;
import docintel.tasks.kv.RedisKeyValueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the task store backend from configuration.
 */
public final class TaskStores {

    private static final Logger log = LoggerFactory.getLogger(TaskStores.class);

    private TaskStores() {
    }

    /**
     * Shared store when a Redis URL is configured, in-memory store otherwise.
     * An unreachable Redis never fails here; the shared store falls back instead.
     */
    public static TaskStore fromConfig(TaskQueueConfig config, ObjectMapper mapper) {
        if (!config.hasRedisUrl()) {
            log.info("No shared store configured, using in-memory task store");
            return new InMemoryTaskStore();
        }
        return new SharedTaskStore(new RedisKeyValueClient(config.redisUrl(), config.redisTimeout()), mapper);
    }
}
