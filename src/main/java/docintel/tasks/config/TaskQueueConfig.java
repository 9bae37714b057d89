package docintel.tasks.config;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration holder for the task service.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from the environment.
 */
public final class TaskQueueConfig {

    private static final int MAX_PORT = 65535;

    // Shared store (optional). Absent means process-local task state.
    private String redisUrl = null;
    private Duration redisTimeout = Duration.ofSeconds(2);

    // Worker pool
    private int maxWorkers = 4;

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";

    // Maintenance
    private Duration taskRetention = Duration.ofHours(1);
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private Duration staleThreshold = Duration.ofMinutes(30);
    private Duration staleCheckInterval = Duration.ofMinutes(1);

    // Result cache
    private boolean cacheEnabled = true;
    private Duration cacheTtl = Duration.ofSeconds(300);

    private TaskQueueConfig() {
    }

    public static TaskQueueConfig defaults() {
        return new TaskQueueConfig();
    }

    public static TaskQueueConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Build config from an arbitrary variable lookup (used by tests).
     *
     * @throws IllegalArgumentException if a numeric variable is not a valid number
     */
    public static TaskQueueConfig fromEnv(Function<String, String> env) {
        TaskQueueConfig config = new TaskQueueConfig();

        String redisUrl = env.apply("REDIS_URL");
        if (redisUrl != null && !redisUrl.isBlank()) {
            config.redisUrl = redisUrl.trim();
        }

        String timeout = env.apply("REDIS_TIMEOUT_MS");
        if (timeout != null && !timeout.isBlank()) {
            config.redisTimeout = Duration.ofMillis(positive("REDIS_TIMEOUT_MS", timeout));
        }

        String workers = env.apply("MAX_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.maxWorkers = positiveInt("MAX_WORKERS", workers, Integer.MAX_VALUE);
        }

        String port = env.apply("PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = positiveInt("PORT", port, MAX_PORT);
        }

        String retention = env.apply("TASK_RETENTION_SECONDS");
        if (retention != null && !retention.isBlank()) {
            config.taskRetention = Duration.ofSeconds(positive("TASK_RETENTION_SECONDS", retention));
        }

        String cleanup = env.apply("CLEANUP_INTERVAL_SECONDS");
        if (cleanup != null && !cleanup.isBlank()) {
            config.cleanupInterval = Duration.ofSeconds(positive("CLEANUP_INTERVAL_SECONDS", cleanup));
        }

        String stale = env.apply("STALE_THRESHOLD_SECONDS");
        if (stale != null && !stale.isBlank()) {
            config.staleThreshold = Duration.ofSeconds(positive("STALE_THRESHOLD_SECONDS", stale));
        }

        String cacheTtl = env.apply("CACHE_TTL");
        if (cacheTtl != null && !cacheTtl.isBlank()) {
            config.cacheTtl = Duration.ofSeconds(positive("CACHE_TTL", cacheTtl));
        }

        String cacheEnabled = env.apply("CACHE_ENABLED");
        if (cacheEnabled != null && !cacheEnabled.isBlank()) {
            config.cacheEnabled = "true".equalsIgnoreCase(cacheEnabled.trim());
        }

        return config;
    }

    private static long positive(String name, String value) {
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + value + "'", e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + parsed);
        }
        return parsed;
    }

    private static int positiveInt(String name, String value, int max) {
        long parsed = positive(name, value);
        if (parsed > max) {
            throw new IllegalArgumentException(name + " must be at most " + max + ", got " + parsed);
        }
        return (int) parsed;
    }

    // Getters
    public String redisUrl() {
        return redisUrl;
    }

    public boolean hasRedisUrl() {
        return redisUrl != null && !redisUrl.isBlank();
    }

    public Duration redisTimeout() {
        return redisTimeout;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration taskRetention() {
        return taskRetention;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    public Duration staleCheckInterval() {
        return staleCheckInterval;
    }

    public boolean cacheEnabled() {
        return cacheEnabled;
    }

    public Duration cacheTtl() {
        return cacheTtl;
    }

    // Fluent setters for testing/customization
    public TaskQueueConfig withRedisUrl(String url) {
        this.redisUrl = url;
        return this;
    }

    public TaskQueueConfig withRedisTimeout(Duration timeout) {
        this.redisTimeout = timeout;
        return this;
    }

    public TaskQueueConfig withMaxWorkers(int maxWorkers) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive");
        }
        this.maxWorkers = maxWorkers;
        return this;
    }

    public TaskQueueConfig withServerPort(int port) {
        if (port <= 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("port must be between 1 and " + MAX_PORT);
        }
        this.serverPort = port;
        return this;
    }

    public TaskQueueConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public TaskQueueConfig withTaskRetention(Duration retention) {
        this.taskRetention = retention;
        return this;
    }

    public TaskQueueConfig withCleanupInterval(Duration interval) {
        this.cleanupInterval = interval;
        return this;
    }

    public TaskQueueConfig withStaleThreshold(Duration threshold) {
        this.staleThreshold = threshold;
        return this;
    }

    public TaskQueueConfig withStaleCheckInterval(Duration interval) {
        this.staleCheckInterval = interval;
        return this;
    }

    public TaskQueueConfig withCacheEnabled(boolean enabled) {
        this.cacheEnabled = enabled;
        return this;
    }

    public TaskQueueConfig withCacheTtl(Duration ttl) {
        this.cacheTtl = ttl;
        return this;
    }

    @Override
    public String toString() {
        return "TaskQueueConfig{" +
                "redisUrlSet=" + hasRedisUrl() +
                ", maxWorkers=" + maxWorkers +
                ", serverPort=" + serverPort +
                ", taskRetention=" + taskRetention +
                ", cacheEnabled=" + cacheEnabled +
                '}';
    }
}
