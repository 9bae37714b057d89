package docintel.tasks.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.api.v1.CacheController;
import docintel.tasks.api.v1.HealthController;
import docintel.tasks.api.v1.TaskController;
import docintel.tasks.cache.Caches;
import docintel.tasks.cache.ResultCache;
import docintel.tasks.queue.TaskQueue;
import docintel.tasks.queue.TaskWork;
import docintel.tasks.scheduler.Scheduler;
import docintel.tasks.server.HttpServer;
import docintel.tasks.server.RouterHandler;
import docintel.tasks.store.TaskStore;
import docintel.tasks.store.TaskStores;
import docintel.tasks.work.WorkRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the task store, queue, cache and HTTP surface.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(TaskQueueConfig.fromEnv());
 * deps.workRegistry().register("echo", args -> args);
 * deps.registerCachedWork("summary", args -> summarize(args)); // memoized
 * deps.startScheduler(); // retention sweep and stale check
 * deps.startServer();    // HTTP API
 * // ...
 * deps.close();          // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final TaskQueueConfig config;
    private final ObjectMapper mapper;
    private final TaskStore taskStore;
    private final TaskQueue taskQueue;
    private final ResultCache resultCache;
    private final WorkRegistry workRegistry;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final CacheController cacheController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    // HTTP server (lazy-initialized)
    private HttpServer httpServer;

    private Dependencies(TaskQueueConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.mapper = RouterHandler.mapper();

        // Core
        this.taskStore = TaskStores.fromConfig(config, mapper);
        this.taskQueue = new TaskQueue(taskStore, config.maxWorkers(), mapper, Clock.systemUTC());
        this.resultCache = Caches.fromConfig(config, mapper);
        this.workRegistry = new WorkRegistry();

        // Controllers (public API)
        this.healthController = new HealthController(taskQueue, resultCache, config);
        this.taskController = new TaskController(taskQueue, workRegistry, config.staleThreshold());
        this.cacheController = new CacheController(resultCache);

        log.info("Dependencies initialized successfully (task store: {})", taskStore.backend());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(TaskQueueConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(TaskQueueConfig.fromEnv());
    }

    // Getters
    public TaskQueueConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    public ResultCache resultCache() {
        return resultCache;
    }

    public WorkRegistry workRegistry() {
        return workRegistry;
    }

    public HealthController healthController() {
        return healthController;
    }

    public TaskController taskController() {
        return taskController;
    }

    public CacheController cacheController() {
        return cacheController;
    }

    /**
     * Register work whose results are memoized in the result cache, keyed by its arguments.
     */
    public Dependencies registerCachedWork(String name, TaskWork work) {
        workRegistry.register(name, resultCache.memoize("work", name, work));
        return this;
    }

    /**
     * Get or create the router handler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(cacheController);
        }
        return routerHandler;
    }

    /**
     * Start background maintenance (retention sweep, stale check).
     */
    public synchronized void startScheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(taskQueue, config);
        }
        scheduler.start();
    }

    /**
     * Start the HTTP server on the configured host and port.
     */
    public synchronized void startServer() {
        if (httpServer == null) {
            httpServer = new HttpServer(routerHandler(), config.serverHost(), config.serverPort());
        }
        httpServer.start();
    }

    public synchronized Scheduler scheduler() {
        return scheduler;
    }

    public synchronized HttpServer httpServer() {
        return httpServer;
    }

    /**
     * Shutdown all resources.
     */
    @Override
    public synchronized void close() {
        log.info("Shutting down dependencies...");

        if (httpServer != null) {
            httpServer.stop();
        }
        if (scheduler != null) {
            scheduler.stop();
        }
        taskQueue.close();
        taskStore.close();
        resultCache.close();

        log.info("Dependencies shutdown complete");
    }
}
