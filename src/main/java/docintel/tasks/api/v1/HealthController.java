package docintel.tasks.api.v1;

import docintel.tasks.api.Controller;
import docintel.tasks.api.v1.dto.HealthResponse;
import docintel.tasks.cache.ResultCache;
import docintel.tasks.config.TaskQueueConfig;
import docintel.tasks.queue.TaskQueue;
import docintel.tasks.server.RouterHandler;
import docintel.tasks.store.TaskStore;
import docintel.tasks.store.TaskStoreException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";
    private static final String PROBE_ID = "health-probe";

    private final TaskQueue taskQueue;
    private final ResultCache resultCache;
    private final TaskQueueConfig config;

    public HealthController(TaskQueue taskQueue, ResultCache resultCache, TaskQueueConfig config) {
        this.taskQueue = taskQueue;
        this.resultCache = resultCache;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        TaskStore store = taskQueue.store();
        try {
            // Round trip to the store; a miss is fine, a backend failure is not
            taskQueue.status(PROBE_ID);

            boolean degraded = config.hasRedisUrl() && !store.isShared();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    store.backend(),
                    store.isShared(),
                    degraded,
                    resultCache.backend().backend(),
                    resultCache.isEnabled(),
                    taskQueue.maxWorkers(),
                    taskQueue.activeWorkers(),
                    taskQueue.queuedTasks());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (TaskStoreException e) {
            log.warn("Health check: task store failing: {}", e.getMessage());
            return unhealthy(store.backend());
        } catch (Exception e) {
            log.error("Health check failed", e);
            return unhealthy(store.backend());
        }
    }

    private ControllerResponse unhealthy(String backend) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(backend)));
        } catch (Exception ex) {
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
