package docintel.tasks.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import docintel.tasks.api.Controller;
import docintel.tasks.api.v1.dto.StaleTasksResponse;
import docintel.tasks.api.v1.dto.SubmitTaskRequest;
import docintel.tasks.api.v1.dto.SubmitTaskResponse;
import docintel.tasks.api.v1.dto.TaskStatusResponse;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.model.TaskStatus;
import docintel.tasks.queue.TaskQueue;
import docintel.tasks.queue.TaskWork;
import docintel.tasks.server.RouterHandler;
import docintel.tasks.store.TaskStoreException;
import docintel.tasks.work.WorkRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for asynchronous tasks.
 * POST /api/v1/tasks - Submit a registered unit of work
 * GET /api/v1/tasks/stale - List PROCESSING tasks that stopped updating
 * GET /api/v1/tasks/{taskId} - Poll task status
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern SUBMIT_PATTERN = Pattern.compile("^/api/v1/tasks/?$");
    private static final Pattern STALE_PATTERN = Pattern.compile("^/api/v1/tasks/stale$");
    private static final Pattern STATUS_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskQueue taskQueue;
    private final WorkRegistry workRegistry;
    private final Duration defaultStaleThreshold;

    public TaskController(TaskQueue taskQueue, WorkRegistry workRegistry, Duration defaultStaleThreshold) {
        this.taskQueue = taskQueue;
        this.workRegistry = workRegistry;
        this.defaultStaleThreshold = defaultStaleThreshold;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SUBMIT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return STALE_PATTERN.matcher(path).matches() || STATUS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleSubmit(req);
            }

            if (STALE_PATTERN.matcher(path).matches()) {
                return handleStale(req);
            }

            Matcher statusMatcher = STATUS_PATTERN.matcher(path);
            if (statusMatcher.matches()) {
                return handleStatus(statusMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (TaskStoreException e) {
            log.warn("Task store unavailable: {}", e.getMessage());
            return ControllerResponse.unavailable("task store unavailable");
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks - returns 202 with the new task id
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        SubmitTaskRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getOriginalMessage());
        }
        request.validate();

        TaskWork work = workRegistry.find(request.work())
                .orElseThrow(() -> new IllegalArgumentException("unknown work: " + request.work()));

        String taskId = taskQueue.submit(work, request.argsArray());

        SubmitTaskResponse response = new SubmitTaskResponse(
                taskId, TaskStatus.PENDING.name(), "Task queued. Poll /api/v1/tasks/" + taskId + " for status.");
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleStatus(String taskId) throws Exception {
        Optional<TaskRecord> record = taskQueue.status(taskId);
        if (record.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(TaskStatusResponse.from(record.get())));
    }

    /**
     * GET /api/v1/tasks/stale?older_than_seconds=N
     */
    private ControllerResponse handleStale(FullHttpRequest req) throws Exception {
        Duration threshold = defaultStaleThreshold;
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("older_than_seconds");
        if (values != null && !values.isEmpty()) {
            try {
                long seconds = Long.parseLong(values.get(0));
                if (seconds < 0) {
                    throw new IllegalArgumentException("older_than_seconds must not be negative");
                }
                threshold = Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("older_than_seconds must be a number");
            }
        }

        List<TaskRecord> stale = taskQueue.findStale(threshold);
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(StaleTasksResponse.from(threshold, stale)));
    }
}
