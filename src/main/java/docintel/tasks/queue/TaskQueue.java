package docintel.tasks.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous task queue: runs submitted work on a fixed worker pool and
 * tracks each task in a {@link TaskStore} under a random id.
 *
 * <pre>
 * TaskQueue queue = new TaskQueue(new InMemoryTaskStore(), 4);
 * String id = queue.submit(args -> Map.of("n", 42));
 * queue.status(id).map(TaskRecord::status); // PENDING, PROCESSING, COMPLETED
 * </pre>
 *
 * The queue does not own the store; whoever built the store closes it.
 */
public class TaskQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final TaskStore store;
    private final ThreadPoolExecutor executor;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int maxWorkers;

    public TaskQueue(TaskStore store, int maxWorkers) {
        this(store, maxWorkers, new ObjectMapper().findAndRegisterModules(), Clock.systemUTC());
    }

    public TaskQueue(TaskStore store, int maxWorkers, ObjectMapper mapper, Clock clock) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive, got " + maxWorkers);
        }
        this.store = Objects.requireNonNull(store, "store is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.maxWorkers = maxWorkers;

        AtomicInteger threadIds = new AtomicInteger(1);
        this.executor = new ThreadPoolExecutor(
                maxWorkers, maxWorkers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), // unbounded: submit never waits for a free slot
                r -> {
                    Thread t = new Thread(r, "task-worker-" + threadIds.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                });

        log.info("TaskQueue initialized with {} workers ({} store)", maxWorkers, store.backend());
    }

    /**
     * Submit work for asynchronous execution.
     * The PENDING record is stored before this method returns.
     *
     * @param work the unit of work
     * @param args arguments passed to {@link TaskWork#execute(Object...)}
     * @return the new task id
     * @throws IllegalStateException if the queue has been closed
     */
    public String submit(TaskWork work, Object... args) {
        Objects.requireNonNull(work, "work is required");
        if (executor.isShutdown()) {
            throw new IllegalStateException("TaskQueue is closed");
        }

        String taskId = UUID.randomUUID().toString();
        store.create(TaskRecord.pending(taskId, now()));
        try {
            executor.execute(new TaskExecution(taskId, work, args, store, mapper, this::now));
        } catch (RejectedExecutionException e) {
            store.delete(taskId);
            throw new IllegalStateException("TaskQueue is closed", e);
        }

        log.info("Task submitted: {}", taskId);
        return taskId;
    }

    /**
     * Submit a callable that takes no arguments.
     */
    public String submit(Callable<?> work) {
        Objects.requireNonNull(work, "work is required");
        return submit(args -> work.call());
    }

    /**
     * Current record for a task.
     *
     * @return the record, or empty if the id was never submitted or has been swept
     */
    public Optional<TaskRecord> status(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return Optional.empty();
        }
        return store.get(taskId);
    }

    /**
     * Remove every task created at least {@code maxAge} ago, whatever its status.
     * Not scheduled by the queue itself.
     *
     * @return number of tasks removed
     */
    public int cleanup(Duration maxAge) {
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative");
        }
        int removed = store.removeCreatedBefore(now().minus(maxAge));
        log.info("Cleaned up {} old tasks", removed);
        return removed;
    }

    /**
     * PROCESSING tasks whose last update is older than {@code threshold}.
     * Usually a sign of a crashed worker; recovery is left to the caller.
     */
    public List<TaskRecord> findStale(Duration threshold) {
        return store.findStale(now().minus(threshold));
    }

    /** Remove one task record explicitly */
    public boolean evict(String taskId) {
        return store.delete(taskId);
    }

    /** Approximate number of workers currently running a task */
    public int activeWorkers() {
        return executor.getActiveCount();
    }

    /** Approximate number of tasks waiting for a free worker */
    public int queuedTasks() {
        return executor.getQueue().size();
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public TaskStore store() {
        return store;
    }

    /** Name of the backend holding task state, e.g. "memory" or "redis" */
    public String storeBackend() {
        return store.backend();
    }

    /**
     * Stop accepting work and wait briefly for running tasks.
     */
    @Override
    public void close() {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("TaskQueue forcefully stopped with tasks still running");
            } else {
                log.info("TaskQueue stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
