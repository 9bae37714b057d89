package docintel.tasks.scheduler;

import docintel.tasks.config.TaskQueueConfig;
import docintel.tasks.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background maintenance for the task queue:
 * - RetentionSweeper: drops records past the retention window
 * - StaleTaskMonitor: reports PROCESSING tasks that stopped updating
 *
 * Uses a single-threaded executor so the jobs never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final RetentionSweeper retentionSweeper;
    private final StaleTaskMonitor staleTaskMonitor;
    private final TaskQueueConfig config;

    private volatile boolean running = false;

    public Scheduler(TaskQueue taskQueue, TaskQueueConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.retentionSweeper = new RetentionSweeper(taskQueue, config.taskRetention());
        this.staleTaskMonitor = new StaleTaskMonitor(taskQueue, config.staleThreshold());
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long cleanupIntervalMs = config.cleanupInterval().toMillis();
        executor.scheduleAtFixedRate(retentionSweeper, cleanupIntervalMs, cleanupIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Retention sweep scheduled every {}ms (retention {})", cleanupIntervalMs, config.taskRetention());

        long staleIntervalMs = config.staleCheckInterval().toMillis();
        executor.scheduleAtFixedRate(staleTaskMonitor, staleIntervalMs, staleIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Stale task check scheduled every {}ms (threshold {})", staleIntervalMs, config.staleThreshold());

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** For a manual sweep outside the schedule */
    public RetentionSweeper retentionSweeper() {
        return retentionSweeper;
    }

    public StaleTaskMonitor staleTaskMonitor() {
        return staleTaskMonitor;
    }
}
