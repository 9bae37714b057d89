package docintel.tasks.scheduler;

import docintel.tasks.model.TaskRecord;
import docintel.tasks.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Reports PROCESSING tasks that have not been updated for longer than the threshold.
 *
 * A task gets stuck if its worker process dies mid-run. The monitor only reports;
 * nothing is retried or failed automatically.
 */
public class StaleTaskMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskMonitor.class);

    private final TaskQueue taskQueue;
    private final Duration threshold;

    public StaleTaskMonitor(TaskQueue taskQueue, Duration threshold) {
        this.taskQueue = taskQueue;
        this.threshold = threshold;
    }

    @Override
    public void run() {
        try {
            check();
        } catch (Exception e) {
            log.error("Stale task check error", e);
        }
    }

    /**
     * @return the stale tasks found
     */
    public List<TaskRecord> check() {
        List<TaskRecord> stale = taskQueue.findStale(threshold);
        for (TaskRecord task : stale) {
            log.warn("Task {} stuck in PROCESSING since {}", task.id(), task.updatedAt());
        }
        if (stale.isEmpty()) {
            log.debug("No stale tasks found");
        }
        return stale;
    }
}
