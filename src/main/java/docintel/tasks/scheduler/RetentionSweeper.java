package docintel.tasks.scheduler;

import docintel.tasks.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodic job that drops task records older than the retention window,
 * whatever their status. Bounds memory and Redis growth.
 */
public class RetentionSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final TaskQueue taskQueue;
    private final Duration retention;

    public RetentionSweeper(TaskQueue taskQueue, Duration retention) {
        this.taskQueue = taskQueue;
        this.retention = retention;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Retention sweep error", e);
        }
    }

    /**
     * Remove tasks created more than the retention window ago.
     *
     * @return number of tasks removed
     */
    public int sweep() {
        int removed = taskQueue.cleanup(retention);
        if (removed > 0) {
            log.info("Retention sweep removed {} tasks older than {}", removed, retention);
        } else {
            log.debug("Retention sweep found nothing older than {}", retention);
        }
        return removed;
    }
}
