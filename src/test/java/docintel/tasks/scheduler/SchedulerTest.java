package docintel.tasks.scheduler;

import docintel.tasks.config.TaskQueueConfig;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.queue.TaskQueue;
import docintel.tasks.store.InMemoryTaskStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    @Test
    void periodicSweepRemovesExpiredTasks() throws Exception {
        InMemoryTaskStore store = new InMemoryTaskStore();
        TaskQueue queue = new TaskQueue(store, 1);
        TaskQueueConfig config = TaskQueueConfig.defaults()
                .withTaskRetention(Duration.ofMillis(1))
                .withCleanupInterval(Duration.ofMillis(50));

        store.create(TaskRecord.pending("expired", Instant.now().minusSeconds(60)));

        try (Scheduler scheduler = new Scheduler(queue, config)) {
            scheduler.start();
            assertTrue(scheduler.isRunning());

            long deadline = System.currentTimeMillis() + 5000;
            while (store.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(0, store.size());
        } finally {
            queue.close();
        }
    }

    @Test
    void stopIsIdempotent() {
        TaskQueue queue = new TaskQueue(new InMemoryTaskStore(), 1);
        Scheduler scheduler = new Scheduler(queue, TaskQueueConfig.defaults());

        scheduler.start();
        scheduler.stop();
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        queue.close();
    }
}
