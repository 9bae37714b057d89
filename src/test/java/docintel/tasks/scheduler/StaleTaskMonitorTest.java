package docintel.tasks.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.MutableClock;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.queue.TaskQueue;
import docintel.tasks.store.InMemoryTaskStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaleTaskMonitorTest {

    private MutableClock clock;
    private InMemoryTaskStore store;
    private TaskQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryTaskStore();
        queue = new TaskQueue(store, 1, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void reportsProcessingTasksPastThreshold() {
        store.create(TaskRecord.pending("stuck", clock.instant()));
        store.update("stuck", r -> r.toProcessing(clock.instant()));
        store.create(TaskRecord.pending("queued", clock.instant()));
        clock.advance(Duration.ofMinutes(40));

        List<TaskRecord> stale = new StaleTaskMonitor(queue, Duration.ofMinutes(30)).check();

        assertEquals(1, stale.size());
        assertEquals("stuck", stale.get(0).id());
        // Reporting never changes the task
        assertEquals(stale.get(0), store.get("stuck").orElseThrow());
    }

    @Test
    void recentlyUpdatedTasksAreNotStale() {
        store.create(TaskRecord.pending("busy", clock.instant()));
        store.update("busy", r -> r.toProcessing(clock.instant()));
        clock.advance(Duration.ofMinutes(10));

        assertTrue(new StaleTaskMonitor(queue, Duration.ofMinutes(30)).check().isEmpty());
    }
}
