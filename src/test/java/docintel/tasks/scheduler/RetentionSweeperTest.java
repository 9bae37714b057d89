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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the retention sweep.
 */
class RetentionSweeperTest {

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
    void sweepsOnlyTasksPastRetention() {
        store.create(TaskRecord.pending("old", clock.instant()));
        clock.advance(Duration.ofMinutes(90));
        store.create(TaskRecord.pending("recent", clock.instant()));

        RetentionSweeper sweeper = new RetentionSweeper(queue, Duration.ofHours(1));
        int removed = sweeper.sweep();

        assertEquals(1, removed);
        assertTrue(store.get("old").isEmpty());
        assertTrue(store.get("recent").isPresent());
    }

    @Test
    void unfinishedTasksAreSweptToo() {
        store.create(TaskRecord.pending("stuck", clock.instant()));
        store.update("stuck", r -> r.toProcessing(clock.instant()));
        clock.advance(Duration.ofHours(2));

        assertEquals(1, new RetentionSweeper(queue, Duration.ofHours(1)).sweep());
        assertEquals(0, store.size());
    }

    @Test
    void nothingToSweep() {
        store.create(TaskRecord.pending("fresh", clock.instant()));

        assertEquals(0, new RetentionSweeper(queue, Duration.ofHours(1)).sweep());
        assertEquals(1, store.size());
    }

    @Test
    void runNeverThrows() {
        queue.close();
        RetentionSweeper sweeper = new RetentionSweeper(queue, Duration.ofSeconds(-5));

        assertDoesNotThrow(sweeper::run);
    }
}
