package docintel.tasks.store;

import com.fasterxml.jackson.databind.node.TextNode;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
    }

    @Test
    void createAndGet() {
        store.create(TaskRecord.pending("task-1", T0));

        TaskRecord found = store.get("task-1").orElseThrow();
        assertEquals(TaskStatus.PENDING, found.status());
        assertEquals(1, store.size());
        assertEquals("memory", store.backend());
        assertFalse(store.isShared());
    }

    @Test
    void getUnknownIdIsEmpty() {
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    void createRejectsDuplicateIds() {
        store.create(TaskRecord.pending("task-1", T0));
        assertThrows(IllegalStateException.class, () -> store.create(TaskRecord.pending("task-1", T0)));
    }

    @Test
    void updateAppliesMutator() {
        store.create(TaskRecord.pending("task-1", T0));

        Optional<TaskRecord> updated = store.update("task-1", r -> r.toProcessing(T0.plusSeconds(1)));

        assertTrue(updated.isPresent());
        assertEquals(TaskStatus.PROCESSING, store.get("task-1").orElseThrow().status());
    }

    @Test
    void updateOfMissingTaskIsEmpty() {
        assertTrue(store.update("missing", r -> r.toProcessing(T0)).isEmpty());
    }

    @Test
    void updateCannotChangeId() {
        store.create(TaskRecord.pending("task-1", T0));
        assertThrows(IllegalStateException.class,
                () -> store.update("task-1", r -> r.toBuilder().id("task-2").build()));
    }

    @Test
    void invalidTransitionLeavesRecordUntouched() {
        store.create(TaskRecord.pending("task-1", T0));

        assertThrows(IllegalStateException.class,
                () -> store.update("task-1", r -> r.toCompleted(TextNode.valueOf("x"), T0)));
        assertEquals(TaskStatus.PENDING, store.get("task-1").orElseThrow().status());
    }

    @Test
    void removeCreatedBeforeIsInclusiveAndIgnoresStatus() {
        store.create(TaskRecord.pending("old-pending", T0));
        store.create(TaskRecord.pending("old-running", T0.plusSeconds(10)));
        store.update("old-running", r -> r.toProcessing(T0.plusSeconds(11)));
        store.create(TaskRecord.pending("new", T0.plusSeconds(20)));

        int removed = store.removeCreatedBefore(T0.plusSeconds(10));

        assertEquals(2, removed);
        assertTrue(store.get("old-pending").isEmpty());
        assertTrue(store.get("old-running").isEmpty());
        assertTrue(store.get("new").isPresent());
    }

    @Test
    void findStaleReturnsOnlyOldProcessingTasks() {
        store.create(TaskRecord.pending("stuck", T0));
        store.update("stuck", r -> r.toProcessing(T0));
        store.create(TaskRecord.pending("fresh", T0));
        store.update("fresh", r -> r.toProcessing(T0.plusSeconds(100)));
        store.create(TaskRecord.pending("waiting", T0));

        List<TaskRecord> stale = store.findStale(T0.plusSeconds(50));

        assertEquals(1, stale.size());
        assertEquals("stuck", stale.get(0).id());
    }

    @Test
    void concurrentUpdatesAreSerialized() throws Exception {
        int threads = 8;
        for (int i = 0; i < threads; i++) {
            store.create(TaskRecord.pending("task-" + i, T0));
        }

        CountDownLatch start = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String id = "task-" + i;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                store.update(id, r -> r.toProcessing(T0));
                store.update(id, r -> r.toCompleted(TextNode.valueOf(id), T0));
            });
            workers.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : workers) {
            t.join(5000);
        }

        for (int i = 0; i < threads; i++) {
            TaskRecord record = store.get("task-" + i).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, record.status());
            assertEquals("task-" + i, record.result().asText());
        }
    }
}
