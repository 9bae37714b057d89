package docintel.tasks.store;

import docintel.tasks.model.TaskRecord;
import docintel.tasks.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Process-local task store.
 * A single lock guards the whole map, so every operation is serialized.
 * Grows without bound unless the retention sweep runs.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final Map<String, TaskRecord> tasks = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void create(TaskRecord record) {
        Objects.requireNonNull(record, "record is required");
        lock.lock();
        try {
            if (tasks.containsKey(record.id())) {
                throw new IllegalStateException("Task already exists: " + record.id());
            }
            tasks.put(record.id(), record);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TaskRecord> update(String taskId, UnaryOperator<TaskRecord> mutator) {
        lock.lock();
        try {
            TaskRecord current = tasks.get(taskId);
            if (current == null) {
                return Optional.empty();
            }
            TaskRecord updated = mutator.apply(current);
            if (!current.id().equals(updated.id())) {
                throw new IllegalStateException("Task id cannot change: " + current.id() + " -> " + updated.id());
            }
            tasks.put(taskId, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TaskRecord> get(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String taskId) {
        lock.lock();
        try {
            return tasks.remove(taskId) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int removeCreatedBefore(Instant cutoff) {
        int removed = 0;
        lock.lock();
        try {
            for (Iterator<TaskRecord> it = tasks.values().iterator(); it.hasNext();) {
                if (!it.next().createdAt().isAfter(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("Removed {} in-memory tasks created before {}", removed, cutoff);
        return removed;
    }

    @Override
    public List<TaskRecord> findStale(Instant updatedBefore) {
        List<TaskRecord> stale = new ArrayList<>();
        lock.lock();
        try {
            for (TaskRecord record : tasks.values()) {
                if (record.status() == TaskStatus.PROCESSING && record.updatedAt().isBefore(updatedBefore)) {
                    stale.add(record);
                }
            }
        } finally {
            lock.unlock();
        }
        return stale;
    }

    /** Number of records currently held */
    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String backend() {
        return "memory";
    }

    @Override
    public boolean isShared() {
        return false;
    }
}
