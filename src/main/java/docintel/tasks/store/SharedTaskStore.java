package docintel.tasks.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import docintel.tasks.kv.KeyValueClient;
import docintel.tasks.kv.KeyValueException;
import docintel.tasks.model.TaskRecord;
import docintel.tasks.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Task store kept in an external key-value store so several processes see the same tasks.
 *
 * Each task is a hash under {@code task:{id}} with one text field per attribute.
 * If the store does not answer a ping at construction, every call is delegated to an
 * embedded {@link InMemoryTaskStore} for the rest of the process lifetime.
 *
 * Updates are written only if the hash still exists, so a record swept or evicted
 * mid-update stays gone. There is no cross-process locking otherwise: concurrent
 * writers to one task are last-write-wins. Only the worker that owns a task transitions it.
 */
public class SharedTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(SharedTaskStore.class);

    static final String KEY_PREFIX = "task:";
    static final String FIELD_ID = "id";
    static final String FIELD_STATUS = "status";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_UPDATED_AT = "updated_at";
    static final String FIELD_RESULT = "result";
    static final String FIELD_ERROR = "error";

    private final KeyValueClient client; // null once degraded
    private final InMemoryTaskStore fallback; // null while shared
    private final ObjectMapper mapper;

    public SharedTaskStore(KeyValueClient client, ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        Objects.requireNonNull(client, "client is required");

        KeyValueClient connected = client;
        InMemoryTaskStore local = null;
        try {
            client.ping();
            log.info("Shared task store connected to {}", client.endpoint());
        } catch (KeyValueException e) {
            log.warn("Shared task store {} unavailable, falling back to in-memory store. "
                    + "Tasks will not be visible to other processes: {}", client.endpoint(), e.getMessage());
            client.close();
            connected = null;
            local = new InMemoryTaskStore();
        }
        this.client = connected;
        this.fallback = local;
    }

    /** True if the store fell back to process memory at construction */
    public boolean isDegraded() {
        return fallback != null;
    }

    @Override
    public void create(TaskRecord record) {
        if (fallback != null) {
            fallback.create(record);
            return;
        }
        String key = key(record.id());
        try {
            if (!client.getHash(key).isEmpty()) {
                throw new IllegalStateException("Task already exists: " + record.id());
            }
            client.putHash(key, encode(record));
        } catch (KeyValueException e) {
            throw failure("create", record.id(), e);
        }
    }

    @Override
    public Optional<TaskRecord> update(String taskId, UnaryOperator<TaskRecord> mutator) {
        if (fallback != null) {
            return fallback.update(taskId, mutator);
        }
        String key = key(taskId);
        try {
            Map<String, String> fields = client.getHash(key);
            if (fields.isEmpty()) {
                return Optional.empty();
            }
            TaskRecord current = decode(taskId, fields);
            TaskRecord updated = mutator.apply(current);
            if (!current.id().equals(updated.id())) {
                throw new IllegalStateException("Task id cannot change: " + current.id() + " -> " + updated.id());
            }
            if (!client.replaceHash(key, encode(updated))) {
                log.debug("Task {} removed while being updated, dropping the update", taskId);
                return Optional.empty();
            }
            return Optional.of(updated);
        } catch (KeyValueException e) {
            throw failure("update", taskId, e);
        }
    }

    @Override
    public Optional<TaskRecord> get(String taskId) {
        if (fallback != null) {
            return fallback.get(taskId);
        }
        try {
            Map<String, String> fields = client.getHash(key(taskId));
            if (fields.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(decode(taskId, fields));
        } catch (KeyValueException e) {
            throw failure("get", taskId, e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        if (fallback != null) {
            return fallback.delete(taskId);
        }
        try {
            return client.delete(key(taskId));
        } catch (KeyValueException e) {
            throw failure("delete", taskId, e);
        }
    }

    @Override
    public int removeCreatedBefore(Instant cutoff) {
        if (fallback != null) {
            return fallback.removeCreatedBefore(cutoff);
        }
        int removed = 0;
        try {
            for (String key : client.scan(KEY_PREFIX + "*")) {
                String createdAt = client.getHash(key).get(FIELD_CREATED_AT);
                if (createdAt == null) {
                    continue; // removed concurrently
                }
                Instant created;
                try {
                    created = parseInstant(createdAt, key);
                } catch (IllegalStateException e) {
                    log.warn("Skipping {} during cleanup: {}", key, e.getMessage());
                    continue;
                }
                if (!created.isAfter(cutoff) && client.delete(key)) {
                    removed++;
                }
            }
        } catch (KeyValueException e) {
            throw failure("removeCreatedBefore", "*", e);
        }
        return removed;
    }

    @Override
    public List<TaskRecord> findStale(Instant updatedBefore) {
        if (fallback != null) {
            return fallback.findStale(updatedBefore);
        }
        List<TaskRecord> stale = new ArrayList<>();
        try {
            for (String key : client.scan(KEY_PREFIX + "*")) {
                Map<String, String> fields = client.getHash(key);
                if (fields.isEmpty() || !TaskStatus.PROCESSING.name().equals(fields.get(FIELD_STATUS))) {
                    continue;
                }
                TaskRecord record;
                try {
                    record = decode(key.substring(KEY_PREFIX.length()), fields);
                } catch (IllegalStateException | IllegalArgumentException e) {
                    log.warn("Skipping {} during stale check: {}", key, e.getMessage());
                    continue;
                }
                if (record.updatedAt().isBefore(updatedBefore)) {
                    stale.add(record);
                }
            }
        } catch (KeyValueException e) {
            throw failure("findStale", "*", e);
        }
        return stale;
    }

    @Override
    public String backend() {
        return fallback != null ? "memory-fallback" : "redis";
    }

    @Override
    public boolean isShared() {
        return fallback == null;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }

    static String key(String taskId) {
        return KEY_PREFIX + taskId;
    }

    Map<String, String> encode(TaskRecord record) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_ID, record.id());
        fields.put(FIELD_STATUS, record.status().name());
        fields.put(FIELD_CREATED_AT, Long.toString(record.createdAt().toEpochMilli()));
        fields.put(FIELD_UPDATED_AT, Long.toString(record.updatedAt().toEpochMilli()));
        if (record.result() != null) {
            try {
                fields.put(FIELD_RESULT, mapper.writeValueAsString(record.result()));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Result of task " + record.id() + " is not serializable", e);
            }
        }
        if (record.error() != null) {
            fields.put(FIELD_ERROR, record.error());
        }
        return fields;
    }

    TaskRecord decode(String taskId, Map<String, String> fields) {
        String key = key(taskId);
        TaskRecord.Builder builder = TaskRecord.builder()
                .id(fields.getOrDefault(FIELD_ID, taskId))
                .status(TaskStatus.parse(fields.get(FIELD_STATUS)))
                .createdAt(parseInstant(fields.get(FIELD_CREATED_AT), key))
                .updatedAt(parseInstant(fields.get(FIELD_UPDATED_AT), key))
                .error(fields.get(FIELD_ERROR));

        String result = fields.get(FIELD_RESULT);
        if (result != null) {
            try {
                builder.result(mapper.readTree(result));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt result field in " + key, e);
            }
        }
        return builder.build();
    }

    private static Instant parseInstant(String millis, String key) {
        if (millis == null) {
            throw new IllegalStateException("Missing timestamp in " + key);
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(millis.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Corrupt timestamp '" + millis + "' in " + key, e);
        }
    }

    private TaskStoreException failure(String operation, String taskId, KeyValueException e) {
        log.warn("Shared task store {} failed for task {}: {}", operation, taskId, e.getMessage());
        return new TaskStoreException("Task store " + operation + " failed for " + taskId, e);
    }
}
