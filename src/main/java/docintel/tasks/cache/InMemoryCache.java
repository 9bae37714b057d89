package docintel.tasks.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local cache. Expired entries are dropped when read.
 */
public class InMemoryCache implements CacheBackend {

    private record Entry(JsonNode value, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryCache() {
        this(Clock.systemUTC());
    }

    public InMemoryCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (!clock.instant().isBefore(entry.expiresAt())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        lock.lock();
        try {
            entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String backend() {
        return "memory";
    }
}
