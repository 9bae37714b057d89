package docintel.tasks.work;

import docintel.tasks.queue.TaskWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named units of work that can be submitted by name, e.g. from the HTTP API.
 * Work should be registered during application startup.
 */
public class WorkRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkRegistry.class);

    private final Map<String, TaskWork> works = new ConcurrentHashMap<>();

    /**
     * Register a unit of work under a name, replacing any previous one.
     *
     * @throws IllegalArgumentException if the name is blank or the work is null
     */
    public WorkRegistry register(String name, TaskWork work) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("work name cannot be blank");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (works.put(name, work) != null) {
            log.warn("Replaced work registered as '{}'", name);
        } else {
            log.info("Registered work '{}'", name);
        }
        return this;
    }

    public Optional<TaskWork> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(works.get(name));
    }

    /** Registered names, sorted */
    public Set<String> names() {
        return new TreeSet<>(works.keySet());
    }
}
