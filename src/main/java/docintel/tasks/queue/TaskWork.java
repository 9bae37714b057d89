package docintel.tasks.queue;

/**
 * A unit of work run by the task queue.
 * The returned value becomes the task result; any exception marks the task FAILED.
 */
@FunctionalInterface
public interface TaskWork {

    Object execute(Object... args) throws Exception;
}
