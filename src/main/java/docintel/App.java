package docintel;

import docintel.tasks.config.Dependencies;
import docintel.tasks.config.TaskQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point: starts the task service and blocks until the JVM shuts down.
 *
 * Registers two built-in units of work that are useful for smoke tests:
 * {@code echo} returns its arguments and is memoized in the result cache,
 * {@code sleep} waits the given number of milliseconds.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        TaskQueueConfig config = TaskQueueConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        deps.registerCachedWork("echo", workArgs -> Arrays.asList(workArgs));
        deps.workRegistry()
                .register("sleep", workArgs -> {
                    long millis = workArgs.length > 0 ? ((Number) workArgs[0]).longValue() : 1000L;
                    Thread.sleep(millis);
                    return millis;
                });

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "shutdown"));

        try {
            deps.startScheduler();
            deps.startServer();
        } catch (RuntimeException e) {
            log.error("Failed to start task service", e);
            deps.close();
            System.exit(1);
        }

        log.info("Task service running on port {} ({} workers, {} task store)",
                config.serverPort(), config.maxWorkers(), deps.taskQueue().storeBackend());
        stopped.await();
    }
}
