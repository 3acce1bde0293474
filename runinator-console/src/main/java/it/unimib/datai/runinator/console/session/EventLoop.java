package it.unimib.datai.runinator.console.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The single thread that owns console state. Registry updates and request completions are delivered here.
 */
public final class EventLoop implements Executor, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);
    static final String THREAD_NAME = "runinator-console-loop";

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, THREAD_NAME);
        t.setDaemon(true);
        return t;
    });

    @Override
    public void execute(Runnable command) {
        executor.execute(guarded(command));
    }

    /**
     * Runs {@code command} every {@code interval}, first after one interval. A failing run does not cancel later ones.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, Duration interval) {
        long millis = interval.toMillis();
        return executor.scheduleAtFixedRate(guarded(command), millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable command) {
        return () -> {
            try {
                command.run();
            } catch (RuntimeException e) {
                log.error("Event loop task failed: {}", e.getMessage(), e);
            }
        };
    }
}
