package io.docsync.client.autosave;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The single thread an {@link AutosaveCoordinator} runs on.
 * <p>
 * Implementations must run tasks one at a time, in submission order for
 * {@link #execute} and in due-time order for {@link #schedule}.
 */
public interface TaskScheduler {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    void shutdown();

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }

    /** Daemon single-thread scheduler named after the document. */
    static TaskScheduler singleThread(String name) {
        ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        return new TaskScheduler() {
            @Override
            public void execute(Runnable task) {
                exec.execute(task);
            }

            @Override
            public Cancellable schedule(Runnable task, Duration delay) {
                ScheduledFuture<?> f = exec.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
                return () -> f.cancel(false);
            }

            @Override
            public void shutdown() {
                exec.shutdown();
            }
        };
    }
}
