package io.github.flameyossnowy.skeletal.api.tasks;

import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks asynchronously on a {@link ScheduledExecutorService}. A failed task is rescheduled
 * with exponential back-off until it runs out of attempts. Pending retries are lost on shutdown.
 */
public class ExecutorTaskQueue implements TaskQueue, AutoCloseable {
    private final ScheduledExecutorService executor;
    private final int maxAttempts;
    private final Duration backoff;
    private final boolean ownsExecutor;
    private volatile TaskDispatcher dispatcher;

    /**
     * Creates a queue running on its own daemon thread, with attempts and back-off taken from
     * {@code config}.
     */
    public ExecutorTaskQueue(@NotNull SkeletalConfig config) {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "skeletal-tasks");
            thread.setDaemon(true);
            return thread;
        }), config.maxTaskAttempts(), config.retryBackoff(), true);
    }

    /**
     * Creates a queue on a caller-managed executor; {@link #close()} leaves it running.
     */
    public ExecutorTaskQueue(@NotNull ScheduledExecutorService executor, int maxAttempts, @NotNull Duration backoff) {
        this(executor, maxAttempts, backoff, false);
    }

    private ExecutorTaskQueue(ScheduledExecutorService executor, int maxAttempts, Duration backoff, boolean ownsExecutor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.executor = executor;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public void bind(@NotNull TaskDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void enqueue(@NotNull RelationTask task) {
        if (dispatcher == null) {
            throw new IllegalStateException("No dispatcher bound to this queue");
        }
        executor.execute(() -> run(task, 1));
    }

    private void run(RelationTask task, int attempt) {
        try {
            dispatcher.dispatch(task);
        } catch (PermanentTaskException e) {
            Logging.error("Dropping task " + task + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (attempt >= maxAttempts) {
                Logging.error("Giving up on task " + task + " after " + attempt + " attempt(s)", e);
                return;
            }
            long delay = delayBefore(attempt + 1);
            Logging.warn("Task " + task + " failed (attempt " + attempt + "), retrying in " + delay + "ms: " + e.getMessage());
            executor.schedule(() -> run(task, attempt + 1), delay, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Delay in milliseconds before the given attempt: the back-off doubled for every earlier retry.
     */
    long delayBefore(int attempt) {
        int doublings = Math.min(Math.max(attempt - 2, 0), 20);
        return backoff.toMillis() << doublings;
    }

    @Override
    public void close() {
        if (!ownsExecutor) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
