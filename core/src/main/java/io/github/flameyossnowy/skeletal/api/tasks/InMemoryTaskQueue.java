package io.github.flameyossnowy.skeletal.api.tasks;

import io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO task queue that runs nothing until {@link #drain()} is called. Meant for tests and
 * embedded deployments that pump the queue themselves.
 */
public class InMemoryTaskQueue implements TaskQueue {
    private final Deque<Pending> pending = new ArrayDeque<>();
    private final List<RelationTask> dropped = new ArrayList<>();
    private final int maxAttempts;
    private volatile TaskDispatcher dispatcher;

    public InMemoryTaskQueue() {
        this(5);
    }

    public InMemoryTaskQueue(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public synchronized void enqueue(@NotNull RelationTask task) {
        pending.addLast(new Pending(task, 0));
    }

    @Override
    public void bind(@NotNull TaskDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Runs queued tasks, including those they enqueue, until the queue is empty.
     *
     * @return the number of tasks that completed
     */
    public int drain() {
        TaskDispatcher target = dispatcher;
        if (target == null) {
            throw new IllegalStateException("No dispatcher bound to this queue");
        }
        int completed = 0;
        while (true) {
            Pending next;
            synchronized (this) {
                next = pending.pollFirst();
            }
            if (next == null) return completed;

            try {
                target.dispatch(next.task);
                completed++;
            } catch (PermanentTaskException e) {
                Logging.error("Dropping task " + next.task + ": " + e.getMessage(), e);
                drop(next.task);
            } catch (RuntimeException e) {
                int attempts = next.attempts + 1;
                if (attempts >= maxAttempts) {
                    Logging.error("Giving up on task " + next.task + " after " + attempts + " attempt(s)", e);
                    drop(next.task);
                } else {
                    Logging.warn("Task " + next.task + " failed (attempt " + attempts + "), retrying: " + e.getMessage());
                    synchronized (this) {
                        pending.addLast(new Pending(next.task, attempts));
                    }
                }
            }
        }
    }

    private synchronized void drop(RelationTask task) {
        dropped.add(task);
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized @NotNull List<RelationTask> pending() {
        List<RelationTask> tasks = new ArrayList<>(pending.size());
        for (Pending entry : pending) tasks.add(entry.task);
        return tasks;
    }

    /**
     * Tasks that failed permanently or ran out of attempts.
     */
    public synchronized @NotNull List<RelationTask> dropped() {
        return List.copyOf(dropped);
    }

    public synchronized void clear() {
        pending.clear();
        dropped.clear();
    }

    private record Pending(RelationTask task, int attempts) {}
}
