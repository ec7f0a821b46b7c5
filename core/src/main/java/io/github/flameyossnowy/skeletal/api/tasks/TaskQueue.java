package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;

/**
 * At-least-once delivery of background tasks.
 *
 * <p>Implementations hand every enqueued task to the bound dispatcher at least once, retry it on
 * failure up to their attempt limit, and drop it for good on a
 * {@link io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException}.</p>
 */
public interface TaskQueue {
    void enqueue(@NotNull RelationTask task);

    /**
     * Sets the dispatcher that executes tasks. Called once while the runtime is built.
     */
    void bind(@NotNull TaskDispatcher dispatcher);
}
