package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;

/**
 * Executes tasks handed over by a {@link TaskQueue}.
 */
@FunctionalInterface
public interface TaskDispatcher {
    /**
     * Runs {@code task} to completion.
     *
     * @throws io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException if retrying can never succeed;
     *         any other exception leaves the task retryable
     */
    void dispatch(@NotNull RelationTask task);
}
