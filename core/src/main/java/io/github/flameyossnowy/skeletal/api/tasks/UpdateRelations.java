package io.github.flameyossnowy.skeletal.api.tasks;

import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Refreshes every record caching {@code destKey} whose relation edge is older than
 * {@code minChangeTime}.
 *
 * @param changedField only visit edges caching this field; null visits all
 */
public record UpdateRelations(@NotNull Key destKey, long minChangeTime, @Nullable String changedField,
                              @Nullable String cursor) implements RelationTask {
    @Override
    public @NotNull TaskType type() {
        return TaskType.UPDATE_RELATIONS;
    }

    public @NotNull UpdateRelations withCursor(@NotNull String next) {
        return new UpdateRelations(destKey, minChangeTime, changedField, next);
    }
}
