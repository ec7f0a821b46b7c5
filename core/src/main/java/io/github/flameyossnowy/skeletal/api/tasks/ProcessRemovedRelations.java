package io.github.flameyossnowy.skeletal.api.tasks;

import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Nulls out or cascade-deletes the records referencing the deleted {@code deletedKey}.
 */
public record ProcessRemovedRelations(@NotNull Key deletedKey, @Nullable String cursor) implements RelationTask {
    @Override
    public @NotNull TaskType type() {
        return TaskType.PROCESS_REMOVED_RELATIONS;
    }

    public @NotNull ProcessRemovedRelations withCursor(@NotNull String next) {
        return new ProcessRemovedRelations(deletedKey, next);
    }
}
