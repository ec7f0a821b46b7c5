package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Refreshes and rewrites every record of {@code kind}.
 */
public record RebuildIndex(@NotNull String kind, @Nullable String cursor, int processed) implements RelationTask {
    @Override
    public @NotNull TaskType type() {
        return TaskType.REBUILD_INDEX;
    }
}
