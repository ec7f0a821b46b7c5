package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Removes relation edges whose source kind or source bone no longer exists.
 *
 * @param srcKind only inspect edges of this source kind, or {@code "*"} for all
 */
public record VacuumRelations(@NotNull String srcKind, @Nullable String cursor, int processed, int removed)
    implements RelationTask {
    public static final String ALL_KINDS = "*";

    @Override
    public @NotNull TaskType type() {
        return TaskType.VACUUM_RELATIONS;
    }
}
