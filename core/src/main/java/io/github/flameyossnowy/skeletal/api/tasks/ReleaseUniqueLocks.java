package io.github.flameyossnowy.skeletal.api.tasks;

import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Deletes unique value locks that {@code owner} no longer claims.
 */
public record ReleaseUniqueLocks(@NotNull String kind, @NotNull String bone, @NotNull Key owner,
                                 @NotNull List<String> hashes) implements RelationTask {
    public ReleaseUniqueLocks {
        hashes = List.copyOf(hashes);
    }

    @Override
    public @NotNull TaskType type() {
        return TaskType.RELEASE_UNIQUE_LOCKS;
    }
}
