package io.github.flameyossnowy.skeletal.api.skeleton;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Hooks attached to a {@link SkeletonDefinition} that observe its writes and deletes.
 */
public interface DatabaseAdapter {
    /**
     * Runs inside the write transaction after all bones were serialized, before the entity is stored.
     * Exceptions abort the write.
     */
    default void prewrite(@NotNull SkeletonInstance skel, boolean isAdd, @NotNull List<String> changeList) {
    }

    /**
     * Runs after the write committed.
     */
    default void write(@NotNull SkeletonInstance skel, boolean isAdd, @NotNull List<String> changeList) {
    }

    /**
     * Runs after the delete committed.
     */
    default void delete(@NotNull SkeletonInstance skel) {
    }
}
