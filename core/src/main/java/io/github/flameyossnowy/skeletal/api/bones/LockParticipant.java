package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.pipeline.WriteContext;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import org.jetbrains.annotations.NotNull;

/**
 * A bone that holds locks on other entities. Both methods run inside the owner's transaction.
 */
public interface LockParticipant {
    /**
     * Brings the locks held for this bone in line with its current value.
     */
    void reconcileLocks(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context);

    /**
     * Releases every lock held for this bone; the owner is being deleted.
     */
    void releaseLocks(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context);
}
