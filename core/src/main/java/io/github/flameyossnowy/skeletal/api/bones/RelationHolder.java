package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonRegistry;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;

/**
 * A bone whose value references records of another kind.
 */
public interface RelationHolder {
    @NotNull String targetKind();

    @NotNull RelationalConsistency consistency();

    @NotNull RelationalUpdateLevel updateLevel();

    /**
     * Resolves the target schema. Called once while the registry is sealed.
     */
    void bind(@NotNull SkeletonRegistry registry, @NotNull String ownerKind, @NotNull String name);

    /**
     * Drops every reference to {@code key} from the bone's value.
     *
     * @return true if anything was removed
     */
    boolean removeReference(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull Key key);
}
