package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A bone that can translate a filter on its property into store filters.
 */
public interface Filterable {
    /**
     * @param name     the bone's name in its skeleton
     * @param property the full filtered property, {@code name} or {@code name.<sub path>}
     */
    void buildFilter(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                     @NotNull String operator, @Nullable Object value);
}
