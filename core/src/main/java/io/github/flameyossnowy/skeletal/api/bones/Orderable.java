package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import org.jetbrains.annotations.NotNull;

public interface Orderable {
    void buildOrder(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property, @NotNull SortOrder order);
}
