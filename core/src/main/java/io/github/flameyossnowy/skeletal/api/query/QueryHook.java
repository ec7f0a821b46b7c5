package io.github.flameyossnowy.skeletal.api.query;

import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Rewrites filters and orders added to a {@link SkeletonQuery} after it was redirected to
 * another kind.
 */
public interface QueryHook {
    /**
     * @return the filter to apply, or null if the hook consumed it
     */
    @Nullable FilterOption rewriteFilter(@NotNull SkeletonQuery query, @NotNull FilterOption filter);

    @NotNull SortOption rewriteOrder(@NotNull SkeletonQuery query, @NotNull SortOption order);
}
