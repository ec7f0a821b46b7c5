package io.github.flameyossnowy.skeletal.api.query;

import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One page of records.
 *
 * @param cursor where the next page starts, null when this was the last one
 */
public record SkeletonQueryResult(@NotNull List<SkeletonInstance> skeletons, @Nullable String cursor) {
    public SkeletonQueryResult {
        skeletons = List.copyOf(skeletons);
    }

    public boolean hasMore() {
        return cursor != null;
    }
}
