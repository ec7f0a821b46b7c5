package io.github.flameyossnowy.skeletal.api.store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One page of query results.
 *
 * @param entities   the matching entities, in query order
 * @param nextCursor position after the last returned entity, or {@code null} when the
 *                   query was exhausted
 */
public record QueryResult(@NotNull List<Entity> entities, @Nullable String nextCursor) {
    public QueryResult {
        entities = List.copyOf(entities);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
