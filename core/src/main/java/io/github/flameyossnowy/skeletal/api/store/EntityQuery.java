package io.github.flameyossnowy.skeletal.api.store;

import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable query description understood by every {@link EntityStore}.
 *
 * <p>Filters are conjunctive. Results come back ordered by {@link #sortOptions()} and then by
 * key. A {@code limit} of {@code -1} means "everything".</p>
 *
 * <p>Instances should be constructed through {@link #builder(String)}.</p>
 */
public record EntityQuery(
    @NotNull String kind,
    @NotNull List<FilterOption> filters,
    @NotNull List<SortOption> sortOptions,
    @Nullable Key ancestor,
    int limit,
    @Nullable String cursor
) {
    public EntityQuery {
        filters = List.copyOf(filters);
        sortOptions = List.copyOf(sortOptions);
        if (limit == 0 || limit < -1) {
            throw new IllegalArgumentException("limit must be positive or -1, got " + limit);
        }
    }

    @Contract("_ -> new")
    public static @NotNull Builder builder(@NotNull String kind) {
        return new Builder(kind);
    }

    public @NotNull Builder toBuilder() {
        Builder builder = new Builder(kind);
        builder.filters.addAll(filters);
        builder.sortOptions.addAll(sortOptions);
        builder.ancestor = ancestor;
        builder.limit = limit;
        builder.cursor = cursor;
        return builder;
    }

    public @NotNull EntityQuery withCursor(@Nullable String newCursor) {
        return new EntityQuery(kind, filters, sortOptions, ancestor, limit, newCursor);
    }

    /**
     * Fluent builder for {@link EntityQuery}.
     *
     * <pre>{@code
     * EntityQuery.builder("relations")
     *     .where("dest.key").eq(key)
     *     .where("delayed_update_tag").lt(since)
     *     .limit(5)
     *     .build();
     * }</pre>
     */
    public static class Builder {
        private final String kind;
        private final List<FilterOption> filters = new ArrayList<>();
        private final List<SortOption> sortOptions = new ArrayList<>();
        private Key ancestor;
        private int limit = -1;
        private String cursor;

        Builder(String kind) {
            this.kind = kind;
        }

        public QueryField where(String field) {
            return new QueryField(this, field);
        }

        public Builder filter(FilterOption filter) {
            filters.add(filter);
            return this;
        }

        public Builder filter(List<FilterOption> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder orderBy(String field, SortOrder direction) {
            sortOptions.add(new SortOption(field, direction));
            return this;
        }

        public Builder orderBy(SortOption option) {
            sortOptions.add(option);
            return this;
        }

        public Builder orderBy(List<SortOption> options) {
            sortOptions.addAll(options);
            return this;
        }

        public Builder ancestor(@Nullable Key ancestor) {
            this.ancestor = ancestor;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder cursor(@Nullable String cursor) {
            this.cursor = cursor;
            return this;
        }

        public EntityQuery build() {
            return new EntityQuery(kind, filters, sortOptions, ancestor, limit, cursor);
        }
    }

    /**
     * Field-scoped operator builder.
     */
    public static class QueryField {
        private final Builder builder;
        private final String field;

        @Contract(pure = true)
        QueryField(Builder builder, String field) {
            this.builder = builder;
            this.field = field;
        }

        private Builder add(String operator, Object value) {
            return builder.filter(new FilterOption(field, operator, value));
        }

        public Builder eq(Object value) { return add("=", value); }

        public Builder ne(Object value) { return add("!=", value); }

        public Builder gt(Object value) { return add(">", value); }

        public Builder gte(Object value) { return add(">=", value); }

        public Builder lt(Object value) { return add("<", value); }

        public Builder lte(Object value) { return add("<=", value); }

        public Builder in(Collection<?> values) { return add("IN", new ArrayList<>(values)); }
    }
}
