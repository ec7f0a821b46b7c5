package io.github.flameyossnowy.skeletal.api.query;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.Filterable;
import io.github.flameyossnowy.skeletal.api.bones.Orderable;
import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.QueryResult;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query over the records of one kind, phrased in terms of bone names.
 *
 * <p>Each filter and order is handed to the bone it names, which translates it into store
 * filters. A multiple relational bone may redirect the whole query to the relation edge kind;
 * filters added afterwards then pass through the {@link QueryHook} it installed, and
 * {@link #fetch()} maps the matching edges back to their owners.</p>
 *
 * <pre>{@code
 * skeletal.query("item")
 *     .filter("tags.name", "=", "red")
 *     .order("price", SortOrder.DESCENDING)
 *     .limit(10)
 *     .fetch();
 * }</pre>
 */
public class SkeletonQuery {
    private final Skeletal runtime;
    private final SkeletonDefinition definition;
    private final List<FilterOption> filters = new ArrayList<>();
    private final List<SortOption> orders = new ArrayList<>();
    private String storeKind;
    private @Nullable Key ancestor;
    private int limit = -1;
    private @Nullable String cursor;
    private @Nullable QueryHook hook;
    private @Nullable Object rewrittenBy;

    public SkeletonQuery(@NotNull Skeletal runtime, @NotNull SkeletonDefinition definition) {
        this.runtime = runtime;
        this.definition = definition;
        this.storeKind = definition.kind();
    }

    public @NotNull Skeletal runtime() {
        return runtime;
    }

    public @NotNull SkeletonDefinition definition() {
        return definition;
    }

    /**
     * The kind actually queried: the record kind, or the relation kind after a rewrite.
     */
    public @NotNull String storeKind() {
        return storeKind;
    }

    public SkeletonQuery filter(@NotNull String property, @NotNull String operator, @Nullable Object value) {
        String boneName = property.split("\\.")[0];
        BaseBone<?> bone = definition.bone(boneName);
        if (!(bone instanceof Filterable filterable)) {
            throw new IllegalArgumentException(definition.kind() + " cannot be filtered by '" + property + "'");
        }
        filterable.buildFilter(boneName, this, property, operator, value);
        return this;
    }

    public SkeletonQuery order(@NotNull String property, @NotNull SortOrder order) {
        String boneName = property.split("\\.")[0];
        BaseBone<?> bone = definition.bone(boneName);
        if (!(bone instanceof Orderable orderable)) {
            throw new IllegalArgumentException(definition.kind() + " cannot be ordered by '" + property + "'");
        }
        orderable.buildOrder(boneName, this, property, order);
        return this;
    }

    /**
     * Applies every entry of {@code filters}; keys are {@code "property operator"} or just
     * {@code "property"} for equality.
     */
    public SkeletonQuery filters(@NotNull Map<String, ?> filters) {
        for (Map.Entry<String, ?> entry : filters.entrySet()) {
            String[] parts = entry.getKey().trim().split("\\s+", 2);
            filter(parts[0], parts.length == 2 ? parts[1] : "=", entry.getValue());
        }
        return this;
    }

    public SkeletonQuery ancestor(@Nullable Key ancestor) {
        this.ancestor = ancestor;
        return this;
    }

    public SkeletonQuery limit(int limit) {
        this.limit = limit;
        return this;
    }

    public SkeletonQuery cursor(@Nullable String cursor) {
        this.cursor = cursor;
        return this;
    }

    /**
     * Adds a store filter, passing it through the installed hook.
     */
    @ApiStatus.Internal
    public void addFilter(@NotNull FilterOption filter) {
        FilterOption rewritten = hook == null ? filter : hook.rewriteFilter(this, filter);
        if (rewritten != null) filters.add(rewritten);
    }

    /**
     * Adds a store filter as is.
     */
    @ApiStatus.Internal
    public void addRawFilter(@NotNull FilterOption filter) {
        filters.add(filter);
    }

    @ApiStatus.Internal
    public void addOrder(@NotNull SortOption order) {
        orders.add(hook == null ? order : hook.rewriteOrder(this, order));
    }

    @ApiStatus.Internal
    public void addRawOrder(@NotNull SortOption order) {
        orders.add(order);
    }

    /**
     * Redirects this query to {@code kind}. Filters and orders added so far are run through
     * {@code hook}, as is everything added later.
     *
     * @param owner the bone performing the rewrite
     */
    @ApiStatus.Internal
    public void rewriteTo(@NotNull String kind, @NotNull Object owner, @NotNull QueryHook hook) {
        if (this.hook != null) {
            throw new IllegalStateException("Query on " + definition.kind() + " was already rewritten");
        }
        List<FilterOption> previousFilters = new ArrayList<>(filters);
        List<SortOption> previousOrders = new ArrayList<>(orders);
        filters.clear();
        orders.clear();
        this.storeKind = kind;
        this.hook = hook;
        this.rewrittenBy = owner;
        for (FilterOption filter : previousFilters) addFilter(filter);
        for (SortOption order : previousOrders) addOrder(order);
        Logging.deepInfo(() -> "Rewrote query on " + definition.kind() + " to kind " + kind);
    }

    public boolean isRewritten() {
        return rewrittenBy != null;
    }

    public @Nullable Object rewrittenBy() {
        return rewrittenBy;
    }

    public @NotNull EntityQuery toEntityQuery() {
        return EntityQuery.builder(storeKind)
            .filter(filters)
            .orderBy(orders)
            .ancestor(ancestor)
            .limit(limit)
            .cursor(cursor)
            .build();
    }

    public @NotNull SkeletonQueryResult fetch() {
        QueryResult result = runtime.store().query(toEntityQuery());
        if (!isRewritten()) {
            List<SkeletonInstance> skeletons = new ArrayList<>(result.entities().size());
            for (Entity entity : result.entities()) skeletons.add(wrap(entity));
            return new SkeletonQueryResult(skeletons, result.nextCursor());
        }

        Set<Key> owners = new LinkedHashSet<>();
        for (Entity edge : result.entities()) {
            Key owner = edge.key().parent();
            if (owner != null) owners.add(owner);
        }
        Map<Key, Entity> found = runtime.store().getMulti(owners);
        List<SkeletonInstance> skeletons = new ArrayList<>(found.size());
        for (Key owner : owners) {
            Entity entity = found.get(owner);
            if (entity != null) skeletons.add(wrap(entity));
        }
        return new SkeletonQueryResult(skeletons, result.nextCursor());
    }

    /**
     * Every matching record, following cursors until exhausted.
     */
    public @NotNull List<SkeletonInstance> fetchAll() {
        List<SkeletonInstance> all = new ArrayList<>();
        Set<Key> seen = new LinkedHashSet<>();
        String start = cursor;
        try {
            while (true) {
                SkeletonQueryResult page = fetch();
                for (SkeletonInstance skel : page.skeletons()) {
                    if (seen.add(skel.key())) all.add(skel);
                }
                if (!page.hasMore()) return all;
                cursor = page.cursor();
            }
        } finally {
            cursor = start;
        }
    }

    private SkeletonInstance wrap(Entity entity) {
        SkeletonInstance skel = new SkeletonInstance(runtime, definition);
        skel.setEntity(entity);
        return skel;
    }
}
