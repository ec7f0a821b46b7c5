package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteContext;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The record's own key. Every skeleton carries one under the name {@code key}; its value is the
 * entity key and is never stored as a property.
 */
public final class KeyBone extends BaseBone<Key> implements Filterable, Orderable {
    public KeyBone() {
        super(new Builder().readOnly());
    }

    @Override
    public @Nullable Object unserialize(@NotNull SkeletonInstance skel, @NotNull String name) {
        return skel.entity() == null ? null : skel.entity().key();
    }

    @Override
    public boolean serialize(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context) {
        return false;
    }

    @Override
    protected @Nullable Key singleValueFromClient(@NotNull Object raw, @NotNull SkeletonInstance skel,
                                                  @NotNull String name, @NotNull List<ReadFromClientError> errors) {
        try {
            return toKey(raw);
        } catch (IllegalArgumentException e) {
            errors.add(ReadFromClientError.invalid("Invalid key"));
            return null;
        }
    }

    static @NotNull Key toKey(@NotNull Object raw) {
        return raw instanceof Key key ? key : Key.parse(raw.toString());
    }

    @Override
    public void buildFilter(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                            @NotNull String operator, @Nullable Object value) {
        if (!property.equals(name)) {
            throw new IllegalArgumentException("Unknown property " + property);
        }
        Object key;
        if (value instanceof Collection<?> collection) {
            List<Key> keys = new ArrayList<>(collection.size());
            for (Object element : collection) keys.add(toKey(element));
            key = keys;
        } else {
            key = value == null ? null : toKey(value);
        }
        query.addFilter(new FilterOption(FilterOption.KEY_PROPERTY, operator, key));
    }

    @Override
    public void buildOrder(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                           @NotNull SortOrder order) {
        query.addOrder(new SortOption(FilterOption.KEY_PROPERTY, order));
    }

    static final class Builder extends BaseBone.Builder<Key, Builder> {
        @Override
        public KeyBone build() {
            return new KeyBone();
        }
    }
}
