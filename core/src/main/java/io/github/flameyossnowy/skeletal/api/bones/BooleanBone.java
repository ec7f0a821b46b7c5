package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public class BooleanBone extends BaseBone<Boolean> implements Filterable, Orderable {
    private static final Set<String> TRUTHY = Set.of("true", "yes", "on", "1");

    protected BooleanBone(@NotNull Builder builder) {
        super(builder);
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    @Override
    protected @Nullable Boolean singleValueFromClient(@NotNull Object raw, @NotNull SkeletonInstance skel,
                                                      @NotNull String name, @NotNull List<ReadFromClientError> errors) {
        return toBoolean(raw);
    }

    private static boolean toBoolean(Object raw) {
        if (raw instanceof Boolean bool) return bool;
        if (raw instanceof Number number) return number.doubleValue() != 0;
        return TRUTHY.contains(raw.toString().trim().toLowerCase(Locale.ROOT));
    }

    @Override
    protected @Nullable Object singleValueUnserialize(@NotNull Object raw) {
        return toBoolean(raw);
    }

    @Override
    protected @Nullable Object filterValue(@Nullable Object value) {
        return value == null ? null : toBoolean(value);
    }

    @Override
    public void buildFilter(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                            @NotNull String operator, @Nullable Object value) {
        buildSimpleFilter(name, query, property, operator, value);
    }

    @Override
    public void buildOrder(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                           @NotNull SortOrder order) {
        buildSimpleOrder(name, query, property, order);
    }

    public static class Builder extends BaseBone.Builder<Boolean, Builder> {
        public Builder() {
            defaultValue(false);
        }

        @Override
        public BooleanBone build() {
            return new BooleanBone(this);
        }
    }
}
