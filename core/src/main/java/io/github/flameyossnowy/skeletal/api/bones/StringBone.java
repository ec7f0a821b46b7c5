package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain text. Values are trimmed; {@code maxLength} is enforced on input.
 */
public class StringBone extends BaseBone<String> implements Filterable, Orderable {
    private final int maxLength;
    private final boolean caseSensitive;

    protected StringBone(@NotNull Builder builder) {
        super(builder);
        this.maxLength = builder.maxLength;
        this.caseSensitive = builder.caseSensitive;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public int maxLength() {
        return maxLength;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    @Override
    protected boolean isEmptySingle(@Nullable Object value) {
        return value == null || value.toString().isBlank();
    }

    @Override
    protected @Nullable String singleValueFromClient(@NotNull Object raw, @NotNull SkeletonInstance skel,
                                                     @NotNull String name, @NotNull List<ReadFromClientError> errors) {
        String value = raw.toString().trim();
        if (value.length() > maxLength) {
            errors.add(ReadFromClientError.invalid("Maximum length of " + maxLength + " exceeded"));
            return null;
        }
        return value;
    }

    @Override
    protected @Nullable Object singleValueUnserialize(@NotNull Object raw) {
        return raw.toString();
    }

    @Override
    protected @NotNull List<Object> uniqueIndexSource(@NotNull Object value) {
        List<Object> values = singleValues(value);
        if (caseSensitive) return values;
        List<Object> folded = new ArrayList<>(values.size());
        for (Object single : values) folded.add(single.toString().toLowerCase(Locale.ROOT));
        return folded;
    }

    @Override
    protected @Nullable Object filterValue(@Nullable Object value) {
        return value == null ? null : value.toString();
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

    public static class Builder extends BaseBone.Builder<String, Builder> {
        private int maxLength = 254;
        private boolean caseSensitive = true;

        public Builder maxLength(int maxLength) {
            if (maxLength < 1) throw new IllegalArgumentException("maxLength must be positive");
            this.maxLength = maxLength;
            return this;
        }

        public Builder caseInsensitive() {
            this.caseSensitive = false;
            return this;
        }

        @Override
        public StringBone build() {
            return new StringBone(this);
        }
    }
}
