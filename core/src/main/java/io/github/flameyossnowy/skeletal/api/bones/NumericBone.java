package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * A number. With a precision of zero values are {@link Long}s, otherwise {@link Double}s
 * rounded half-up to {@code precision} decimal places.
 */
public class NumericBone extends BaseBone<Number> implements Filterable, Orderable {
    private final int precision;
    private final double min;
    private final double max;

    protected NumericBone(@NotNull Builder builder) {
        super(builder);
        this.precision = builder.precision;
        this.min = builder.min;
        this.max = builder.max;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public int precision() {
        return precision;
    }

    @Override
    protected @Nullable Number singleValueFromClient(@NotNull Object raw, @NotNull SkeletonInstance skel,
                                                     @NotNull String name, @NotNull List<ReadFromClientError> errors) {
        Number parsed = parse(raw);
        if (parsed == null) {
            errors.add(ReadFromClientError.invalid("Not a number"));
            return null;
        }
        if (parsed.doubleValue() < min || parsed.doubleValue() > max) {
            errors.add(ReadFromClientError.invalid("Value must be between " + min + " and " + max));
            return null;
        }
        return parsed;
    }

    /**
     * Converts {@code raw} to this bone's number type, or returns null if it is not a number.
     */
    public @Nullable Number parse(@Nullable Object raw) {
        BigDecimal decimal;
        try {
            if (raw instanceof Number number) {
                double asDouble = number.doubleValue();
                if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) return null;
                decimal = raw instanceof Long || raw instanceof Integer ? BigDecimal.valueOf(number.longValue())
                    : BigDecimal.valueOf(asDouble);
            } else if (raw instanceof String string && !string.isBlank()) {
                decimal = new BigDecimal(string.trim().replace(',', '.'));
            } else {
                return null;
            }
        } catch (NumberFormatException e) {
            return null;
        }
        BigDecimal rounded = decimal.setScale(precision, RoundingMode.HALF_UP);
        return precision == 0 ? (Number) rounded.longValue() : (Number) rounded.doubleValue();
    }

    @Override
    protected @Nullable Object singleValueUnserialize(@NotNull Object raw) {
        return parse(raw);
    }

    @Override
    protected @Nullable Object filterValue(@Nullable Object value) {
        Number parsed = parse(value);
        if (value != null && parsed == null) {
            throw new IllegalArgumentException("Not a number: " + value);
        }
        return parsed;
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

    public static class Builder extends BaseBone.Builder<Number, Builder> {
        private int precision;
        private double min = -Math.pow(2, 53);
        private double max = Math.pow(2, 53);

        public Builder precision(int precision) {
            if (precision < 0) throw new IllegalArgumentException("precision must not be negative");
            this.precision = precision;
            return this;
        }

        public Builder range(double min, double max) {
            if (min > max) throw new IllegalArgumentException("min must not exceed max");
            this.min = min;
            this.max = max;
            return this;
        }

        @Override
        public NumericBone build() {
            return new NumericBone(this);
        }
    }
}
