package io.github.flameyossnowy.skeletal.api.options;

import io.github.flameyossnowy.skeletal.api.store.Entity;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * A single comparison against a (possibly dotted) property path.
 *
 * <p>Supported operators are {@code =}, {@code !=}, {@code <}, {@code <=}, {@code >},
 * {@code >=} and {@code IN}. {@code __key__} addresses the entity key itself.</p>
 */
public record FilterOption(@NotNull String field, @NotNull String operator, @Nullable Object value) {
    public static final String KEY_PROPERTY = "__key__";

    private static final Set<String> OPERATORS = Set.of("=", "!=", "<", "<=", ">", ">=", "IN");

    public FilterOption {
        if (field.isEmpty()) {
            throw new IllegalArgumentException("Filter field must not be empty");
        }
        operator = operator.trim().toUpperCase(Locale.ROOT);
        if (!OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Unsupported filter operator '" + operator + "' on " + field);
        }
        if (operator.equals("IN") && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException("IN requires a Collection value");
        }
        value = Entity.normalize(value);
    }

    public FilterOption withField(@NotNull String newField) {
        return new FilterOption(newField, operator, value);
    }

    public boolean isKeyFilter() {
        return KEY_PROPERTY.equals(field);
    }
}
