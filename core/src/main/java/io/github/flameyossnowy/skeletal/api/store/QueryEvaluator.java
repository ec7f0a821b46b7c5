package io.github.flameyossnowy.skeletal.api.store;

import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Document-store query semantics evaluated in memory.
 *
 * <p>A filter on a list-valued (or list-nested) property matches when any element matches.
 * Entities lacking the property never match. Values of different types order as
 * null, booleans, numbers, strings, instants, keys, then anything else.</p>
 */
public final class QueryEvaluator {
    private QueryEvaluator() {}

    public static boolean matches(@NotNull Entity entity, @NotNull EntityQuery query) {
        if (!entity.key().kind().equals(query.kind())) {
            return false;
        }
        if (query.ancestor() != null && !query.ancestor().isAncestorOf(entity.key())) {
            return false;
        }
        for (FilterOption filter : query.filters()) {
            if (!matches(entity, filter)) return false;
        }
        return true;
    }

    public static boolean matches(@NotNull Entity entity, @NotNull FilterOption filter) {
        List<Object> candidates = filter.isKeyFilter() ? List.of(entity.key()) : entity.resolve(filter.field());
        for (Object candidate : candidates) {
            if (test(candidate, filter.operator(), filter.value())) return true;
        }
        return false;
    }

    private static boolean test(@Nullable Object candidate, String operator, @Nullable Object expected) {
        switch (operator) {
            case "=":
                return valueEquals(candidate, expected);
            case "!=":
                return !valueEquals(candidate, expected);
            case "IN":
                for (Object option : (Collection<?>) expected) {
                    if (valueEquals(candidate, option)) return true;
                }
                return false;
            default:
                if (candidate == null || expected == null || rank(candidate) != rank(expected)) {
                    return false;
                }
                int cmp = compare(candidate, expected);
                return switch (operator) {
                    case "<" -> cmp < 0;
                    case "<=" -> cmp <= 0;
                    case ">" -> cmp > 0;
                    case ">=" -> cmp >= 0;
                    default -> throw new IllegalArgumentException("Unsupported operator " + operator);
                };
        }
    }

    private static boolean valueEquals(@Nullable Object a, @Nullable Object b) {
        if (a instanceof Number && b instanceof Number) {
            return compare(a, b) == 0;
        }
        return Objects.equals(a, b);
    }

    private static int rank(@Nullable Object value) {
        if (value == null) return 0;
        if (value instanceof Boolean) return 1;
        if (value instanceof Number) return 2;
        if (value instanceof String) return 3;
        if (value instanceof Instant) return 4;
        if (value instanceof Key) return 5;
        return 6;
    }

    /**
     * Total order over property values.
     */
    public static int compare(@Nullable Object a, @Nullable Object b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        return switch (rankA) {
            case 0 -> 0;
            case 1 -> Boolean.compare((Boolean) a, (Boolean) b);
            case 2 -> {
                if (a instanceof Long x && b instanceof Long y) yield Long.compare(x, y);
                yield Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            }
            case 3 -> ((String) a).compareTo((String) b);
            case 4 -> ((Instant) a).compareTo((Instant) b);
            case 5 -> ((Key) a).compareTo((Key) b);
            default -> String.valueOf(a).compareTo(String.valueOf(b));
        };
    }

    /**
     * The value an entity sorts by for one order: the smallest matching value when ascending,
     * the largest when descending.
     */
    public static @Nullable Object sortValue(@NotNull Entity entity, @NotNull SortOption option) {
        if (FilterOption.KEY_PROPERTY.equals(option.field())) {
            return entity.key();
        }
        List<Object> values = entity.resolve(option.field());
        if (values.isEmpty()) return null;
        Object best = values.get(0);
        for (Object value : values) {
            int cmp = compare(value, best);
            if (option.order() == SortOrder.ASCENDING ? cmp < 0 : cmp > 0) best = value;
        }
        return best;
    }

    public static @NotNull List<Object> sortValues(@NotNull Entity entity, @NotNull List<SortOption> options) {
        List<Object> values = new ArrayList<>(options.size());
        for (SortOption option : options) {
            values.add(sortValue(entity, option));
        }
        return values;
    }

    /**
     * Compares two positions (sort values plus key) under the given orders.
     */
    public static int comparePositions(@NotNull List<Object> valuesA, @NotNull Key keyA,
                                       @NotNull List<Object> valuesB, @NotNull Key keyB,
                                       @NotNull List<SortOption> options) {
        for (int i = 0; i < options.size(); i++) {
            int cmp = compare(valuesA.get(i), valuesB.get(i));
            if (cmp != 0) {
                return options.get(i).order() == SortOrder.ASCENDING ? cmp : -cmp;
            }
        }
        return keyA.compareTo(keyB);
    }

    public static @NotNull Comparator<Entity> comparator(@NotNull List<SortOption> options) {
        return (a, b) -> comparePositions(sortValues(a, options), a.key(), sortValues(b, options), b.key(), options);
    }
}
