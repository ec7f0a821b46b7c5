package io.github.flameyossnowy.skeletal.mongodb;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.exists;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.gte;
import static com.mongodb.client.model.Filters.in;
import static com.mongodb.client.model.Filters.lt;
import static com.mongodb.client.model.Filters.lte;
import static com.mongodb.client.model.Filters.ne;

/**
 * Translates {@link EntityQuery} filters and orders into MongoDB query documents.
 */
public final class MongoFilterBuilder {
    private MongoFilterBuilder() {
        throw new AssertionError("No instances");
    }

    public static @NotNull Bson filterOf(@NotNull EntityQuery query) {
        List<Bson> filters = new ArrayList<>(query.filters().size() + 1);
        if (query.ancestor() != null) {
            filters.add(eq(MongoEntityCodec.ANCESTORS, query.ancestor().path()));
        }
        for (FilterOption filter : query.filters()) {
            filters.add(buildFilter(filter));
        }
        if (filters.isEmpty()) return Filters.empty();
        return filters.size() == 1 ? filters.get(0) : and(filters);
    }

    public static @NotNull Bson buildFilter(@NotNull FilterOption filter) {
        String field = fieldName(filter.field());
        Object value = filter.isKeyFilter() ? keyValue(filter.value()) : MongoEntityCodec.encodeValue(filter.value());

        return switch (filter.operator()) {
            case "=" -> eq(field, value);
            // entities lacking the property never match, so != must not select missing fields
            case "!=" -> and(exists(field), ne(field, value));
            case ">" -> gt(field, value);
            case ">=" -> gte(field, value);
            case "<" -> lt(field, value);
            case "<=" -> lte(field, value);
            case "IN" -> {
                if (!(value instanceof Collection<?> c)) {
                    throw new IllegalArgumentException("IN requires a Collection value");
                }
                yield in(field, c);
            }
            default -> throw new IllegalArgumentException("Unsupported operator " + filter.operator());
        };
    }

    /**
     * Sort document for the query's orders, always ending with the document id as tiebreaker.
     */
    public static @NotNull Bson sortOf(@NotNull List<SortOption> options) {
        List<Bson> sorts = new ArrayList<>(options.size() + 1);
        boolean byId = false;
        for (SortOption option : options) {
            String field = fieldName(option.field());
            byId |= field.equals(MongoEntityCodec.ID);
            sorts.add(option.order() == SortOrder.ASCENDING ? Sorts.ascending(field) : Sorts.descending(field));
        }
        if (!byId) sorts.add(Sorts.ascending(MongoEntityCodec.ID));
        return Sorts.orderBy(sorts);
    }

    public static @NotNull String fieldName(@NotNull String property) {
        return FilterOption.KEY_PROPERTY.equals(property) ? MongoEntityCodec.ID : property;
    }

    private static @Nullable Object keyValue(@Nullable Object value) {
        if (value instanceof Key key) return key.path();
        if (value instanceof Collection<?> collection) {
            List<Object> paths = new ArrayList<>(collection.size());
            for (Object element : collection) paths.add(keyValue(element));
            return paths;
        }
        return value;
    }
}
