package io.github.flameyossnowy.skeletal.mongodb;

import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.lt;
import static com.mongodb.client.model.Filters.or;

/**
 * Query cursors for the MongoDB store: the sort values and id of the last returned document,
 * as URL-safe Base64 of extended JSON. Resuming selects everything strictly after that position.
 */
public final class MongoCursorCodec {
    private static final JsonWriterSettings JSON = JsonWriterSettings.builder().outputMode(JsonMode.EXTENDED).build();
    private static final String VALUES = "v";
    private static final String ID = "id";

    private MongoCursorCodec() {
        throw new AssertionError("No instances");
    }

    public static @NotNull String encode(@NotNull Document last, @NotNull List<SortOption> options) {
        List<Object> values = new ArrayList<>(options.size());
        for (SortOption option : options) {
            values.add(last.getEmbedded(List.of(MongoFilterBuilder.fieldName(option.field()).split("\\.")), Object.class));
        }
        Document position = new Document(VALUES, values).append(ID, last.get(MongoEntityCodec.ID));
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(position.toJson(JSON).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Filter matching every document after the cursor position under {@code options}.
     *
     * @throws IllegalArgumentException if the cursor is malformed or was built for other orders
     */
    public static @NotNull Bson resumeFilter(@NotNull String cursor, @NotNull List<SortOption> options) {
        List<?> values;
        Object id;
        try {
            Document position = Document.parse(new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8));
            values = position.getList(VALUES, Object.class);
            id = position.get(ID);
        } catch (IllegalArgumentException | ClassCastException | JsonParseException | BSONException e) {
            throw new IllegalArgumentException("Malformed cursor: " + cursor, e);
        }
        if (values == null || id == null || values.size() != options.size()) {
            throw new IllegalArgumentException("Cursor does not match the query orders: " + cursor);
        }

        List<Bson> branches = new ArrayList<>(options.size() + 1);
        List<Bson> equalPrefix = new ArrayList<>();
        for (int i = 0; i < options.size(); i++) {
            SortOption option = options.get(i);
            String field = MongoFilterBuilder.fieldName(option.field());
            Object value = values.get(i);
            Bson after = option.order() == SortOrder.ASCENDING ? gt(field, value) : lt(field, value);
            branches.add(withPrefix(equalPrefix, after));
            equalPrefix.add(eq(field, value));
        }
        branches.add(withPrefix(equalPrefix, gt(MongoEntityCodec.ID, id)));
        return branches.size() == 1 ? branches.get(0) : or(branches);
    }

    private static Bson withPrefix(List<Bson> prefix, Bson last) {
        if (prefix.isEmpty()) return last;
        List<Bson> all = new ArrayList<>(prefix);
        all.add(last);
        return and(all);
    }
}
