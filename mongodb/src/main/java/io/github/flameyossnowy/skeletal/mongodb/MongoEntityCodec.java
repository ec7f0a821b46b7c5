package io.github.flameyossnowy.skeletal.mongodb;

import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps entities to MongoDB documents and back.
 *
 * <p>The document id is the key path; {@code _ancestors} lists the paths of the key and all of its
 * ancestors so ancestor queries become a plain equality match. Keys stored as values are embedded
 * documents {@code {"_key": path}}, instants are stored as BSON dates.</p>
 */
public final class MongoEntityCodec {
    public static final String ID = "_id";
    public static final String ANCESTORS = "_ancestors";
    public static final String KEY_MARKER = "_key";

    private MongoEntityCodec() {
        throw new AssertionError("No instances");
    }

    public static @NotNull Document encode(@NotNull Entity entity) {
        Document document = new Document(ID, entity.key().path());
        List<String> ancestors = new ArrayList<>();
        for (Key key : entity.key().lineage()) ancestors.add(key.path());
        document.put(ANCESTORS, ancestors);
        for (Map.Entry<String, Object> property : entity.properties().entrySet()) {
            document.put(property.getKey(), encodeValue(property.getValue()));
        }
        return document;
    }

    public static @NotNull Entity decode(@NotNull String kind, @NotNull Document document) {
        Key key = Key.parse(String.valueOf(document.get(ID)));
        if (!key.kind().equals(kind)) {
            throw new IllegalStateException("Document " + key + " found in collection " + kind);
        }
        Entity entity = new Entity(key);
        for (Map.Entry<String, Object> field : document.entrySet()) {
            if (field.getKey().equals(ID) || field.getKey().equals(ANCESTORS)) continue;
            entity.put(field.getKey(), decodeValue(field.getValue()));
        }
        return entity;
    }

    public static @Nullable Object encodeValue(@Nullable Object value) {
        if (value instanceof Key key) {
            return new Document(KEY_MARKER, key.path());
        }
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof Map<?, ?> map) {
            Document document = new Document();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                document.put(String.valueOf(entry.getKey()), encodeValue(entry.getValue()));
            }
            return document;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) list.add(encodeValue(element));
            return list;
        }
        return Entity.normalize(value);
    }

    public static @Nullable Object decodeValue(@Nullable Object value) {
        if (value instanceof Document document) {
            if (document.size() == 1 && document.get(KEY_MARKER) instanceof String path) {
                return Key.parse(path);
            }
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : document.entrySet()) {
                map.put(entry.getKey(), decodeValue(entry.getValue()));
            }
            return map;
        }
        if (value instanceof List<?> list) {
            List<Object> decoded = new ArrayList<>(list.size());
            for (Object element : list) decoded.add(decodeValue(element));
            return decoded;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Integer number) {
            return number.longValue();
        }
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue().doubleValue();
        }
        return value;
    }
}
