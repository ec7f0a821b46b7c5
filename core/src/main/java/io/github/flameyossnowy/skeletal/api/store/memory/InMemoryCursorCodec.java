package io.github.flameyossnowy.skeletal.api.store.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Cursors of the in-memory store. A cursor carries the sort values and key of the last returned
 * entity as URL-safe Base64 JSON, so the store keeps no state per cursor. Every value is tagged
 * with its type so it compares exactly like the stored value after decoding.
 */
final class InMemoryCursorCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String KEY = "k";
    private static final String VALUES = "s";
    private static final String TYPE = "t";
    private static final String VALUE = "v";

    private InMemoryCursorCodec() {
        throw new AssertionError("No instances");
    }

    static @NotNull String encode(@NotNull List<Object> sortValues, @NotNull Key key) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(KEY, key.path());
        ArrayNode values = root.putArray(VALUES);
        for (Object value : sortValues) {
            values.add(encodeValue(value));
        }
        try {
            return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(MAPPER.writeValueAsBytes(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode cursor for " + key, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the cursor is malformed or holds another number of orders
     */
    static @NotNull Position decode(@NotNull String cursor, int orders) {
        try {
            JsonNode root = MAPPER.readTree(new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8));
            JsonNode key = root == null ? null : root.get(KEY);
            JsonNode values = root == null ? null : root.get(VALUES);
            if (key == null || !key.isTextual() || values == null || !values.isArray()) {
                throw new IllegalArgumentException("Malformed cursor: " + cursor);
            }
            if (values.size() != orders) {
                throw new IllegalArgumentException("Cursor does not match the query orders: " + cursor);
            }
            List<Object> sortValues = new ArrayList<>(values.size());
            for (JsonNode value : values) {
                sortValues.add(decodeValue(value));
            }
            return new Position(sortValues, Key.parse(key.asText()));
        } catch (JsonProcessingException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed cursor: " + cursor, e);
        }
    }

    private static ObjectNode encodeValue(@Nullable Object value) {
        ObjectNode node = MAPPER.createObjectNode();
        if (value == null) {
            node.put(TYPE, "null");
        } else if (value instanceof Boolean bool) {
            node.put(TYPE, "bool").put(VALUE, bool);
        } else if (value instanceof Long || value instanceof Integer) {
            node.put(TYPE, "long").put(VALUE, ((Number) value).longValue());
        } else if (value instanceof Number number) {
            node.put(TYPE, "double").put(VALUE, number.doubleValue());
        } else if (value instanceof String string) {
            node.put(TYPE, "string").put(VALUE, string);
        } else if (value instanceof Instant instant) {
            node.put(TYPE, "instant").put(VALUE, instant.toString());
        } else if (value instanceof Key key) {
            node.put(TYPE, "key").put(VALUE, key.path());
        } else {
            node.put(TYPE, "text").put(VALUE, String.valueOf(value));
        }
        return node;
    }

    private static @Nullable Object decodeValue(JsonNode node) {
        String type = node.path(TYPE).asText();
        JsonNode value = node.path(VALUE);
        return switch (type) {
            case "null" -> null;
            case "bool" -> value.asBoolean();
            case "long" -> value.asLong();
            case "double" -> value.asDouble();
            case "string" -> value.asText();
            case "instant" -> Instant.parse(value.asText());
            case "key" -> Key.parse(value.asText());
            case "text" -> new Text(value.asText());
            default -> throw new IllegalArgumentException("Unknown cursor value type '" + type + "'");
        };
    }

    record Position(List<Object> sortValues, Key key) {}

    /**
     * Stands in for values ordered by their string form.
     */
    private record Text(String text) {
        @Override
        public String toString() {
            return text;
        }
    }
}
