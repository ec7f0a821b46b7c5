package io.github.flameyossnowy.skeletal.api.store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A keyed property bag as held by the document store.
 *
 * <p>Property values are restricted to {@code null}, {@link String}, {@link Long}, {@link Double},
 * {@link Boolean}, {@link Instant}, {@link Key}, lists of those and embedded maps with string keys.
 * Values are normalised on the way in: integral numbers become {@code Long}, other numbers
 * {@code Double}, collections become mutable lists and maps mutable ordered maps.</p>
 */
public final class Entity {
    private Key key;
    private final Map<String, Object> properties;

    public Entity(@NotNull Key key) {
        this.key = key;
        this.properties = new LinkedHashMap<>();
    }

    public Entity(@NotNull Key key, @NotNull Map<String, ?> properties) {
        this(key);
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public @NotNull Key key() {
        return key;
    }

    /**
     * Replaces an incomplete key with the one allocated by the store.
     */
    public void setKey(@NotNull Key key) {
        this.key = key;
    }

    public @Nullable Object get(@NotNull String name) {
        return properties.get(name);
    }

    public boolean contains(@NotNull String name) {
        return properties.containsKey(name);
    }

    public Entity put(@NotNull String name, @Nullable Object value) {
        properties.put(name, normalize(value));
        return this;
    }

    public @Nullable Object remove(@NotNull String name) {
        return properties.remove(name);
    }

    public @NotNull Set<String> propertyNames() {
        return Collections.unmodifiableSet(properties.keySet());
    }

    public @NotNull Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    @SuppressWarnings("unchecked")
    public @NotNull Map<String, Object> getMap(@NotNull String name) {
        Object value = properties.get(name);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        properties.put(name, created);
        return created;
    }

    public @NotNull List<Object> getList(@NotNull String name) {
        Object value = properties.get(name);
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return new ArrayList<>();
    }

    public @Nullable Long getLong(@NotNull String name) {
        Object value = properties.get(name);
        return value instanceof Number number ? number.longValue() : null;
    }

    public @Nullable Key getKey(@NotNull String name) {
        Object value = properties.get(name);
        return value instanceof Key k ? k : null;
    }

    /**
     * Resolves a dotted property path through embedded maps. Lists met on the way are
     * flattened, so the result holds every value reachable under that path.
     */
    public @NotNull List<Object> resolve(@NotNull String path) {
        List<Object> current = new ArrayList<>(1);
        current.add(properties);
        for (String part : path.split("\\.")) {
            List<Object> next = new ArrayList<>();
            for (Object node : current) {
                collect(node, part, next);
            }
            current = next;
            if (current.isEmpty()) break;
        }
        List<Object> flattened = new ArrayList<>(current.size());
        for (Object value : current) {
            if (value instanceof List<?> list) flattened.addAll(list);
            else flattened.add(value);
        }
        return flattened;
    }

    private static void collect(Object node, String part, List<Object> into) {
        if (node instanceof Map<?, ?> map) {
            if (map.containsKey(part)) into.add(map.get(part));
        } else if (node instanceof List<?> list) {
            for (Object element : list) {
                collect(element, part, into);
            }
        }
    }

    /**
     * Deep copy; the copy shares nothing mutable with this entity.
     */
    public @NotNull Entity copy() {
        Entity copy = new Entity(key);
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            copy.properties.put(entry.getKey(), deepCopy(entry.getValue()));
        }
        return copy;
    }

    public static @Nullable Object deepCopy(@Nullable Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) copy.add(deepCopy(element));
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put((String) entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        return value;
    }

    public static @Nullable Object normalize(@Nullable Object value) {
        if (value == null
            || value instanceof String
            || value instanceof Long
            || value instanceof Double
            || value instanceof Boolean
            || value instanceof Instant
            || value instanceof Key) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) list.add(normalize(element));
            return list;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String name)) {
                    throw new IllegalArgumentException("Embedded entity property names must be strings, got " + entry.getKey());
                }
                normalized.put(name, normalize(entry.getValue()));
            }
            return normalized;
        }
        throw new IllegalArgumentException("Unsupported property value type: " + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity entity)) return false;
        return key.equals(entity.key) && properties.equals(entity.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, properties);
    }

    @Override
    public String toString() {
        return "Entity{" + key + ", " + properties + '}';
    }
}
