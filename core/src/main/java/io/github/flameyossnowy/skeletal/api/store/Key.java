package io.github.flameyossnowy.skeletal.api.store;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identity of an entity: a kind, a numeric id or a string name, and an optional parent key.
 *
 * <p>The textual form lists every component from the entity-group root down to this key,
 * separated by {@code /}; each component is {@code kind:i:<id>} or {@code kind:n:<name>}
 * with the name URL-encoded. A key with neither id nor name is incomplete and only valid
 * as an argument to {@link EntityStore#put(Entity)}, which allocates an id for it.</p>
 */
public final class Key implements Comparable<Key> {
    private final String kind;
    private final Long id;
    private final String name;
    private final Key parent;
    private final String path;

    private Key(@NotNull String kind, @Nullable Long id, @Nullable String name, @Nullable Key parent) {
        if (kind.isEmpty() || kind.indexOf(':') >= 0 || kind.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Invalid kind: '" + kind + "'");
        }
        if (parent != null && !parent.isComplete()) {
            throw new IllegalArgumentException("Parent key must be complete: " + parent);
        }
        if (name != null && name.isEmpty()) {
            throw new IllegalArgumentException("Key names must not be empty");
        }
        this.kind = kind;
        this.id = id;
        this.name = name;
        this.parent = parent;
        this.path = buildPath();
    }

    @Contract("_, _ -> new")
    public static @NotNull Key of(@NotNull String kind, long id) {
        return new Key(kind, id, null, null);
    }

    @Contract("_, _ -> new")
    public static @NotNull Key of(@NotNull String kind, @NotNull String name) {
        return new Key(kind, null, name, null);
    }

    @Contract("_, _, _ -> new")
    public static @NotNull Key of(@Nullable Key parent, @NotNull String kind, long id) {
        return new Key(kind, id, null, parent);
    }

    @Contract("_, _, _ -> new")
    public static @NotNull Key of(@Nullable Key parent, @NotNull String kind, @NotNull String name) {
        return new Key(kind, null, name, parent);
    }

    /**
     * Creates an incomplete key; the store assigns the id on first put.
     */
    @Contract("_, _ -> new")
    public static @NotNull Key incomplete(@Nullable Key parent, @NotNull String kind) {
        return new Key(kind, null, null, parent);
    }

    /**
     * Parses the textual form produced by {@link #path()}.
     */
    public static @NotNull Key parse(@NotNull String path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Empty key path");
        }
        Key current = null;
        for (String component : path.split("/")) {
            String[] parts = component.split(":", 3);
            if (parts.length != 3) {
                throw new IllegalArgumentException("Malformed key component '" + component + "' in " + path);
            }
            switch (parts[1]) {
                case "i" -> {
                    try {
                        current = new Key(parts[0], Long.parseLong(parts[2]), null, current);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Malformed id in key component '" + component + "'", e);
                    }
                }
                case "n" -> current = new Key(parts[0], null, URLDecoder.decode(parts[2], StandardCharsets.UTF_8), current);
                default -> throw new IllegalArgumentException("Unknown key component type '" + parts[1] + "' in " + path);
            }
        }
        return current;
    }

    public @NotNull String kind() {
        return kind;
    }

    public @Nullable Long id() {
        return id;
    }

    public @Nullable String name() {
        return name;
    }

    public @Nullable Key parent() {
        return parent;
    }

    /**
     * The id or name, whichever is set.
     */
    public @Nullable Object idOrName() {
        return id != null ? id : name;
    }

    public boolean isComplete() {
        return id != null || name != null;
    }

    public @NotNull String path() {
        return path;
    }

    /**
     * The root of this key's entity group.
     */
    public @NotNull Key root() {
        Key current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * Returns true if this key equals {@code other} or is one of its ancestors.
     */
    public boolean isAncestorOf(@NotNull Key other) {
        Key current = other;
        while (current != null) {
            if (current.equals(this)) return true;
            current = current.parent;
        }
        return false;
    }

    /**
     * This key and its ancestors, root first.
     */
    public @NotNull List<Key> lineage() {
        List<Key> lineage = new ArrayList<>(4);
        Key current = this;
        while (current != null) {
            lineage.add(current);
            current = current.parent;
        }
        Collections.reverse(lineage);
        return lineage;
    }

    private String buildPath() {
        String own = id != null
            ? kind + ":i:" + id
            : name != null ? kind + ":n:" + URLEncoder.encode(name, StandardCharsets.UTF_8) : kind + ":?:";
        return parent == null ? own : parent.path + "/" + own;
    }

    @Override
    public int compareTo(@NotNull Key other) {
        List<Key> mine = lineage();
        List<Key> theirs = other.lineage();
        int shared = Math.min(mine.size(), theirs.size());
        for (int i = 0; i < shared; i++) {
            int cmp = compareComponent(mine.get(i), theirs.get(i));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(mine.size(), theirs.size());
    }

    private static int compareComponent(Key a, Key b) {
        int cmp = a.kind.compareTo(b.kind);
        if (cmp != 0) return cmp;
        if (a.id != null && b.id != null) return Long.compare(a.id, b.id);
        if (a.id != null) return b.name != null ? -1 : 1;
        if (b.id != null) return a.name != null ? 1 : -1;
        if (a.name != null && b.name != null) return a.name.compareTo(b.name);
        return Boolean.compare(a.name != null, b.name != null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Key key)) return false;
        return path.equals(key.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
