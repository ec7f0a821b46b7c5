package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One reference held by a {@link RelationalBone}: a cached copy of the referenced record
 * ({@code dest}, always carrying its {@code key}) and the optional edge data ({@code rel}).
 *
 * <p>Both maps hold values in their stored form. The cached copy may be stale.</p>
 */
public record RelationalValue(@NotNull Map<String, Object> dest, @Nullable Map<String, Object> rel) {
    public static final String DEST = "dest";
    public static final String REL = "rel";

    @SuppressWarnings("unchecked")
    public RelationalValue {
        if (!(dest.get("key") instanceof Key)) {
            throw new IllegalArgumentException("Relational dest must carry a key, got " + dest);
        }
        dest = Collections.unmodifiableMap((Map<String, Object>) Entity.normalize(dest));
        rel = rel == null ? null : Collections.unmodifiableMap((Map<String, Object>) Entity.normalize(rel));
    }

    public @NotNull Key key() {
        return (Key) dest.get("key");
    }

    public @Nullable Object destValue(@NotNull String field) {
        return dest.get(field);
    }

    public @NotNull RelationalValue withRel(@Nullable Map<String, Object> newRel) {
        return new RelationalValue(dest, newRel);
    }

    /**
     * The stored representation, {@code {"dest": ..., "rel": ...}}.
     */
    public @NotNull Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(DEST, Entity.deepCopy(dest));
        map.put(REL, Entity.deepCopy(rel));
        return map;
    }

    @SuppressWarnings("unchecked")
    public static @Nullable RelationalValue fromMap(@NotNull Map<?, ?> map) {
        if (!(map.get(DEST) instanceof Map<?, ?> dest) || !(dest.get("key") instanceof Key)) {
            return null;
        }
        Object rel = map.get(REL);
        return new RelationalValue((Map<String, Object>) dest, rel instanceof Map<?, ?> relMap ? (Map<String, Object>) relMap : null);
    }
}
