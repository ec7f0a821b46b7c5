package io.github.flameyossnowy.skeletal.api.skeleton;

import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.KeyBone;
import io.github.flameyossnowy.skeletal.api.exceptions.SchemaException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable schema of one record kind: its name, its bones in declaration order and the
 * adapters observing its writes.
 *
 * <p>Every definition carries a {@link KeyBone} named {@code key} as its first bone.</p>
 */
public final class SkeletonDefinition {
    public static final String KEY_BONE = "key";

    private final String kind;
    private final Map<String, BaseBone<?>> bones;
    private final List<DatabaseAdapter> adapters;

    private SkeletonDefinition(Builder builder) {
        this.kind = builder.kind;
        this.bones = Collections.unmodifiableMap(new LinkedHashMap<>(builder.bones));
        this.adapters = List.copyOf(builder.adapters);
    }

    @Contract("_ -> new")
    public static @NotNull Builder builder(@NotNull String kind) {
        return new Builder(kind);
    }

    public @NotNull String kind() {
        return kind;
    }

    public @NotNull Map<String, BaseBone<?>> bones() {
        return bones;
    }

    public @Nullable BaseBone<?> bone(@NotNull String name) {
        return bones.get(name);
    }

    public boolean hasBone(@NotNull String name) {
        return bones.containsKey(name);
    }

    public @NotNull List<DatabaseAdapter> adapters() {
        return adapters;
    }

    /**
     * Names of the bones declaring a unique constraint.
     */
    public @NotNull List<String> uniqueBones() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, BaseBone<?>> entry : bones.entrySet()) {
            if (entry.getValue().unique() != null) names.add(entry.getKey());
        }
        return names;
    }

    @Override
    public String toString() {
        return "SkeletonDefinition{" + kind + ", bones=" + bones.keySet() + '}';
    }

    public static class Builder {
        private final String kind;
        private final Map<String, BaseBone<?>> bones = new LinkedHashMap<>();
        private final List<DatabaseAdapter> adapters = new ArrayList<>();

        Builder(String kind) {
            if (kind.isBlank() || kind.indexOf(':') >= 0 || kind.indexOf('/') >= 0) {
                throw new SchemaException("Invalid kind name '" + kind + "'");
            }
            this.kind = kind;
            bones.put(KEY_BONE, new KeyBone());
        }

        public Builder bone(@NotNull String name, @NotNull BaseBone<?> bone) {
            if (name.isEmpty() || name.contains(".") || name.startsWith("_")) {
                throw new SchemaException("Invalid bone name '" + name + "' in " + kind);
            }
            if (SystemProperties.ALL.contains(name)) {
                throw new SchemaException("Bone name '" + name + "' is reserved");
            }
            if (bones.containsKey(name)) {
                throw new SchemaException("Duplicate bone '" + name + "' in " + kind);
            }
            bones.put(name, bone);
            return this;
        }

        public Builder adapter(@NotNull DatabaseAdapter adapter) {
            adapters.add(adapter);
            return this;
        }

        public SkeletonDefinition build() {
            return new SkeletonDefinition(this);
        }
    }
}
