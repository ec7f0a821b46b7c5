package io.github.flameyossnowy.skeletal.api.skeleton;

import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.RelationHolder;
import io.github.flameyossnowy.skeletal.api.exceptions.SchemaException;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All record kinds known to the application.
 *
 * <p>Built in two phases: definitions are registered on a {@link Builder}, then {@link Builder#build()}
 * seals the registry and binds every relational bone to its target schema. A sealed registry never
 * changes.</p>
 */
public final class SkeletonRegistry {
    private final Map<String, SkeletonDefinition> definitions;

    private SkeletonRegistry(Map<String, SkeletonDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    /**
     * @throws SchemaException if the kind is unknown
     */
    public @NotNull SkeletonDefinition definition(@NotNull String kind) {
        SkeletonDefinition definition = definitions.get(kind);
        if (definition == null) {
            throw new SchemaException("Unknown kind '" + kind + "'");
        }
        return definition;
    }

    public @NotNull Optional<SkeletonDefinition> find(@NotNull String kind) {
        return Optional.ofNullable(definitions.get(kind));
    }

    public boolean contains(@NotNull String kind) {
        return definitions.containsKey(kind);
    }

    public @NotNull Set<String> kinds() {
        return definitions.keySet();
    }

    public static class Builder {
        private final Map<String, SkeletonDefinition> definitions = new LinkedHashMap<>();
        private boolean sealed;

        public Builder register(@NotNull SkeletonDefinition definition) {
            if (sealed) {
                throw new SchemaException("Cannot register " + definition.kind() + ": the registry is already sealed");
            }
            if (definitions.putIfAbsent(definition.kind(), definition) != null) {
                throw new SchemaException("Kind '" + definition.kind() + "' is already registered");
            }
            return this;
        }

        public SkeletonRegistry build() {
            if (sealed) {
                throw new SchemaException("The registry was already built");
            }
            sealed = true;
            SkeletonRegistry registry = new SkeletonRegistry(new LinkedHashMap<>(definitions));
            for (SkeletonDefinition definition : definitions.values()) {
                for (Map.Entry<String, BaseBone<?>> entry : definition.bones().entrySet()) {
                    if (entry.getValue() instanceof RelationHolder holder) {
                        holder.bind(registry, definition.kind(), entry.getKey());
                    }
                }
            }
            Logging.info("Sealed skeleton registry with " + definitions.size() + " kind(s)");
            return registry;
        }
    }
}
