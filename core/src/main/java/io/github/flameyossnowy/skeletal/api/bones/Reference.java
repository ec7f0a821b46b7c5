package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * A reference as assigned to a {@link RelationalBone}: the target key plus edge data for the
 * bone's {@code using} schema, in client form.
 */
public record Reference(@NotNull Key key, @NotNull Map<String, ?> rel) {
    public Reference {
        rel = Map.copyOf(rel);
    }

    @Contract("_ -> new")
    public static @NotNull Reference to(@NotNull Key key) {
        return new Reference(key, Map.of());
    }

    @Contract("_, _ -> new")
    public static @NotNull Reference to(@NotNull Key key, @NotNull Map<String, ?> rel) {
        return new Reference(key, rel);
    }
}
