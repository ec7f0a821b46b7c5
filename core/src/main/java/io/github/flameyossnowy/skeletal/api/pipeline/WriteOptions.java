package io.github.flameyossnowy.skeletal.api.pipeline;

import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * @param clearUpdateTag mark the record as fresh: no propagation is scheduled and workers skip
 *                       its relation edges. Workers set this when they rewrite a record.
 * @param key            write under this key instead of the instance's own
 */
public record WriteOptions(boolean clearUpdateTag, @Nullable Key key) {
    private static final WriteOptions DEFAULTS = new WriteOptions(false, null);

    public static @NotNull WriteOptions defaults() {
        return DEFAULTS;
    }

    @Contract(" -> new")
    public static @NotNull WriteOptions fresh() {
        return new WriteOptions(true, null);
    }

    @Contract("_ -> new")
    public @NotNull WriteOptions withKey(@Nullable Key newKey) {
        return new WriteOptions(clearUpdateTag, newKey);
    }
}
