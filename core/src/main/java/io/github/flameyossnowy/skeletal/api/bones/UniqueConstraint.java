package io.github.flameyossnowy.skeletal.api.bones;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Declares a bone's value unique across all records of its kind.
 *
 * @param lockEmpty whether an empty value is locked too
 * @param message   error reported to the client when the value is taken
 */
public record UniqueConstraint(@NotNull UniqueLockMethod method, boolean lockEmpty, @NotNull String message) {
    @Contract("_ -> new")
    public static @NotNull UniqueConstraint of(@NotNull String message) {
        return new UniqueConstraint(UniqueLockMethod.SAME_VALUE, false, message);
    }
}
