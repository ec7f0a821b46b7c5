package io.github.flameyossnowy.skeletal.api.bones;

import org.jetbrains.annotations.NotNull;

/**
 * When cached copies of a referenced record are refreshed.
 */
public enum RelationalUpdateLevel {
    /** Whenever the referenced record changes, and on rebuilds. */
    ALWAYS(0),
    /** Only on rebuilds and explicit refreshes. */
    ON_REBUILD(1),
    /** Only when the value is assigned. */
    NEVER(2);

    private final int value;

    RelationalUpdateLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static @NotNull RelationalUpdateLevel fromValue(long value) {
        for (RelationalUpdateLevel level : values()) {
            if (level.value == value) return level;
        }
        throw new IllegalArgumentException("Unknown relational update level " + value);
    }
}
