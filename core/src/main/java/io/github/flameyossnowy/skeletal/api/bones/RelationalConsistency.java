package io.github.flameyossnowy.skeletal.api.bones;

import org.jetbrains.annotations.NotNull;

/**
 * What happens to a relational value when the record it references is deleted.
 */
public enum RelationalConsistency {
    /** Keep the stale copy. */
    IGNORE(1),
    /** Refuse to delete the referenced record. */
    PREVENT_DELETION(2),
    /** Remove the reference from the referencing record. */
    SET_NULL(3),
    /** Delete the referencing record as well. */
    CASCADE_DELETION(4);

    private final int value;

    RelationalConsistency(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static @NotNull RelationalConsistency fromValue(long value) {
        for (RelationalConsistency consistency : values()) {
            if (consistency.value == value) return consistency;
        }
        throw new IllegalArgumentException("Unknown relational consistency " + value);
    }
}
