package io.github.flameyossnowy.skeletal.api.integrity;

import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A detected inconsistency in stored bookkeeping data. The operation that detected it
 * still completes.
 */
public record IntegrityWarning(@NotNull Type type, @Nullable Key subject, @NotNull String detail) {

    public enum Type {
        /** A relational lock points at an entity that does not exist. */
        MISSING_LOCK_TARGET,
        /** Incoming and outgoing relational lock lists disagree. */
        ASYMMETRIC_RELATIONAL_LOCK,
        /** A unique value lock that should exist is gone. */
        MISSING_UNIQUE_LOCK,
        /** A unique value lock is held by a different record than expected. */
        FOREIGN_UNIQUE_LOCK,
        /** A relation edge points at an owner record that no longer exists. */
        VANISHED_OWNER
    }

    @Override
    public String toString() {
        return type + " on " + subject + ": " + detail;
    }
}
