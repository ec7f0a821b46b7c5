package io.github.flameyossnowy.skeletal.mongodb;

import com.mongodb.MongoException;
import io.github.flameyossnowy.skeletal.api.exceptions.SkeletalException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import org.jetbrains.annotations.NotNull;

/**
 * Translates driver exceptions into Skeletal exceptions.
 */
public final class MongoErrors {
    static final int WRITE_CONFLICT = 112;
    static final int DUPLICATE_KEY = 11000;

    private MongoErrors() {
        throw new AssertionError("No instances");
    }

    /**
     * Transient transaction errors, unknown commit results, write conflicts and duplicate ids all
     * mean another writer got there first, so they become a retryable
     * {@link TransactionConflictException}.
     */
    public static @NotNull SkeletalException translate(@NotNull MongoException e) {
        if (e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
            || e.hasErrorLabel(MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL)
            || e.getCode() == WRITE_CONFLICT
            || e.getCode() == DUPLICATE_KEY) {
            return new TransactionConflictException("MongoDB transaction conflict: " + e.getMessage(), e);
        }
        return new SkeletalException("MongoDB operation failed: " + e.getMessage(), e);
    }
}
