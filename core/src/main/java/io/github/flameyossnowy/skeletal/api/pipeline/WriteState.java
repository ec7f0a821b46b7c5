package io.github.flameyossnowy.skeletal.api.pipeline;

/**
 * Stages of a single write.
 */
public enum WriteState {
    BEGIN,
    LOAD_EXISTING,
    ALLOCATE_KEY,
    MERGE_VALUES,
    SERIALIZE_BONES,
    COMMIT_ENTITY,
    POST_COMMIT,
    DONE,
    /** A unique value was taken by another record; reported through the record's errors. */
    LOCK_CONFLICT,
    /** Optimistic concurrency collision; the caller must retry the whole write. */
    TRANSACTION_CONFLICT,
    /** The write completed but integrity warnings were raised on the way. */
    FATAL;

    public boolean isTerminal() {
        return this == DONE || this == LOCK_CONFLICT || this == TRANSACTION_CONFLICT || this == FATAL;
    }

    /**
     * True for terminal states in which nothing was committed.
     */
    public boolean isFailure() {
        return this == LOCK_CONFLICT || this == TRANSACTION_CONFLICT;
    }
}
