package io.github.flameyossnowy.skeletal.api.exceptions;

/**
 * The store rejected a transaction because of a concurrent modification or because the
 * transaction grew past the store's limits. The whole operation may be retried.
 */
public class TransactionConflictException extends SkeletalException {
    public TransactionConflictException(String message) {
        super(message);
    }

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
