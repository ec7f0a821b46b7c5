package io.github.flameyossnowy.skeletal.api.store;

/**
 * Work executed inside {@link EntityStore#runInTransaction(TransactionCallable)}.
 */
@FunctionalInterface
public interface TransactionCallable<T> {
    T call();
}
