package io.github.flameyossnowy.skeletal.api.store;

import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Client of the keyed document store the engine runs on.
 *
 * <p>Point reads inside a transaction are strongly consistent; queries may lag behind
 * committed writes. A transaction touches a bounded number of entity groups; exceeding the
 * bound or colliding with a concurrent writer fails the transaction with
 * {@link TransactionConflictException} and nothing of it is applied.</p>
 */
public interface EntityStore {

    @Nullable Entity get(@NotNull Key key);

    /**
     * Reads several entities at once. Missing entities are absent from the returned map.
     */
    @NotNull Map<Key, Entity> getMulti(@NotNull Collection<Key> keys);

    /**
     * Stores the entity, allocating an id first when its key is incomplete.
     *
     * @return the (now complete) key
     */
    @NotNull Key put(@NotNull Entity entity);

    @NotNull List<Key> putMulti(@NotNull Collection<Entity> entities);

    void delete(@NotNull Key key);

    void deleteMulti(@NotNull Collection<Key> keys);

    /**
     * Runs {@code callable} atomically. A call made while a transaction is already running on
     * this thread joins it.
     *
     * @throws TransactionConflictException when the transaction could not be committed
     */
    <T> T runInTransaction(@NotNull TransactionCallable<T> callable);

    boolean isInTransaction();

    /**
     * Runs {@code action} once the current transaction has committed, or right away when no
     * transaction is running. Actions of a rolled back transaction never run.
     */
    void afterCommit(@NotNull Runnable action);

    @NotNull QueryResult query(@NotNull EntityQuery query);

    @NotNull Key allocateKey(@NotNull String kind, @Nullable Key parent);

    /**
     * Runs the query page by page until it is exhausted.
     */
    default @NotNull List<Entity> queryAll(@NotNull EntityQuery query) {
        List<Entity> all = new ArrayList<>();
        EntityQuery page = query;
        while (true) {
            QueryResult result = query(page);
            all.addAll(result.entities());
            if (!result.hasMore()) {
                return all;
            }
            page = page.withCursor(result.nextCursor());
        }
    }
}
