package io.github.flameyossnowy.skeletal.api.store.memory;

import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.QueryEvaluator;
import io.github.flameyossnowy.skeletal.api.store.QueryResult;
import io.github.flameyossnowy.skeletal.api.store.TransactionCallable;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entity store kept entirely in memory.
 *
 * <p>Transactions are optimistic: every entity read or written inside a transaction has its
 * committed version recorded, writes are buffered, and commit validates all recorded versions
 * under a single commit lock. A mismatch, or touching more than {@code maxEntityGroups}
 * entity groups, fails with {@link TransactionConflictException}. Queries always see committed
 * state only, and their cursors are positions rather than snapshots: a page resumes after the last
 * returned entity in whatever state the store holds then.</p>
 */
public class InMemoryEntityStore implements EntityStore {
    private static final Entity TOMBSTONE = new Entity(Key.of("__tombstone__", 1));

    private final TreeMap<Key, Entity> committed = new TreeMap<>();
    private final Map<Key, Long> versions = new HashMap<>();
    private final Object commitLock = new Object();
    private final Map<String, AtomicLong> idSequences = new ConcurrentHashMap<>();
    private final ThreadLocal<Transaction> current = new ThreadLocal<>();
    private final int maxEntityGroups;

    public InMemoryEntityStore() {
        this(SkeletalConfig.defaults());
    }

    public InMemoryEntityStore(@NotNull SkeletalConfig config) {
        this(config.maxTransactionGroups());
    }

    public InMemoryEntityStore(int maxEntityGroups) {
        if (maxEntityGroups < 1) {
            throw new IllegalArgumentException("maxEntityGroups must be positive");
        }
        this.maxEntityGroups = maxEntityGroups;
    }

    @Override
    public @Nullable Entity get(@NotNull Key key) {
        Transaction tx = current.get();
        if (tx != null) {
            Entity buffered = tx.writes.get(key);
            if (buffered != null) {
                return buffered == TOMBSTONE ? null : buffered.copy();
            }
            tx.touch(key);
        }
        synchronized (commitLock) {
            if (tx != null) {
                tx.readVersions.putIfAbsent(key, versionOf(key));
            }
            Entity entity = committed.get(key);
            return entity == null ? null : entity.copy();
        }
    }

    @Override
    public @NotNull Map<Key, Entity> getMulti(@NotNull Collection<Key> keys) {
        Map<Key, Entity> found = new LinkedHashMap<>();
        for (Key key : keys) {
            Entity entity = get(key);
            if (entity != null) found.put(key, entity);
        }
        return found;
    }

    @Override
    public @NotNull Key put(@NotNull Entity entity) {
        if (!entity.key().isComplete()) {
            entity.setKey(allocateKey(entity.key().kind(), entity.key().parent()));
        }
        Key key = entity.key();
        Transaction tx = current.get();
        if (tx == null) {
            synchronized (commitLock) {
                apply(key, entity.copy());
            }
            return key;
        }
        tx.touch(key);
        recordVersion(tx, key);
        tx.writes.put(key, entity.copy());
        return key;
    }

    @Override
    public @NotNull List<Key> putMulti(@NotNull Collection<Entity> entities) {
        List<Key> keys = new ArrayList<>(entities.size());
        for (Entity entity : entities) keys.add(put(entity));
        return keys;
    }

    @Override
    public void delete(@NotNull Key key) {
        Transaction tx = current.get();
        if (tx == null) {
            synchronized (commitLock) {
                apply(key, null);
            }
            return;
        }
        tx.touch(key);
        recordVersion(tx, key);
        tx.writes.put(key, TOMBSTONE);
    }

    @Override
    public void deleteMulti(@NotNull Collection<Key> keys) {
        for (Key key : keys) delete(key);
    }

    private void recordVersion(Transaction tx, Key key) {
        if (tx.readVersions.containsKey(key)) return;
        synchronized (commitLock) {
            tx.readVersions.put(key, versionOf(key));
        }
    }

    @Override
    public <T> T runInTransaction(@NotNull TransactionCallable<T> callable) {
        if (current.get() != null) {
            return callable.call();
        }

        Transaction tx = new Transaction();
        current.set(tx);
        T result;
        try {
            result = callable.call();
            commit(tx);
        } finally {
            current.remove();
        }

        for (Runnable action : tx.afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                Logging.error("After-commit action failed: " + e.getMessage(), e);
            }
        }
        return result;
    }

    private void commit(Transaction tx) {
        synchronized (commitLock) {
            for (Map.Entry<Key, Long> read : tx.readVersions.entrySet()) {
                if (versionOf(read.getKey()) != read.getValue()) {
                    throw new TransactionConflictException("Concurrent modification of " + read.getKey());
                }
            }
            for (Map.Entry<Key, Entity> write : tx.writes.entrySet()) {
                apply(write.getKey(), write.getValue() == TOMBSTONE ? null : write.getValue());
            }
        }
        Logging.deepInfo(() -> "Committed transaction touching " + tx.groups.size() + " entity group(s), "
            + tx.writes.size() + " write(s)");
    }

    // caller holds commitLock; versions survive deletion so a reader of a deleted entity still conflicts
    private void apply(Key key, @Nullable Entity entity) {
        versions.merge(key, 1L, Long::sum);
        if (entity == null) {
            committed.remove(key);
        } else {
            committed.put(key, entity);
        }
    }

    private long versionOf(Key key) {
        return versions.getOrDefault(key, 0L);
    }

    @Override
    public boolean isInTransaction() {
        return current.get() != null;
    }

    @Override
    public void afterCommit(@NotNull Runnable action) {
        Transaction tx = current.get();
        if (tx == null) {
            action.run();
        } else {
            tx.afterCommit.add(action);
        }
    }

    @Override
    public @NotNull QueryResult query(@NotNull EntityQuery query) {
        List<Entity> matching = new ArrayList<>();
        synchronized (commitLock) {
            for (Entity entity : committed.values()) {
                if (QueryEvaluator.matches(entity, query)) {
                    matching.add(entity.copy());
                }
            }
        }
        matching.sort(QueryEvaluator.comparator(query.sortOptions()));

        if (query.cursor() != null) {
            InMemoryCursorCodec.Position position = InMemoryCursorCodec.decode(query.cursor(), query.sortOptions().size());
            matching.removeIf(entity -> QueryEvaluator.comparePositions(
                QueryEvaluator.sortValues(entity, query.sortOptions()), entity.key(),
                position.sortValues(), position.key(), query.sortOptions()) <= 0);
        }

        if (query.limit() == -1 || matching.size() <= query.limit()) {
            return new QueryResult(matching, null);
        }

        List<Entity> page = matching.subList(0, query.limit());
        Entity last = page.get(page.size() - 1);
        return new QueryResult(page, InMemoryCursorCodec.encode(QueryEvaluator.sortValues(last, query.sortOptions()), last.key()));
    }

    @Override
    public @NotNull Key allocateKey(@NotNull String kind, @Nullable Key parent) {
        long id = idSequences.computeIfAbsent(kind, ignored -> new AtomicLong()).incrementAndGet();
        return Key.of(parent, kind, id);
    }

    /**
     * Number of committed entities of the given kind.
     */
    public int count(@NotNull String kind) {
        int count = 0;
        synchronized (commitLock) {
            for (Key key : committed.keySet()) {
                if (key.kind().equals(kind)) count++;
            }
        }
        return count;
    }

    public void clear() {
        synchronized (commitLock) {
            committed.clear();
            versions.clear();
        }
    }

    private final class Transaction {
        private final Map<Key, Long> readVersions = new HashMap<>();
        private final Map<Key, Entity> writes = new LinkedHashMap<>();
        private final Set<Key> groups = new HashSet<>();
        private final List<Runnable> afterCommit = new ArrayList<>();

        void touch(Key key) {
            if (groups.add(key.root()) && groups.size() > maxEntityGroups) {
                throw new TransactionConflictException("Transaction touches more than " + maxEntityGroups + " entity groups");
            }
        }
    }
}
