package io.github.flameyossnowy.skeletal.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.QueryResult;
import io.github.flameyossnowy.skeletal.api.store.TransactionCallable;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.bson.Document;
import org.bson.UuidRepresentation;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.in;

/**
 * {@link EntityStore} on MongoDB. Every kind is a collection; transactions are multi-document
 * transactions on a client session bound to the calling thread, so a replica set is required.
 *
 * <pre>{@code
 * MongoEntityStore store = MongoEntityStore.builder()
 *     .withConnectionString("mongodb://localhost:27017/?replicaSet=rs0")
 *     .setDatabase("app")
 *     .config(config)
 *     .build();
 * }</pre>
 */
public class MongoEntityStore implements EntityStore, AutoCloseable {
    public static final String COUNTERS_COLLECTION = "_skeletal_counters";

    private final MongoClient client;
    private final MongoDatabase database;
    private final boolean ownsClient;
    private final int maxEntityGroups;
    private final ThreadLocal<Transaction> current = new ThreadLocal<>();

    MongoEntityStore(@NotNull MongoClient client, @NotNull String databaseName, boolean ownsClient, int maxEntityGroups) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
        this.ownsClient = ownsClient;
        this.maxEntityGroups = maxEntityGroups;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public @NotNull MongoDatabase database() {
        return database;
    }

    private MongoCollection<Document> collection(String kind) {
        return database.getCollection(kind);
    }

    private @Nullable ClientSession session(@Nullable Key touched) {
        Transaction tx = current.get();
        if (tx == null) return null;
        if (touched != null) tx.touch(touched);
        return tx.session;
    }

    @Override
    public @Nullable Entity get(@NotNull Key key) {
        ClientSession session = session(key);
        try {
            FindIterable<Document> found = session == null
                ? collection(key.kind()).find(eq(MongoEntityCodec.ID, key.path()))
                : collection(key.kind()).find(session, eq(MongoEntityCodec.ID, key.path()));
            Document document = found.first();
            return document == null ? null : MongoEntityCodec.decode(key.kind(), document);
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
    }

    @Override
    public @NotNull Map<Key, Entity> getMulti(@NotNull Collection<Key> keys) {
        Map<String, List<Key>> byKind = new LinkedHashMap<>();
        for (Key key : keys) {
            byKind.computeIfAbsent(key.kind(), ignored -> new ArrayList<>()).add(key);
        }
        Map<Key, Entity> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, List<Key>> group : byKind.entrySet()) {
            List<String> paths = new ArrayList<>(group.getValue().size());
            ClientSession session = null;
            for (Key key : group.getValue()) {
                paths.add(key.path());
                session = session(key);
            }
            Bson filter = in(MongoEntityCodec.ID, paths);
            try {
                FindIterable<Document> found = session == null
                    ? collection(group.getKey()).find(filter)
                    : collection(group.getKey()).find(session, filter);
                for (Document document : found) {
                    Entity entity = MongoEntityCodec.decode(group.getKey(), document);
                    loaded.put(entity.key(), entity);
                }
            } catch (MongoException e) {
                throw MongoErrors.translate(e);
            }
        }
        Map<Key, Entity> ordered = new LinkedHashMap<>();
        for (Key key : keys) {
            Entity entity = loaded.get(key);
            if (entity != null) ordered.put(key, entity);
        }
        return ordered;
    }

    @Override
    public @NotNull Key put(@NotNull Entity entity) {
        if (!entity.key().isComplete()) {
            entity.setKey(allocateKey(entity.key().kind(), entity.key().parent()));
        }
        Key key = entity.key();
        ClientSession session = session(key);
        Bson filter = eq(MongoEntityCodec.ID, key.path());
        Document document = MongoEntityCodec.encode(entity);
        ReplaceOptions options = new ReplaceOptions().upsert(true);
        try {
            if (session == null) {
                collection(key.kind()).replaceOne(filter, document, options);
            } else {
                collection(key.kind()).replaceOne(session, filter, document, options);
            }
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
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
        ClientSession session = session(key);
        Bson filter = eq(MongoEntityCodec.ID, key.path());
        try {
            if (session == null) {
                collection(key.kind()).deleteOne(filter);
            } else {
                collection(key.kind()).deleteOne(session, filter);
            }
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
    }

    @Override
    public void deleteMulti(@NotNull Collection<Key> keys) {
        for (Key key : keys) delete(key);
    }

    @Override
    public <T> T runInTransaction(@NotNull TransactionCallable<T> callable) {
        if (current.get() != null) {
            return callable.call();
        }

        ClientSession session;
        try {
            session = client.startSession();
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
        try {
            session.startTransaction();
        } catch (MongoException e) {
            session.close();
            throw MongoErrors.translate(e);
        }
        Transaction tx = new Transaction(session);
        current.set(tx);
        T result;
        try {
            result = callable.call();
            tx.session.commitTransaction();
        } catch (MongoException e) {
            abort(tx);
            throw MongoErrors.translate(e);
        } catch (RuntimeException e) {
            abort(tx);
            throw e;
        } finally {
            current.remove();
            tx.session.close();
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

    private static void abort(Transaction tx) {
        if (!tx.session.hasActiveTransaction()) return;
        try {
            tx.session.abortTransaction();
        } catch (MongoException e) {
            Logging.warn("Failed to abort MongoDB transaction: " + e.getMessage());
        }
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
        Bson filter = MongoFilterBuilder.filterOf(query);
        if (query.cursor() != null) {
            filter = and(filter, MongoCursorCodec.resumeFilter(query.cursor(), query.sortOptions()));
        }
        ClientSession session = session(null);
        try {
            FindIterable<Document> iterable = session == null
                ? collection(query.kind()).find(filter)
                : collection(query.kind()).find(session, filter);
            iterable = iterable.sort(MongoFilterBuilder.sortOf(query.sortOptions()));
            // one extra document tells whether another page exists
            if (query.limit() != -1) iterable = iterable.limit(query.limit() + 1);

            List<Document> documents = new ArrayList<>();
            try (MongoCursor<Document> cursor = iterable.iterator()) {
                while (cursor.hasNext()) documents.add(cursor.next());
            }

            String next = null;
            if (query.limit() != -1 && documents.size() > query.limit()) {
                documents = documents.subList(0, query.limit());
                next = MongoCursorCodec.encode(documents.get(documents.size() - 1), query.sortOptions());
            }
            List<Entity> entities = new ArrayList<>(documents.size());
            for (Document document : documents) {
                entities.add(MongoEntityCodec.decode(query.kind(), document));
            }
            return new QueryResult(entities, next);
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
    }

    /**
     * Allocates ids from a counter document per kind. Allocation is not part of any running
     * transaction, so ids of rolled back writes are never reused.
     */
    @Override
    public @NotNull Key allocateKey(@NotNull String kind, @Nullable Key parent) {
        try {
            Document counter = database.getCollection(COUNTERS_COLLECTION).findOneAndUpdate(
                eq(MongoEntityCodec.ID, kind),
                Updates.inc("seq", 1L),
                new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER));
            Number seq = Objects.requireNonNull(counter, "counter upsert returned nothing").get("seq", Number.class);
            return Key.of(parent, kind, seq.longValue());
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
    }

    @Override
    public void close() {
        if (ownsClient) client.close();
    }

    private final class Transaction {
        private final ClientSession session;
        private final Set<Key> groups = new HashSet<>();
        private final List<Runnable> afterCommit = new ArrayList<>();

        Transaction(ClientSession session) {
            this.session = session;
        }

        void touch(Key key) {
            if (groups.add(key.root()) && groups.size() > maxEntityGroups) {
                throw new TransactionConflictException("Transaction touches more than " + maxEntityGroups + " entity groups");
            }
        }
    }

    public static class Builder {
        private MongoClient client;
        private MongoClientSettings.Builder settings;
        private String database;
        private int maxEntityGroups = SkeletalConfig.defaults().maxTransactionGroups();

        public Builder withClient(@NotNull MongoClient client) {
            this.client = client;
            return this;
        }

        public Builder withSettings(@NotNull MongoClientSettings.Builder settings) {
            this.settings = settings;
            return this;
        }

        public Builder withConnectionString(@NotNull String connectionString) {
            this.settings = MongoClientSettings.builder().applyConnectionString(new ConnectionString(connectionString));
            return this;
        }

        public Builder setDatabase(@NotNull String database) {
            this.database = database;
            return this;
        }

        /**
         * Takes the transaction limits from the runtime configuration.
         */
        public Builder config(@NotNull SkeletalConfig config) {
            return maxEntityGroups(config.maxTransactionGroups());
        }

        public Builder maxEntityGroups(int maxEntityGroups) {
            if (maxEntityGroups < 1) {
                throw new IllegalArgumentException("maxEntityGroups must be positive");
            }
            this.maxEntityGroups = maxEntityGroups;
            return this;
        }

        public MongoEntityStore build() {
            Objects.requireNonNull(database, "database");
            if (client != null) {
                return new MongoEntityStore(client, database, false, maxEntityGroups);
            }
            if (settings == null) {
                throw new IllegalStateException("Either a client, settings or a connection string is required");
            }
            MongoClient created = MongoClients.create(settings.uuidRepresentation(UuidRepresentation.STANDARD).build());
            return new MongoEntityStore(created, database, true, maxEntityGroups);
        }
    }
}
