import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReplaceOptions;
import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.SkeletalException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.QueryResult;
import io.github.flameyossnowy.skeletal.mongodb.MongoEntityStore;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class MongoEntityStoreTest {
    private MongoClient client;
    private ClientSession session;
    private MongoCollection<Document> posts;
    private MongoCollection<Document> counters;
    private MongoEntityStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        client = mock(MongoClient.class);
        session = mock(ClientSession.class);
        MongoDatabase database = mock(MongoDatabase.class);
        posts = mock(MongoCollection.class);
        counters = mock(MongoCollection.class);

        when(client.getDatabase("app")).thenReturn(database);
        when(client.startSession()).thenReturn(session);
        when(session.hasActiveTransaction()).thenReturn(true);
        when(database.getCollection("post")).thenReturn(posts);
        when(database.getCollection(MongoEntityStore.COUNTERS_COLLECTION)).thenReturn(counters);

        store = MongoEntityStore.builder()
            .withClient(client)
            .setDatabase("app")
            .maxEntityGroups(2)
            .build();
    }

    @SuppressWarnings("unchecked")
    private FindIterable<Document> found(Document... documents) {
        FindIterable<Document> iterable = mock(FindIterable.class);
        MongoCursor<Document> cursor = mock(MongoCursor.class);
        when(iterable.sort(any(Bson.class))).thenReturn(iterable);
        when(iterable.limit(anyInt())).thenReturn(iterable);
        when(iterable.iterator()).thenReturn(cursor);
        when(iterable.first()).thenReturn(documents.length == 0 ? null : documents[0]);

        Iterator<Document> remaining = List.of(documents).iterator();
        when(cursor.hasNext()).thenAnswer(invocation -> remaining.hasNext());
        when(cursor.next()).thenAnswer(invocation -> remaining.next());
        return iterable;
    }

    @Test
    void putOutsideTransactionUpserts() {
        Key key = store.put(new Entity(Key.of("post", 3)).put("name", "Hello"));

        ArgumentCaptor<Document> written = ArgumentCaptor.forClass(Document.class);
        ArgumentCaptor<ReplaceOptions> options = ArgumentCaptor.forClass(ReplaceOptions.class);
        verify(posts).replaceOne(any(Bson.class), written.capture(), options.capture());
        assertEquals(Key.of("post", 3), key);
        assertEquals("post:i:3", written.getValue().get("_id"));
        assertEquals("Hello", written.getValue().get("name"));
        assertTrue(options.getValue().isUpsert());
        verifyNoInteractions(session);
    }

    @Test
    void incompleteKeysTakeTheNextCounterValue() {
        when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenReturn(new Document("_id", "post").append("seq", 41L));

        Entity entity = new Entity(Key.incomplete(null, "post"));
        Key key = store.put(entity);

        assertEquals(Key.of("post", 41), key);
        assertEquals(key, entity.key());
    }

    @Test
    void getMissingReturnsNull() {
        FindIterable<Document> empty = found();
        when(posts.find(any(Bson.class))).thenReturn(empty);

        assertNull(store.get(Key.of("post", 9)));
    }

    @Test
    void transactionCommitsBeforeAfterCommitActions() {
        Runnable action = mock(Runnable.class);

        String result = store.runInTransaction(() -> {
            assertTrue(store.isInTransaction());
            store.put(new Entity(Key.of("post", 1)).put("name", "a"));
            store.afterCommit(action);
            verifyNoInteractions(action);
            return "done";
        });

        assertEquals("done", result);
        assertFalse(store.isInTransaction());
        InOrder order = inOrder(session, posts, action);
        order.verify(session).startTransaction();
        order.verify(posts).replaceOne(eq(session), any(Bson.class), any(Document.class), any(ReplaceOptions.class));
        order.verify(session).commitTransaction();
        order.verify(session).close();
        order.verify(action).run();
    }

    @Test
    void failingCallableAbortsAndDiscardsActions() {
        Runnable action = mock(Runnable.class);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> store.runInTransaction(() -> {
            store.afterCommit(action);
            throw new IllegalStateException("nope");
        }));

        assertEquals("nope", thrown.getMessage());
        verify(session).abortTransaction();
        verify(session, never()).commitTransaction();
        verify(session).close();
        verifyNoInteractions(action);
    }

    @Test
    void transientCommitErrorIsAConflict() {
        MongoException transientError = new MongoException(251, "no such transaction");
        transientError.addLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);
        doThrow(transientError).when(session).commitTransaction();

        assertThrows(TransactionConflictException.class, () -> store.runInTransaction(() -> null));
        verify(session).abortTransaction();
    }

    @Test
    void failedTransactionStartClosesTheSession() {
        doThrow(new MongoException(20, "transactions are not supported")).when(session).startTransaction();

        assertThrows(SkeletalException.class, () -> store.runInTransaction(() -> null));

        verify(session).close();
        assertFalse(store.isInTransaction());
    }

    @Test
    void entityGroupLimitComesFromConfig() {
        MongoEntityStore configured = MongoEntityStore.builder()
            .withClient(client)
            .setDatabase("app")
            .config(SkeletalConfig.builder().maxTransactionGroups(1).build())
            .build();

        assertThrows(TransactionConflictException.class, () -> configured.runInTransaction(() -> {
            configured.put(new Entity(Key.of("post", 1)));
            configured.put(new Entity(Key.of("post", 2)));
            return null;
        }));
        verify(session, never()).commitTransaction();
        verify(session).close();
    }

    @Test
    void tooManyEntityGroupsConflict() {
        assertThrows(TransactionConflictException.class, () -> store.runInTransaction(() -> {
            store.put(new Entity(Key.of("post", 1)));
            // same group as post 1
            store.put(new Entity(Key.of(Key.of("post", 1), "post", 5)));
            store.put(new Entity(Key.of("post", 2)));
            store.put(new Entity(Key.of("post", 3)));
            return null;
        }));
        verify(session, never()).commitTransaction();
    }

    @Test
    void nestedTransactionsJoinTheOuterOne() {
        store.runInTransaction(() -> store.runInTransaction(() -> {
            store.delete(Key.of("post", 1));
            return null;
        }));

        verify(client, times(1)).startSession();
        verify(posts).deleteOne(eq(session), any(Bson.class));
        verify(session, times(1)).commitTransaction();
    }

    @Test
    void queryReturnsCursorWhenMoreResultsExist() {
        FindIterable<Document> page = found(
            new Document("_id", "post:i:1").append("name", "a"),
            new Document("_id", "post:i:2").append("name", "b"),
            new Document("_id", "post:i:3").append("name", "c"));
        when(posts.find(any(Bson.class))).thenReturn(page);

        QueryResult result = store.query(EntityQuery.builder("post").limit(2).build());

        assertEquals(List.of(Key.of("post", 1), Key.of("post", 2)),
            result.entities().stream().map(Entity::key).toList());
        assertNotNull(result.nextCursor());
        verify(page).limit(3);
    }

    @Test
    void lastPageHasNoCursor() {
        FindIterable<Document> page = found(new Document("_id", "post:i:1"));
        when(posts.find(any(Bson.class))).thenReturn(page);

        QueryResult result = store.query(EntityQuery.builder("post").limit(5).build());

        assertEquals(1, result.entities().size());
        assertNull(result.nextCursor());
    }

    @Test
    void injectedClientIsNotClosed() {
        store.close();

        verify(client, never()).close();
    }
}
