import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.tasks.RelationTask;
import io.github.flameyossnowy.skeletal.api.tasks.TaskCodec;
import io.github.flameyossnowy.skeletal.api.tasks.TaskDispatcher;
import io.github.flameyossnowy.skeletal.api.tasks.VacuumRelations;
import io.github.flameyossnowy.skeletal.mongodb.MongoTaskQueue;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MongoTaskQueueTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final RelationTask TASK = new VacuumRelations(VacuumRelations.ALL_KINDS, null, 0, 0);

    private final TaskCodec codec = new TaskCodec();
    private MongoCollection<Document> collection;
    private TaskDispatcher dispatcher;
    private MongoTaskQueue queue;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        collection = mock(MongoCollection.class);
        dispatcher = mock(TaskDispatcher.class);
        queue = new MongoTaskQueue(collection, codec, 3, Duration.ofSeconds(2), Duration.ofMinutes(5),
            Clock.fixed(NOW, ZoneOffset.UTC));
        queue.bind(dispatcher);
    }

    private Document leased(String payload, int attempts) {
        return new Document("_id", new ObjectId())
            .append("type", TASK.type().name())
            .append("payload", payload)
            .append("attempts", attempts);
    }

    private void leaseReturns(Document first, Document... rest) {
        when(collection.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenReturn(first, rest);
    }

    @Test
    void enqueueStoresADueTask() {
        queue.enqueue(TASK);

        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        verify(collection).insertOne(inserted.capture());
        Document document = inserted.getValue();
        assertEquals("VACUUM_RELATIONS", document.getString("type"));
        assertEquals(TASK, codec.decode(document.getString("payload")));
        assertEquals(0, document.get("attempts"));
        assertEquals(Date.from(NOW), document.getDate("available_at"));
        assertTrue(document.containsKey("lease_until"));
        assertNull(document.get("lease_until"));
    }

    @Test
    void enqueueFailuresAreTranslated() {
        when(collection.insertOne(any(Document.class))).thenThrow(new MongoException(112, "write conflict"));

        assertThrows(TransactionConflictException.class, () -> queue.enqueue(TASK));
    }

    @Test
    void pollingRequiresADispatcher() {
        @SuppressWarnings("unchecked")
        MongoTaskQueue unbound = new MongoTaskQueue(mock(MongoCollection.class), codec, 1, Duration.ZERO,
            Duration.ofMinutes(1), Clock.systemUTC());

        assertThrows(IllegalStateException.class, unbound::pollOnce);
    }

    @Test
    void nothingDue() {
        leaseReturns(null);

        assertFalse(queue.pollOnce());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void completedTasksAreDeleted() {
        leaseReturns(leased(codec.encode(TASK), 1), leased(codec.encode(TASK), 1), null);

        assertEquals(2, queue.drain());

        verify(dispatcher, times(2)).dispatch(TASK);
        verify(collection, times(2)).deleteOne(any(Bson.class));
        verify(collection, never()).updateOne(any(Bson.class), any(Bson.class));
    }

    @Test
    void failedTaskIsRescheduledWithBackoff() {
        leaseReturns(leased(codec.encode(TASK), 2));
        doThrow(new IllegalStateException("boom")).when(dispatcher).dispatch(TASK);

        assertTrue(queue.pollOnce());

        ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
        verify(collection).updateOne(any(Bson.class), update.capture());
        verify(collection, never()).deleteOne(any(Bson.class));

        BsonDocument set = MongoFilterBuilderTest.render(update.getValue()).getDocument("$set");
        // second attempt doubles the two second backoff
        assertEquals(NOW.plusSeconds(4).toEpochMilli(), set.getDateTime("available_at").getValue());
        assertTrue(set.get("lease_until").isNull());
    }

    @Test
    void taskIsDroppedAfterTheLastAttempt() {
        leaseReturns(leased(codec.encode(TASK), 3));
        doThrow(new IllegalStateException("boom")).when(dispatcher).dispatch(TASK);

        assertTrue(queue.pollOnce());

        verify(collection).deleteOne(any(Bson.class));
        verify(collection, never()).updateOne(any(Bson.class), any(Bson.class));
    }

    @Test
    void permanentFailuresAreDroppedImmediately() {
        leaseReturns(leased(codec.encode(TASK), 1));
        doThrow(new PermanentTaskException("unknown kind")).when(dispatcher).dispatch(TASK);

        assertTrue(queue.pollOnce());

        verify(collection).deleteOne(any(Bson.class));
        verify(collection, never()).updateOne(any(Bson.class), any(Bson.class));
    }

    @Test
    void undecodablePayloadIsDropped() {
        leaseReturns(leased("{not json", 1));

        assertTrue(queue.pollOnce());

        verifyNoInteractions(dispatcher);
        verify(collection).deleteOne(any(Bson.class));
    }
}
