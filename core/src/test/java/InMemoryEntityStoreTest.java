import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.QueryResult;
import io.github.flameyossnowy.skeletal.api.store.memory.InMemoryEntityStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEntityStoreTest {

    private static Entity item(long id, String name, long rank) {
        return new Entity(Key.of("item", id)).put("name", name).put("rank", rank);
    }

    @Test
    void put_allocatesIdsForIncompleteKeys() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        Key first = store.put(new Entity(Key.incomplete(null, "item")));
        Key second = store.put(new Entity(Key.incomplete(null, "item")));
        assertTrue(first.isComplete());
        assertNotEquals(first, second);
        assertEquals(2, store.count("item"));
    }

    @Test
    void get_returnsCopies() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.put(item(1, "a", 1));
        store.get(Key.of("item", 1)).put("name", "changed");
        assertEquals("a", store.get(Key.of("item", 1)).get("name"));
    }

    @Test
    void transaction_buffersWritesUntilCommit() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        List<String> events = new ArrayList<>();
        store.runInTransaction(() -> {
            store.put(item(1, "a", 1));
            store.afterCommit(() -> events.add("committed"));
            assertNotNull(store.get(Key.of("item", 1)));
            assertEquals(0, store.count("item"));
            assertTrue(events.isEmpty());
            return null;
        });
        assertEquals(1, store.count("item"));
        assertEquals(List.of("committed"), events);
    }

    @Test
    void failedTransaction_discardsWrites() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        assertThrows(IllegalStateException.class, () -> store.runInTransaction(() -> {
            store.put(item(1, "a", 1));
            throw new IllegalStateException("boom");
        }));
        assertNull(store.get(Key.of("item", 1)));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void concurrentModification_conflicts() throws Exception {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.put(item(1, "a", 1));
        CountDownLatch read = new CountDownLatch(1);
        CountDownLatch written = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> slow = executor.submit(() -> store.runInTransaction(() -> {
                Entity entity = store.get(Key.of("item", 1));
                read.countDown();
                await(written);
                store.put(entity.put("name", "slow"));
                return null;
            }));
            assertTrue(read.await(5, TimeUnit.SECONDS));
            store.runInTransaction(() -> store.put(item(1, "fast", 1)));
            written.countDown();

            Exception failure = assertThrows(Exception.class, () -> slow.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TransactionConflictException.class, failure.getCause());
            assertEquals("fast", store.get(Key.of("item", 1)).get("name"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void tooManyEntityGroups_conflicts() {
        InMemoryEntityStore store = new InMemoryEntityStore(2);
        assertThrows(TransactionConflictException.class, () -> store.runInTransaction(() -> {
            store.put(item(1, "a", 1));
            store.put(new Entity(Key.of(Key.of("item", 1), "child", 1)));
            store.put(item(2, "b", 1));
            store.put(item(3, "c", 1));
            return null;
        }));
        assertEquals(0, store.count("item"));
    }

    @Test
    void query_pagesWithCursor() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        for (long i = 1; i <= 7; i++) {
            store.put(item(i, "n" + i, i % 3));
        }
        EntityQuery query = EntityQuery.builder("item")
            .where("rank").gte(1)
            .orderBy("rank", SortOrder.DESCENDING)
            .limit(2)
            .build();

        List<Key> seen = new ArrayList<>();
        QueryResult page = store.query(query);
        while (true) {
            for (Entity entity : page.entities()) seen.add(entity.key());
            if (!page.hasMore()) break;
            page = store.query(query.withCursor(page.nextCursor()));
        }
        assertEquals(List.of(Key.of("item", 2), Key.of("item", 5), Key.of("item", 1), Key.of("item", 4), Key.of("item", 7)), seen);
    }

    @Test
    void query_filtersByAncestorAndKey() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        Key parent = Key.of("item", 1);
        store.put(item(1, "a", 1));
        store.put(new Entity(Key.of(parent, "note", 1)).put("text", "x"));
        store.put(new Entity(Key.of(Key.of("item", 2), "note", 1)).put("text", "y"));

        List<Entity> notes = store.queryAll(EntityQuery.builder("note").ancestor(parent).build());
        assertEquals(1, notes.size());
        assertEquals("x", notes.get(0).get("text"));

        List<Entity> byKey = store.queryAll(EntityQuery.builder("item").where("__key__").eq(parent).build());
        assertEquals(1, byKey.size());
    }

    @Test
    void entityGroupLimit_comesFromConfig() {
        InMemoryEntityStore store = new InMemoryEntityStore(SkeletalConfig.builder().maxTransactionGroups(1).build());
        assertThrows(TransactionConflictException.class, () -> store.runInTransaction(() -> {
            store.put(item(1, "a", 1));
            store.put(item(2, "b", 1));
            return null;
        }));
        assertEquals(0, store.count("item"));
    }

    @Test
    void cursor_carriesItsPosition() {
        InMemoryEntityStore first = new InMemoryEntityStore();
        InMemoryEntityStore second = new InMemoryEntityStore();
        for (long i = 1; i <= 4; i++) {
            first.put(item(i, "n" + i, 10 - i));
            second.put(item(i, "n" + i, 10 - i));
        }
        EntityQuery query = EntityQuery.builder("item").orderBy("rank", SortOrder.ASCENDING).limit(2).build();

        QueryResult page = first.query(query);
        assertEquals(List.of(Key.of("item", 4), Key.of("item", 3)), page.entities().stream().map(Entity::key).toList());

        // no store holds state for the cursor, so any store with the same data resumes it
        QueryResult rest = second.query(query.withCursor(page.nextCursor()));
        assertEquals(List.of(Key.of("item", 2), Key.of("item", 1)), rest.entities().stream().map(Entity::key).toList());
        assertFalse(rest.hasMore());
    }

    @Test
    void cursor_resumesAfterChanges() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        for (long i = 1; i <= 4; i++) {
            store.put(item(i, "n" + i, i));
        }
        EntityQuery query = EntityQuery.builder("item").orderBy("rank", SortOrder.ASCENDING).limit(2).build();
        QueryResult page = store.query(query);

        store.delete(Key.of("item", 3));
        store.put(item(5, "early", 0));
        store.put(item(6, "late", 9));

        QueryResult rest = store.query(query.withCursor(page.nextCursor()));
        assertEquals(List.of(Key.of("item", 4), Key.of("item", 6)), rest.entities().stream().map(Entity::key).toList());
    }

    @Test
    void cursorOfOtherOrders_isRejected() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        for (long i = 1; i <= 3; i++) {
            store.put(item(i, "n" + i, i));
        }
        QueryResult page = store.query(EntityQuery.builder("item").limit(1).build());

        EntityQuery ordered = EntityQuery.builder("item").orderBy("rank", SortOrder.ASCENDING)
            .cursor(page.nextCursor()).build();
        assertThrows(IllegalArgumentException.class, () -> store.query(ordered));
    }

    @Test
    void unknownCursor_isRejected() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        assertThrows(IllegalArgumentException.class,
            () -> store.query(EntityQuery.builder("item").cursor("nope").build()));
        assertThrows(IllegalArgumentException.class,
            () -> store.query(EntityQuery.builder("item").cursor("%%%").build()));
    }
}
