import io.github.flameyossnowy.skeletal.api.bones.NumericBone;
import io.github.flameyossnowy.skeletal.api.bones.RelationalBone;
import io.github.flameyossnowy.skeletal.api.bones.RelationalUpdateLevel;
import io.github.flameyossnowy.skeletal.api.bones.RelationalValue;
import io.github.flameyossnowy.skeletal.api.bones.StringBone;
import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.SchemaException;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityWarning;
import io.github.flameyossnowy.skeletal.api.skeleton.DatabaseAdapter;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.tasks.RebuildIndex;
import io.github.flameyossnowy.skeletal.api.tasks.RelationTask;
import io.github.flameyossnowy.skeletal.api.tasks.UpdateRelations;
import io.github.flameyossnowy.skeletal.api.tasks.VacuumRelations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RelationPropagationTest {
    private DatabaseAdapter articleAdapter;
    private TestRuntime test;

    @BeforeEach
    void setUp() {
        articleAdapter = mock(DatabaseAdapter.class);
        test = new TestRuntime(
            SkeletalConfig.builder().changeListThreshold(2).build(),
            SkeletonDefinition.builder("author")
                .bone("name", StringBone.builder().build())
                .bone("bio", StringBone.builder().build())
                .bone("age", NumericBone.builder().build())
                .build(),
            SkeletonDefinition.builder("article")
                .bone("name", StringBone.builder().build())
                .bone("author", RelationalBone.builder("author").build())
                .bone("editor", RelationalBone.builder("author").updateLevel(RelationalUpdateLevel.NEVER).build())
                .adapter(articleAdapter)
                .build()
        );
    }

    private Key author(String name) {
        return test.runtime.newSkeleton("author").set("name", name).write().orElseThrow();
    }

    private Key article(String name, Key author) {
        return test.runtime.newSkeleton("article").set("name", name).set("author", author).write().orElseThrow();
    }

    private void rename(Key author, String name) {
        SkeletonInstance skel = test.runtime.read("author", author).orElseThrow();
        skel.set("name", name);
        skel.write().orElseThrow();
    }

    private String cachedAuthorName(Key article) {
        SkeletonInstance skel = test.runtime.read("article", article).orElseThrow();
        return (String) ((RelationalValue) skel.get("author")).destValue("name");
    }

    @Test
    void newRecord_schedulesNothing() {
        author("Ada");
        assertEquals(0, test.queue.size());
    }

    @Test
    void change_propagatesToCachedCopies() {
        Key ada = author("Ada");
        Key first = article("First", ada);
        Key second = article("Second", ada);

        rename(ada, "Ada Lovelace");
        List<RelationTask> pending = test.queue.pending();
        assertEquals(1, pending.size());
        UpdateRelations task = (UpdateRelations) pending.get(0);
        assertEquals(ada, task.destKey());
        assertEquals("name", task.changedField());

        test.queue.drain();
        assertEquals("Ada Lovelace", cachedAuthorName(first));
        assertEquals("Ada Lovelace", cachedAuthorName(second));
        assertEquals(0L, test.store.get(first).get(SystemProperties.DELAYED_UPDATE_TAG));
        verify(articleAdapter, times(2)).write(any(), eq(false), anyList());
        for (Entity edge : test.edgesTo(ada)) {
            assertEquals("Ada Lovelace", ((Map<?, ?>) edge.get(RelationalBone.EDGE_DEST)).get("name"));
        }
    }

    @Test
    void propagation_isIdempotent() {
        Key ada = author("Ada");
        article("First", ada);
        rename(ada, "Ada Lovelace");
        UpdateRelations task = (UpdateRelations) test.queue.pending().get(0);
        test.queue.drain();
        verify(articleAdapter, times(1)).write(any(), eq(false), anyList());

        test.runtime.enqueue(task);
        test.queue.drain();
        verify(articleAdapter, times(1)).write(any(), eq(false), anyList());
    }

    @Test
    void changeOfUncachedField_touchesNoReferrer() {
        Key ada = author("Ada");
        article("First", ada);

        SkeletonInstance skel = test.runtime.read("author", ada).orElseThrow();
        skel.set("bio", "Mathematician");
        skel.write().orElseThrow();
        test.queue.drain();

        verify(articleAdapter, times(0)).write(any(), eq(false), anyList());
    }

    @Test
    void manyChanges_scheduleOneUnfilteredTask() {
        Key ada = author("Ada");
        SkeletonInstance skel = test.runtime.read("author", ada).orElseThrow();
        skel.set("name", "Ada Lovelace");
        skel.set("bio", "Mathematician");
        skel.set("age", 36);
        skel.write().orElseThrow();

        List<RelationTask> pending = test.queue.pending();
        assertEquals(1, pending.size());
        assertNull(((UpdateRelations) pending.get(0)).changedField());
    }

    @Test
    void neverUpdateLevel_keepsAssignedCopy() {
        Key ada = author("Ada");
        SkeletonInstance skel = test.runtime.newSkeleton("article");
        skel.set("name", "Edited").set("author", ada).set("editor", ada);
        Key article = skel.write().orElseThrow();

        rename(ada, "Ada Lovelace");
        test.queue.drain();

        SkeletonInstance reread = test.runtime.read("article", article).orElseThrow();
        assertEquals("Ada Lovelace", ((RelationalValue) reread.get("author")).destValue("name"));
        assertEquals("Ada", ((RelationalValue) reread.get("editor")).destValue("name"));
    }

    @Test
    void batches_continueWithCursor() {
        Key ada = author("Ada");
        for (int i = 0; i < 12; i++) {
            article("Article " + i, ada);
        }
        rename(ada, "Ada Lovelace");

        int completed = test.queue.drain();
        assertEquals(3, completed);
        verify(articleAdapter, times(12)).write(any(), eq(false), anyList());
    }

    @Test
    void ownerReferencingManyRecords_isRefreshed() {
        TestRuntime wide = new TestRuntime(
            SkeletonDefinition.builder("tag")
                .bone("name", StringBone.builder().build())
                .build(),
            SkeletonDefinition.builder("board")
                .bone("tags", RelationalBone.builder("tag").multiple().build())
                .build()
        );
        List<Key> tags = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            tags.add(wide.runtime.newSkeleton("tag").set("name", "tag " + i).write().orElseThrow());
        }
        Key board = wide.runtime.newSkeleton("board").set("tags", tags).write().orElseThrow();

        SkeletonInstance tag = wide.runtime.read("tag", tags.get(0)).orElseThrow();
        tag.set("name", "renamed");
        tag.write().orElseThrow();
        wide.queue.drain();

        assertTrue(wide.queue.dropped().isEmpty());
        List<?> cached = (List<?>) wide.runtime.read("board", board).orElseThrow().get("tags");
        assertEquals(30, cached.size());
        RelationalValue first = cached.stream()
            .map(RelationalValue.class::cast)
            .filter(value -> value.key().equals(tags.get(0)))
            .findFirst()
            .orElseThrow();
        assertEquals("renamed", first.destValue("name"));
        assertEquals(0L, wide.store.get(board).get(SystemProperties.DELAYED_UPDATE_TAG));
    }

    @Test
    void vanishedOwner_isReported() {
        Key ada = author("Ada");
        Key ghost = Key.of("article", 999);
        Entity edge = new Entity(Key.of(ghost, "relations", 1))
            .put(RelationalBone.EDGE_DEST, Map.of("key", ada, "name", "Ada"))
            .put(RelationalBone.EDGE_SRC_KIND, "article")
            .put(RelationalBone.EDGE_SRC_PROPERTY, "author")
            .put(RelationalBone.EDGE_DEST_KIND, "author")
            .put(RelationalBone.EDGE_UPDATE_LEVEL, 0)
            .put(RelationalBone.EDGE_CONSISTENCY, 1)
            .put(RelationalBone.EDGE_FOREIGN_KEYS, List.of("key", "name"))
            .put(SystemProperties.DELAYED_UPDATE_TAG, 1L);
        test.store.put(edge);

        rename(ada, "Ada Lovelace");
        test.queue.drain();

        assertTrue(test.monitor.has(IntegrityWarning.Type.VANISHED_OWNER));
        assertNotNull(test.store.get(edge.key()));
    }

    @Test
    void vacuum_removesEdgesOfUnknownSources() {
        Key ada = author("Ada");
        Key first = article("First", ada);
        Entity orphan = new Entity(Key.of(Key.of("retired", 1), "relations", 1))
            .put(RelationalBone.EDGE_DEST, Map.of("key", ada))
            .put(RelationalBone.EDGE_SRC_KIND, "retired")
            .put(RelationalBone.EDGE_SRC_PROPERTY, "author");
        test.store.put(orphan);

        test.runtime.vacuumRelations(VacuumRelations.ALL_KINDS);
        test.queue.drain();

        assertNull(test.store.get(orphan.key()));
        assertEquals(1, test.edgesOf(first).size());
    }

    @Test
    void rebuildIndex_refreshesStaleCopies() {
        Key ada = author("Ada");
        Key first = article("First", ada);

        Entity raw = test.store.get(ada);
        raw.put("name", "Countess");
        test.store.put(raw);
        assertEquals("Ada", cachedAuthorName(first));

        test.runtime.rebuildIndex("article");
        test.queue.drain();
        assertEquals("Countess", cachedAuthorName(first));
    }

    @Test
    void rebuildIndex_rejectsUnknownKind() {
        assertThrows(SchemaException.class, () -> test.runtime.rebuildIndex("nope"));

        RebuildIndex task = new RebuildIndex("nope", null, 0);
        test.runtime.enqueue(task);
        test.queue.drain();
        assertEquals(List.of(task), test.queue.dropped());
    }
}
