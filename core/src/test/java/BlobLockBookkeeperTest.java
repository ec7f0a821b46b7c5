import io.github.flameyossnowy.skeletal.api.bones.RelationalBone;
import io.github.flameyossnowy.skeletal.api.bones.StringBone;
import io.github.flameyossnowy.skeletal.api.pipeline.BlobLockBookkeeper;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlobLockBookkeeperTest {
    private TestRuntime test;

    @BeforeEach
    void setUp() {
        test = new TestRuntime(
            SkeletonDefinition.builder("folder")
                .bone("name", StringBone.builder().build())
                .bone("files", new BlobKeyBone())
                .build(),
            SkeletonDefinition.builder("share")
                .bone("name", StringBone.builder().build())
                .bone("folder", RelationalBone.builder("folder").cacheFields("name", "files").build())
                .build()
        );
    }

    private Entity lockOf(Key owner) {
        return test.store.get(Key.of(test.runtime.config().blobLockKind(), owner.path()));
    }

    @Test
    void recordsWithoutBlobs_haveNoBookkeeping() {
        Key folder = test.runtime.newSkeleton("folder").set("name", "empty").write().orElseThrow();
        assertNull(lockOf(folder));
    }

    @Test
    void droppedBlobs_moveToOldReferences() {
        Key folder = test.runtime.newSkeleton("folder").set("name", "docs").set("files", List.of("a", "b"))
            .write().orElseThrow();
        Entity lock = lockOf(folder);
        assertEquals(List.of("a", "b"), lock.get(BlobLockBookkeeper.ACTIVE));
        assertEquals(false, lock.get(BlobLockBookkeeper.HAS_OLD));

        SkeletonInstance skel = test.runtime.read("folder", folder).orElseThrow();
        skel.set("files", List.of("b", "c"));
        skel.write().orElseThrow();

        lock = lockOf(folder);
        assertEquals(List.of("b", "c"), lock.get(BlobLockBookkeeper.ACTIVE));
        assertEquals(List.of("a"), lock.get(BlobLockBookkeeper.OLD));
        assertEquals(true, lock.get(BlobLockBookkeeper.HAS_OLD));
        assertEquals(false, lock.get(BlobLockBookkeeper.STALE));
    }

    @Test
    void cachedRelations_referenceBlobsToo() {
        Key folder = test.runtime.newSkeleton("folder").set("name", "docs").set("files", List.of("a"))
            .write().orElseThrow();
        Key share = test.runtime.newSkeleton("share").set("name", "public").set("folder", folder)
            .write().orElseThrow();

        assertEquals(List.of("a"), lockOf(share).get(BlobLockBookkeeper.ACTIVE));
    }

    @Test
    void delete_retiresActiveBlobs() {
        Key folder = test.runtime.newSkeleton("folder").set("name", "docs").set("files", List.of("a", "b"))
            .write().orElseThrow();
        SkeletonInstance skel = test.runtime.read("folder", folder).orElseThrow();
        skel.set("files", List.of("b", "c"));
        skel.write().orElseThrow();

        assertTrue(test.runtime.read("folder", folder).orElseThrow().delete().isSuccess());

        Entity lock = lockOf(folder);
        assertEquals(List.of(), lock.get(BlobLockBookkeeper.ACTIVE));
        assertEquals(List.of("a", "b", "c"), lock.get(BlobLockBookkeeper.OLD));
        assertEquals(true, lock.get(BlobLockBookkeeper.HAS_OLD));
        assertEquals(true, lock.get(BlobLockBookkeeper.STALE));
    }

    @Test
    void delete_dropsEmptyBookkeeping() {
        Key folder = test.runtime.newSkeleton("folder").set("name", "docs").write().orElseThrow();
        Key lockKey = Key.of(test.runtime.config().blobLockKind(), folder.path());
        test.store.put(new Entity(lockKey)
            .put(BlobLockBookkeeper.ACTIVE, List.of())
            .put(BlobLockBookkeeper.OLD, List.of())
            .put(BlobLockBookkeeper.HAS_OLD, false)
            .put(BlobLockBookkeeper.STALE, false));

        assertTrue(test.runtime.read("folder", folder).orElseThrow().delete().isSuccess());

        assertNull(test.store.get(lockKey));
    }
}
