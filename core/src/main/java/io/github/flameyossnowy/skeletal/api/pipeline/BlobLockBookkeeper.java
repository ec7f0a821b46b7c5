package io.github.flameyossnowy.skeletal.api.pipeline;

import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Tracks which blobs each record references, so blob storage can tell live blobs from garbage.
 * One bookkeeping entity per owner, named after the owner's key path.
 */
public final class BlobLockBookkeeper {
    public static final String ACTIVE = "active_blob_references";
    public static final String OLD = "old_blob_references";
    public static final String HAS_OLD = "has_old_blob_references";
    public static final String STALE = "is_stale";

    private final EntityStore store;
    private final String blobLockKind;

    public BlobLockBookkeeper(@NotNull EntityStore store, @NotNull String blobLockKind) {
        this.store = store;
        this.blobLockKind = blobLockKind;
    }

    public @NotNull Key lockKey(@NotNull Key owner) {
        return Key.of(blobLockKind, owner.path());
    }

    /**
     * Records the blobs currently referenced by {@code skel}. Blobs no longer referenced move to
     * the old references. Runs inside the write transaction.
     */
    public void update(@NotNull SkeletonInstance skel) {
        TreeSet<String> active = new TreeSet<>();
        for (Map.Entry<String, BaseBone<?>> entry : skel.definition().bones().entrySet()) {
            active.addAll(entry.getValue().getReferencedBlobs(skel, entry.getKey()));
        }

        Key key = lockKey(skel.entity().key());
        Entity lock = store.get(key);
        if (lock == null) {
            if (active.isEmpty()) return;
            lock = new Entity(key);
        }

        TreeSet<String> old = new TreeSet<>();
        for (Object blob : lock.getList(OLD)) old.add(String.valueOf(blob));
        for (Object blob : lock.getList(ACTIVE)) {
            if (!active.contains(blob)) old.add(String.valueOf(blob));
        }
        old.removeAll(active);

        lock.put(ACTIVE, new ArrayList<>(active));
        lock.put(OLD, new ArrayList<>(old));
        lock.put(HAS_OLD, !old.isEmpty());
        lock.put(STALE, false);
        store.put(lock);
    }

    /**
     * Retires the bookkeeping of a deleted owner. Its active blobs join the old references so the
     * blob collector picks them up, and the entity is flagged stale so the collector removes it
     * afterwards. Bookkeeping that references nothing is deleted right away.
     */
    public void markStale(@NotNull Key owner) {
        Key key = lockKey(owner);
        Entity lock = store.get(key);
        if (lock == null) return;

        List<Object> active = lock.getList(ACTIVE);
        TreeSet<String> old = new TreeSet<>();
        for (Object blob : lock.getList(OLD)) old.add(String.valueOf(blob));
        if (active.isEmpty() && old.isEmpty()) {
            store.delete(key);
            return;
        }
        for (Object blob : active) old.add(String.valueOf(blob));

        lock.put(ACTIVE, new ArrayList<>());
        lock.put(OLD, new ArrayList<>(old));
        lock.put(HAS_OLD, true);
        lock.put(STALE, true);
        store.put(lock);
    }
}
