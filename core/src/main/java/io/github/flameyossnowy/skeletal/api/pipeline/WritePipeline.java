package io.github.flameyossnowy.skeletal.api.pipeline;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.LockParticipant;
import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientError;
import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientErrorSeverity;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.exceptions.UniqueValueConflictException;
import io.github.flameyossnowy.skeletal.api.result.TransactionResult;
import io.github.flameyossnowy.skeletal.api.skeleton.DatabaseAdapter;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.tasks.ReleaseUniqueLocks;
import io.github.flameyossnowy.skeletal.api.tasks.TaskQueue;
import io.github.flameyossnowy.skeletal.api.tasks.UpdateRelations;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores a {@link SkeletonInstance}.
 *
 * <p>Everything up to and including storing the entity happens in one transaction: loading or
 * allocating the entity, merging the assigned values over the stored ones, serializing bones,
 * reconciling relational and unique locks, and the adapters' prewrite hooks. Relation edge upkeep
 * and adapter write hooks follow the commit; propagation tasks are enqueued once it succeeded.</p>
 *
 * <p>When the caller already runs a transaction the write joins it and failures are rethrown so the
 * caller's transaction rolls back as a whole.</p>
 */
public final class WritePipeline {
    public static final String RELEASED_UNIQUE_HASHES = "releasedUniqueHashes";

    private final Skeletal runtime;
    private final UniqueLockManager uniqueLocks;
    private final BlobLockBookkeeper blobLocks;

    public WritePipeline(@NotNull Skeletal runtime, @NotNull UniqueLockManager uniqueLocks,
                         @NotNull BlobLockBookkeeper blobLocks) {
        this.runtime = runtime;
        this.uniqueLocks = uniqueLocks;
        this.blobLocks = blobLocks;
    }

    public @NotNull TransactionResult<Key> write(@NotNull SkeletonInstance skel, @NotNull WriteOptions options) {
        if (skel.isMarkedForCascadeDeletion()) {
            Key key = skel.key();
            Logging.info("Deleting " + key + " instead of writing it, a referenced record is gone");
            return runtime.delete(skel).map(ignored -> key);
        }

        EntityStore store = runtime.store();
        WriteContext context = new WriteContext(runtime, skel, options);
        context.setJoined(store.isInTransaction());
        try {
            Key key = store.runInTransaction(() -> writeInTransaction(context));
            postCommit(context, key);
            context.transition(context.warnings().isEmpty() ? WriteState.DONE : WriteState.FATAL);
            return TransactionResult.success(key);
        } catch (UniqueValueConflictException e) {
            context.transition(WriteState.LOCK_CONFLICT);
            skel.errors().add(new ReadFromClientError(ReadFromClientErrorSeverity.INVALID, e.getMessage(),
                List.of(e.getBoneName()), List.of()));
            if (context.isJoined()) throw e;
            return TransactionResult.failure(e);
        } catch (TransactionConflictException e) {
            context.transition(WriteState.TRANSACTION_CONFLICT);
            if (context.isJoined()) throw e;
            Logging.deepInfo(() -> "Write of " + skel.kind() + " conflicted: " + e.getMessage());
            return TransactionResult.failure(e);
        }
    }

    private Key writeInTransaction(WriteContext context) {
        SkeletonInstance skel = context.skeleton();
        EntityStore store = runtime.store();
        Key key = context.options().key() != null ? context.options().key() : skel.key();
        if (key != null && !key.kind().equals(skel.kind())) {
            throw new IllegalArgumentException("Cannot write " + skel.kind() + " under key " + key);
        }

        Map<String, Object> assigned = new LinkedHashMap<>();
        for (String name : skel.accessedNames()) {
            if (!name.equals(SkeletonDefinition.KEY_BONE)) assigned.put(name, skel.get(name));
        }
        context.resetChanges();

        Entity target;
        if (key != null) {
            context.transition(WriteState.LOAD_EXISTING);
            Entity existing = store.get(key);
            context.setAdd(existing == null);
            target = existing != null ? existing : new Entity(key);
        } else {
            context.transition(WriteState.ALLOCATE_KEY);
            context.setAdd(true);
            target = new Entity(store.allocateKey(skel.kind(), null));
        }

        context.transition(WriteState.MERGE_VALUES);
        skel.setEntity(target);
        assigned.forEach(skel::setValue);

        context.transition(WriteState.SERIALIZE_BONES);
        Map<String, BaseBone<?>> bones = skel.definition().bones();
        for (Map.Entry<String, BaseBone<?>> entry : bones.entrySet()) {
            String name = entry.getKey();
            if (name.equals(SkeletonDefinition.KEY_BONE)) continue;
            if (!skel.isAccessed(name) && target.contains(name)) continue;
            if (entry.getValue().serialize(skel, name, context)) {
                context.addChange(name);
            }
        }
        for (Map.Entry<String, BaseBone<?>> entry : bones.entrySet()) {
            if (entry.getValue() instanceof LockParticipant participant) {
                participant.reconcileLocks(skel, entry.getKey(), context);
            }
        }
        Map<String, List<String>> released = uniqueLocks.acquire(skel, context);
        context.setAttribute(RELEASED_UNIQUE_HASHES, released);
        blobLocks.update(skel);
        target.put(SystemProperties.DELAYED_UPDATE_TAG, context.options().clearUpdateTag() ? 0L : runtime.clock().next());

        for (DatabaseAdapter adapter : skel.definition().adapters()) {
            adapter.prewrite(skel, context.isAdd(), context.changeList());
        }

        context.transition(WriteState.COMMIT_ENTITY);
        Key stored = store.put(target);
        store.afterCommit(() -> scheduleTasks(context, stored, released));
        return stored;
    }

    private void scheduleTasks(WriteContext context, Key key, Map<String, List<String>> released) {
        TaskQueue queue = runtime.taskQueue();
        String kind = context.skeleton().kind();
        released.forEach((bone, hashes) -> queue.enqueue(new ReleaseUniqueLocks(kind, bone, key, hashes)));

        if (context.isAdd() || context.options().clearUpdateTag()) {
            return;
        }
        long minChangeTime = runtime.clock().next();
        List<String> changes = context.changeList();
        if (!changes.isEmpty() && changes.size() < runtime.config().changeListThreshold()) {
            for (String field : changes) {
                queue.enqueue(new UpdateRelations(key, minChangeTime, field, null));
            }
        } else {
            queue.enqueue(new UpdateRelations(key, minChangeTime, null, null));
        }
    }

    private void postCommit(WriteContext context, Key key) {
        context.transition(WriteState.POST_COMMIT);
        SkeletonInstance skel = context.skeleton();
        for (Map.Entry<String, BaseBone<?>> entry : skel.definition().bones().entrySet()) {
            try {
                entry.getValue().postSavedHandler(skel, entry.getKey(), key);
            } catch (RuntimeException e) {
                if (context.isJoined()) throw e;
                Logging.error("Post-save handler of " + skel.kind() + "." + entry.getKey() + " failed for " + key, e);
            }
        }
        for (DatabaseAdapter adapter : skel.definition().adapters()) {
            adapter.write(skel, context.isAdd(), context.changeList());
        }
    }
}
