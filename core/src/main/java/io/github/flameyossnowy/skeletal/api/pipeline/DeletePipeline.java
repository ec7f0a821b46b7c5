package io.github.flameyossnowy.skeletal.api.pipeline;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.exceptions.EntityNotFoundException;
import io.github.flameyossnowy.skeletal.api.exceptions.LockedException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.result.TransactionResult;
import io.github.flameyossnowy.skeletal.api.skeleton.DatabaseAdapter;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.tasks.ProcessRemovedRelations;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deletes a {@link SkeletonInstance}: refuses while other records hold prevent-deletion locks on
 * it, releases the locks it holds itself, and schedules cleanup of records referencing it.
 */
public final class DeletePipeline {
    private final Skeletal runtime;
    private final UniqueLockManager uniqueLocks;
    private final BlobLockBookkeeper blobLocks;

    public DeletePipeline(@NotNull Skeletal runtime, @NotNull UniqueLockManager uniqueLocks,
                          @NotNull BlobLockBookkeeper blobLocks) {
        this.runtime = runtime;
        this.uniqueLocks = uniqueLocks;
        this.blobLocks = blobLocks;
    }

    /**
     * @return success, or a failure carrying {@link LockedException}, {@link EntityNotFoundException}
     *         or {@link TransactionConflictException}; these are rethrown instead when the caller's
     *         transaction is joined
     */
    public @NotNull TransactionResult<Boolean> delete(@NotNull SkeletonInstance skel) {
        Key key = skel.key();
        if (key == null) {
            throw new IllegalStateException("Cannot delete a record that was never written");
        }
        EntityStore store = runtime.store();
        WriteContext context = new WriteContext(runtime, skel, WriteOptions.defaults());
        context.setJoined(store.isInTransaction());
        try {
            store.runInTransaction(() -> {
                deleteInTransaction(context, key);
                return null;
            });
        } catch (LockedException | EntityNotFoundException | TransactionConflictException e) {
            context.transition(failureState(e));
            if (context.isJoined()) throw e;
            Logging.deepInfo(() -> "Delete of " + key + " failed: " + e.getMessage());
            return TransactionResult.failure(e);
        }

        context.transition(WriteState.POST_COMMIT);
        for (Map.Entry<String, BaseBone<?>> entry : skel.definition().bones().entrySet()) {
            try {
                entry.getValue().postDeletedHandler(skel, entry.getKey(), key);
            } catch (RuntimeException e) {
                if (context.isJoined()) throw e;
                Logging.error("Post-delete handler of " + skel.kind() + "." + entry.getKey() + " failed for " + key, e);
            }
        }
        for (DatabaseAdapter adapter : skel.definition().adapters()) {
            adapter.delete(skel);
        }
        context.transition(context.warnings().isEmpty() ? WriteState.DONE : WriteState.FATAL);
        return TransactionResult.success(true);
    }

    // a missing entity means a concurrent delete won
    private static WriteState failureState(RuntimeException e) {
        return e instanceof LockedException ? WriteState.LOCK_CONFLICT : WriteState.TRANSACTION_CONFLICT;
    }

    private void deleteInTransaction(WriteContext context, Key key) {
        SkeletonInstance skel = context.skeleton();
        EntityStore store = runtime.store();

        context.transition(WriteState.LOAD_EXISTING);
        Entity entity = store.get(key);
        if (entity == null) {
            throw new EntityNotFoundException(key);
        }
        skel.setEntity(entity);

        List<Key> lockedBy = new ArrayList<>();
        for (Object holder : entity.getList(SystemProperties.INCOMING_RELATIONAL_LOCKS)) {
            if (holder instanceof Key holderKey) lockedBy.add(holderKey);
        }
        if (!lockedBy.isEmpty()) {
            throw new LockedException(key, lockedBy);
        }

        for (Map.Entry<String, BaseBone<?>> entry : skel.definition().bones().entrySet()) {
            entry.getValue().delete(skel, entry.getKey(), context);
        }
        uniqueLocks.releaseAll(skel, context);
        blobLocks.markStale(key);

        context.transition(WriteState.COMMIT_ENTITY);
        store.delete(key);
        store.afterCommit(() -> runtime.taskQueue().enqueue(new ProcessRemovedRelations(key, null)));
    }
}
