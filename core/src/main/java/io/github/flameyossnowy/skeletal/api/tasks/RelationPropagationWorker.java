package io.github.flameyossnowy.skeletal.api.tasks;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.RelationHolder;
import io.github.flameyossnowy.skeletal.api.bones.RelationalBone;
import io.github.flameyossnowy.skeletal.api.bones.RelationalConsistency;
import io.github.flameyossnowy.skeletal.api.bones.RelationalUpdateLevel;
import io.github.flameyossnowy.skeletal.api.exceptions.EntityNotFoundException;
import io.github.flameyossnowy.skeletal.api.exceptions.LockedException;
import io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityWarning;
import io.github.flameyossnowy.skeletal.api.pipeline.UniqueLockManager;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteOptions;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.QueryResult;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handlers of the background tasks.
 *
 * <p>Each handler processes one batch of at most {@code batchSize} items and enqueues its own
 * continuation while more are left. All of them are idempotent: an item that is already consistent
 * either no longer matches the batch query or is rewritten to the same state.</p>
 */
public class RelationPropagationWorker {
    private final Skeletal runtime;
    private final UniqueLockManager uniqueLocks;

    public RelationPropagationWorker(@NotNull Skeletal runtime, @NotNull UniqueLockManager uniqueLocks) {
        this.runtime = runtime;
        this.uniqueLocks = uniqueLocks;
    }

    private EntityStore store() {
        return runtime.store();
    }

    private String relationKind() {
        return runtime.config().relationKind();
    }

    private int batchSize() {
        return runtime.config().batchSize();
    }

    /**
     * Refreshes the owners of every edge pointing at {@code task.destKey()} that was written before
     * the referenced record changed.
     */
    public void updateRelations(@NotNull UpdateRelations task) {
        Logging.deepInfo(() -> "Updating relations to " + task.destKey() + " older than " + task.minChangeTime()
            + (task.changedField() == null ? "" : " caching " + task.changedField()));

        EntityQuery.Builder query = EntityQuery.builder(relationKind())
            .where(RelationalBone.EDGE_DEST + "." + SkeletonDefinition.KEY_BONE).eq(task.destKey())
            .where(SystemProperties.DELAYED_UPDATE_TAG).lt(task.minChangeTime())
            .where(RelationalBone.EDGE_UPDATE_LEVEL).eq(RelationalUpdateLevel.ALWAYS.value());
        if (task.changedField() != null) {
            query.where(RelationalBone.EDGE_FOREIGN_KEYS).eq(task.changedField());
        }
        QueryResult page = store().query(query.limit(batchSize()).cursor(task.cursor()).build());

        TransactionConflictException conflict = null;
        for (Entity edge : page.entities()) {
            SkeletonDefinition definition = ownerDefinition(edge);
            if (definition == null) continue;
            Key owner = edge.key().parent();
            try {
                if (!refreshAndWrite(definition, owner)) reportVanished(edge, owner);
            } catch (TransactionConflictException e) {
                Logging.warn("Refreshing " + owner + " conflicted, retrying later: " + e.getMessage());
                conflict = e;
            }
        }

        if (page.hasMore() && page.entities().size() >= batchSize()) {
            runtime.taskQueue().enqueue(task.withCursor(page.nextCursor()));
        }
        // refreshed owners no longer match the batch query, so a retry only revisits the conflicted ones
        if (conflict != null) throw conflict;
    }

    /**
     * Re-reads and refreshes a record outside any transaction, then writes it. Reading the
     * referenced records happens before the write transaction opens so it never counts towards the
     * transaction's entity groups.
     *
     * @return false if the record no longer exists
     */
    private boolean refreshAndWrite(SkeletonDefinition definition, Key key) {
        SkeletonInstance skel = new SkeletonInstance(runtime, definition);
        if (!skel.read(key)) return false;
        skel.refresh();
        try {
            skel.write(WriteOptions.fresh()).orElseThrow();
        } catch (LockedException | EntityNotFoundException e) {
            Logging.warn("Could not rewrite " + key + ": " + e.getMessage());
        }
        return true;
    }

    /**
     * Empties or cascade-deletes the owners of every set-null or cascade edge pointing at the
     * deleted record.
     */
    public void processRemovedRelations(@NotNull ProcessRemovedRelations task) {
        Key deleted = task.deletedKey();
        Logging.deepInfo(() -> "Processing removed relations to " + deleted);

        EntityQuery query = EntityQuery.builder(relationKind())
            .where(RelationalBone.EDGE_DEST + "." + SkeletonDefinition.KEY_BONE).eq(deleted)
            .where(RelationalBone.EDGE_CONSISTENCY).gt(RelationalConsistency.PREVENT_DELETION.value())
            .limit(batchSize())
            .cursor(task.cursor())
            .build();
        QueryResult page = store().query(query);

        // an owner with several cascade bones to the deleted record shows up once per edge
        Set<Key> cascaded = new HashSet<>();
        for (Entity edge : page.entities()) {
            SkeletonDefinition definition = ownerDefinition(edge);
            if (definition == null) continue;
            Key owner = edge.key().parent();
            if (cascaded.contains(owner)) continue;
            Long rawConsistency = edge.getLong(RelationalBone.EDGE_CONSISTENCY);
            RelationalConsistency consistency = RelationalConsistency.fromValue(rawConsistency == null ? 0 : rawConsistency);

            SkeletonInstance skel = new SkeletonInstance(runtime, definition);
            if (!skel.read(owner)) {
                reportVanished(edge, owner);
                continue;
            }
            if (consistency == RelationalConsistency.CASCADE_DELETION) {
                Logging.info("Cascade deleting " + owner + " due to removal of " + deleted);
                cascaded.add(owner);
                skel.delete().ifError(error -> {
                    if (error instanceof LockedException || error instanceof EntityNotFoundException) {
                        Logging.warn("Could not cascade delete " + owner + ": " + error.getMessage());
                    } else if (error instanceof RuntimeException runtimeError) {
                        throw runtimeError;
                    }
                });
            } else {
                removeReference(definition, edge, owner, deleted);
            }
        }

        if (page.hasMore() && page.entities().size() >= batchSize()) {
            runtime.taskQueue().enqueue(task.withCursor(page.nextCursor()));
        }
    }

    private void removeReference(SkeletonDefinition definition, Entity edge, Key owner, Key deleted) {
        String property = String.valueOf(edge.get(RelationalBone.EDGE_SRC_PROPERTY));
        BaseBone<?> bone = definition.bone(property);
        if (!(bone instanceof RelationHolder holder)) {
            Logging.info("Dropping edge " + edge.key() + ", " + owner.kind() + " has no relational bone '" + property + "'");
            store().delete(edge.key());
            return;
        }
        store().runInTransaction(() -> {
            SkeletonInstance skel = new SkeletonInstance(runtime, definition);
            if (!skel.read(owner)) return null;
            if (holder.removeReference(skel, property, deleted)) {
                Logging.info(property + ": removed reference to " + deleted + " from " + owner);
            }
            // rewriting also drops the edge if the reference was already gone
            skel.write(WriteOptions.fresh()).orElseThrow();
            return null;
        });
    }

    public void releaseUniqueLocks(@NotNull ReleaseUniqueLocks task) {
        uniqueLocks.releaseStale(task);
    }

    /**
     * Deletes edges whose source kind or source bone no longer exists.
     */
    public void vacuumRelations(@NotNull VacuumRelations task) {
        EntityQuery.Builder query = EntityQuery.builder(relationKind());
        if (!VacuumRelations.ALL_KINDS.equals(task.srcKind())) {
            query.where(RelationalBone.EDGE_SRC_KIND).eq(task.srcKind());
        }
        QueryResult page = store().query(query.limit(batchSize()).cursor(task.cursor()).build());

        List<Key> orphaned = new ArrayList<>();
        for (Entity edge : page.entities()) {
            Object srcKind = edge.get(RelationalBone.EDGE_SRC_KIND);
            Object srcProperty = edge.get(RelationalBone.EDGE_SRC_PROPERTY);
            Optional<SkeletonDefinition> definition = srcKind instanceof String kind
                ? runtime.registry().find(kind) : Optional.empty();
            if (definition.isEmpty() || !(srcProperty instanceof String property)
                || !(definition.get().bone(property) instanceof RelationHolder)) {
                orphaned.add(edge.key());
            }
        }
        store().deleteMulti(orphaned);

        int processed = task.processed() + page.entities().size();
        int removed = task.removed() + orphaned.size();
        if (page.hasMore()) {
            runtime.taskQueue().enqueue(new VacuumRelations(task.srcKind(), page.nextCursor(), processed, removed));
        } else {
            Logging.info("Relation vacuum of " + task.srcKind() + " finished: " + processed + " edge(s) checked, "
                + removed + " removed");
        }
    }

    /**
     * Refreshes and rewrites every record of a kind.
     */
    public void rebuildIndex(@NotNull RebuildIndex task) {
        SkeletonDefinition definition = runtime.registry().find(task.kind())
            .orElseThrow(() -> new PermanentTaskException("Cannot rebuild unknown kind " + task.kind()));
        QueryResult page = store().query(EntityQuery.builder(task.kind())
            .limit(batchSize())
            .cursor(task.cursor())
            .build());

        TransactionConflictException conflict = null;
        for (Entity entity : page.entities()) {
            try {
                refreshAndWrite(definition, entity.key());
            } catch (TransactionConflictException e) {
                Logging.warn("Rebuilding " + entity.key() + " conflicted: " + e.getMessage());
                conflict = e;
            }
        }

        int processed = task.processed() + page.entities().size();
        if (page.hasMore()) {
            runtime.taskQueue().enqueue(new RebuildIndex(task.kind(), page.nextCursor(), processed));
        } else {
            Logging.info("Rebuilt " + processed + " record(s) of " + task.kind());
        }
        if (conflict != null) {
            // the continuation is already queued, retrying this page rewrites its records once more
            throw conflict;
        }
    }

    private @Nullable SkeletonDefinition ownerDefinition(Entity edge) {
        Key owner = edge.key().parent();
        if (owner == null) {
            Logging.info("Relation edge " + edge.key() + " has no owner, skipping");
            return null;
        }
        Optional<SkeletonDefinition> definition = runtime.registry().find(owner.kind());
        if (definition.isEmpty()) {
            Logging.info("Relation edge " + edge.key() + " belongs to unknown kind " + owner.kind() + ", skipping");
            return null;
        }
        return definition.get();
    }

    private void reportVanished(Entity edge, Key owner) {
        runtime.integrityMonitor().report(new IntegrityWarning(IntegrityWarning.Type.VANISHED_OWNER, owner,
            "relation edge " + edge.key() + " outlived its owner"));
    }
}
