package io.github.flameyossnowy.skeletal.api;

import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityMonitor;
import io.github.flameyossnowy.skeletal.api.integrity.LoggingIntegrityMonitor;
import io.github.flameyossnowy.skeletal.api.pipeline.BlobLockBookkeeper;
import io.github.flameyossnowy.skeletal.api.pipeline.DeletePipeline;
import io.github.flameyossnowy.skeletal.api.pipeline.UniqueLockManager;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteOptions;
import io.github.flameyossnowy.skeletal.api.pipeline.WritePipeline;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.result.TransactionResult;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonRegistry;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.tasks.DefaultTaskDispatcher;
import io.github.flameyossnowy.skeletal.api.tasks.InMemoryTaskQueue;
import io.github.flameyossnowy.skeletal.api.tasks.RebuildIndex;
import io.github.flameyossnowy.skeletal.api.tasks.RelationPropagationWorker;
import io.github.flameyossnowy.skeletal.api.tasks.RelationTask;
import io.github.flameyossnowy.skeletal.api.tasks.TaskQueue;
import io.github.flameyossnowy.skeletal.api.tasks.VacuumRelations;
import io.github.flameyossnowy.skeletal.api.utils.ChangeClock;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the engine: binds a sealed {@link SkeletonRegistry} to an {@link EntityStore}
 * and a {@link TaskQueue}.
 *
 * <pre>{@code
 * Skeletal skeletal = Skeletal.builder()
 *     .store(new InMemoryEntityStore())
 *     .registry(registry)
 *     .build();
 *
 * SkeletonInstance tag = skeletal.newSkeleton("tag");
 * tag.set("name", "red");
 * Key key = tag.write().expect("Failed to save tag");
 * }</pre>
 */
public final class Skeletal {
    private final EntityStore store;
    private final SkeletonRegistry registry;
    private final TaskQueue taskQueue;
    private final SkeletalConfig config;
    private final IntegrityMonitor integrityMonitor;
    private final ChangeClock clock;
    private final WritePipeline writePipeline;
    private final DeletePipeline deletePipeline;
    private final RelationPropagationWorker worker;

    private Skeletal(Builder builder) {
        this.store = builder.store;
        this.registry = builder.registry;
        this.taskQueue = builder.taskQueue;
        this.config = builder.config;
        this.integrityMonitor = builder.integrityMonitor;
        this.clock = builder.clock;

        UniqueLockManager uniqueLocks = new UniqueLockManager(store);
        BlobLockBookkeeper blobLocks = new BlobLockBookkeeper(store, config.blobLockKind());
        this.writePipeline = new WritePipeline(this, uniqueLocks, blobLocks);
        this.deletePipeline = new DeletePipeline(this, uniqueLocks, blobLocks);
        this.worker = new RelationPropagationWorker(this, uniqueLocks);
        taskQueue.bind(new DefaultTaskDispatcher(worker));
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public @NotNull EntityStore store() {
        return store;
    }

    public @NotNull SkeletonRegistry registry() {
        return registry;
    }

    public @NotNull TaskQueue taskQueue() {
        return taskQueue;
    }

    public @NotNull SkeletalConfig config() {
        return config;
    }

    public @NotNull IntegrityMonitor integrityMonitor() {
        return integrityMonitor;
    }

    public @NotNull ChangeClock clock() {
        return clock;
    }

    public @NotNull RelationPropagationWorker worker() {
        return worker;
    }

    /**
     * A new, empty record of {@code kind}.
     */
    public @NotNull SkeletonInstance newSkeleton(@NotNull String kind) {
        return new SkeletonInstance(this, registry.definition(kind));
    }

    public @NotNull Optional<SkeletonInstance> read(@NotNull String kind, @NotNull Key key) {
        SkeletonInstance skel = newSkeleton(kind);
        return skel.read(key) ? Optional.of(skel) : Optional.empty();
    }

    public @NotNull SkeletonQuery query(@NotNull String kind) {
        return new SkeletonQuery(this, registry.definition(kind));
    }

    public @NotNull TransactionResult<Key> write(@NotNull SkeletonInstance skel, @NotNull WriteOptions options) {
        return writePipeline.write(skel, options);
    }

    public @NotNull TransactionResult<Boolean> delete(@NotNull SkeletonInstance skel) {
        return deletePipeline.delete(skel);
    }

    public void enqueue(@NotNull RelationTask task) {
        taskQueue.enqueue(task);
    }

    /**
     * Schedules removal of relation edges left behind by removed kinds or bones.
     *
     * @param srcKind the source kind to inspect, or {@link VacuumRelations#ALL_KINDS}
     */
    public void vacuumRelations(@NotNull String srcKind) {
        taskQueue.enqueue(new VacuumRelations(srcKind, null, 0, 0));
    }

    /**
     * Schedules refreshing and rewriting every record of {@code kind}.
     */
    public void rebuildIndex(@NotNull String kind) {
        registry.definition(kind);
        taskQueue.enqueue(new RebuildIndex(kind, null, 0));
    }

    public static class Builder {
        private EntityStore store;
        private SkeletonRegistry registry;
        private TaskQueue taskQueue;
        private SkeletalConfig config = SkeletalConfig.defaults();
        private IntegrityMonitor integrityMonitor;
        private ChangeClock clock;

        public Builder store(@NotNull EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder registry(@NotNull SkeletonRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder taskQueue(@NotNull TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public Builder config(@NotNull SkeletalConfig config) {
            this.config = config;
            return this;
        }

        public Builder integrityMonitor(@NotNull IntegrityMonitor integrityMonitor) {
            this.integrityMonitor = integrityMonitor;
            return this;
        }

        public Builder clock(@NotNull ChangeClock clock) {
            this.clock = clock;
            return this;
        }

        public Skeletal build() {
            Objects.requireNonNull(store, "store");
            Objects.requireNonNull(registry, "registry");
            if (taskQueue == null) taskQueue = new InMemoryTaskQueue(config.maxTaskAttempts());
            if (integrityMonitor == null) integrityMonitor = new LoggingIntegrityMonitor();
            if (clock == null) clock = ChangeClock.system();
            return new Skeletal(this);
        }
    }
}
