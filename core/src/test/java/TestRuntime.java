import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonRegistry;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.store.memory.InMemoryEntityStore;
import io.github.flameyossnowy.skeletal.api.tasks.InMemoryTaskQueue;

import java.util.List;

/**
 * In-memory runtime shared by the scenario tests.
 */
final class TestRuntime {
    final InMemoryEntityStore store;
    final InMemoryTaskQueue queue = new InMemoryTaskQueue();
    final RecordingIntegrityMonitor monitor = new RecordingIntegrityMonitor();
    final Skeletal runtime;

    TestRuntime(SkeletonDefinition... definitions) {
        this(SkeletalConfig.defaults(), definitions);
    }

    TestRuntime(SkeletalConfig config, SkeletonDefinition... definitions) {
        this.store = new InMemoryEntityStore(config);
        SkeletonRegistry.Builder registry = SkeletonRegistry.builder();
        for (SkeletonDefinition definition : definitions) registry.register(definition);
        this.runtime = Skeletal.builder()
            .store(store)
            .registry(registry.build())
            .taskQueue(queue)
            .config(config)
            .integrityMonitor(monitor)
            .build();
    }

    List<Entity> edgesOf(Key owner) {
        return store.queryAll(EntityQuery.builder(runtime.config().relationKind()).ancestor(owner).build());
    }

    List<Entity> edgesTo(Key dest) {
        return store.queryAll(EntityQuery.builder(runtime.config().relationKind()).where("dest.key").eq(dest).build());
    }
}
