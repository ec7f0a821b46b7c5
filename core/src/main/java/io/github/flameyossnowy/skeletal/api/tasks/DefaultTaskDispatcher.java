package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;

/**
 * Routes each task type to its handler on the {@link RelationPropagationWorker}.
 */
public class DefaultTaskDispatcher implements TaskDispatcher {
    private final RelationPropagationWorker worker;

    public DefaultTaskDispatcher(@NotNull RelationPropagationWorker worker) {
        this.worker = worker;
    }

    @Override
    public void dispatch(@NotNull RelationTask task) {
        switch (task.type()) {
            case UPDATE_RELATIONS -> worker.updateRelations((UpdateRelations) task);
            case PROCESS_REMOVED_RELATIONS -> worker.processRemovedRelations((ProcessRemovedRelations) task);
            case RELEASE_UNIQUE_LOCKS -> worker.releaseUniqueLocks((ReleaseUniqueLocks) task);
            case VACUUM_RELATIONS -> worker.vacuumRelations((VacuumRelations) task);
            case REBUILD_INDEX -> worker.rebuildIndex((RebuildIndex) task);
        }
    }
}
