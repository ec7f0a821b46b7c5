package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;

public enum TaskType {
    UPDATE_RELATIONS(UpdateRelations.class),
    PROCESS_REMOVED_RELATIONS(ProcessRemovedRelations.class),
    RELEASE_UNIQUE_LOCKS(ReleaseUniqueLocks.class),
    VACUUM_RELATIONS(VacuumRelations.class),
    REBUILD_INDEX(RebuildIndex.class);

    private final Class<? extends RelationTask> taskClass;

    TaskType(Class<? extends RelationTask> taskClass) {
        this.taskClass = taskClass;
    }

    public @NotNull Class<? extends RelationTask> taskClass() {
        return taskClass;
    }
}
