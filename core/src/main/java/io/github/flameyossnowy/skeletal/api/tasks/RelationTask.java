package io.github.flameyossnowy.skeletal.api.tasks;

import org.jetbrains.annotations.NotNull;

/**
 * A unit of background work. Every task carries all the state it needs; handlers must tolerate
 * being run more than once.
 */
public sealed interface RelationTask
    permits UpdateRelations, ProcessRemovedRelations, ReleaseUniqueLocks, VacuumRelations, RebuildIndex {

    @NotNull TaskType type();
}
