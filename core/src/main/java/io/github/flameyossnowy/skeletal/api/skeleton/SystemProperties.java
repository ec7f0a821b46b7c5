package io.github.flameyossnowy.skeletal.api.skeleton;

import java.util.Set;

/**
 * Property names the engine keeps on every owner entity. Bones may not use them.
 */
public final class SystemProperties {
    /** Epoch micros of the last write that needs propagation, 0 when written fresh by a worker. */
    public static final String DELAYED_UPDATE_TAG = "delayed_update_tag";
    /** Embedded map of bone name to the keys that bone locks against deletion. */
    public static final String OUTGOING_RELATIONAL_LOCKS = "outgoing_relational_locks";
    /** Keys of the entities that lock this one against deletion. */
    public static final String INCOMING_RELATIONAL_LOCKS = "incoming_relational_locks";
    /** Embedded map of bone name to the unique index hashes claimed by this entity. */
    public static final String UNIQUE_INDEX_VALUES = "unique_index_values";

    public static final Set<String> ALL = Set.of(
        DELAYED_UPDATE_TAG, OUTGOING_RELATIONAL_LOCKS, INCOMING_RELATIONAL_LOCKS, UNIQUE_INDEX_VALUES
    );

    private SystemProperties() {}
}
