package io.github.flameyossnowy.skeletal.api.bones;

/**
 * How the values of a multiple bone are locked for uniqueness.
 */
public enum UniqueLockMethod {
    /** Every value is locked on its own; no two records may share any value. */
    SAME_VALUE,
    /** The set of values is locked; order and duplicates are ignored. */
    SAME_SET,
    /** The list of values is locked as given, order included. */
    SAME_LIST
}
