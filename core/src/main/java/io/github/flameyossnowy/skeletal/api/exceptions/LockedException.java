package io.github.flameyossnowy.skeletal.api.exceptions;

import io.github.flameyossnowy.skeletal.api.store.Key;

import java.util.List;

/**
 * Thrown when an entity cannot be deleted because other records still hold
 * prevent-deletion locks on it.
 */
public class LockedException extends SkeletalException {
    private final Key key;
    private final List<Key> lockedBy;

    public LockedException(Key key, List<Key> lockedBy) {
        super(key + " is still referenced by " + lockedBy.size() + " record(s), which prevents deleting it");
        this.key = key;
        this.lockedBy = List.copyOf(lockedBy);
    }

    public Key getKey() {
        return key;
    }

    public List<Key> getLockedBy() {
        return lockedBy;
    }
}
